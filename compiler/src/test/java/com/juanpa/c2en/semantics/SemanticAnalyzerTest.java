package com.juanpa.c2en.semantics;

import com.juanpa.c2en.ast.Program;
import com.juanpa.c2en.lexer.Lexer;
import com.juanpa.c2en.parser.CParser;
import com.juanpa.c2en.util.ErrorReporter;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class SemanticAnalyzerTest
{
	private ErrorReporter reporter;
	private SemanticAnalyzer analyzer;

	@BeforeEach
	void setUp()
	{
		reporter = new ErrorReporter(new PrintStream(new ByteArrayOutputStream()));
	}

	private boolean analyze(String source)
	{
		return analyze(source, Collections.emptyList());
	}

	private boolean analyze(String source, Collection<String> extraLibraryFunctions)
	{
		Program program = new CParser(Lexer.tokenize(source, "test.c"), "test.c", reporter).parse();
		assertNotNull(program, () -> "Unexpected syntax errors: " + reporter.getDiagnostics());
		analyzer = new SemanticAnalyzer("test.c", reporter, extraLibraryFunctions);
		return analyzer.analyze(program);
	}

	private List<String> diagnostics()
	{
		return reporter.getDiagnostics();
	}

	@Test
	void validProgramPasses()
	{
		assertTrue(analyze("int square(int n) { return n * n; }\n"
				+ "int main() { int x = 4; int y = square(x); printf(\"%d\", y); return 0; }"));
		assertTrue(diagnostics().isEmpty());
		assertEquals(0, analyzer.getErrorCount());
	}

	@Test
	void variableIsVisibleInsideNestedIf()
	{
		assertTrue(analyze("int main() { int x = 1; if (x) { if (x > 0) { x = 2; } } return x; }"));
	}

	@Test
	void redeclarationInFunctionBody()
	{
		assertFalse(analyze("int main() {\n  int x;\n  int x;\n  return 0;\n}"));
		assertEquals(List.of("[SEMANTIC ERROR] test.c:3: Variable 'x' already declared in this scope"), diagnostics());
	}

	@Test
	void nestedBlocksShareTheFunctionScope()
	{
		assertFalse(analyze("int main() { { int x; } int x; return 0; }"));
		assertEquals(1, diagnostics().size());
		assertTrue(diagnostics().get(0).endsWith("Variable 'x' already declared in this scope"));
	}

	@Test
	void undeclaredVariableReportsItsLine()
	{
		assertFalse(analyze("int main() {\n  return y;\n}"));
		assertEquals(List.of("[SEMANTIC ERROR] test.c:2: Undeclared variable 'y'"), diagnostics());
	}

	@Test
	void undefinedFunctionAndItsArgumentAreBothReported()
	{
		assertFalse(analyze("int main() { foo(y); return 0; }"));
		assertEquals(List.of(
				"[SEMANTIC ERROR] test.c:1: Undefined function 'foo'",
				"[SEMANTIC ERROR] test.c:1: Undeclared variable 'y'"), diagnostics());
	}

	@Test
	void libraryFunctionsNeedNoDeclaration()
	{
		assertTrue(analyze("int main() { char* s = malloc(16); strcpy(s, \"hi\"); printf(\"%d\", strlen(s)); free(s); scanf(\"%d\", 0); return 0; }"));
	}

	@Test
	void configuredLibraryFunctionsAreAccepted()
	{
		assertFalse(analyze("int main() { puts(\"x\"); return 0; }"));

		reporter.reset();
		assertTrue(analyze("int main() { puts(\"x\"); return 0; }", List.of("puts")));
	}

	@Test
	void callToLaterFunctionIsReported()
	{
		assertFalse(analyze("int main() { return helper(); }\nint helper() { return 1; }"));
		assertEquals(List.of("[SEMANTIC ERROR] test.c:1: Undefined function 'helper'"), diagnostics());
	}

	@Test
	void prototypeAllowsEarlyCallAndLaterDefinition()
	{
		assertTrue(analyze("int helper(int v);\nint main() { return helper(2); }\nint helper(int v) { return v; }"));

		FunctionSymbol helper = (FunctionSymbol) analyzer.getGlobalScope().resolve("helper");
		assertTrue(helper.isDefined());
		assertEquals(List.of("int"), helper.getParameterTypes());
	}

	@Test
	void duplicateFunctionSkipsItsBody()
	{
		assertFalse(analyze("int f() { return 1; }\nint f() { return z; }"));
		assertEquals(List.of("[SEMANTIC ERROR] test.c:2: Function 'f' already declared"), diagnostics());
	}

	@Test
	void globalVariableNameCannotBeReusedForAFunction()
	{
		assertFalse(analyze("int count;\nint count() { return 0; }"));
		assertEquals(List.of("[SEMANTIC ERROR] test.c:2: Function 'count' already declared"), diagnostics());
	}

	@Test
	void arrayAccessChecks()
	{
		assertFalse(analyze("int main() { int a; int b[3]; a[0] = 1; c[1] = 2; b[i] = 0; return b[0]; }"));
		assertEquals(List.of(
				"[SEMANTIC ERROR] test.c:1: 'a' is not an array",
				"[SEMANTIC ERROR] test.c:1: Undeclared array 'c'",
				"[SEMANTIC ERROR] test.c:1: Undeclared variable 'i'"), diagnostics());
	}

	@Test
	void arrayParametersCanBeIndexed()
	{
		assertTrue(analyze("int sum(int values[], int n) { int total = 0; int i; for (i = 0; i < n; i++) total += values[i]; return total; }"));
	}

	@Test
	void duplicateParameterNames()
	{
		assertFalse(analyze("int f(int a, int a) { return a; }"));
		assertEquals(List.of("[SEMANTIC ERROR] test.c:1: Variable 'a' already declared in this scope"), diagnostics());
	}

	@Test
	void declarationIsVisibleToItsOwnInitializer()
	{
		assertTrue(analyze("int main() { int x = x; return x; }"));
	}

	@Test
	void initializerIsCheckedBeforeArraySize()
	{
		assertFalse(analyze("int main() { int a[n] = {m}; return 0; }"));
		assertEquals(List.of(
				"[SEMANTIC ERROR] test.c:1: Undeclared variable 'm'",
				"[SEMANTIC ERROR] test.c:1: Undeclared variable 'n'"), diagnostics());
	}

	@Test
	void globalsEnumConstantsAndTypedefsAreInTheGlobalScope()
	{
		assertTrue(analyze("enum Level { LOW, HIGH = LOW + 1 };\n"
				+ "typedef unsigned int uint;\n"
				+ "int limit = HIGH;\n"
				+ "int main() { uint n = limit; return n + LOW; }"));

		SymbolTable global = analyzer.getGlobalScope();
		assertTrue(global.resolve("uint") instanceof TypedefSymbol);
		assertEquals(VariableSymbol.Kind.ENUM_CONSTANT, ((VariableSymbol) global.resolve("HIGH")).getKind());
		assertNotNull(global.resolve("limit"));
	}

	@Test
	void duplicateStructTag()
	{
		assertFalse(analyze("struct P { int x; };\nstruct P { int y; };"));
		assertEquals(List.of("[SEMANTIC ERROR] test.c:2: Struct 'P' already defined"), diagnostics());
	}

	@Test
	void duplicateStructMember()
	{
		assertFalse(analyze("struct P {\n  int x;\n  int x;\n};"));
		assertEquals(List.of("[SEMANTIC ERROR] test.c:3: Duplicate member 'x' in struct 'P'"), diagnostics());
	}

	@Test
	void memberAccessChecksOnlyTheObject()
	{
		assertTrue(analyze("struct P { int x; };\nint main() { struct P p; p.anything = 1; return 0; }"));
		assertFalse(analyze("int main() { q->next = 0; return 0; }"));
		assertEquals(List.of("[SEMANTIC ERROR] test.c:1: Undeclared variable 'q'"), diagnostics());
	}

	@Test
	void switchGotoAndLabels()
	{
		assertTrue(analyze("int main() { int d = 2; switch (d) { case 1: d = 0; break; default: goto out; } out: return d; }"));
	}

	@Test
	void scopesAreRetainedAfterAnalysis()
	{
		assertTrue(analyze("int g;\nint f(int a) { int b; return a + b; }\nint main() { int c; return f(c); }"));

		List<String> names = analyzer.getScopes().stream().map(SymbolTable::getScopeName).collect(Collectors.toList());
		assertEquals(List.of("global", "f", "main"), names);

		SymbolTable fScope = analyzer.getScopes().get(1);
		assertEquals(List.of("a", "b"), List.copyOf(fScope.getSymbols().keySet()));
		assertSame(analyzer.getGlobalScope(), fScope.getEnclosingScope());
		assertEquals("f", fScope.resolveCurrentScope("b").getScopeName());
	}

	@Test
	void analysisStartsFreshOnEachCall()
	{
		Program program = new CParser(Lexer.tokenize("int main() { int x; return x; }", "test.c"), "test.c", reporter).parse();
		SemanticAnalyzer shared = new SemanticAnalyzer("test.c", reporter);

		assertTrue(shared.analyze(program));
		assertTrue(shared.analyze(program));
		assertEquals(2, shared.getScopes().size());
	}
}
