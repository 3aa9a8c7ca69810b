package com.juanpa.c2en.parser;

import com.juanpa.c2en.ast.Program;
import com.juanpa.c2en.ast.declarations.EnumDefinition;
import com.juanpa.c2en.ast.declarations.FunctionDeclaration;
import com.juanpa.c2en.ast.declarations.StructDefinition;
import com.juanpa.c2en.ast.declarations.TypedefDeclaration;
import com.juanpa.c2en.ast.expressions.ArrayAccessExpression;
import com.juanpa.c2en.ast.expressions.Expression;
import com.juanpa.c2en.ast.expressions.LiteralExpression;
import com.juanpa.c2en.ast.statements.*;
import com.juanpa.c2en.lexer.Lexer;
import com.juanpa.c2en.util.ErrorReporter;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CParserTest
{
	private ByteArrayOutputStream errors;
	private ErrorReporter reporter;

	@BeforeEach
	void setUp()
	{
		errors = new ByteArrayOutputStream();
		reporter = new ErrorReporter(new PrintStream(errors, true, StandardCharsets.UTF_8));
	}

	private Program parse(String source)
	{
		return new CParser(Lexer.tokenize(source, "test.c"), "test.c", reporter).parse();
	}

	private Program parseValid(String source)
	{
		Program program = parse(source);
		assertNotNull(program, () -> "Unexpected errors: " + reporter.getDiagnostics());
		return program;
	}

	private List<Statement> body(String functionBody)
	{
		Program program = parseValid("void f() { " + functionBody + " }");
		return program.getFunctions().get(0).getBody().getStatements();
	}

	private String expr(String expressionSource)
	{
		Statement statement = body(expressionSource + ";").get(0);
		return ((ExpressionStatement) statement).getExpression().toString();
	}

	// --- Expressions ---

	@Test
	void multiplicationBindsTighterThanAddition()
	{
		assertEquals("(1 + (2 * 3))", expr("1 + 2 * 3"));
	}

	@Test
	void binaryOperatorsAreLeftAssociative()
	{
		assertEquals("((a - b) - c)", expr("a - b - c"));
		assertEquals("((a / b) % c)", expr("a / b % c"));
	}

	@Test
	void assignmentIsRightAssociative()
	{
		assertEquals("(a = (b = c))", expr("a = b = c"));
		assertEquals("(x += (y << 2))", expr("x += y << 2"));
	}

	@Test
	void ternaryIsRightAssociative()
	{
		assertEquals("(a ? b : (c ? d : e))", expr("a ? b : c ? d : e"));
	}

	@Test
	void fullPrecedenceLadder()
	{
		assertEquals("(a || (b && (c | (d ^ (e & (f == (g < (h << (i + (j * k))))))))))",
				expr("a || b && c | d ^ e & f == g < h << i + j * k"));
	}

	@Test
	void unaryAndPostfixOperators()
	{
		assertEquals("(-(x++))", expr("-x++"));
		assertEquals("(!(*p))", expr("!*p"));
		assertEquals("(&a[1])", expr("&a[1]"));
		assertEquals("(++i)", expr("++i"));
		assertEquals("p->next->value", expr("p->next->value"));
		assertEquals("(s.count--)", expr("s.count--"));
	}

	@Test
	void parenthesesOverridePrecedence()
	{
		assertEquals("((1 + 2) * 3)", expr("(1 + 2) * 3"));
	}

	@Test
	void sizeofAndCasts()
	{
		assertEquals("sizeof(int)", expr("sizeof(int)"));
		assertEquals("sizeof(x)", expr("sizeof x"));
		assertEquals("((char*) p)", expr("(char*) p"));
		assertEquals("(((unsigned long) n) + 1)", expr("(unsigned long) n + 1"));
	}

	@Test
	void callsKeepArgumentOrder()
	{
		assertEquals("printf(\"%d %c\", (a + 1), 'z')", expr("printf(\"%d %c\", a + 1, 'z')"));
		assertEquals("rand()", expr("rand()"));
	}

	@Test
	void literalKinds()
	{
		List<Statement> statements = body("1; \"s\"; 'c';");

		assertEquals(LiteralExpression.Kind.NUMBER, ((LiteralExpression) ((ExpressionStatement) statements.get(0)).getExpression()).getKind());
		assertEquals(LiteralExpression.Kind.STRING, ((LiteralExpression) ((ExpressionStatement) statements.get(1)).getExpression()).getKind());
		assertEquals(LiteralExpression.Kind.CHAR, ((LiteralExpression) ((ExpressionStatement) statements.get(2)).getExpression()).getKind());
	}

	// --- Declarations ---

	@Test
	void functionWithParametersAndPrototype()
	{
		Program program = parseValid("int add(int a, int b);\nint sum(int values[], int n) { return 0; }\nint main(void) { return 0; }");

		List<FunctionDeclaration> functions = program.getFunctions();
		assertEquals(3, functions.size());

		FunctionDeclaration prototype = functions.get(0);
		assertTrue(prototype.isPrototype());
		assertEquals(2, prototype.getParameters().size());

		FunctionDeclaration sum = functions.get(1);
		assertEquals("int", sum.getReturnType());
		assertTrue(sum.getParameters().get(0).isArray());
		assertFalse(sum.getParameters().get(1).isArray());
		assertEquals(2, sum.getNameToken().getLine());

		FunctionDeclaration main = functions.get(2);
		assertTrue(main.getParameters().isEmpty());
		assertFalse(main.isPrototype());
	}

	@Test
	void typeSpecifiersAreRenderedAsText()
	{
		Program program = parseValid("unsigned long int total;\nconst char* name;\nint main(int argc, char** argv) { return 0; }");

		assertEquals("unsigned long int", ((VariableDeclaration) program.getDeclarations().get(0)).getType());
		assertEquals("const char*", ((VariableDeclaration) program.getDeclarations().get(1)).getType());
		assertEquals("char**", program.getFunctions().get(0).getParameters().get(1).getType());
	}

	@Test
	void arrayDeclarationWithInitializerList()
	{
		VariableDeclaration declaration = (VariableDeclaration) body("int a[3] = {1, 2, 3};").get(0);

		assertTrue(declaration.isArray());
		assertEquals("3", declaration.getArraySize().toString());
		assertEquals("{1, 2, 3}", declaration.getInitializer().toString());
	}

	@Test
	void structUnionEnumAndTypedef()
	{
		String source = "struct Node { int value; struct Node* next; };\n"
				+ "union Number { int i; float f; };\n"
				+ "enum Color { RED, GREEN = 5, BLUE, };\n"
				+ "typedef struct { int x; int y; } Point;\n"
				+ "typedef unsigned int uint;\n"
				+ "Point origin;\n"
				+ "int main() { Point p; uint n = 0; p.x = n; return p.x; }";
		Program program = parseValid(source);

		StructDefinition node = (StructDefinition) program.getDeclarations().get(0);
		assertEquals("Node", node.getName());
		assertFalse(node.isUnion());
		assertEquals("struct Node*", node.getMembers().get(1).getType());

		StructDefinition number = (StructDefinition) program.getDeclarations().get(1);
		assertTrue(number.isUnion());

		EnumDefinition color = (EnumDefinition) program.getDeclarations().get(2);
		assertEquals(3, color.getConstants().size());
		assertEquals("5", color.getConstants().get(1).getValue().toString());
		assertNull(color.getConstants().get(2).getValue());

		TypedefDeclaration point = (TypedefDeclaration) program.getDeclarations().get(3);
		assertEquals("Point", point.getAlias());
		assertEquals("struct", point.getType());
		assertEquals(2, ((StructDefinition) point.getInlineDefinition()).getMembers().size());

		assertEquals("unsigned int", ((TypedefDeclaration) program.getDeclarations().get(4)).getType());
		assertEquals("Point", ((VariableDeclaration) program.getDeclarations().get(5)).getType());

		List<Statement> mainBody = program.getFunctions().get(0).getBody().getStatements();
		assertEquals("uint", ((VariableDeclaration) mainBody.get(1)).getType());
	}

	// --- Statements ---

	@Test
	void switchClausesOwnTheirStatements()
	{
		SwitchStatement statement = (SwitchStatement) body("switch (d) { case 1: case 7: t = 0; break; default: t = -1; }").get(0);

		List<SwitchClause> clauses = statement.getClauses();
		assertEquals(3, clauses.size());
		assertTrue(clauses.get(0).getStatements().isEmpty());
		assertEquals("7", ((SwitchCase) clauses.get(1)).getValue().toString());
		assertEquals(2, clauses.get(1).getStatements().size());
		assertTrue(clauses.get(2) instanceof SwitchDefault);
		assertEquals(1, clauses.get(2).getStatements().size());
	}

	@Test
	void statementBeforeFirstCaseIsAnError()
	{
		assertNull(parse("void f() { switch (x) { y = 1; } }"));
		assertEquals("[ERROR] test.c:1:25: Expected 'case' or 'default' in switch body", reporter.getDiagnostics().get(0));
	}

	@Test
	void forLoopVariants()
	{
		List<Statement> statements = body("for (int i = 0; i < 10; i++) x += i; for (i = 0; ; ) break; for (;;) { }");

		ForStatement withDeclaration = (ForStatement) statements.get(0);
		assertTrue(withDeclaration.getInitializer() instanceof VariableDeclaration);
		assertEquals("(i < 10)", withDeclaration.getCondition().toString());
		assertEquals("(i++)", withDeclaration.getIncrement().toString());

		ForStatement withExpression = (ForStatement) statements.get(1);
		assertTrue(withExpression.getInitializer() instanceof ExpressionStatement);
		assertNull(withExpression.getCondition());

		ForStatement empty = (ForStatement) statements.get(2);
		assertNull(empty.getInitializer());
		assertNull(empty.getCondition());
		assertNull(empty.getIncrement());
	}

	@Test
	void ifElseWhileDoWhile()
	{
		List<Statement> statements = body("if (a) b = 1; else if (c) b = 2; else { b = 3; } while (n > 0) n--; do { n++; } while (n < 5);");

		IfStatement ifStatement = (IfStatement) statements.get(0);
		assertTrue(ifStatement.getElseBranch() instanceof IfStatement);
		assertTrue(((IfStatement) ifStatement.getElseBranch()).getElseBranch() instanceof BlockStatement);

		assertEquals("(n > 0)", ((WhileStatement) statements.get(1)).getCondition().toString());
		assertEquals("(n < 5)", ((DoWhileStatement) statements.get(2)).getCondition().toString());
	}

	@Test
	void labelsAndGoto()
	{
		List<Statement> statements = body("goto done; x = 1; done: return;");

		assertEquals("done", ((GotoStatement) statements.get(0)).getLabel());
		assertEquals("done", ((LabelStatement) statements.get(2)).getName());
		assertNull(((ReturnStatement) statements.get(3)).getValue());
	}

	@Test
	void arrayAccessKeepsArrayAndIndex()
	{
		Expression expression = ((ExpressionStatement) body("grid[i][j + 1];").get(0)).getExpression();

		ArrayAccessExpression outer = (ArrayAccessExpression) expression;
		assertEquals("(j + 1)", outer.getIndex().toString());
		assertTrue(outer.getArray() instanceof ArrayAccessExpression);
	}

	@Test
	void emptyInputGivesEmptyProgram()
	{
		Program program = parseValid("// nothing here\n");
		assertTrue(program.getDeclarations().isEmpty());
	}

	// --- Errors ---

	@Test
	void malformedParameterListFailsTheParse()
	{
		assertNull(parse("int main( { return 0; }"));
		assertEquals("[ERROR] test.c:1:11: Expected parameter type", reporter.getDiagnostics().get(0));
	}

	@Test
	void missingSemicolonIsReportedAtTheNextToken()
	{
		assertNull(parse("int main() { return 0 }"));
		assertEquals(List.of("[ERROR] test.c:1:23: Expected ';' after return"), reporter.getDiagnostics());
		assertTrue(errors.toString(StandardCharsets.UTF_8).contains("Expected ';' after return"));
	}

	@Test
	void invalidAssignmentTarget()
	{
		assertNull(parse("void f() { 1 = x; }"));
		assertEquals("[ERROR] test.c:1:14: Invalid assignment target", reporter.getDiagnostics().get(0));
	}

	@Test
	void invalidIncrementTarget()
	{
		assertNull(parse("void f() { 5++; }"));
		assertEquals("[ERROR] test.c:1:13: Invalid increment/decrement target", reporter.getDiagnostics().get(0));
	}

	@Test
	void lexicalErrorIsReportedWithoutParsing()
	{
		assertNull(parse("int main() { return @; }"));
		assertEquals(List.of("[ERROR] test.c:1:21: Unexpected character: '@'"), reporter.getDiagnostics());
	}

	@Test
	void deeplyNestedParenthesesAreRejected()
	{
		String nested = "(".repeat(1000) + "1" + ")".repeat(1000);

		assertNull(parse("int main() { return " + nested + "; }"));
		assertEquals(1, reporter.getDiagnostics().size());
		assertTrue(reporter.getDiagnostics().get(0).endsWith(": Nesting too deep"));
	}

	@Test
	void deeplyNestedBlocksAreRejected()
	{
		assertNull(parse("int main() " + "{".repeat(5000) + "}".repeat(5000)));
		assertEquals(1, reporter.getDiagnostics().size());
		assertTrue(reporter.getDiagnostics().get(0).endsWith(": Nesting too deep"));
	}

	@Test
	void ordinaryNestingStillParses()
	{
		String nested = "(".repeat(60) + "x" + ")".repeat(60);
		String blocks = "{".repeat(100) + "x = " + nested + ";" + "}".repeat(100);

		assertNotNull(parse("int main() { int x = 1; " + blocks + " return x; }"));
		assertTrue(reporter.getDiagnostics().isEmpty());
	}

	@Test
	void parsingResumesAtTheNextDeclaration()
	{
		CParser parser = new CParser(Lexer.tokenize("int bad( {\n}\nint good() { return 0 }", "test.c"), "test.c", reporter);

		assertNull(parser.parse());
		assertTrue(parser.hadError());
		assertEquals(List.of(
				"[ERROR] test.c:1:10: Expected parameter type",
				"[ERROR] test.c:3:23: Expected ';' after return"), reporter.getDiagnostics());
	}

	@Test
	void missingFunctionName()
	{
		assertNull(parse("int (void) { }"));
		assertEquals("[ERROR] test.c:1:5: Expected function name", reporter.getDiagnostics().get(0));
	}

	@Test
	void unknownTopLevelToken()
	{
		assertNull(parse("return 0;"));
		assertEquals("[ERROR] test.c:1:1: Expected return type", reporter.getDiagnostics().get(0));
	}
}
