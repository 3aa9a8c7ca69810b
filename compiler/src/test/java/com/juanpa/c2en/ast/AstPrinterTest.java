package com.juanpa.c2en.ast;

import com.juanpa.c2en.lexer.Lexer;
import com.juanpa.c2en.parser.CParser;
import com.juanpa.c2en.util.ErrorReporter;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;

import static org.junit.jupiter.api.Assertions.*;

class AstPrinterTest
{
	private static Program parse(String source)
	{
		ErrorReporter reporter = new ErrorReporter(new PrintStream(new ByteArrayOutputStream()));
		Program program = new CParser(Lexer.tokenize(source, "test.c"), "test.c", reporter).parse();
		assertNotNull(program, () -> "Unexpected errors: " + reporter.getDiagnostics());
		return program;
	}

	@Test
	void printsIndentedOutline()
	{
		Program program = parse("int main() { int x = 1 + 2; return x; }");

		String expected = "PROGRAM (1 functions)\n"
				+ "  FUNCTION main: int\n"
				+ "    BLOCK\n"
				+ "      DECLARATION x: int\n"
				+ "        BINARY_OP +\n"
				+ "          LITERAL 1 (number)\n"
				+ "          LITERAL 2 (number)\n"
				+ "      RETURN\n"
				+ "        IDENTIFIER x\n";
		assertEquals(expected, AstPrinter.print(program));
	}

	@Test
	void printsParametersControlFlowAndLiteralKinds()
	{
		Program program = parse("void greet(char name[], int n) { if (n) printf(\"hi %s\", name); else putchar('x'); }");

		String expected = "PROGRAM (1 functions)\n"
				+ "  FUNCTION greet: void\n"
				+ "    PARAMETER name: char[]\n"
				+ "    PARAMETER n: int\n"
				+ "    BLOCK\n"
				+ "      IF\n"
				+ "        IDENTIFIER n\n"
				+ "        EXPRESSION\n"
				+ "          CALL printf\n"
				+ "            LITERAL \"hi %s\" (string)\n"
				+ "            IDENTIFIER name\n"
				+ "      ELSE\n"
				+ "        EXPRESSION\n"
				+ "          CALL putchar\n"
				+ "            LITERAL 'x' (char)\n";
		assertEquals(expected, AstPrinter.print(program));
	}

	@Test
	void printsTopLevelDefinitions()
	{
		Program program = parse("typedef struct Pair { int a; int b[2]; } Pair;\nenum { OFF, ON = 1 };\nint table[4];");

		String expected = "PROGRAM (0 functions)\n"
				+ "  TYPEDEF Pair: struct Pair\n"
				+ "    STRUCT Pair\n"
				+ "      DECLARATION a: int\n"
				+ "      DECLARATION b: int[]\n"
				+ "        LITERAL 2 (number)\n"
				+ "  ENUM\n"
				+ "    CONSTANT OFF\n"
				+ "    CONSTANT ON\n"
				+ "      LITERAL 1 (number)\n"
				+ "  DECLARATION table: int[]\n"
				+ "    LITERAL 4 (number)\n";
		assertEquals(expected, AstPrinter.print(program));
	}

	@Test
	void printingIsDeterministic()
	{
		String source = "int f(int a) { switch (a) { case 1: return a ? 2 : 3; default: break; } do { a--; } while (a > 0); return sizeof(int); }";

		String first = AstPrinter.print(parse(source));
		String second = AstPrinter.print(parse(source));
		Program program = parse(source);

		assertEquals(first, second);
		assertEquals(AstPrinter.print(program), AstPrinter.print(program));
		assertTrue(first.contains("      SWITCH\n"));
		assertTrue(first.contains("TERNARY"));
		assertTrue(first.contains("SIZEOF int"));
		assertTrue(first.contains("POSTFIX_OP --"));
	}

	@Test
	void printsSubtrees()
	{
		Program program = parse("int main() { x = -y; }");
		ASTNode statement = program.getFunctions().get(0).getBody().getStatements().get(0);

		assertEquals("EXPRESSION\n  ASSIGNMENT =\n    IDENTIFIER x\n    UNARY_OP -\n      IDENTIFIER y\n", AstPrinter.print(statement));
	}
}
