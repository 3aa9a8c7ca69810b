package com.juanpa.c2en.semantics;

import com.juanpa.c2en.lexer.Token;
import com.juanpa.c2en.lexer.TokenType;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SymbolTableTest
{
	private static VariableSymbol variable(String name, int line, String scope, boolean isArray)
	{
		return new VariableSymbol(name, "int", new Token(TokenType.IDENTIFIER, name, line, 1), scope,
				VariableSymbol.Kind.VARIABLE, isArray);
	}

	@Test
	void resolveWalksTheEnclosingChain()
	{
		SymbolTable global = new SymbolTable(null, "global");
		SymbolTable function = new SymbolTable(global, "main");
		global.define(variable("counter", 1, "global", false));
		function.define(variable("x", 3, "main", false));

		assertNotNull(function.resolve("counter"));
		assertNotNull(function.resolve("x"));
		assertNull(global.resolve("x"));
		assertNull(function.resolveCurrentScope("counter"));
		assertSame(global, function.getEnclosingScope());
	}

	@Test
	void innerDeclarationShadowsOuter()
	{
		SymbolTable global = new SymbolTable(null, "global");
		SymbolTable function = new SymbolTable(global, "f");
		global.define(variable("x", 1, "global", false));
		function.define(variable("x", 5, "f", true));

		assertEquals(5, function.resolve("x").getLine());
		assertTrue(function.resolve("x").isArray());
		assertEquals(1, global.resolve("x").getLine());
	}

	@Test
	void duplicateDefinitionThrows()
	{
		SymbolTable scope = new SymbolTable(null, "global");
		scope.define(variable("x", 1, "global", false));

		IllegalArgumentException e = assertThrows(IllegalArgumentException.class, () -> scope.define(variable("x", 2, "global", false)));
		assertTrue(e.getMessage().contains("'x'"));
	}

	@Test
	void printsSymbolsInDeclarationOrder()
	{
		SymbolTable scope = new SymbolTable(null, "global");
		scope.define(new FunctionSymbol("main", "int", new Token(TokenType.IDENTIFIER, "main", 4, 5), "global", List.of(), true));
		scope.define(variable("buffer", 1, "global", true));
		scope.define(new TypedefSymbol("uint", "unsigned int", new Token(TokenType.IDENTIFIER, "uint", 2, 22), "global"));

		assertEquals("Symbol Table [global]:\n"
				+ "  main: int (line 4) [function]\n"
				+ "  buffer: int (line 1) [array]\n"
				+ "  uint: unsigned int (line 2) [typedef]\n", scope.toString());
		assertEquals(3, scope.size());
	}

	@Test
	void functionSymbolTracksDefinition()
	{
		FunctionSymbol symbol = new FunctionSymbol("f", "void", new Token(TokenType.IDENTIFIER, "f", 1, 6), "global", List.of("int", "char*"), false);

		assertFalse(symbol.isDefined());
		symbol.markDefined();
		assertTrue(symbol.isDefined());
		assertEquals(List.of("int", "char*"), symbol.getParameterTypes());
		assertTrue(symbol.isFunction());
		assertFalse(symbol.isArray());
	}
}
