package com.juanpa.c2en.semantics;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Represents a symbol table for a specific scope.
 * It maps identifier names to their corresponding Symbol objects, in declaration order.
 * Symbol tables form a tree structure through their enclosing scope; following
 * that link never changes the parent.
 */
public class SymbolTable
{
	private final Map<String, Symbol> symbols;
	private final SymbolTable enclosingScope; // Reference to the parent scope, null for the global scope
	private final String scopeName;           // "global" or the function name

	public SymbolTable(SymbolTable enclosingScope, String scopeName)
	{
		this.symbols = new LinkedHashMap<>();
		this.enclosingScope = enclosingScope;
		this.scopeName = scopeName;
	}

	/**
	 * Defines a new symbol in the current scope.
	 *
	 * @param symbol The symbol to define.
	 * @throws IllegalArgumentException if a symbol with the same name already exists in this scope.
	 */
	public void define(Symbol symbol)
	{
		if (symbols.containsKey(symbol.getName()))
		{
			throw new IllegalArgumentException("Symbol '" + symbol.getName() + "' already defined in scope '" + scopeName + "'.");
		}
		symbols.put(symbol.getName(), symbol);
	}

	/**
	 * Looks up a symbol, starting from the current scope and moving up to enclosing scopes.
	 *
	 * @param name The name of the symbol to look up.
	 * @return The found Symbol, or null if not found in any enclosing scope.
	 */
	public Symbol resolve(String name)
	{
		for (SymbolTable scope = this; scope != null; scope = scope.enclosingScope)
		{
			Symbol symbol = scope.symbols.get(name);
			if (symbol != null)
			{
				return symbol;
			}
		}
		return null;
	}

	/**
	 * Looks up a symbol only in the current scope.
	 *
	 * @param name The name of the symbol to look up.
	 * @return The found Symbol, or null if not found in this scope.
	 */
	public Symbol resolveCurrentScope(String name)
	{
		return symbols.get(name);
	}

	public SymbolTable getEnclosingScope()
	{
		return enclosingScope;
	}

	public String getScopeName()
	{
		return scopeName;
	}

	public Map<String, Symbol> getSymbols()
	{
		return Collections.unmodifiableMap(symbols);
	}

	public int size()
	{
		return symbols.size();
	}

	@Override
	public String toString()
	{
		StringBuilder sb = new StringBuilder();
		sb.append("Symbol Table [").append(scopeName).append("]:\n");
		for (Symbol symbol : symbols.values())
		{
			sb.append("  ").append(symbol).append("\n");
		}
		return sb.toString();
	}
}
