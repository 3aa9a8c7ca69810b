// File: src/main/java/com/juanpa/c2en/semantics/VariableSymbol.java

package com.juanpa.c2en.semantics;

import com.juanpa.c2en.lexer.Token;

/**
 * Represents a variable (local, global or parameter) or an enum constant in the symbol table.
 */
public class VariableSymbol extends Symbol
{
	public enum Kind
	{
		VARIABLE, PARAMETER, ENUM_CONSTANT
	}

	private final Kind kind;
	private final boolean isArray;

	/**
	 * Constructs a VariableSymbol.
	 *
	 * @param name             The name of the variable.
	 * @param type             The declared type of the variable.
	 * @param declarationToken The token where this variable was declared.
	 * @param scopeName        The name of the declaring scope.
	 * @param kind             What kind of declaration introduced the name.
	 * @param isArray          True if declared with brackets.
	 */
	public VariableSymbol(String name, String type, Token declarationToken, String scopeName, Kind kind, boolean isArray)
	{
		super(name, type, declarationToken, scopeName);
		this.kind = kind;
		this.isArray = isArray;
	}

	public Kind getKind()
	{
		return kind;
	}

	@Override
	public boolean isFunction()
	{
		return false;
	}

	@Override
	public boolean isArray()
	{
		return isArray;
	}
}
