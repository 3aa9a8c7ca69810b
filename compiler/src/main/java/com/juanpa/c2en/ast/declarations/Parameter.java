package com.juanpa.c2en.ast.declarations;

import com.juanpa.c2en.lexer.Token;

/**
 * A single formal parameter of a function. Not a visitor node: it is always
 * handled through its owning {@link FunctionDeclaration}.
 */
public class Parameter
{
	private final String type;
	private final Token name;
	private final boolean isArray; // Declared with trailing []

	public Parameter(String type, Token name, boolean isArray)
	{
		this.type = type;
		this.name = name;
		this.isArray = isArray;
	}

	public String getType()
	{
		return type;
	}

	public String getName()
	{
		return name.getLexeme();
	}

	public Token getNameToken()
	{
		return name;
	}

	public boolean isArray()
	{
		return isArray;
	}

	@Override
	public String toString()
	{
		return type + " " + name.getLexeme() + (isArray ? "[]" : "");
	}
}
