package com.juanpa.c2en.ast.declarations;

import com.juanpa.c2en.ast.expressions.Expression;
import com.juanpa.c2en.lexer.Token;

/**
 * One enumerator of an {@link EnumDefinition}, with its optional explicit value.
 */
public class EnumConstant
{
	private final Token name;
	private final Expression value;

	public EnumConstant(Token name, Expression value)
	{
		this.name = name;
		this.value = value;
	}

	public String getName()
	{
		return name.getLexeme();
	}

	public Token getNameToken()
	{
		return name;
	}

	public Expression getValue()
	{
		return value;
	}

	@Override
	public String toString()
	{
		return value == null ? name.getLexeme() : name.getLexeme() + " = " + value;
	}
}
