package com.juanpa.c2en.semantics;

import com.juanpa.c2en.lexer.Token;

/**
 * A name introduced by {@code typedef}; its type is the aliased type.
 */
public class TypedefSymbol extends Symbol
{
	public TypedefSymbol(String alias, String aliasedType, Token declarationToken, String scopeName)
	{
		super(alias, aliasedType, declarationToken, scopeName);
	}

	@Override
	public boolean isFunction()
	{
		return false;
	}

	@Override
	public String toString()
	{
		return super.toString() + " [typedef]";
	}
}
