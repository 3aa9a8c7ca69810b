package com.juanpa.c2en.semantics;

import com.juanpa.c2en.lexer.Token;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A function known to the global scope. A prototype creates an undefined symbol;
 * the matching definition later marks it defined.
 */
public class FunctionSymbol extends Symbol
{
	private final List<String> parameterTypes;
	private boolean defined;

	public FunctionSymbol(String name, String returnType, Token declarationToken, String scopeName, List<String> parameterTypes, boolean defined)
	{
		super(name, returnType, declarationToken, scopeName);
		this.parameterTypes = new ArrayList<>(parameterTypes);
		this.defined = defined;
	}

	public List<String> getParameterTypes()
	{
		return Collections.unmodifiableList(parameterTypes);
	}

	public boolean isDefined()
	{
		return defined;
	}

	public void markDefined()
	{
		this.defined = true;
	}

	@Override
	public boolean isFunction()
	{
		return true;
	}
}
