package com.juanpa.c2en.ast.statements;

import com.juanpa.c2en.ast.ASTVisitor;
import com.juanpa.c2en.lexer.Token;

public class BreakStatement implements Statement
{
	private final Token keyword;

	public BreakStatement(Token keyword)
	{
		this.keyword = keyword;
	}

	@Override
	public Token getFirstToken()
	{
		return keyword;
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitBreakStatement(this);
	}

	@Override
	public String toString()
	{
		return "break;";
	}
}
