package com.juanpa.c2en.ast.statements;

import com.juanpa.c2en.ast.ASTVisitor;
import com.juanpa.c2en.lexer.Token;

public class ContinueStatement implements Statement
{
	private final Token keyword;

	public ContinueStatement(Token keyword)
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
		return visitor.visitContinueStatement(this);
	}

	@Override
	public String toString()
	{
		return "continue;";
	}
}
