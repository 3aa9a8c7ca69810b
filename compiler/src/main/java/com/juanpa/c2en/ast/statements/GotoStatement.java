package com.juanpa.c2en.ast.statements;

import com.juanpa.c2en.ast.ASTVisitor;
import com.juanpa.c2en.lexer.Token;

public class GotoStatement implements Statement
{
	private final Token keyword;
	private final Token label;

	public GotoStatement(Token keyword, Token label)
	{
		this.keyword = keyword;
		this.label = label;
	}

	public String getLabel()
	{
		return label.getLexeme();
	}

	@Override
	public Token getFirstToken()
	{
		return keyword;
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitGotoStatement(this);
	}

	@Override
	public String toString()
	{
		return "goto " + label.getLexeme() + ";";
	}
}
