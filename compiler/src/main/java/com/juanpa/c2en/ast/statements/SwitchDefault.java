package com.juanpa.c2en.ast.statements;

import com.juanpa.c2en.ast.ASTVisitor;
import com.juanpa.c2en.lexer.Token;

public class SwitchDefault extends SwitchClause
{
	public SwitchDefault(Token defaultKeyword)
	{
		super(defaultKeyword);
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitSwitchDefault(this);
	}

	@Override
	public String toString()
	{
		return "default:" + bodyToString();
	}
}
