package com.juanpa.c2en.ast.statements;

import com.juanpa.c2en.ast.ASTVisitor;
import com.juanpa.c2en.lexer.Token;

/**
 * A {@code name:} label. The statement that follows it is parsed as a sibling,
 * not as a child of the label.
 */
public class LabelStatement implements Statement
{
	private final Token name;

	public LabelStatement(Token name)
	{
		this.name = name;
	}

	public String getName()
	{
		return name.getLexeme();
	}

	@Override
	public Token getFirstToken()
	{
		return name;
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitLabelStatement(this);
	}

	@Override
	public String toString()
	{
		return name.getLexeme() + ":";
	}
}
