package com.juanpa.c2en.ast.expressions;

import com.juanpa.c2en.ast.ASTVisitor;
import com.juanpa.c2en.lexer.Token;
import com.juanpa.c2en.lexer.TokenType;

/**
 * Member selection through {@code .} or {@code ->}.
 */
public class MemberAccessExpression implements Expression
{
	private final Expression object;
	private final Token operator;
	private final Token member;

	public MemberAccessExpression(Expression object, Token operator, Token member)
	{
		this.object = object;
		this.operator = operator;
		this.member = member;
	}

	public Expression getObject()
	{
		return object;
	}

	public String getMemberName()
	{
		return member.getLexeme();
	}

	public boolean isArrow()
	{
		return operator.getType() == TokenType.ARROW;
	}

	@Override
	public Token getFirstToken()
	{
		return object.getFirstToken();
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitMemberAccessExpression(this);
	}

	@Override
	public String toString()
	{
		return object + operator.getLexeme() + member.getLexeme();
	}
}
