package com.juanpa.c2en.ast.expressions;

import com.juanpa.c2en.ast.ASTVisitor;
import com.juanpa.c2en.lexer.Token;

public class CastExpression implements Expression
{
	private final Token leftParen;
	private final String targetType;
	private final Expression operand;

	public CastExpression(Token leftParen, String targetType, Expression operand)
	{
		this.leftParen = leftParen;
		this.targetType = targetType;
		this.operand = operand;
	}

	public String getTargetType()
	{
		return targetType;
	}

	public Expression getOperand()
	{
		return operand;
	}

	@Override
	public Token getFirstToken()
	{
		return leftParen;
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitCastExpression(this);
	}

	@Override
	public String toString()
	{
		return "((" + targetType + ") " + operand + ")";
	}
}
