package com.juanpa.c2en.ast.expressions;

import com.juanpa.c2en.ast.ASTVisitor;
import com.juanpa.c2en.lexer.Token;

/**
 * {@code condition ? thenExpression : elseExpression}. Nested ternaries group to the right.
 */
public class TernaryExpression implements Expression
{
	private final Expression condition;
	private final Expression thenExpression;
	private final Expression elseExpression;

	public TernaryExpression(Expression condition, Expression thenExpression, Expression elseExpression)
	{
		this.condition = condition;
		this.thenExpression = thenExpression;
		this.elseExpression = elseExpression;
	}

	public Expression getCondition()
	{
		return condition;
	}

	public Expression getThenExpression()
	{
		return thenExpression;
	}

	public Expression getElseExpression()
	{
		return elseExpression;
	}

	@Override
	public Token getFirstToken()
	{
		return condition.getFirstToken();
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitTernaryExpression(this);
	}

	@Override
	public String toString()
	{
		return "(" + condition + " ? " + thenExpression + " : " + elseExpression + ")";
	}
}
