package com.juanpa.c2en.ast.expressions;

import com.juanpa.c2en.ast.ASTVisitor;
import com.juanpa.c2en.lexer.Token;

/**
 * {@code target op= value} for {@code += -= *= /= %= &= |= ^= <<= >>=}.
 */
public class CompoundAssignmentExpression implements Expression
{
	private final Expression target;
	private final Token operator;
	private final Expression value;

	public CompoundAssignmentExpression(Expression target, Token operator, Expression value)
	{
		this.target = target;
		this.operator = operator;
		this.value = value;
	}

	public Expression getTarget()
	{
		return target;
	}

	public Token getOperator()
	{
		return operator;
	}

	public Expression getValue()
	{
		return value;
	}

	@Override
	public Token getFirstToken()
	{
		return target.getFirstToken();
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitCompoundAssignmentExpression(this);
	}

	@Override
	public String toString()
	{
		return "(" + target + " " + operator.getLexeme() + " " + value + ")";
	}
}
