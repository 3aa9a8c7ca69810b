package com.juanpa.c2en.ast.statements;

import com.juanpa.c2en.ast.ASTVisitor;
import com.juanpa.c2en.ast.expressions.Expression;
import com.juanpa.c2en.lexer.Token;

/**
 * An expression evaluated for its side effects, terminated by a semicolon.
 */
public class ExpressionStatement implements Statement
{
	private final Expression expression;

	public ExpressionStatement(Expression expression)
	{
		this.expression = expression;
	}

	public Expression getExpression()
	{
		return expression;
	}

	@Override
	public Token getFirstToken()
	{
		return expression.getFirstToken();
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitExpressionStatement(this);
	}

	@Override
	public String toString()
	{
		return expression + ";";
	}
}
