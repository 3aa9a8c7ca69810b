// File: src/main/java/com/juanpa/c2en/ast/expressions/PostfixUnaryExpression.java

package com.juanpa.c2en.ast.expressions;

import com.juanpa.c2en.ast.ASTVisitor;
import com.juanpa.c2en.lexer.Token;

/**
 * Represents a postfix unary expression like `i++` or `i--`.
 */
public class PostfixUnaryExpression implements Expression
{
	private final Expression operand;
	private final Token operator;

	public PostfixUnaryExpression(Expression operand, Token operator)
	{
		this.operand = operand;
		this.operator = operator;
	}

	public Expression getOperand()
	{
		return operand;
	}

	public Token getOperator()
	{
		return operator;
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitPostfixUnaryExpression(this);
	}

	@Override
	public Token getFirstToken()
	{
		return operand.getFirstToken();
	}

	@Override
	public String toString()
	{
		return "(" + operand + operator.getLexeme() + ")";
	}
}
