// File: src/main/java/com/juanpa/c2en/ast/expressions/AssignmentExpression.java

package com.juanpa.c2en.ast.expressions;

import com.juanpa.c2en.ast.ASTVisitor;
import com.juanpa.c2en.lexer.Token;

/**
 * AST node representing a plain assignment operation (e.g., x = 10, arr[i] = y).
 * The target is an identifier, array access, member access or dereference.
 */
public class AssignmentExpression implements Expression
{
	private final Expression target;
	private final Token operator;
	private final Expression value;

	public AssignmentExpression(Expression target, Token operator, Expression value)
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
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitAssignmentExpression(this);
	}

	@Override
	public String toString()
	{
		return "(" + target + " = " + value + ")";
	}

	@Override
	public Token getFirstToken()
	{
		return target.getFirstToken();
	}
}
