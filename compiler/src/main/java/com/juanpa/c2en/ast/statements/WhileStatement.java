package com.juanpa.c2en.ast.statements;

import com.juanpa.c2en.ast.ASTVisitor;
import com.juanpa.c2en.ast.expressions.Expression;
import com.juanpa.c2en.lexer.Token;

public class WhileStatement implements Statement
{
	private final Token whileKeyword;
	private final Expression condition;
	private final Statement body;

	public WhileStatement(Token whileKeyword, Expression condition, Statement body)
	{
		this.whileKeyword = whileKeyword;
		this.condition = condition;
		this.body = body;
	}

	public Expression getCondition()
	{
		return condition;
	}

	public Statement getBody()
	{
		return body;
	}

	@Override
	public Token getFirstToken()
	{
		return whileKeyword;
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitWhileStatement(this);
	}

	@Override
	public String toString()
	{
		return "while (" + condition + ") " + body;
	}
}
