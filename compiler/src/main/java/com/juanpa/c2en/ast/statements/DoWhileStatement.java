package com.juanpa.c2en.ast.statements;

import com.juanpa.c2en.ast.ASTVisitor;
import com.juanpa.c2en.ast.expressions.Expression;
import com.juanpa.c2en.lexer.Token;

/**
 * {@code do <body> while (<condition>);}. The body always runs at least once.
 */
public class DoWhileStatement implements Statement
{
	private final Token doKeyword;
	private final Statement body;
	private final Expression condition;

	public DoWhileStatement(Token doKeyword, Statement body, Expression condition)
	{
		this.doKeyword = doKeyword;
		this.body = body;
		this.condition = condition;
	}

	public Statement getBody()
	{
		return body;
	}

	public Expression getCondition()
	{
		return condition;
	}

	@Override
	public Token getFirstToken()
	{
		return doKeyword;
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitDoWhileStatement(this);
	}

	@Override
	public String toString()
	{
		return "do " + body + " while (" + condition + ");";
	}
}
