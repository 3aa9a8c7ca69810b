// File: src/main/java/com/juanpa/c2en/ast/statements/IfStatement.java
package com.juanpa.c2en.ast.statements;

import com.juanpa.c2en.ast.ASTVisitor;
import com.juanpa.c2en.ast.expressions.Expression;
import com.juanpa.c2en.lexer.Token;

/**
 * AST node representing an 'if-else' statement.
 * Includes a condition, a 'then' branch (which can be a single statement or a block),
 * and an optional 'else' branch.
 */
public class IfStatement implements Statement
{
	private final Token ifKeyword;
	private final Expression condition;
	private final Statement thenBranch;
	private final Statement elseBranch; // Null when there is no else

	public IfStatement(Token ifKeyword, Expression condition, Statement thenBranch, Statement elseBranch)
	{
		this.ifKeyword = ifKeyword;
		this.condition = condition;
		this.thenBranch = thenBranch;
		this.elseBranch = elseBranch;
	}

	public Expression getCondition()
	{
		return condition;
	}

	public Statement getThenBranch()
	{
		return thenBranch;
	}

	public Statement getElseBranch()
	{
		return elseBranch;
	}

	@Override
	public Token getFirstToken()
	{
		return ifKeyword;
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitIfStatement(this);
	}

	@Override
	public String toString()
	{
		String text = "if (" + condition + ") " + thenBranch;
		return elseBranch == null ? text : text + " else " + elseBranch;
	}
}
