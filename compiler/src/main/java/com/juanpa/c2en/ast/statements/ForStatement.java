// File: src/main/java/com/juanpa/c2en/ast/statements/ForStatement.java

package com.juanpa.c2en.ast.statements;

import com.juanpa.c2en.ast.ASTVisitor;
import com.juanpa.c2en.ast.expressions.Expression;
import com.juanpa.c2en.lexer.Token;

/**
 * AST node representing a C-style 'for' loop: {@code for (initializer; condition; increment) body}.
 * The initializer is either a {@link VariableDeclaration} or an {@link ExpressionStatement};
 * each of the three header parts may be absent.
 */
public class ForStatement implements Statement
{
	private final Token forKeyword;
	private final Statement initializer;
	private final Expression condition;
	private final Expression increment;
	private final Statement body;

	public ForStatement(Token forKeyword, Statement initializer, Expression condition, Expression increment, Statement body)
	{
		this.forKeyword = forKeyword;
		this.initializer = initializer;
		this.condition = condition;
		this.increment = increment;
		this.body = body;
	}

	public Statement getInitializer()
	{
		return initializer;
	}

	public Expression getCondition()
	{
		return condition;
	}

	public Expression getIncrement()
	{
		return increment;
	}

	public Statement getBody()
	{
		return body;
	}

	@Override
	public Token getFirstToken()
	{
		return forKeyword;
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitForStatement(this);
	}

	@Override
	public String toString()
	{
		return "for (" + (initializer != null ? initializer.toString() : ";") + " "
				+ (condition != null ? condition.toString() : "") + "; "
				+ (increment != null ? increment.toString() : "") + ") " + body;
	}
}
