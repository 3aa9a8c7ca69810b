// File: src/main/java/com/juanpa/c2en/ast/statements/ReturnStatement.java

package com.juanpa.c2en.ast.statements;

import com.juanpa.c2en.ast.ASTVisitor;
import com.juanpa.c2en.ast.expressions.Expression;
import com.juanpa.c2en.lexer.Token;

/**
 * AST node representing a 'return' statement.
 * Can optionally return a value (an expression).
 */
public class ReturnStatement implements Statement
{
	private final Token keyword;
	private final Expression value; // Null for 'return;'

	public ReturnStatement(Token keyword, Expression value)
	{
		this.keyword = keyword;
		this.value = value;
	}

	public Expression getValue()
	{
		return value;
	}

	@Override
	public Token getFirstToken()
	{
		return keyword;
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitReturnStatement(this);
	}

	@Override
	public String toString()
	{
		return value == null ? "return;" : "return " + value + ";";
	}
}
