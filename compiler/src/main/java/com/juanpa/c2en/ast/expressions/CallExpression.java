// File: src/main/java/com/juanpa/c2en/ast/expressions/CallExpression.java

package com.juanpa.c2en.ast.expressions;

import com.juanpa.c2en.ast.ASTVisitor;
import com.juanpa.c2en.lexer.Token;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * AST node representing a call to a named function, e.g. {@code printf("%d", x)}.
 */
public class CallExpression implements Expression
{
	private final Token callee;            // The function name token
	private final List<Expression> arguments;

	public CallExpression(Token callee, List<Expression> arguments)
	{
		this.callee = callee;
		this.arguments = new ArrayList<>(arguments);
	}

	public String getFunctionName()
	{
		return callee.getLexeme();
	}

	public List<Expression> getArguments()
	{
		return Collections.unmodifiableList(arguments);
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitCallExpression(this);
	}

	@Override
	public String toString()
	{
		return callee.getLexeme() + "(" + arguments.stream().map(Expression::toString).collect(Collectors.joining(", ")) + ")";
	}

	@Override
	public Token getFirstToken()
	{
		return callee;
	}
}
