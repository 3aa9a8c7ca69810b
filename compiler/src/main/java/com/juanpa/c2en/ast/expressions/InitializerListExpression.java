// File: src/main/java/com/juanpa/c2en/ast/expressions/InitializerListExpression.java

package com.juanpa.c2en.ast.expressions;

import com.juanpa.c2en.ast.ASTVisitor;
import com.juanpa.c2en.lexer.Token;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Represents a brace initializer, e.g., `{1, 2, 3}`.
 * Only valid as the initializer of a declaration.
 */
public class InitializerListExpression implements Expression
{
	private final Token leftBrace;
	private final List<Expression> elements;

	public InitializerListExpression(Token leftBrace)
	{
		this.leftBrace = leftBrace;
		this.elements = new ArrayList<>();
	}

	public void addElement(Expression element)
	{
		elements.add(element);
	}

	public List<Expression> getElements()
	{
		return Collections.unmodifiableList(elements);
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitInitializerListExpression(this);
	}

	@Override
	public Token getFirstToken()
	{
		return leftBrace;
	}

	@Override
	public String toString()
	{
		return "{" + elements.stream().map(Expression::toString).collect(Collectors.joining(", ")) + "}";
	}
}
