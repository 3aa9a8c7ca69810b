// File: src/main/java/com/juanpa/c2en/ast/expressions/ArrayAccessExpression.java

package com.juanpa.c2en.ast.expressions;

import com.juanpa.c2en.ast.ASTVisitor;
import com.juanpa.c2en.lexer.Token;

/**
 * Represents accessing an element of an array, e.g., {@code myArray[index]}.
 */
public class ArrayAccessExpression implements Expression
{
	private final Expression array;
	private final Token leftBracket;
	private final Expression index;

	public ArrayAccessExpression(Expression array, Token leftBracket, Expression index)
	{
		this.array = array;
		this.leftBracket = leftBracket;
		this.index = index;
	}

	public Expression getArray()
	{
		return array;
	}

	public Token getLeftBracket()
	{
		return leftBracket;
	}

	public Expression getIndex()
	{
		return index;
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitArrayAccessExpression(this);
	}

	@Override
	public Token getFirstToken()
	{
		return array.getFirstToken();
	}

	@Override
	public String toString()
	{
		return array + "[" + index + "]";
	}
}
