package com.juanpa.c2en.ast.expressions;

import com.juanpa.c2en.ast.ASTVisitor;
import com.juanpa.c2en.lexer.Token;

/**
 * {@code sizeof(type)} or {@code sizeof expr}. Exactly one of typeName and operand is set.
 */
public class SizeofExpression implements Expression
{
	private final Token keyword;
	private final String typeName;
	private final Expression operand;

	public SizeofExpression(Token keyword, String typeName, Expression operand)
	{
		this.keyword = keyword;
		this.typeName = typeName;
		this.operand = operand;
	}

	public String getTypeName()
	{
		return typeName;
	}

	public Expression getOperand()
	{
		return operand;
	}

	public boolean isTypeOperand()
	{
		return typeName != null;
	}

	@Override
	public Token getFirstToken()
	{
		return keyword;
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitSizeofExpression(this);
	}

	@Override
	public String toString()
	{
		return "sizeof(" + (typeName != null ? typeName : operand.toString()) + ")";
	}
}
