// File: src/main/java/com/juanpa/c2en/ast/expressions/LiteralExpression.java

package com.juanpa.c2en.ast.expressions;

import com.juanpa.c2en.ast.ASTVisitor;
import com.juanpa.c2en.lexer.Token;

/**
 * AST node representing a literal value: a number, a string or a character.
 * The value is kept exactly as written, quotes and escapes included.
 */
public class LiteralExpression implements Expression
{
	public enum Kind
	{
		NUMBER("number"), STRING("string"), CHAR("char");

		private final String displayName;

		Kind(String displayName)
		{
			this.displayName = displayName;
		}

		public String getDisplayName()
		{
			return displayName;
		}
	}

	private final Token literalToken;
	private final Kind kind;

	public LiteralExpression(Token literalToken, Kind kind)
	{
		this.literalToken = literalToken;
		this.kind = kind;
	}

	public String getValue()
	{
		return literalToken.getLexeme();
	}

	public Kind getKind()
	{
		return kind;
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitLiteralExpression(this);
	}

	@Override
	public String toString()
	{
		return literalToken.getLexeme();
	}

	@Override
	public Token getFirstToken()
	{
		return literalToken;
	}
}
