// File: src/main/java/com/juanpa/c2en/ast/statements/VariableDeclaration.java

package com.juanpa.c2en.ast.statements;

import com.juanpa.c2en.ast.ASTVisitor;
import com.juanpa.c2en.ast.declarations.Declaration;
import com.juanpa.c2en.ast.expressions.Expression;
import com.juanpa.c2en.lexer.Token;

/**
 * AST node representing a variable declaration, e.g. {@code int x = 5;} or {@code char buf[64];}.
 * Used for locals, globals and struct members alike.
 */
public class VariableDeclaration implements Statement, Declaration
{
	private final Token typeStart;        // First token of the type, for error reporting
	private final String type;            // Rendered type (e.g., "unsigned int", "char*")
	private final Token name;             // The variable's name token
	private final boolean isArray;
	private final Expression arraySize;   // Optional, only meaningful for arrays
	private final Expression initializer; // Optional

	/**
	 * Constructs a VariableDeclaration.
	 *
	 * @param typeStart   The first token of the declared type.
	 * @param type        The rendered type.
	 * @param name        The variable name token.
	 * @param isArray     True if declared with brackets.
	 * @param arraySize   The size expression between the brackets, or null.
	 * @param initializer The initial value expression, or null.
	 */
	public VariableDeclaration(Token typeStart, String type, Token name, boolean isArray, Expression arraySize, Expression initializer)
	{
		this.typeStart = typeStart;
		this.type = type;
		this.name = name;
		this.isArray = isArray;
		this.arraySize = arraySize;
		this.initializer = initializer;
	}

	public String getType()
	{
		return type;
	}

	public String getName()
	{
		return name.getLexeme();
	}

	public Token getNameToken()
	{
		return name;
	}

	public boolean isArray()
	{
		return isArray;
	}

	public Expression getArraySize()
	{
		return arraySize;
	}

	public Expression getInitializer()
	{
		return initializer;
	}

	@Override
	public Token getFirstToken()
	{
		return typeStart;
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitVariableDeclaration(this);
	}

	@Override
	public String toString()
	{
		StringBuilder sb = new StringBuilder(type).append(" ").append(name.getLexeme());
		if (isArray)
		{
			sb.append("[").append(arraySize != null ? arraySize.toString() : "").append("]");
		}
		if (initializer != null)
		{
			sb.append(" = ").append(initializer);
		}
		return sb.append(";").toString();
	}
}
