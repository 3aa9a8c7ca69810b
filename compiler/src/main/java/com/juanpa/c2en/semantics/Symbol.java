// File: src/main/java/com/juanpa/c2en/semantics/Symbol.java

package com.juanpa.c2en.semantics;

import com.juanpa.c2en.lexer.Token;

/**
 * Abstract base class for all symbols in the symbol table.
 * A symbol represents a declared entity in the program (e.g., variable, function, typedef).
 */
public abstract class Symbol
{
	private final String name;
	private final String type;             // Rendered C type, or the return type for functions
	private final Token declarationToken;  // The token where this symbol was declared
	private final String scopeName;        // Name of the scope the symbol was declared in

	/**
	 * Constructor for a Symbol.
	 *
	 * @param name             The name of the symbol.
	 * @param type             The type of the symbol.
	 * @param declarationToken The token representing the declaration of this symbol.
	 * @param scopeName        The name of the declaring scope.
	 */
	protected Symbol(String name, String type, Token declarationToken, String scopeName)
	{
		this.name = name;
		this.type = type;
		this.declarationToken = declarationToken;
		this.scopeName = scopeName;
	}

	public String getName()
	{
		return name;
	}

	public String getType()
	{
		return type;
	}

	public Token getDeclarationToken()
	{
		return declarationToken;
	}

	public String getScopeName()
	{
		return scopeName;
	}

	public int getLine()
	{
		return declarationToken.getLine();
	}

	public abstract boolean isFunction();

	/**
	 * @return True if the symbol may be indexed with {@code []}.
	 */
	public boolean isArray()
	{
		return false;
	}

	/**
	 * Format: {@code name: type (line N)} plus {@code [function]} or {@code [array]} markers.
	 */
	@Override
	public String toString()
	{
		return name + ": " + type + " (line " + getLine() + ")"
				+ (isFunction() ? " [function]" : "")
				+ (isArray() ? " [array]" : "");
	}
}
