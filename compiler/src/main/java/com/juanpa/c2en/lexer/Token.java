package com.juanpa.c2en.lexer;

/**
 * Represents a single token produced by the c2en Lexer.
 * Each token encapsulates its type, the actual text (lexeme),
 * and its position in the source file for error reporting.
 */
public class Token
{
	private final TokenType type;    // The classification of the token (e.g., IDENTIFIER, INT, PLUS)
	private final String lexeme;     // The source text, or the diagnostic message for ERROR tokens
	private final int line;          // The line number in the source file where the token starts
	private final int column;        // The column number in the source file where the token starts

	/**
	 * Constructs a new Token instance.
	 *
	 * @param type   The TokenType of this token.
	 * @param lexeme The raw string value of the token from the source code.
	 * @param line   The line number where this token begins.
	 * @param column The column number where this token begins.
	 */
	public Token(TokenType type, String lexeme, int line, int column)
	{
		this.type = type;
		this.lexeme = lexeme;
		this.line = line;
		this.column = column;
	}

	public TokenType getType()
	{
		return type;
	}

	public String getLexeme()
	{
		return lexeme;
	}

	public int getLine()
	{
		return line;
	}

	public int getColumn()
	{
		return column;
	}

	/**
	 * Provides a string representation of the Token, useful for debugging.
	 * Format: "TokenType 'Lexeme' (Line:Column)"
	 */
	@Override
	public String toString()
	{
		return type + " '" + lexeme + "' (Line:" + line + ", Col:" + column + ")";
	}

	/**
	 * Tokens are equal when type and lexeme match. Line/column are not included as
	 * tokens from different positions could still be considered "the same"
	 * for comparison in tests.
	 */
	@Override
	public boolean equals(Object o)
	{
		if (this == o)
		{
			return true;
		}
		if (o == null || getClass() != o.getClass())
		{
			return false;
		}

		Token token = (Token) o;
		return type == token.type && lexeme.equals(token.lexeme);
	}

	@Override
	public int hashCode()
	{
		return 31 * type.hashCode() + lexeme.hashCode();
	}
}
