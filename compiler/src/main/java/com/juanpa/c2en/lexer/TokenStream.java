package com.juanpa.c2en.lexer;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * The ordered output of one tokenization run.
 * The last token is always either {@link TokenType#EOF} or {@link TokenType#ERROR};
 * the stream is never modified after the lexer hands it over.
 */
public final class TokenStream
{
	private final List<Token> tokens;
	private final String sourceName;

	public TokenStream(List<Token> tokens, String sourceName)
	{
		Objects.requireNonNull(tokens);
		if (tokens.isEmpty())
		{
			throw new IllegalArgumentException("Token stream must contain at least an EOF or ERROR token");
		}
		TokenType lastType = tokens.get(tokens.size() - 1).getType();
		if (lastType != TokenType.EOF && lastType != TokenType.ERROR)
		{
			throw new IllegalArgumentException("Token stream must end with EOF or ERROR, found " + lastType);
		}
		this.tokens = Collections.unmodifiableList(new ArrayList<>(tokens));
		this.sourceName = sourceName;
	}

	public int size()
	{
		return tokens.size();
	}

	public Token get(int index)
	{
		return tokens.get(index);
	}

	/**
	 * The terminating token. Callers treat it as the authoritative end of input.
	 */
	public Token last()
	{
		return tokens.get(tokens.size() - 1);
	}

	/**
	 * @return True if tokenization stopped on a lexical error.
	 */
	public boolean hasError()
	{
		return last().getType() == TokenType.ERROR;
	}

	public List<Token> getTokens()
	{
		return tokens;
	}

	public String getSourceName()
	{
		return sourceName;
	}
}
