// File: src/main/java/com/juanpa/c2en/lexer/Lexer.java

package com.juanpa.c2en.lexer;

import com.juanpa.c2en.util.Debug;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * The Lexer is responsible for performing lexical analysis (scanning).
 * It reads raw C source code and converts it into a stream of Tokens.
 * Preprocessor lines and comments are skipped without interpretation.
 * Scanning stops at the first lexical error: the offending ERROR token
 * becomes the last token of the stream and carries the diagnostic message.
 */
public class Lexer
{
	private final String source; // The raw source code string
	private final String sourceName; // File name, kept on the resulting stream
	private final List<Token> tokens = new ArrayList<>(); // List to store generated tokens

	private int start = 0; // Current token's starting position in the source
	private int current = 0; // Current position in the source
	private int line = 1; // Current line number
	private int column = 1; // Current column number

	private int startLine = 1;
	private int startColumn = 1;

	// Static map to store reserved keywords for quick lookup
	private static final Map<String, TokenType> keywords;

	static
	{
		keywords = new HashMap<>();
		keywords.put("int", TokenType.INT);
		keywords.put("char", TokenType.CHAR);
		keywords.put("float", TokenType.FLOAT);
		keywords.put("double", TokenType.DOUBLE);
		keywords.put("void", TokenType.VOID);
		keywords.put("if", TokenType.IF);
		keywords.put("else", TokenType.ELSE);
		keywords.put("while", TokenType.WHILE);
		keywords.put("for", TokenType.FOR);
		keywords.put("do", TokenType.DO);
		keywords.put("return", TokenType.RETURN);
		keywords.put("break", TokenType.BREAK);
		keywords.put("continue", TokenType.CONTINUE);
		keywords.put("struct", TokenType.STRUCT);
		keywords.put("union", TokenType.UNION);
		keywords.put("typedef", TokenType.TYPEDEF);
		keywords.put("sizeof", TokenType.SIZEOF);
		keywords.put("const", TokenType.CONST);
		keywords.put("static", TokenType.STATIC);
		keywords.put("extern", TokenType.EXTERN);
		keywords.put("switch", TokenType.SWITCH);
		keywords.put("case", TokenType.CASE);
		keywords.put("default", TokenType.DEFAULT);
		keywords.put("enum", TokenType.ENUM);
		keywords.put("goto", TokenType.GOTO);
		keywords.put("signed", TokenType.SIGNED);
		keywords.put("unsigned", TokenType.UNSIGNED);
		keywords.put("long", TokenType.LONG);
		keywords.put("short", TokenType.SHORT);
	}

	/**
	 * Constructs a Lexer.
	 *
	 * @param source     The source code string to tokenize.
	 * @param sourceName The file name, used only for diagnostics.
	 */
	public Lexer(String source, String sourceName)
	{
		this.source = source;
		this.sourceName = sourceName;
	}

	/**
	 * Convenience entry point: tokenizes {@code source} in one call.
	 */
	public static TokenStream tokenize(String source, String sourceName)
	{
		return new Lexer(source, sourceName).scanTokens();
	}

	/**
	 * Scans the entire source code and returns the token stream.
	 * The stream ends with EOF, or with the first ERROR token encountered.
	 */
	public TokenStream scanTokens()
	{
		while (true)
		{
			skipWhitespaceAndComments();

			// Save the starting position of the token before scanning it
			start = current;
			startLine = line;
			startColumn = column;

			if (isAtEnd())
			{
				tokens.add(new Token(TokenType.EOF, "", line, column));
				break;
			}

			scanToken();

			if (tokens.get(tokens.size() - 1).getType() == TokenType.ERROR)
			{
				break;
			}
		}

		Debug.log("Lexer produced %d tokens for %s", tokens.size(), sourceName);
		return new TokenStream(tokens, sourceName);
	}

	/**
	 * Skips whitespace, preprocessor lines, and both comment styles.
	 * An unterminated block comment silently runs to the end of input.
	 */
	private void skipWhitespaceAndComments()
	{
		while (!isAtEnd())
		{
			char c = peek();
			if (c == ' ' || c == '\t' || c == '\r' || c == '\n')
			{
				advance();
			}
			else if (c == '#')
			{
				// Preprocessor directive: consumed to end of line, never expanded
				while (peek() != '\n' && !isAtEnd())
				{
					advance();
				}
			}
			else if (c == '/' && peekNext() == '/')
			{
				while (peek() != '\n' && !isAtEnd())
				{
					advance();
				}
			}
			else if (c == '/' && peekNext() == '*')
			{
				advance();
				advance();
				while (!isAtEnd())
				{
					if (peek() == '*' && peekNext() == '/')
					{
						advance();
						advance();
						break;
					}
					advance();
				}
			}
			else
			{
				return;
			}
		}
	}

	/**
	 * Scans a single token from the source code.
	 */
	private void scanToken()
	{
		char c = advance(); // Get and consume the current character

		switch (c)
		{
			// --- Single-character tokens ---
			case '(':
				addToken(TokenType.LEFT_PAREN);
				break;
			case ')':
				addToken(TokenType.RIGHT_PAREN);
				break;
			case '{':
				addToken(TokenType.LEFT_BRACE);
				break;
			case '}':
				addToken(TokenType.RIGHT_BRACE);
				break;
			case '[':
				addToken(TokenType.LEFT_BRACKET);
				break;
			case ']':
				addToken(TokenType.RIGHT_BRACKET);
				break;
			case ',':
				addToken(TokenType.COMMA);
				break;
			case ';':
				addToken(TokenType.SEMICOLON);
				break;
			case '?':
				addToken(TokenType.QUESTION);
				break;
			case ':':
				addToken(TokenType.COLON);
				break;
			case '.':
				addToken(TokenType.DOT);
				break;
			case '~':
				addToken(TokenType.TILDE);
				break;

			// --- Operators that can be one, two or three characters ---
			case '+':
				if (match('+'))
				{
					addToken(TokenType.PLUS_PLUS);
				}
				else if (match('='))
				{
					addToken(TokenType.PLUS_ASSIGN);
				}
				else
				{
					addToken(TokenType.PLUS);
				}
				break;
			case '-':
				if (match('-'))
				{
					addToken(TokenType.MINUS_MINUS);
				}
				else if (match('>'))
				{
					addToken(TokenType.ARROW);
				}
				else if (match('='))
				{
					addToken(TokenType.MINUS_ASSIGN);
				}
				else
				{
					addToken(TokenType.MINUS);
				}
				break;
			case '*':
				addToken(match('=') ? TokenType.STAR_ASSIGN : TokenType.STAR);
				break;
			case '/':
				// Comments were already consumed by skipWhitespaceAndComments()
				addToken(match('=') ? TokenType.SLASH_ASSIGN : TokenType.SLASH);
				break;
			case '%':
				addToken(match('=') ? TokenType.MODULO_ASSIGN : TokenType.MODULO);
				break;
			case '=':
				addToken(match('=') ? TokenType.EQUAL_EQUAL : TokenType.ASSIGN);
				break;
			case '!':
				addToken(match('=') ? TokenType.BANG_EQUAL : TokenType.BANG);
				break;
			case '<':
				if (match('<'))
				{
					addToken(match('=') ? TokenType.LEFT_SHIFT_ASSIGN : TokenType.LEFT_SHIFT);
				}
				else
				{
					addToken(match('=') ? TokenType.LESS_EQUAL : TokenType.LESS);
				}
				break;
			case '>':
				if (match('>'))
				{
					addToken(match('=') ? TokenType.RIGHT_SHIFT_ASSIGN : TokenType.RIGHT_SHIFT);
				}
				else
				{
					addToken(match('=') ? TokenType.GREATER_EQUAL : TokenType.GREATER);
				}
				break;
			case '&':
				if (match('&'))
				{
					addToken(TokenType.AMPERSAND_AMPERSAND);
				}
				else if (match('='))
				{
					addToken(TokenType.AMPERSAND_ASSIGN);
				}
				else
				{
					addToken(TokenType.AMPERSAND);
				}
				break;
			case '|':
				if (match('|'))
				{
					addToken(TokenType.PIPE_PIPE);
				}
				else if (match('='))
				{
					addToken(TokenType.PIPE_ASSIGN);
				}
				else
				{
					addToken(TokenType.PIPE);
				}
				break;
			case '^':
				addToken(match('=') ? TokenType.XOR_ASSIGN : TokenType.XOR);
				break;

			// --- Literals ---
			case '"':
				scanQuoted('"', TokenType.STRING, "Unterminated string");
				break;
			case '\'':
				scanQuoted('\'', TokenType.CHAR_LITERAL, "Unterminated character literal");
				break;

			default:
				if (isDigit(c))
				{
					scanNumber();
				}
				else if (isIdentifierStart(c))
				{
					scanIdentifier();
				}
				else
				{
					// A supplementary character is reported whole, not as its first surrogate.
					if (Character.isHighSurrogate(c) && !isAtEnd() && Character.isLowSurrogate(peek()))
					{
						advance();
					}
					String character = new String(Character.toChars(source.codePointAt(start)));
					addErrorToken("Unexpected character: '" + character + "'");
				}
				break;
		}
	}

	/**
	 * Consumes the current character and returns it, also updates line/column.
	 *
	 * @return The consumed character.
	 */
	private char advance()
	{
		char c = source.charAt(current++);
		if (c == '\n')
		{
			line++;
			column = 1;
		}
		else
		{
			column++;
		}
		return c;
	}

	/**
	 * Adds a token whose lexeme is the source text from {@code start} to {@code current}.
	 *
	 * @param type The TokenType of the token.
	 */
	private void addToken(TokenType type)
	{
		String text = source.substring(start, current);
		// Multi-line tokens keep the position they started at.
		tokens.add(new Token(type, text, startLine, startColumn));
	}

	private void addErrorToken(String message)
	{
		tokens.add(new Token(TokenType.ERROR, message, startLine, startColumn));
	}

	/**
	 * Checks if the current character matches the expected character.
	 * If it matches, consumes it.
	 *
	 * @param expected The expected character.
	 * @return True if the character matched and was consumed, false otherwise.
	 */
	private boolean match(char expected)
	{
		if (isAtEnd())
		{
			return false;
		}
		if (source.charAt(current) != expected)
		{
			return false;
		}

		advance();
		return true;
	}

	/**
	 * Looks at the current character without consuming it.
	 *
	 * @return The current character, or '\0' if at the end of the source.
	 */
	private char peek()
	{
		if (isAtEnd())
		{
			return '\0';
		}
		return source.charAt(current);
	}

	/**
	 * Looks at the next character (one position ahead) without consuming it.
	 *
	 * @return The next character, or '\0' if at or beyond the end of the source.
	 */
	private char peekNext()
	{
		if (current + 1 >= source.length())
		{
			return '\0';
		}
		return source.charAt(current + 1);
	}

	private boolean isAtEnd()
	{
		return current >= source.length();
	}

	/**
	 * Scans a number literal: digits, optionally followed by '.' and more digits.
	 * Exponents and suffixes are not part of the accepted subset.
	 */
	private void scanNumber()
	{
		while (isDigit(peek()))
		{
			advance();
		}

		if (peek() == '.' && isDigit(peekNext()))
		{
			advance(); // Consume the '.'
			while (isDigit(peek()))
			{
				advance();
			}
		}

		addToken(TokenType.NUMBER);
	}

	/**
	 * Scans a string or character literal. The opening delimiter has already been consumed.
	 * A backslash protects the following character, which is copied verbatim; escape
	 * sequences are not interpreted. The lexeme keeps both delimiters.
	 */
	private void scanQuoted(char delimiter, TokenType type, String unterminatedMessage)
	{
		while (peek() != delimiter && !isAtEnd())
		{
			if (advance() == '\\' && !isAtEnd())
			{
				advance();
			}
		}

		if (isAtEnd())
		{
			addErrorToken(unterminatedMessage);
			return;
		}

		advance(); // Consume the closing delimiter
		addToken(type);
	}

	/**
	 * Scans an identifier or keyword.
	 */
	private void scanIdentifier()
	{
		while (isIdentifierPart(peek()))
		{
			advance();
		}

		String text = source.substring(start, current);
		addToken(keywords.getOrDefault(text, TokenType.IDENTIFIER));
	}

	private static boolean isDigit(char c)
	{
		return c >= '0' && c <= '9';
	}

	private static boolean isIdentifierStart(char c)
	{
		return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '_';
	}

	private static boolean isIdentifierPart(char c)
	{
		return isIdentifierStart(c) || isDigit(c);
	}
}
