// File: src/main/java/com/juanpa/c2en/lexer/TokenType.java
package com.juanpa.c2en.lexer;

/**
 * Defines the types of tokens recognized by the c2en Lexer.
 * This enum covers keywords, operators, literals, punctuation, and special tokens.
 */
public enum TokenType
{
	// --- Keywords ---
	// Primitives & Types
	INT, CHAR, FLOAT, DOUBLE, VOID,
	SIGNED, UNSIGNED, LONG, SHORT,

	// Control Flow
	IF, ELSE, WHILE, FOR, DO, SWITCH, CASE, DEFAULT,
	RETURN, BREAK, CONTINUE, GOTO,

	// Aggregates & Storage
	STRUCT, UNION, ENUM, TYPEDEF, SIZEOF,
	CONST, STATIC, EXTERN,

	// --- Literals ---
	IDENTIFIER,
	NUMBER,
	STRING,
	CHAR_LITERAL,

	// --- Punctuation & Delimiters ---
	LEFT_PAREN, RIGHT_PAREN,       // ( )
	LEFT_BRACE, RIGHT_BRACE,       // { }
	LEFT_BRACKET, RIGHT_BRACKET,   // [ ]
	DOT, COMMA, SEMICOLON, COLON, QUESTION,

	// --- Operators ---
	// Unary
	PLUS_PLUS, MINUS_MINUS,          // ++ --
	BANG,                            // !
	TILDE,                           // ~

	// Multiplicative
	STAR, SLASH, MODULO,             // * / %

	// Additive
	PLUS, MINUS,                     // + -

	// Shift
	LEFT_SHIFT, RIGHT_SHIFT,         // << >>

	// Relational & Equality
	LESS, LESS_EQUAL,                // < <=
	GREATER, GREATER_EQUAL,          // > >=
	EQUAL_EQUAL, BANG_EQUAL,         // == !=

	// Bitwise
	AMPERSAND,                       // &
	PIPE,                            // |
	XOR,                             // ^

	// Logical
	AMPERSAND_AMPERSAND,             // &&
	PIPE_PIPE,                       // ||

	// Assignment & Compound Assignment
	ASSIGN,                          // =
	PLUS_ASSIGN, MINUS_ASSIGN,       // += -=
	STAR_ASSIGN, SLASH_ASSIGN,       // *= /=
	MODULO_ASSIGN,                   // %=
	AMPERSAND_ASSIGN, PIPE_ASSIGN,   // &= |=
	XOR_ASSIGN,                      // ^=
	LEFT_SHIFT_ASSIGN, RIGHT_SHIFT_ASSIGN, // <<= >>=

	// Member access
	ARROW,                           // ->

	// --- Special Tokens ---
	EOF, // End Of File
	ERROR // For lexical errors; the lexeme holds the message
}
