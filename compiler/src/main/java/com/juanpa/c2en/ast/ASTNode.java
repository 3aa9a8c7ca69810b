package com.juanpa.c2en.ast;

import com.juanpa.c2en.lexer.Token;

/**
 * Base interface for all nodes in the Abstract Syntax Tree (AST).
 * Every node remembers the token it starts at, which gives diagnostics
 * their line and column.
 */
public interface ASTNode
{
	/**
	 * Accepts an ASTVisitor to traverse this node.
	 *
	 * @param visitor The ASTVisitor instance.
	 * @param <R>     The return type of the visitor's visit methods.
	 * @return The result of the visitor's operation.
	 */
	<R> R accept(ASTVisitor<R> visitor);

	/**
	 * Returns the first token that constitutes this node.
	 * Useful for error reporting to pinpoint the exact location of a semantic error.
	 *
	 * @return The first Token of this node.
	 */
	Token getFirstToken();

	default int getLine()
	{
		return getFirstToken().getLine();
	}

	default int getColumn()
	{
		return getFirstToken().getColumn();
	}
}
