package com.juanpa.c2en.ast.statements;

import com.juanpa.c2en.ast.ASTNode;

/**
 * Base interface for all statement nodes in the Abstract Syntax Tree (AST).
 * Statements are executable units that do not produce a value.
 */
public interface Statement extends ASTNode
{
}
