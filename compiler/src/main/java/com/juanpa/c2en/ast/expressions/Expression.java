// File: src/main/java/com/juanpa/c2en/ast/expressions/Expression.java

package com.juanpa.c2en.ast.expressions;

import com.juanpa.c2en.ast.ASTNode;

/**
 * Base interface for all expression nodes in the Abstract Syntax Tree (AST).
 * Expressions are parts of the program that produce a value. Their
 * {@code toString} renders a fully parenthesised form, e.g. {@code (1 + (2 * 3))}.
 */
public interface Expression extends ASTNode
{
}
