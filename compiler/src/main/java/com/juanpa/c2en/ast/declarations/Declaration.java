package com.juanpa.c2en.ast.declarations;

import com.juanpa.c2en.ast.ASTNode;

/**
 * Marker for nodes that may appear at the top level of a {@link com.juanpa.c2en.ast.Program}.
 */
public interface Declaration extends ASTNode
{
}
