// File: src/main/java/com/juanpa/c2en/ast/Program.java

package com.juanpa.c2en.ast;

import com.juanpa.c2en.ast.declarations.Declaration;
import com.juanpa.c2en.ast.declarations.FunctionDeclaration;
import com.juanpa.c2en.lexer.Token;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * The root AST node representing an entire translation unit.
 * Holds the top-level declarations in source order.
 */
public class Program implements ASTNode
{
	private final Token firstToken; // First token of the file, EOF for an empty one
	private final List<Declaration> declarations;

	public Program(Token firstToken)
	{
		this.firstToken = firstToken;
		this.declarations = new ArrayList<>();
	}

	public void addDeclaration(Declaration declaration)
	{
		this.declarations.add(declaration);
	}

	public List<Declaration> getDeclarations()
	{
		return Collections.unmodifiableList(declarations);
	}

	/**
	 * @return The function definitions and prototypes, in source order.
	 */
	public List<FunctionDeclaration> getFunctions()
	{
		List<FunctionDeclaration> functions = new ArrayList<>();
		for (Declaration declaration : declarations)
		{
			if (declaration instanceof FunctionDeclaration)
			{
				functions.add((FunctionDeclaration) declaration);
			}
		}
		return functions;
	}

	@Override
	public Token getFirstToken()
	{
		return firstToken;
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitProgram(this);
	}

	@Override
	public String toString()
	{
		StringBuilder sb = new StringBuilder();
		for (Declaration declaration : declarations)
		{
			sb.append(declaration.toString()).append("\n");
		}
		return sb.toString();
	}
}
