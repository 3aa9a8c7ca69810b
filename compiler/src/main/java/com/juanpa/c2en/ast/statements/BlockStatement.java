// File: src/main/java/com/juanpa/c2en/ast/statements/BlockStatement.java
package com.juanpa.c2en.ast.statements;

import com.juanpa.c2en.ast.ASTVisitor;
import com.juanpa.c2en.lexer.Token;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * AST node representing a block of statements enclosed in curly braces {}.
 * This is used for function bodies, if/else blocks, loop bodies, etc.
 */
public class BlockStatement implements Statement
{
	private final Token leftBrace;
	private final List<Statement> statements;

	public BlockStatement(Token leftBrace)
	{
		this.leftBrace = leftBrace;
		this.statements = new ArrayList<>();
	}

	public void addStatement(Statement statement)
	{
		this.statements.add(statement);
	}

	public List<Statement> getStatements()
	{
		return Collections.unmodifiableList(statements);
	}

	@Override
	public Token getFirstToken()
	{
		return leftBrace;
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitBlockStatement(this);
	}

	@Override
	public String toString()
	{
		StringBuilder sb = new StringBuilder("{\n");
		for (Statement stmt : statements)
		{
			// Indent statements within the block
			for (String line : stmt.toString().split("\n"))
			{
				sb.append("  ").append(line).append("\n");
			}
		}
		sb.append("}");
		return sb.toString();
	}
}
