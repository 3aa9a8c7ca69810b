package com.juanpa.c2en.ast.statements;

import com.juanpa.c2en.ast.ASTNode;
import com.juanpa.c2en.lexer.Token;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A labelled section of a switch body: the statements from a {@code case} or
 * {@code default} label up to the next label or the closing brace.
 */
public abstract class SwitchClause implements ASTNode
{
	private final Token keyword;
	private final List<Statement> statements = new ArrayList<>();

	protected SwitchClause(Token keyword)
	{
		this.keyword = keyword;
	}

	public void addStatement(Statement statement)
	{
		statements.add(statement);
	}

	public List<Statement> getStatements()
	{
		return Collections.unmodifiableList(statements);
	}

	@Override
	public Token getFirstToken()
	{
		return keyword;
	}

	protected String bodyToString()
	{
		StringBuilder sb = new StringBuilder();
		for (Statement statement : statements)
		{
			sb.append("\n  ").append(statement);
		}
		return sb.toString();
	}
}
