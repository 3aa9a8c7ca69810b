// File: src/main/java/com/juanpa/c2en/ast/statements/SwitchStatement.java

package com.juanpa.c2en.ast.statements;

import com.juanpa.c2en.ast.ASTVisitor;
import com.juanpa.c2en.ast.expressions.Expression;
import com.juanpa.c2en.lexer.Token;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * AST node representing a switch statement.
 * The body is a flat list of case and default clauses, in source order.
 */
public class SwitchStatement implements Statement
{
	private final Token switchKeyword;
	private final Expression subject; // The expression being switched on
	private final List<SwitchClause> clauses;

	public SwitchStatement(Token switchKeyword, Expression subject)
	{
		this.switchKeyword = switchKeyword;
		this.subject = subject;
		this.clauses = new ArrayList<>();
	}

	public void addClause(SwitchClause clause)
	{
		this.clauses.add(clause);
	}

	public Expression getSubject()
	{
		return subject;
	}

	public List<SwitchClause> getClauses()
	{
		return Collections.unmodifiableList(clauses);
	}

	@Override
	public Token getFirstToken()
	{
		return switchKeyword;
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitSwitchStatement(this);
	}

	@Override
	public String toString()
	{
		StringBuilder sb = new StringBuilder("switch (").append(subject).append(") {\n");
		for (SwitchClause clause : clauses)
		{
			sb.append(clause).append("\n");
		}
		return sb.append("}").toString();
	}
}
