package com.juanpa.c2en.ast.declarations;

import com.juanpa.c2en.ast.ASTVisitor;
import com.juanpa.c2en.ast.statements.VariableDeclaration;
import com.juanpa.c2en.lexer.Token;
import com.juanpa.c2en.lexer.TokenType;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * AST node for a {@code struct} or {@code union} definition with its members.
 * The tag name is null for an anonymous definition inside a typedef.
 */
public class StructDefinition implements Declaration
{
	private final Token keyword;
	private final String name;
	private final List<VariableDeclaration> members;

	public StructDefinition(Token keyword, String name)
	{
		this.keyword = keyword;
		this.name = name;
		this.members = new ArrayList<>();
	}

	public void addMember(VariableDeclaration member)
	{
		this.members.add(member);
	}

	public List<VariableDeclaration> getMembers()
	{
		return Collections.unmodifiableList(members);
	}

	public String getName()
	{
		return name;
	}

	public boolean isUnion()
	{
		return keyword.getType() == TokenType.UNION;
	}

	/**
	 * @return "struct" or "union".
	 */
	public String getKind()
	{
		return keyword.getLexeme();
	}

	@Override
	public Token getFirstToken()
	{
		return keyword;
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitStructDefinition(this);
	}

	@Override
	public String toString()
	{
		StringBuilder sb = new StringBuilder(getKind());
		if (name != null)
		{
			sb.append(" ").append(name);
		}
		sb.append(" {\n");
		for (VariableDeclaration member : members)
		{
			sb.append("  ").append(member).append("\n");
		}
		return sb.append("};").toString();
	}
}
