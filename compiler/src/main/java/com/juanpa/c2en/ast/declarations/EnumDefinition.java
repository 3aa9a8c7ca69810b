package com.juanpa.c2en.ast.declarations;

import com.juanpa.c2en.ast.ASTVisitor;
import com.juanpa.c2en.lexer.Token;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * AST node for an {@code enum} definition. The tag name may be null.
 */
public class EnumDefinition implements Declaration
{
	private final Token keyword;
	private final String name;
	private final List<EnumConstant> constants;

	public EnumDefinition(Token keyword, String name)
	{
		this.keyword = keyword;
		this.name = name;
		this.constants = new ArrayList<>();
	}

	public void addConstant(EnumConstant constant)
	{
		this.constants.add(constant);
	}

	public List<EnumConstant> getConstants()
	{
		return Collections.unmodifiableList(constants);
	}

	public String getName()
	{
		return name;
	}

	@Override
	public Token getFirstToken()
	{
		return keyword;
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitEnumDefinition(this);
	}

	@Override
	public String toString()
	{
		return "enum" + (name != null ? " " + name : "") + " { "
				+ constants.stream().map(EnumConstant::toString).collect(Collectors.joining(", ")) + " };";
	}
}
