package com.juanpa.c2en.ast.declarations;

import com.juanpa.c2en.ast.ASTVisitor;
import com.juanpa.c2en.lexer.Token;

/**
 * AST node for {@code typedef <type> <alias>;}. When the aliased type is a struct,
 * union or enum defined in place, that definition is kept as {@code inlineDefinition}.
 */
public class TypedefDeclaration implements Declaration
{
	private final Token keyword;
	private final String type;
	private final Token alias;
	private final Declaration inlineDefinition; // Null unless the type was defined inside the typedef

	public TypedefDeclaration(Token keyword, String type, Token alias, Declaration inlineDefinition)
	{
		this.keyword = keyword;
		this.type = type;
		this.alias = alias;
		this.inlineDefinition = inlineDefinition;
	}

	public String getType()
	{
		return type;
	}

	public String getAlias()
	{
		return alias.getLexeme();
	}

	public Token getAliasToken()
	{
		return alias;
	}

	public Declaration getInlineDefinition()
	{
		return inlineDefinition;
	}

	@Override
	public Token getFirstToken()
	{
		return keyword;
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitTypedefDeclaration(this);
	}

	@Override
	public String toString()
	{
		return "typedef " + type + " " + alias.getLexeme() + ";";
	}
}
