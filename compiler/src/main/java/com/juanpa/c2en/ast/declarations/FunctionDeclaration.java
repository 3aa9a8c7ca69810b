// File: src/main/java/com/juanpa/c2en/ast/declarations/FunctionDeclaration.java

package com.juanpa.c2en.ast.declarations;

import com.juanpa.c2en.ast.ASTVisitor;
import com.juanpa.c2en.ast.statements.BlockStatement;
import com.juanpa.c2en.lexer.Token;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * AST node representing a function definition or, when it has no body, a prototype.
 */
public class FunctionDeclaration implements Declaration
{
	private final Token typeStart;      // First token of the return type, used for error reporting
	private final String returnType;    // Rendered return type (e.g., "int", "char*")
	private final Token name;           // The function name token
	private final List<Parameter> parameters;
	private final BlockStatement body;  // Null for a prototype

	/**
	 * Constructs a FunctionDeclaration.
	 *
	 * @param typeStart  The first token of the return type.
	 * @param returnType The rendered return type.
	 * @param name       The function name token.
	 * @param parameters The formal parameters, in order.
	 * @param body       The function body, or null for a prototype.
	 */
	public FunctionDeclaration(Token typeStart, String returnType, Token name, List<Parameter> parameters, BlockStatement body)
	{
		this.typeStart = typeStart;
		this.returnType = returnType;
		this.name = name;
		this.parameters = new ArrayList<>(parameters);
		this.body = body;
	}

	public String getReturnType()
	{
		return returnType;
	}

	public String getName()
	{
		return name.getLexeme();
	}

	public Token getNameToken()
	{
		return name;
	}

	public List<Parameter> getParameters()
	{
		return Collections.unmodifiableList(parameters);
	}

	public BlockStatement getBody()
	{
		return body;
	}

	public boolean isPrototype()
	{
		return body == null;
	}

	@Override
	public Token getFirstToken()
	{
		return typeStart;
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitFunctionDeclaration(this);
	}

	@Override
	public String toString()
	{
		String signature = returnType + " " + name.getLexeme() + "("
				+ parameters.stream().map(Parameter::toString).collect(Collectors.joining(", ")) + ")";
		return body == null ? signature + ";" : signature + " " + body;
	}
}
