// File: src/main/java/com/juanpa/c2en/ast/statements/SwitchCase.java

package com.juanpa.c2en.ast.statements;

import com.juanpa.c2en.ast.ASTVisitor;
import com.juanpa.c2en.ast.expressions.Expression;
import com.juanpa.c2en.lexer.Token;

public class SwitchCase extends SwitchClause
{
	private final Expression value; // The constant expression for the case (e.g., 10, 'A')

	public SwitchCase(Token caseKeyword, Expression value)
	{
		super(caseKeyword);
		this.value = value;
	}

	public Expression getValue()
	{
		return value;
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitSwitchCase(this);
	}

	@Override
	public String toString()
	{
		return "case " + value + ":" + bodyToString();
	}
}
