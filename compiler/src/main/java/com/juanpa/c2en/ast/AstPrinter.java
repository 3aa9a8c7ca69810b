package com.juanpa.c2en.ast;

import com.juanpa.c2en.ast.declarations.*;
import com.juanpa.c2en.ast.expressions.*;
import com.juanpa.c2en.ast.statements.*;

/**
 * Renders an AST as an indented outline, one node per line, two spaces per level.
 * The output depends only on the tree, so printing the same tree twice gives the same text.
 */
public class AstPrinter implements ASTVisitor<Void>
{
	private final StringBuilder out = new StringBuilder();
	private int indentLevel = 0;

	/**
	 * @param node The root of the subtree to render.
	 * @return The outline, each line terminated by a newline.
	 */
	public static String print(ASTNode node)
	{
		AstPrinter printer = new AstPrinter();
		printer.visit(node);
		return printer.out.toString();
	}

	private void visit(ASTNode node)
	{
		if (node != null)
		{
			node.accept(this);
		}
	}

	private void line(String text)
	{
		out.append("  ".repeat(indentLevel)).append(text).append('\n');
	}

	// Prints a label line and its children one level deeper.
	private void node(String label, ASTNode... children)
	{
		line(label);
		indentLevel++;
		for (ASTNode child : children)
		{
			visit(child);
		}
		indentLevel--;
	}

	// --- Declarations ---

	@Override
	public Void visitProgram(Program program)
	{
		line("PROGRAM (" + program.getFunctions().size() + " functions)");
		indentLevel++;
		for (Declaration declaration : program.getDeclarations())
		{
			visit(declaration);
		}
		indentLevel--;
		return null;
	}

	@Override
	public Void visitFunctionDeclaration(FunctionDeclaration declaration)
	{
		line((declaration.isPrototype() ? "PROTOTYPE " : "FUNCTION ") + declaration.getName() + ": " + declaration.getReturnType());
		indentLevel++;
		for (Parameter parameter : declaration.getParameters())
		{
			line("PARAMETER " + parameter.getName() + ": " + parameter.getType() + (parameter.isArray() ? "[]" : ""));
		}
		visit(declaration.getBody());
		indentLevel--;
		return null;
	}

	@Override
	public Void visitStructDefinition(StructDefinition definition)
	{
		String label = definition.isUnion() ? "UNION" : "STRUCT";
		line(definition.getName() != null ? label + " " + definition.getName() : label);
		indentLevel++;
		for (VariableDeclaration member : definition.getMembers())
		{
			visit(member);
		}
		indentLevel--;
		return null;
	}

	@Override
	public Void visitEnumDefinition(EnumDefinition definition)
	{
		line(definition.getName() != null ? "ENUM " + definition.getName() : "ENUM");
		indentLevel++;
		for (EnumConstant constant : definition.getConstants())
		{
			node("CONSTANT " + constant.getName(), constant.getValue());
		}
		indentLevel--;
		return null;
	}

	@Override
	public Void visitTypedefDeclaration(TypedefDeclaration declaration)
	{
		node("TYPEDEF " + declaration.getAlias() + ": " + declaration.getType(), declaration.getInlineDefinition());
		return null;
	}

	@Override
	public Void visitVariableDeclaration(VariableDeclaration declaration)
	{
		String type = declaration.isArray() ? declaration.getType() + "[]" : declaration.getType();
		node("DECLARATION " + declaration.getName() + ": " + type, declaration.getArraySize(), declaration.getInitializer());
		return null;
	}

	// --- Statements ---

	@Override
	public Void visitBlockStatement(BlockStatement statement)
	{
		node("BLOCK", statement.getStatements().toArray(new ASTNode[0]));
		return null;
	}

	@Override
	public Void visitExpressionStatement(ExpressionStatement statement)
	{
		node("EXPRESSION", statement.getExpression());
		return null;
	}

	@Override
	public Void visitIfStatement(IfStatement statement)
	{
		node("IF", statement.getCondition(), statement.getThenBranch());
		if (statement.getElseBranch() != null)
		{
			node("ELSE", statement.getElseBranch());
		}
		return null;
	}

	@Override
	public Void visitWhileStatement(WhileStatement statement)
	{
		node("WHILE", statement.getCondition(), statement.getBody());
		return null;
	}

	@Override
	public Void visitDoWhileStatement(DoWhileStatement statement)
	{
		node("DO_WHILE", statement.getBody(), statement.getCondition());
		return null;
	}

	@Override
	public Void visitForStatement(ForStatement statement)
	{
		node("FOR", statement.getInitializer(), statement.getCondition(), statement.getIncrement(), statement.getBody());
		return null;
	}

	@Override
	public Void visitSwitchStatement(SwitchStatement statement)
	{
		node("SWITCH", statement.getSubject());
		indentLevel++;
		for (SwitchClause clause : statement.getClauses())
		{
			visit(clause);
		}
		indentLevel--;
		return null;
	}

	@Override
	public Void visitSwitchCase(SwitchCase switchCase)
	{
		line("CASE");
		indentLevel++;
		visit(switchCase.getValue());
		for (Statement statement : switchCase.getStatements())
		{
			visit(statement);
		}
		indentLevel--;
		return null;
	}

	@Override
	public Void visitSwitchDefault(SwitchDefault switchDefault)
	{
		node("DEFAULT", switchDefault.getStatements().toArray(new ASTNode[0]));
		return null;
	}

	@Override
	public Void visitReturnStatement(ReturnStatement statement)
	{
		node("RETURN", statement.getValue());
		return null;
	}

	@Override
	public Void visitBreakStatement(BreakStatement statement)
	{
		line("BREAK");
		return null;
	}

	@Override
	public Void visitContinueStatement(ContinueStatement statement)
	{
		line("CONTINUE");
		return null;
	}

	@Override
	public Void visitGotoStatement(GotoStatement statement)
	{
		line("GOTO " + statement.getLabel());
		return null;
	}

	@Override
	public Void visitLabelStatement(LabelStatement statement)
	{
		line("LABEL " + statement.getName());
		return null;
	}

	// --- Expressions ---

	@Override
	public Void visitBinaryExpression(BinaryExpression expression)
	{
		node("BINARY_OP " + expression.getOperator().getLexeme(), expression.getLeft(), expression.getRight());
		return null;
	}

	@Override
	public Void visitUnaryExpression(UnaryExpression expression)
	{
		node("UNARY_OP " + expression.getOperator().getLexeme(), expression.getOperand());
		return null;
	}

	@Override
	public Void visitPostfixUnaryExpression(PostfixUnaryExpression expression)
	{
		node("POSTFIX_OP " + expression.getOperator().getLexeme(), expression.getOperand());
		return null;
	}

	@Override
	public Void visitTernaryExpression(TernaryExpression expression)
	{
		node("TERNARY", expression.getCondition(), expression.getThenExpression(), expression.getElseExpression());
		return null;
	}

	@Override
	public Void visitAssignmentExpression(AssignmentExpression expression)
	{
		node("ASSIGNMENT =", expression.getTarget(), expression.getValue());
		return null;
	}

	@Override
	public Void visitCompoundAssignmentExpression(CompoundAssignmentExpression expression)
	{
		node("COMPOUND_ASSIGNMENT " + expression.getOperator().getLexeme(), expression.getTarget(), expression.getValue());
		return null;
	}

	@Override
	public Void visitCallExpression(CallExpression expression)
	{
		node("CALL " + expression.getFunctionName(), expression.getArguments().toArray(new ASTNode[0]));
		return null;
	}

	@Override
	public Void visitArrayAccessExpression(ArrayAccessExpression expression)
	{
		node("ARRAY_ACCESS", expression.getArray(), expression.getIndex());
		return null;
	}

	@Override
	public Void visitMemberAccessExpression(MemberAccessExpression expression)
	{
		node("MEMBER_ACCESS " + (expression.isArrow() ? "->" : ".") + expression.getMemberName(), expression.getObject());
		return null;
	}

	@Override
	public Void visitLiteralExpression(LiteralExpression expression)
	{
		line("LITERAL " + expression.getValue() + " (" + expression.getKind().getDisplayName() + ")");
		return null;
	}

	@Override
	public Void visitIdentifierExpression(IdentifierExpression expression)
	{
		line("IDENTIFIER " + expression.getName());
		return null;
	}

	@Override
	public Void visitSizeofExpression(SizeofExpression expression)
	{
		if (expression.isTypeOperand())
		{
			line("SIZEOF " + expression.getTypeName());
		}
		else
		{
			node("SIZEOF", expression.getOperand());
		}
		return null;
	}

	@Override
	public Void visitCastExpression(CastExpression expression)
	{
		node("CAST " + expression.getTargetType(), expression.getOperand());
		return null;
	}

	@Override
	public Void visitInitializerListExpression(InitializerListExpression expression)
	{
		node("INITIALIZER_LIST", expression.getElements().toArray(new ASTNode[0]));
		return null;
	}
}
