// File: src/main/java/com/juanpa/c2en/ast/ASTVisitor.java

package com.juanpa.c2en.ast;

import com.juanpa.c2en.ast.declarations.EnumDefinition;
import com.juanpa.c2en.ast.declarations.FunctionDeclaration;
import com.juanpa.c2en.ast.declarations.StructDefinition;
import com.juanpa.c2en.ast.declarations.TypedefDeclaration;
import com.juanpa.c2en.ast.expressions.*;
import com.juanpa.c2en.ast.statements.*;

/**
 * Interface for the Visitor pattern that allows AST traversal.
 * Each `visit` method corresponds to a specific AST node type, so adding a node
 * kind means extending every visitor.
 * The generic type `R` represents the return value type of the `visit` methods;
 * visitors that only walk the tree use `Void`.
 */
public interface ASTVisitor<R>
{
	// --- Declarations ---
	R visitProgram(Program program);

	R visitFunctionDeclaration(FunctionDeclaration declaration);

	R visitStructDefinition(StructDefinition definition);

	R visitEnumDefinition(EnumDefinition definition);

	R visitTypedefDeclaration(TypedefDeclaration declaration);

	R visitVariableDeclaration(VariableDeclaration declaration);

	// --- Statements ---
	R visitBlockStatement(BlockStatement statement);

	R visitExpressionStatement(ExpressionStatement statement);

	R visitIfStatement(IfStatement statement);

	R visitWhileStatement(WhileStatement statement);

	R visitDoWhileStatement(DoWhileStatement statement);

	R visitForStatement(ForStatement statement);

	R visitSwitchStatement(SwitchStatement statement);

	R visitSwitchCase(SwitchCase switchCase);

	R visitSwitchDefault(SwitchDefault switchDefault);

	R visitReturnStatement(ReturnStatement statement);

	R visitBreakStatement(BreakStatement statement);

	R visitContinueStatement(ContinueStatement statement);

	R visitGotoStatement(GotoStatement statement);

	R visitLabelStatement(LabelStatement statement);

	// --- Expressions ---
	R visitBinaryExpression(BinaryExpression expression);

	R visitUnaryExpression(UnaryExpression expression);

	R visitPostfixUnaryExpression(PostfixUnaryExpression expression);

	R visitTernaryExpression(TernaryExpression expression);

	R visitAssignmentExpression(AssignmentExpression expression);

	R visitCompoundAssignmentExpression(CompoundAssignmentExpression expression);

	R visitCallExpression(CallExpression expression);

	R visitArrayAccessExpression(ArrayAccessExpression expression);

	R visitMemberAccessExpression(MemberAccessExpression expression);

	R visitLiteralExpression(LiteralExpression expression);

	R visitIdentifierExpression(IdentifierExpression expression);

	R visitSizeofExpression(SizeofExpression expression);

	R visitCastExpression(CastExpression expression);

	R visitInitializerListExpression(InitializerListExpression expression);
}
