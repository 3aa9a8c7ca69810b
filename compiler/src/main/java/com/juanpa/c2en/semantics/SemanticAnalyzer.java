// File: src/main/java/com/juanpa/c2en/semantics/SemanticAnalyzer.java
package com.juanpa.c2en.semantics;

import com.juanpa.c2en.ast.ASTNode;
import com.juanpa.c2en.ast.ASTVisitor;
import com.juanpa.c2en.ast.Program;
import com.juanpa.c2en.ast.declarations.*;
import com.juanpa.c2en.ast.expressions.*;
import com.juanpa.c2en.ast.statements.*;
import com.juanpa.c2en.util.Debug;
import com.juanpa.c2en.util.ErrorReporter;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Performs name resolution over a parsed program in a single pass.
 * Top-level items are processed in source order, so a function must be declared
 * (or prototyped) before it is called. Each function gets one scope under the
 * global scope; nested blocks share it.
 */
public class SemanticAnalyzer implements ASTVisitor<Void>
{
	/**
	 * Functions callable without a declaration in the program.
	 */
	public static final Set<String> LIBRARY_FUNCTIONS = Collections.unmodifiableSet(new LinkedHashSet<>(
			List.of("printf", "scanf", "strlen", "strcpy", "malloc", "free")));

	private final String sourceName;
	private final ErrorReporter errorReporter;
	private final Set<String> libraryFunctions;

	private SymbolTable globalScope;
	private SymbolTable currentScope;
	private final List<SymbolTable> scopes = new ArrayList<>();           // Global first, then one per analyzed function
	private final Map<String, StructDefinition> structTags = new LinkedHashMap<>();
	private int errorCount;

	public SemanticAnalyzer(String sourceName, ErrorReporter errorReporter)
	{
		this(sourceName, errorReporter, Collections.emptyList());
	}

	/**
	 * @param extraLibraryFunctions Names accepted as calls in addition to {@link #LIBRARY_FUNCTIONS}.
	 */
	public SemanticAnalyzer(String sourceName, ErrorReporter errorReporter, Collection<String> extraLibraryFunctions)
	{
		this.sourceName = sourceName;
		this.errorReporter = errorReporter;
		this.libraryFunctions = new HashSet<>(LIBRARY_FUNCTIONS);
		this.libraryFunctions.addAll(extraLibraryFunctions);
	}

	/**
	 * Analyzes a whole program. The tree is only read, never modified.
	 *
	 * @param program The root of the AST.
	 * @return True if no semantic error was found.
	 */
	public boolean analyze(Program program)
	{
		globalScope = new SymbolTable(null, "global");
		currentScope = globalScope;
		scopes.clear();
		scopes.add(globalScope);
		structTags.clear();
		errorCount = 0;

		program.accept(this);

		Debug.log("Semantic analysis of %s finished with %d error(s)", sourceName, errorCount);
		return errorCount == 0;
	}

	public SymbolTable getGlobalScope()
	{
		return globalScope;
	}

	/**
	 * @return The global scope followed by every function scope, in analysis order.
	 */
	public List<SymbolTable> getScopes()
	{
		return Collections.unmodifiableList(scopes);
	}

	public int getErrorCount()
	{
		return errorCount;
	}

	// --- Scope and error helpers ---

	private void enterScope(String scopeName)
	{
		currentScope = new SymbolTable(currentScope, scopeName);
		scopes.add(currentScope);
		Debug.log("Entering scope '%s'", scopeName);
		Debug.indent();
	}

	private void exitScope()
	{
		Debug.dedent();
		Debug.log("Leaving scope '%s' (%d symbols)", currentScope.getScopeName(), currentScope.size());
		if (currentScope.getEnclosingScope() != null)
		{
			currentScope = currentScope.getEnclosingScope();
		}
	}

	private void error(ASTNode node, String message)
	{
		error(node.getLine(), message);
	}

	private void error(int line, String message)
	{
		errorCount++;
		errorReporter.reportSemantic(sourceName, line, message);
	}

	/**
	 * Defines a variable-like symbol in the current scope unless the name is already taken there.
	 */
	private void declare(Symbol symbol)
	{
		if (currentScope.resolveCurrentScope(symbol.getName()) != null)
		{
			error(symbol.getLine(), "Variable '" + symbol.getName() + "' already declared in this scope");
			return;
		}
		currentScope.define(symbol);
	}

	private void visit(ASTNode node)
	{
		if (node != null)
		{
			node.accept(this);
		}
	}

	// --- Declarations ---

	@Override
	public Void visitProgram(Program program)
	{
		for (Declaration declaration : program.getDeclarations())
		{
			visit(declaration);
		}
		return null;
	}

	@Override
	public Void visitFunctionDeclaration(FunctionDeclaration declaration)
	{
		String name = declaration.getName();
		Symbol existing = globalScope.resolveCurrentScope(name);

		if (existing != null)
		{
			FunctionSymbol previous = existing instanceof FunctionSymbol ? (FunctionSymbol) existing : null;
			if (previous == null || (previous.isDefined() && !declaration.isPrototype()))
			{
				error(declaration.getNameToken().getLine(), "Function '" + name + "' already declared");
				return null;
			}
			if (!declaration.isPrototype())
			{
				previous.markDefined();
			}
		}
		else
		{
			List<String> parameterTypes = new ArrayList<>();
			for (Parameter parameter : declaration.getParameters())
			{
				parameterTypes.add(parameter.isArray() ? parameter.getType() + "[]" : parameter.getType());
			}
			globalScope.define(new FunctionSymbol(name, declaration.getReturnType(), declaration.getNameToken(),
					globalScope.getScopeName(), parameterTypes, !declaration.isPrototype()));
		}

		if (declaration.isPrototype())
		{
			return null;
		}

		enterScope(name);
		for (Parameter parameter : declaration.getParameters())
		{
			declare(new VariableSymbol(parameter.getName(), parameter.getType(), parameter.getNameToken(),
					name, VariableSymbol.Kind.PARAMETER, parameter.isArray()));
		}
		// The body shares the function scope with the parameters
		for (Statement statement : declaration.getBody().getStatements())
		{
			visit(statement);
		}
		exitScope();
		return null;
	}

	@Override
	public Void visitStructDefinition(StructDefinition definition)
	{
		String tag = definition.getName();
		if (tag != null)
		{
			if (structTags.containsKey(tag))
			{
				String kind = definition.isUnion() ? "Union" : "Struct";
				error(definition, kind + " '" + tag + "' already defined");
			}
			else
			{
				structTags.put(tag, definition);
			}
		}

		Set<String> memberNames = new HashSet<>();
		for (VariableDeclaration member : definition.getMembers())
		{
			if (!memberNames.add(member.getName()))
			{
				error(member.getNameToken().getLine(), "Duplicate member '" + member.getName() + "' in " + definition.getKind()
						+ (tag != null ? " '" + tag + "'" : ""));
			}
			visit(member.getArraySize());
		}
		return null;
	}

	@Override
	public Void visitEnumDefinition(EnumDefinition definition)
	{
		for (EnumConstant constant : definition.getConstants())
		{
			visit(constant.getValue());
			declare(new VariableSymbol(constant.getName(), "int", constant.getNameToken(),
					currentScope.getScopeName(), VariableSymbol.Kind.ENUM_CONSTANT, false));
		}
		return null;
	}

	@Override
	public Void visitTypedefDeclaration(TypedefDeclaration declaration)
	{
		visit(declaration.getInlineDefinition());
		declare(new TypedefSymbol(declaration.getAlias(), declaration.getType(), declaration.getAliasToken(),
				currentScope.getScopeName()));
		return null;
	}

	/**
	 * The name is visible to its own initializer.
	 */
	@Override
	public Void visitVariableDeclaration(VariableDeclaration declaration)
	{
		declare(new VariableSymbol(declaration.getName(), declaration.getType(), declaration.getNameToken(),
				currentScope.getScopeName(), VariableSymbol.Kind.VARIABLE, declaration.isArray()));
		visit(declaration.getInitializer());
		visit(declaration.getArraySize());
		return null;
	}

	// --- Statements ---

	@Override
	public Void visitBlockStatement(BlockStatement statement)
	{
		for (Statement inner : statement.getStatements())
		{
			visit(inner);
		}
		return null;
	}

	@Override
	public Void visitExpressionStatement(ExpressionStatement statement)
	{
		visit(statement.getExpression());
		return null;
	}

	@Override
	public Void visitIfStatement(IfStatement statement)
	{
		visit(statement.getCondition());
		visit(statement.getThenBranch());
		visit(statement.getElseBranch());
		return null;
	}

	@Override
	public Void visitWhileStatement(WhileStatement statement)
	{
		visit(statement.getCondition());
		visit(statement.getBody());
		return null;
	}

	@Override
	public Void visitDoWhileStatement(DoWhileStatement statement)
	{
		visit(statement.getBody());
		visit(statement.getCondition());
		return null;
	}

	@Override
	public Void visitForStatement(ForStatement statement)
	{
		visit(statement.getInitializer());
		visit(statement.getCondition());
		visit(statement.getIncrement());
		visit(statement.getBody());
		return null;
	}

	@Override
	public Void visitSwitchStatement(SwitchStatement statement)
	{
		visit(statement.getSubject());
		for (SwitchClause clause : statement.getClauses())
		{
			visit(clause);
		}
		return null;
	}

	@Override
	public Void visitSwitchCase(SwitchCase switchCase)
	{
		visit(switchCase.getValue());
		for (Statement statement : switchCase.getStatements())
		{
			visit(statement);
		}
		return null;
	}

	@Override
	public Void visitSwitchDefault(SwitchDefault switchDefault)
	{
		for (Statement statement : switchDefault.getStatements())
		{
			visit(statement);
		}
		return null;
	}

	@Override
	public Void visitReturnStatement(ReturnStatement statement)
	{
		visit(statement.getValue());
		return null;
	}

	@Override
	public Void visitBreakStatement(BreakStatement statement)
	{
		return null;
	}

	@Override
	public Void visitContinueStatement(ContinueStatement statement)
	{
		return null;
	}

	@Override
	public Void visitGotoStatement(GotoStatement statement)
	{
		return null; // Label targets are not checked
	}

	@Override
	public Void visitLabelStatement(LabelStatement statement)
	{
		return null;
	}

	// --- Expressions ---

	@Override
	public Void visitBinaryExpression(BinaryExpression expression)
	{
		visit(expression.getLeft());
		visit(expression.getRight());
		return null;
	}

	@Override
	public Void visitUnaryExpression(UnaryExpression expression)
	{
		visit(expression.getOperand());
		return null;
	}

	@Override
	public Void visitPostfixUnaryExpression(PostfixUnaryExpression expression)
	{
		visit(expression.getOperand());
		return null;
	}

	@Override
	public Void visitTernaryExpression(TernaryExpression expression)
	{
		visit(expression.getCondition());
		visit(expression.getThenExpression());
		visit(expression.getElseExpression());
		return null;
	}

	@Override
	public Void visitAssignmentExpression(AssignmentExpression expression)
	{
		visit(expression.getTarget());
		visit(expression.getValue());
		return null;
	}

	@Override
	public Void visitCompoundAssignmentExpression(CompoundAssignmentExpression expression)
	{
		visit(expression.getTarget());
		visit(expression.getValue());
		return null;
	}

	/**
	 * Only the global scope and the library list are consulted, so a call to a
	 * function defined further down the file is reported.
	 */
	@Override
	public Void visitCallExpression(CallExpression expression)
	{
		String name = expression.getFunctionName();
		if (globalScope.resolveCurrentScope(name) == null && !libraryFunctions.contains(name))
		{
			error(expression, "Undefined function '" + name + "'");
		}
		for (Expression argument : expression.getArguments())
		{
			visit(argument);
		}
		return null;
	}

	@Override
	public Void visitArrayAccessExpression(ArrayAccessExpression expression)
	{
		if (expression.getArray() instanceof IdentifierExpression)
		{
			IdentifierExpression array = (IdentifierExpression) expression.getArray();
			Symbol symbol = currentScope.resolve(array.getName());
			if (symbol == null)
			{
				error(array, "Undeclared array '" + array.getName() + "'");
			}
			else if (!symbol.isArray())
			{
				error(array, "'" + array.getName() + "' is not an array");
			}
		}
		else
		{
			visit(expression.getArray());
		}
		visit(expression.getIndex());
		return null;
	}

	@Override
	public Void visitMemberAccessExpression(MemberAccessExpression expression)
	{
		visit(expression.getObject()); // Member names are not checked against the struct
		return null;
	}

	@Override
	public Void visitLiteralExpression(LiteralExpression expression)
	{
		return null;
	}

	@Override
	public Void visitIdentifierExpression(IdentifierExpression expression)
	{
		if (currentScope.resolve(expression.getName()) == null)
		{
			error(expression, "Undeclared variable '" + expression.getName() + "'");
		}
		return null;
	}

	@Override
	public Void visitSizeofExpression(SizeofExpression expression)
	{
		visit(expression.getOperand());
		return null;
	}

	@Override
	public Void visitCastExpression(CastExpression expression)
	{
		visit(expression.getOperand());
		return null;
	}

	@Override
	public Void visitInitializerListExpression(InitializerListExpression expression)
	{
		for (Expression element : expression.getElements())
		{
			visit(element);
		}
		return null;
	}
}
