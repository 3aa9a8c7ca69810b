// File: src/main/java/com/juanpa/c2en/parser/CParser.java

package com.juanpa.c2en.parser;

import com.juanpa.c2en.ast.Program;
import com.juanpa.c2en.ast.declarations.Declaration;
import com.juanpa.c2en.ast.declarations.EnumConstant;
import com.juanpa.c2en.ast.declarations.EnumDefinition;
import com.juanpa.c2en.ast.declarations.FunctionDeclaration;
import com.juanpa.c2en.ast.declarations.Parameter;
import com.juanpa.c2en.ast.declarations.StructDefinition;
import com.juanpa.c2en.ast.declarations.TypedefDeclaration;
import com.juanpa.c2en.ast.expressions.*;
import com.juanpa.c2en.ast.statements.*;
import com.juanpa.c2en.lexer.Token;
import com.juanpa.c2en.lexer.TokenStream;
import com.juanpa.c2en.lexer.TokenType;
import com.juanpa.c2en.util.Debug;
import com.juanpa.c2en.util.ErrorReporter;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * The CParser is responsible for performing syntactic analysis.
 * It takes the token stream from the lexer and attempts to build an
 * Abstract Syntax Tree (AST) based on the supported C grammar.
 * This parser uses a recursive-descent approach, one method per precedence level.
 */
public class CParser
{
	// Above the C99 minimums of 127 nested blocks and 63 nested parentheses.
	private static final int MAX_DEPTH = 512;

	private final TokenStream stream;           // The tokens from the lexer
	private final List<Token> tokens;
	private final String sourceName;            // File name used in diagnostics
	private final ErrorReporter errorReporter;  // For reporting parsing errors
	private final Set<String> typedefNames = new HashSet<>(); // Names introduced by typedef so far
	private int current = 0;                    // Current position in the token list
	private boolean hadError = false;
	private int depth = 0;                      // Open statement and expression levels

	/**
	 * Constructs a CParser.
	 *
	 * @param stream        The token stream produced by the lexer.
	 * @param sourceName    The file name reported in diagnostics.
	 * @param errorReporter An instance of ErrorReporter for handling parsing errors.
	 */
	public CParser(TokenStream stream, String sourceName, ErrorReporter errorReporter)
	{
		this.stream = stream;
		this.tokens = stream.getTokens();
		this.sourceName = sourceName;
		this.errorReporter = errorReporter;
	}

	/**
	 * Starts the parsing process for the entire translation unit.
	 *
	 * @return The root of the parsed AST, or null if any lexical or syntax error was reported.
	 */
	public Program parse()
	{
		if (stream.hasError())
		{
			Token lexicalError = stream.last();
			errorReporter.report(sourceName, lexicalError.getLine(), lexicalError.getColumn(), lexicalError.getLexeme());
			hadError = true;
			return null;
		}

		Program program = new Program(peek());
		while (!isAtEnd())
		{
			try
			{
				program.addDeclaration(topLevelDeclaration());
			}
			catch (SyntaxError e)
			{
				synchronize();
			}
		}
		Debug.log("Parsed %d top-level declarations from %s", program.getDeclarations().size(), sourceName);
		return hadError ? null : program;
	}

	/**
	 * @return True if any error was reported by the last {@link #parse()} call.
	 */
	public boolean hadError()
	{
		return hadError;
	}

	// --- Declarations ---

	/**
	 * Parses one top-level item: a typedef, a struct/union/enum definition,
	 * a function definition or prototype, or a global variable.
	 */
	private Declaration topLevelDeclaration() throws SyntaxError
	{
		if (match(TokenType.TYPEDEF))
		{
			return typedefDeclaration();
		}
		if (startsTagDefinition())
		{
			Declaration definition = check(TokenType.ENUM) ? enumDefinition() : structDefinition();
			consume(TokenType.SEMICOLON, "Expected ';' after " + definition.getFirstToken().getLexeme() + " definition");
			return definition;
		}

		Token typeStart = peek();
		String type = typeSpecifier("Expected return type");
		Token name = consume(TokenType.IDENTIFIER, "Expected function name");

		if (check(TokenType.LEFT_BRACKET, TokenType.ASSIGN, TokenType.SEMICOLON))
		{
			Debug.log("Parsing global variable '%s'", name.getLexeme());
			return variableDeclarationRest(typeStart, type, name);
		}
		return functionDeclaration(typeStart, type, name);
	}

	/**
	 * Grammar: `TYPE IDENTIFIER ( PARAMETERS? ) ( BLOCK | ; )`
	 * The type and name have already been consumed.
	 */
	private FunctionDeclaration functionDeclaration(Token typeStart, String returnType, Token name) throws SyntaxError
	{
		Debug.log("Parsing function '%s'", name.getLexeme());
		Debug.indent();
		try
		{
			consume(TokenType.LEFT_PAREN, "Expected '(' after function name");

			List<Parameter> parameters = new ArrayList<>();
			if (check(TokenType.VOID) && check(1, TokenType.RIGHT_PAREN))
			{
				advance(); // (void) declares no parameters
			}
			else if (!check(TokenType.RIGHT_PAREN))
			{
				do
				{
					parameters.add(parameter());
				}
				while (match(TokenType.COMMA));
			}
			consume(TokenType.RIGHT_PAREN, "Expected ')' after parameters");

			if (match(TokenType.SEMICOLON))
			{
				return new FunctionDeclaration(typeStart, returnType, name, parameters, null);
			}

			consume(TokenType.LEFT_BRACE, "Expected '{' before function body");
			BlockStatement body = block();
			return new FunctionDeclaration(typeStart, returnType, name, parameters, body);
		}
		finally
		{
			Debug.dedent();
		}
	}

	private Parameter parameter() throws SyntaxError
	{
		String type = typeSpecifier("Expected parameter type");
		Token name = consume(TokenType.IDENTIFIER, "Expected parameter name");
		boolean isArray = false;
		if (match(TokenType.LEFT_BRACKET))
		{
			if (!check(TokenType.RIGHT_BRACKET))
			{
				expression(); // The size of an array parameter carries no meaning
			}
			consume(TokenType.RIGHT_BRACKET, "Expected ']' after '['");
			isArray = true;
		}
		return new Parameter(type, name, isArray);
	}

	/**
	 * Grammar: `TYPEDEF ( STRUCT_OR_UNION_OR_ENUM_DEFINITION | TYPE ) IDENTIFIER ;`
	 * The alias becomes usable as a type name for the rest of the file.
	 */
	private TypedefDeclaration typedefDeclaration() throws SyntaxError
	{
		Token keyword = previous();
		Declaration inlineDefinition = null;
		StringBuilder type = new StringBuilder();

		if (startsTagDefinition())
		{
			Token tagKeyword = peek();
			String tagName;
			if (check(TokenType.ENUM))
			{
				EnumDefinition definition = enumDefinition();
				tagName = definition.getName();
				inlineDefinition = definition;
			}
			else
			{
				StructDefinition definition = structDefinition();
				tagName = definition.getName();
				inlineDefinition = definition;
			}
			type.append(tagKeyword.getLexeme());
			if (tagName != null)
			{
				type.append(' ').append(tagName);
			}
			while (match(TokenType.STAR))
			{
				type.append('*');
			}
		}
		else
		{
			type.append(typeSpecifier("Expected type after 'typedef'"));
		}

		Token alias = consume(TokenType.IDENTIFIER, "Expected typedef name");
		consume(TokenType.SEMICOLON, "Expected ';' after typedef");
		typedefNames.add(alias.getLexeme());
		Debug.log("Registered typedef '%s' for %s", alias.getLexeme(), type);
		return new TypedefDeclaration(keyword, type.toString(), alias, inlineDefinition);
	}

	/**
	 * Grammar: `( STRUCT | UNION ) IDENTIFIER? { ( TYPE IDENTIFIER ( [ SIZE? ] )? ; )* }`
	 */
	private StructDefinition structDefinition() throws SyntaxError
	{
		Token keyword = advance();
		String kind = keyword.getLexeme();
		String name = match(TokenType.IDENTIFIER) ? previous().getLexeme() : null;
		consume(TokenType.LEFT_BRACE, "Expected '{' after " + kind + " name");

		StructDefinition definition = new StructDefinition(keyword, name);
		while (!check(TokenType.RIGHT_BRACE) && !isAtEnd())
		{
			Token typeStart = peek();
			String type = typeSpecifier("Expected member type");
			Token memberName = consume(TokenType.IDENTIFIER, "Expected member name");
			boolean isArray = false;
			Expression size = null;
			if (match(TokenType.LEFT_BRACKET))
			{
				isArray = true;
				if (!check(TokenType.RIGHT_BRACKET))
				{
					size = expression();
				}
				consume(TokenType.RIGHT_BRACKET, "Expected ']' after array size");
			}
			consume(TokenType.SEMICOLON, "Expected ';' after member declaration");
			definition.addMember(new VariableDeclaration(typeStart, type, memberName, isArray, size, null));
		}
		consume(TokenType.RIGHT_BRACE, "Expected '}' after " + kind + " members");
		return definition;
	}

	private EnumDefinition enumDefinition() throws SyntaxError
	{
		Token keyword = advance();
		String name = match(TokenType.IDENTIFIER) ? previous().getLexeme() : null;
		consume(TokenType.LEFT_BRACE, "Expected '{' after enum name");

		EnumDefinition definition = new EnumDefinition(keyword, name);
		if (!check(TokenType.RIGHT_BRACE))
		{
			do
			{
				if (check(TokenType.RIGHT_BRACE))
				{
					break; // Trailing comma
				}
				Token constant = consume(TokenType.IDENTIFIER, "Expected enumerator name");
				Expression value = match(TokenType.ASSIGN) ? ternary() : null;
				definition.addConstant(new EnumConstant(constant, value));
			}
			while (match(TokenType.COMMA));
		}
		consume(TokenType.RIGHT_BRACE, "Expected '}' after enumerators");
		return definition;
	}

	/**
	 * Parses a type specifier: qualifiers and base type keywords, a tagged
	 * struct/union/enum type or a typedef name, followed by any number of '*'.
	 *
	 * @param message The error message if no type is found.
	 * @return The rendered type, words joined by single spaces with '*' appended (e.g. "unsigned long", "char*").
	 * @throws SyntaxError if the current token cannot start a type.
	 */
	private String typeSpecifier(String message) throws SyntaxError
	{
		List<String> words = new ArrayList<>();
		boolean hasBaseType = false;

		while (true)
		{
			if (match(TokenType.CONST, TokenType.STATIC, TokenType.EXTERN))
			{
				words.add(previous().getLexeme());
			}
			else if (match(TokenType.SIGNED, TokenType.UNSIGNED, TokenType.LONG, TokenType.SHORT,
					TokenType.INT, TokenType.CHAR, TokenType.FLOAT, TokenType.DOUBLE, TokenType.VOID))
			{
				words.add(previous().getLexeme());
				hasBaseType = true;
			}
			else if (!hasBaseType && match(TokenType.STRUCT, TokenType.UNION, TokenType.ENUM))
			{
				String keyword = previous().getLexeme();
				Token tag = consume(TokenType.IDENTIFIER, "Expected " + keyword + " name");
				words.add(keyword + " " + tag.getLexeme());
				hasBaseType = true;
			}
			else if (!hasBaseType && isTypedefName(peek()))
			{
				words.add(advance().getLexeme());
				hasBaseType = true;
			}
			else
			{
				break;
			}
		}

		if (words.isEmpty())
		{
			throw error(peek(), message);
		}

		StringBuilder type = new StringBuilder(String.join(" ", words));
		while (match(TokenType.STAR))
		{
			type.append('*');
		}
		return type.toString();
	}

	// --- Statements ---

	/**
	 * Parses a block statement. The opening brace has already been consumed.
	 * Grammar: `{ STATEMENT* }`
	 */
	private BlockStatement block() throws SyntaxError
	{
		BlockStatement block = new BlockStatement(previous());
		while (!check(TokenType.RIGHT_BRACE) && !isAtEnd())
		{
			block.addStatement(statement());
		}
		consume(TokenType.RIGHT_BRACE, "Expected '}' after block");
		return block;
	}

	/**
	 * Parses a single statement, dispatching on its leading token.
	 */
	private Statement statement() throws SyntaxError
	{
		descend();
		try
		{
			if (isTypeStart(0))
			{
				return variableDeclaration();
			}
			if (match(TokenType.IF))
			{
				return ifStatement();
			}
			if (match(TokenType.WHILE))
			{
				return whileStatement();
			}
			if (match(TokenType.DO))
			{
				return doWhileStatement();
			}
			if (match(TokenType.FOR))
			{
				return forStatement();
			}
			if (match(TokenType.SWITCH))
			{
				return switchStatement();
			}
			if (match(TokenType.RETURN))
			{
				return returnStatement();
			}
			if (match(TokenType.BREAK))
			{
				Token keyword = previous();
				consume(TokenType.SEMICOLON, "Expected ';' after break");
				return new BreakStatement(keyword);
			}
			if (match(TokenType.CONTINUE))
			{
				Token keyword = previous();
				consume(TokenType.SEMICOLON, "Expected ';' after continue");
				return new ContinueStatement(keyword);
			}
			if (match(TokenType.GOTO))
			{
				Token keyword = previous();
				Token label = consume(TokenType.IDENTIFIER, "Expected label name after 'goto'");
				consume(TokenType.SEMICOLON, "Expected ';' after goto");
				return new GotoStatement(keyword, label);
			}
			if (check(TokenType.IDENTIFIER) && check(1, TokenType.COLON))
			{
				Token label = advance();
				advance(); // ':'
				return new LabelStatement(label);
			}
			if (match(TokenType.LEFT_BRACE))
			{
				return block();
			}
			if (match(TokenType.SEMICOLON))
			{
				return new BlockStatement(previous()); // Empty statement
			}
			return expressionStatement();
		}
		finally
		{
			depth--;
		}
	}

	private VariableDeclaration variableDeclaration() throws SyntaxError
	{
		Token typeStart = peek();
		String type = typeSpecifier("Expected type");
		Token name = consume(TokenType.IDENTIFIER, "Expected variable name");
		return variableDeclarationRest(typeStart, type, name);
	}

	/**
	 * Finishes a declaration after its name: optional array brackets,
	 * optional initializer and the terminating semicolon.
	 */
	private VariableDeclaration variableDeclarationRest(Token typeStart, String type, Token name) throws SyntaxError
	{
		boolean isArray = false;
		Expression size = null;
		if (match(TokenType.LEFT_BRACKET))
		{
			isArray = true;
			if (!check(TokenType.RIGHT_BRACKET))
			{
				size = expression();
			}
			consume(TokenType.RIGHT_BRACKET, "Expected ']' after array size");
		}

		Expression initializer = null;
		if (match(TokenType.ASSIGN))
		{
			initializer = check(TokenType.LEFT_BRACE) ? initializerList() : assignment();
		}
		consume(TokenType.SEMICOLON, "Expected ';' after declaration");
		return new VariableDeclaration(typeStart, type, name, isArray, size, initializer);
	}

	private InitializerListExpression initializerList() throws SyntaxError
	{
		InitializerListExpression list = new InitializerListExpression(advance());
		if (!check(TokenType.RIGHT_BRACE))
		{
			do
			{
				if (check(TokenType.RIGHT_BRACE))
				{
					break; // Trailing comma
				}
				list.addElement(check(TokenType.LEFT_BRACE) ? initializerList() : assignment());
			}
			while (match(TokenType.COMMA));
		}
		consume(TokenType.RIGHT_BRACE, "Expected '}' after initializer list");
		return list;
	}

	private IfStatement ifStatement() throws SyntaxError
	{
		Token ifKeyword = previous();
		consume(TokenType.LEFT_PAREN, "Expected '(' after 'if'");
		Expression condition = expression();
		consume(TokenType.RIGHT_PAREN, "Expected ')' after condition");

		Statement thenBranch = statement();
		Statement elseBranch = null;
		if (match(TokenType.ELSE))
		{
			elseBranch = statement();
		}
		return new IfStatement(ifKeyword, condition, thenBranch, elseBranch);
	}

	private WhileStatement whileStatement() throws SyntaxError
	{
		Token whileKeyword = previous();
		consume(TokenType.LEFT_PAREN, "Expected '(' after 'while'");
		Expression condition = expression();
		consume(TokenType.RIGHT_PAREN, "Expected ')' after condition");
		Statement body = statement();
		return new WhileStatement(whileKeyword, condition, body);
	}

	private DoWhileStatement doWhileStatement() throws SyntaxError
	{
		Token doKeyword = previous();
		Statement body = statement();
		consume(TokenType.WHILE, "Expected 'while' after do body");
		consume(TokenType.LEFT_PAREN, "Expected '(' after 'while'");
		Expression condition = expression();
		consume(TokenType.RIGHT_PAREN, "Expected ')' after condition");
		consume(TokenType.SEMICOLON, "Expected ';' after do-while");
		return new DoWhileStatement(doKeyword, body, condition);
	}

	/**
	 * Grammar: `FOR ( (DECLARATION | EXPRESSION? ;) EXPRESSION? ; EXPRESSION? ) STATEMENT`
	 */
	private ForStatement forStatement() throws SyntaxError
	{
		Token forKeyword = previous();
		consume(TokenType.LEFT_PAREN, "Expected '(' after 'for'");

		Statement initializer = null;
		if (isTypeStart(0))
		{
			initializer = variableDeclaration(); // Consumes its own ';'
		}
		else if (!match(TokenType.SEMICOLON))
		{
			Expression init = expression();
			consume(TokenType.SEMICOLON, "Expected ';' after loop initializer");
			initializer = new ExpressionStatement(init);
		}

		Expression condition = check(TokenType.SEMICOLON) ? null : expression();
		consume(TokenType.SEMICOLON, "Expected ';' after loop condition");

		Expression increment = check(TokenType.RIGHT_PAREN) ? null : expression();
		consume(TokenType.RIGHT_PAREN, "Expected ')' after for clauses");

		Statement body = statement();
		return new ForStatement(forKeyword, initializer, condition, increment, body);
	}

	/**
	 * Parses a switch statement.
	 * Grammar: `SWITCH ( EXPRESSION ) { ( ( CASE EXPRESSION | DEFAULT ) : STATEMENT* )* }`
	 * Every statement belongs to the closest preceding label.
	 */
	private SwitchStatement switchStatement() throws SyntaxError
	{
		Token switchKeyword = previous();
		consume(TokenType.LEFT_PAREN, "Expected '(' after 'switch'");
		Expression subject = expression();
		consume(TokenType.RIGHT_PAREN, "Expected ')' after switch expression");
		consume(TokenType.LEFT_BRACE, "Expected '{' before switch body");

		SwitchStatement switchStatement = new SwitchStatement(switchKeyword, subject);
		SwitchClause clause = null;
		while (!check(TokenType.RIGHT_BRACE) && !isAtEnd())
		{
			if (match(TokenType.CASE))
			{
				Token caseKeyword = previous();
				Expression value = ternary();
				consume(TokenType.COLON, "Expected ':' after case value");
				clause = new SwitchCase(caseKeyword, value);
				switchStatement.addClause(clause);
			}
			else if (match(TokenType.DEFAULT))
			{
				Token defaultKeyword = previous();
				consume(TokenType.COLON, "Expected ':' after 'default'");
				clause = new SwitchDefault(defaultKeyword);
				switchStatement.addClause(clause);
			}
			else if (clause == null)
			{
				throw error(peek(), "Expected 'case' or 'default' in switch body");
			}
			else
			{
				clause.addStatement(statement());
			}
		}
		consume(TokenType.RIGHT_BRACE, "Expected '}' after switch body");
		return switchStatement;
	}

	private ReturnStatement returnStatement() throws SyntaxError
	{
		Token keyword = previous();
		Expression value = check(TokenType.SEMICOLON) ? null : expression();
		consume(TokenType.SEMICOLON, "Expected ';' after return");
		return new ReturnStatement(keyword, value);
	}

	private ExpressionStatement expressionStatement() throws SyntaxError
	{
		Expression expr = expression();
		consume(TokenType.SEMICOLON, "Expected ';' after expression");
		return new ExpressionStatement(expr);
	}

	// --- Expressions, loosest binding first ---

	private Expression expression() throws SyntaxError
	{
		return assignment();
	}

	/**
	 * Assignment is right-associative: {@code a = b = c} parses as {@code a = (b = c)}.
	 */
	private Expression assignment() throws SyntaxError
	{
		descend();
		try
		{
			Expression expr = ternary();

			if (match(TokenType.ASSIGN))
			{
				Token operator = previous();
				Expression value = assignment();
				if (!isAssignable(expr))
				{
					throw error(operator, "Invalid assignment target");
				}
				return new AssignmentExpression(expr, operator, value);
			}

			if (match(TokenType.PLUS_ASSIGN, TokenType.MINUS_ASSIGN, TokenType.STAR_ASSIGN, TokenType.SLASH_ASSIGN,
					TokenType.MODULO_ASSIGN, TokenType.AMPERSAND_ASSIGN, TokenType.PIPE_ASSIGN, TokenType.XOR_ASSIGN,
					TokenType.LEFT_SHIFT_ASSIGN, TokenType.RIGHT_SHIFT_ASSIGN))
			{
				Token operator = previous();
				Expression value = assignment();
				if (!isAssignable(expr))
				{
					throw error(operator, "Invalid assignment target");
				}
				return new CompoundAssignmentExpression(expr, operator, value);
			}
			return expr;
		}
		finally
		{
			depth--;
		}
	}

	/**
	 * The else branch recurses into ternary, so {@code a ? b : c ? d : e} groups to the right.
	 */
	private Expression ternary() throws SyntaxError
	{
		descend();
		try
		{
			Expression condition = logicalOr();

			if (match(TokenType.QUESTION))
			{
				Expression thenBranch = expression();
				consume(TokenType.COLON, "Expected ':' in conditional expression");
				Expression elseBranch = ternary();
				return new TernaryExpression(condition, thenBranch, elseBranch);
			}
			return condition;
		}
		finally
		{
			depth--;
		}
	}

	private Expression logicalOr() throws SyntaxError
	{
		Expression expr = logicalAnd();

		while (match(TokenType.PIPE_PIPE))
		{
			Token operator = previous();
			Expression right = logicalAnd();
			expr = new BinaryExpression(expr, operator, right);
		}
		return expr;
	}

	private Expression logicalAnd() throws SyntaxError
	{
		Expression expr = bitwiseOr();

		while (match(TokenType.AMPERSAND_AMPERSAND))
		{
			Token operator = previous();
			Expression right = bitwiseOr();
			expr = new BinaryExpression(expr, operator, right);
		}
		return expr;
	}

	private Expression bitwiseOr() throws SyntaxError
	{
		Expression expr = bitwiseXor();

		while (match(TokenType.PIPE))
		{
			Token operator = previous();
			Expression right = bitwiseXor();
			expr = new BinaryExpression(expr, operator, right);
		}
		return expr;
	}

	private Expression bitwiseXor() throws SyntaxError
	{
		Expression expr = bitwiseAnd();

		while (match(TokenType.XOR))
		{
			Token operator = previous();
			Expression right = bitwiseAnd();
			expr = new BinaryExpression(expr, operator, right);
		}
		return expr;
	}

	private Expression bitwiseAnd() throws SyntaxError
	{
		Expression expr = equality();

		while (match(TokenType.AMPERSAND))
		{
			Token operator = previous();
			Expression right = equality();
			expr = new BinaryExpression(expr, operator, right);
		}
		return expr;
	}

	private Expression equality() throws SyntaxError
	{
		Expression expr = comparison();

		while (match(TokenType.EQUAL_EQUAL, TokenType.BANG_EQUAL))
		{
			Token operator = previous();
			Expression right = comparison();
			expr = new BinaryExpression(expr, operator, right);
		}
		return expr;
	}

	private Expression comparison() throws SyntaxError
	{
		Expression expr = shift();

		while (match(TokenType.LESS, TokenType.LESS_EQUAL, TokenType.GREATER, TokenType.GREATER_EQUAL))
		{
			Token operator = previous();
			Expression right = shift();
			expr = new BinaryExpression(expr, operator, right);
		}
		return expr;
	}

	private Expression shift() throws SyntaxError
	{
		Expression expr = additive();

		while (match(TokenType.LEFT_SHIFT, TokenType.RIGHT_SHIFT))
		{
			Token operator = previous();
			Expression right = additive();
			expr = new BinaryExpression(expr, operator, right);
		}
		return expr;
	}

	private Expression additive() throws SyntaxError
	{
		Expression expr = multiplicative();

		while (match(TokenType.PLUS, TokenType.MINUS))
		{
			Token operator = previous();
			Expression right = multiplicative();
			expr = new BinaryExpression(expr, operator, right);
		}
		return expr;
	}

	private Expression multiplicative() throws SyntaxError
	{
		Expression expr = unary();

		while (match(TokenType.STAR, TokenType.SLASH, TokenType.MODULO))
		{
			Token operator = previous();
			Expression right = unary();
			expr = new BinaryExpression(expr, operator, right);
		}
		return expr;
	}

	/**
	 * Prefix operators, sizeof and casts.
	 */
	private Expression unary() throws SyntaxError
	{
		descend();
		try
		{
			if (match(TokenType.BANG, TokenType.MINUS, TokenType.PLUS, TokenType.TILDE, TokenType.STAR, TokenType.AMPERSAND))
			{
				Token operator = previous();
				Expression operand = unary();
				return new UnaryExpression(operator, operand);
			}

			if (match(TokenType.PLUS_PLUS, TokenType.MINUS_MINUS))
			{
				Token operator = previous();
				Expression operand = unary();
				if (!isAssignable(operand))
				{
					throw error(operator, "Invalid increment/decrement target");
				}
				return new UnaryExpression(operator, operand);
			}

			if (match(TokenType.SIZEOF))
			{
				Token keyword = previous();
				if (check(TokenType.LEFT_PAREN) && isTypeStart(1))
				{
					advance(); // '('
					String type = typeSpecifier("Expected type");
					consume(TokenType.RIGHT_PAREN, "Expected ')' after type");
					return new SizeofExpression(keyword, type, null);
				}
				return new SizeofExpression(keyword, null, unary());
			}

			if (check(TokenType.LEFT_PAREN) && isTypeStart(1))
			{
				Token leftParen = advance();
				String type = typeSpecifier("Expected type");
				consume(TokenType.RIGHT_PAREN, "Expected ')' after cast type");
				return new CastExpression(leftParen, type, unary());
			}

			return postfix();
		}
		finally
		{
			depth--;
		}
	}

	/**
	 * Array indexing, member access and postfix increment/decrement, applied left to right.
	 */
	private Expression postfix() throws SyntaxError
	{
		Expression expr = primary();

		while (true)
		{
			if (match(TokenType.LEFT_BRACKET))
			{
				Token leftBracket = previous();
				Expression index = expression();
				consume(TokenType.RIGHT_BRACKET, "Expected ']' after array index");
				expr = new ArrayAccessExpression(expr, leftBracket, index);
			}
			else if (match(TokenType.DOT, TokenType.ARROW))
			{
				Token operator = previous();
				Token member = consume(TokenType.IDENTIFIER, "Expected member name after '" + operator.getLexeme() + "'");
				expr = new MemberAccessExpression(expr, operator, member);
			}
			else if (match(TokenType.PLUS_PLUS, TokenType.MINUS_MINUS))
			{
				Token operator = previous();
				if (!isAssignable(expr))
				{
					throw error(operator, "Invalid increment/decrement target");
				}
				expr = new PostfixUnaryExpression(expr, operator);
			}
			else
			{
				break;
			}
		}
		return expr;
	}

	private Expression primary() throws SyntaxError
	{
		if (match(TokenType.NUMBER))
		{
			return new LiteralExpression(previous(), LiteralExpression.Kind.NUMBER);
		}
		if (match(TokenType.STRING))
		{
			return new LiteralExpression(previous(), LiteralExpression.Kind.STRING);
		}
		if (match(TokenType.CHAR_LITERAL))
		{
			return new LiteralExpression(previous(), LiteralExpression.Kind.CHAR);
		}

		if (match(TokenType.IDENTIFIER))
		{
			Token name = previous();
			if (match(TokenType.LEFT_PAREN))
			{
				List<Expression> arguments = new ArrayList<>();
				if (!check(TokenType.RIGHT_PAREN))
				{
					do
					{
						arguments.add(assignment());
					}
					while (match(TokenType.COMMA));
				}
				consume(TokenType.RIGHT_PAREN, "Expected ')' after arguments");
				return new CallExpression(name, arguments);
			}
			return new IdentifierExpression(name);
		}

		if (match(TokenType.LEFT_PAREN))
		{
			Expression expr = expression();
			consume(TokenType.RIGHT_PAREN, "Expected ')' after expression");
			return expr;
		}

		throw error(peek(), "Expected expression");
	}

	// --- Helpers ---

	/**
	 * Targets of assignment and increment/decrement: a name, an element, a member or a dereference.
	 */
	private boolean isAssignable(Expression expr)
	{
		if (expr instanceof IdentifierExpression || expr instanceof ArrayAccessExpression || expr instanceof MemberAccessExpression)
		{
			return true;
		}
		return expr instanceof UnaryExpression && ((UnaryExpression) expr).getOperator().getType() == TokenType.STAR;
	}

	/**
	 * Checks whether the token at the given offset can begin a type specifier.
	 */
	private boolean isTypeStart(int offset)
	{
		Token token = peek(offset);
		switch (token.getType())
		{
			case INT:
			case CHAR:
			case FLOAT:
			case DOUBLE:
			case VOID:
			case SIGNED:
			case UNSIGNED:
			case LONG:
			case SHORT:
			case CONST:
			case STATIC:
			case EXTERN:
			case STRUCT:
			case UNION:
			case ENUM:
				return true;
			default:
				return isTypedefName(token);
		}
	}

	private boolean isTypedefName(Token token)
	{
		return token.getType() == TokenType.IDENTIFIER && typedefNames.contains(token.getLexeme());
	}

	/**
	 * True when a struct, union or enum keyword is followed by a body, optionally after a tag name.
	 */
	private boolean startsTagDefinition()
	{
		if (!check(TokenType.STRUCT, TokenType.UNION, TokenType.ENUM))
		{
			return false;
		}
		return check(1, TokenType.LEFT_BRACE) || (check(1, TokenType.IDENTIFIER) && check(2, TokenType.LEFT_BRACE));
	}

	/**
	 * Checks if the current token matches any of the given types and, if so, consumes it.
	 *
	 * @param types The TokenType(s) to match against.
	 * @return True if a match was found and the token was consumed, false otherwise.
	 */
	private boolean match(TokenType... types)
	{
		for (TokenType type : types)
		{
			if (check(type))
			{
				advance();
				return true;
			}
		}
		return false;
	}

	/**
	 * Consumes the current token if it has the expected type; otherwise reports
	 * a syntax error and throws a SyntaxError.
	 */
	private Token consume(TokenType type, String message) throws SyntaxError
	{
		if (check(type))
		{
			return advance();
		}
		throw error(peek(), message);
	}

	private boolean check(TokenType... types)
	{
		if (isAtEnd())
		{
			return false;
		}
		TokenType currentType = peek().getType();
		for (TokenType type : types)
		{
			if (currentType == type)
			{
				return true;
			}
		}
		return false;
	}

	/**
	 * Helper method to check a token type at a given offset from the current position.
	 *
	 * @param offset The offset from the current token (0 for current, 1 for next, etc.)
	 * @param type   The TokenType to check for.
	 * @return True if the token at the offset exists and matches the type, false otherwise.
	 */
	private boolean check(int offset, TokenType type)
	{
		if (current + offset >= tokens.size())
		{
			return false;
		}
		return tokens.get(current + offset).getType() == type;
	}

	private Token advance()
	{
		if (!isAtEnd())
		{
			current++;
		}
		return previous();
	}

	/**
	 * Looks at the token at a given offset from the current position without consuming it.
	 *
	 * @return The Token at the specified offset, or the final token if past the end.
	 */
	private Token peek(int offset)
	{
		if (current + offset >= tokens.size())
		{
			return tokens.get(tokens.size() - 1);
		}
		return tokens.get(current + offset);
	}

	private Token peek()
	{
		return peek(0);
	}

	private Token previous()
	{
		return tokens.get(current - 1);
	}

	private boolean isAtEnd()
	{
		return peek().getType() == TokenType.EOF;
	}

	/**
	 * Reports a parsing error and creates a SyntaxError.
	 *
	 * @param token   The token where the error occurred.
	 * @param message The error message.
	 * @return A new SyntaxError instance.
	 */
	private SyntaxError error(Token token, String message)
	{
		hadError = true;
		errorReporter.report(sourceName, token.getLine(), token.getColumn(), message);
		return new SyntaxError();
	}

	/**
	 * Opens one statement or expression level. Each caller closes it with {@code depth--} in a finally block.
	 */
	private void descend() throws SyntaxError
	{
		if (++depth > MAX_DEPTH)
		{
			depth--;
			throw error(peek(), "Nesting too deep");
		}
	}

	/**
	 * Skips tokens after an error until something that can start a top-level
	 * declaration. Always consumes at least one token so parsing makes progress.
	 */
	private void synchronize()
	{
		advance();

		while (!isAtEnd())
		{
			if (check(TokenType.TYPEDEF) || isTypeStart(0))
			{
				return;
			}
			advance();
		}
	}

	/**
	 * Custom exception for handling parsing errors.
	 * This is an unchecked exception, used internally by the parser
	 * to unwind the stack when a syntax error is found.
	 */
	private static class SyntaxError extends RuntimeException
	{
	}
}
