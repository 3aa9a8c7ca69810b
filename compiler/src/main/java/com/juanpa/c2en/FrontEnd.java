// File: src/main/java/com/juanpa/c2en/FrontEnd.java

package com.juanpa.c2en;

import com.juanpa.c2en.ast.Program;
import com.juanpa.c2en.lexer.Lexer;
import com.juanpa.c2en.lexer.TokenStream;
import com.juanpa.c2en.parser.CParser;
import com.juanpa.c2en.semantics.SemanticAnalyzer;
import com.juanpa.c2en.util.CompilerConfig;
import com.juanpa.c2en.util.ErrorReporter;
import com.juanpa.c2en.util.Log;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Runs the front-end pipeline on one source file: lexing, parsing and semantic analysis.
 * Each stage only runs if the previous one succeeded.
 */
public class FrontEnd
{
	/**
	 * The stage a compilation stopped at.
	 */
	public enum Stage
	{
		LEXICAL("Lexical analysis failed"),
		SYNTAX("Syntax analysis failed"),
		SEMANTIC("Semantic analysis failed");

		private final String failureMessage;

		Stage(String failureMessage)
		{
			this.failureMessage = failureMessage;
		}

		public String getFailureMessage()
		{
			return failureMessage;
		}
	}

	/**
	 * Everything a compilation produced. Later stages are null when an earlier one failed.
	 */
	public static final class Result
	{
		private final TokenStream tokens;
		private final Program program;
		private final SemanticAnalyzer analyzer;
		private final Stage failedStage;

		private Result(TokenStream tokens, Program program, SemanticAnalyzer analyzer, Stage failedStage)
		{
			this.tokens = tokens;
			this.program = program;
			this.analyzer = analyzer;
			this.failedStage = failedStage;
		}

		public TokenStream getTokens()
		{
			return tokens;
		}

		public Program getProgram()
		{
			return program;
		}

		public SemanticAnalyzer getAnalyzer()
		{
			return analyzer;
		}

		/**
		 * @return The stage that failed, or null on success.
		 */
		public Stage getFailedStage()
		{
			return failedStage;
		}

		public boolean isSuccess()
		{
			return failedStage == null;
		}
	}

	private final CompilerConfig config;
	private final ErrorReporter errorReporter;

	public FrontEnd(CompilerConfig config, ErrorReporter errorReporter)
	{
		this.config = config;
		this.errorReporter = errorReporter;
	}

	/**
	 * Reads a source file as UTF-8 and compiles it. The file name as given is used in diagnostics.
	 */
	public Result compileFile(Path sourceFile) throws IOException
	{
		Log.info("Reading source file...");
		String source = new String(Files.readAllBytes(sourceFile), StandardCharsets.UTF_8);
		return compile(source, sourceFile.toString());
	}

	public Result compile(String source, String sourceName)
	{
		Log.info("Performing lexical analysis...");
		TokenStream tokens = Lexer.tokenize(source, sourceName);
		CParser parser = new CParser(tokens, sourceName, errorReporter);

		if (tokens.hasError())
		{
			parser.parse(); // Reports the lexical error in the diagnostic format
			return new Result(tokens, null, null, Stage.LEXICAL);
		}

		Log.info("Performing syntax analysis...");
		Program program = parser.parse();
		if (program == null)
		{
			return new Result(tokens, null, null, Stage.SYNTAX);
		}

		Log.info("Performing semantic analysis...");
		SemanticAnalyzer analyzer = new SemanticAnalyzer(sourceName, errorReporter, config.getLibraryFunctions());
		boolean valid = analyzer.analyze(program);
		return new Result(tokens, program, analyzer, valid ? null : Stage.SEMANTIC);
	}
}
