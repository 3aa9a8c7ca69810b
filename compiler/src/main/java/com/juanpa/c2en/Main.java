// File: src/main/java/com/juanpa/c2en/Main.java

package com.juanpa.c2en;

import com.juanpa.c2en.ast.AstPrinter;
import com.juanpa.c2en.lexer.Token;
import com.juanpa.c2en.semantics.SymbolTable;
import com.juanpa.c2en.util.CompilerConfig;
import com.juanpa.c2en.util.Debug;
import com.juanpa.c2en.util.ErrorReporter;
import com.juanpa.c2en.util.Log;

import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Properties;

/**
 * Entry point for the c2en front end.
 * Usage: {@code c2en <input.c> [-v] [--show-tokens] [--show-ast] [--show-symbols] [--help] [--version]}
 */
public class Main
{
	public static final String VERSION = "1.0.0";

	public static void main(String[] args)
	{
		System.exit(run(args));
	}

	/**
	 * Runs the driver without exiting the JVM.
	 *
	 * @return The process exit code: 0 on success, 1 on any failure.
	 */
	public static int run(String[] args)
	{
		String inputFile = null;
		boolean verbose = false;
		boolean showTokens = false;
		boolean showAst = false;
		boolean showSymbols = false;

		for (String arg : args)
		{
			switch (arg)
			{
				case "-v":
					verbose = true;
					break;
				case "--show-tokens":
					showTokens = true;
					break;
				case "--show-ast":
					showAst = true;
					break;
				case "--show-symbols":
					showSymbols = true;
					break;
				case "--help":
					printUsage();
					return 0;
				case "--version":
					printVersion();
					return 0;
				default:
					if (arg.startsWith("-"))
					{
						Log.error("Unknown option: %s", arg);
						printUsage();
						return 1;
					}
					if (inputFile != null)
					{
						Log.error("Multiple input files specified");
						return 1;
					}
					inputFile = arg;
			}
		}

		if (inputFile == null)
		{
			Log.error("No input file specified");
			printUsage();
			return 1;
		}

		Log.setVerbose(verbose);
		CompilerConfig config = loadConfiguration();
		Log.setVerbose(verbose || config.isVerbose());
		Debug.setEnabled(config.isDebugTrace());

		try
		{
			return compile(Paths.get(inputFile), config,
					showTokens || config.isShowTokens(),
					showAst || config.isShowAst(),
					showSymbols || config.isShowSymbols());
		}
		catch (OutOfMemoryError e)
		{
			Log.error("Memory allocation failed");
			return 1;
		}
	}

	private static int compile(Path inputFile, CompilerConfig config, boolean showTokens, boolean showAst, boolean showSymbols)
	{
		Log.info("Starting compilation of %s", inputFile);
		if (!Files.exists(inputFile))
		{
			Log.error("Failed to read input file: %s", inputFile);
			return 1;
		}

		ErrorReporter errorReporter = new ErrorReporter();
		FrontEnd.Result result;
		try
		{
			result = new FrontEnd(config, errorReporter).compileFile(inputFile);
		}
		catch (IOException e)
		{
			Log.error("Failed to read input file: %s (%s)", inputFile, e.getMessage());
			return 1;
		}

		if (showTokens)
		{
			System.out.println("\n=== TOKENS ===");
			for (Token token : result.getTokens().getTokens())
			{
				System.out.println(String.format("%d:%d  %-15s  '%s'",
						token.getLine(), token.getColumn(), token.getType(), token.getLexeme()));
			}
			System.out.println();
		}

		if (showAst && result.getProgram() != null)
		{
			System.out.println("\n=== ABSTRACT SYNTAX TREE ===");
			System.out.print(AstPrinter.print(result.getProgram()));
			System.out.println();
		}

		if (showSymbols && result.getAnalyzer() != null)
		{
			System.out.println("\n=== SYMBOL TABLES ===");
			for (SymbolTable scope : result.getAnalyzer().getScopes())
			{
				System.out.print(scope);
			}
			System.out.println();
		}

		if (!result.isSuccess())
		{
			Log.error(result.getFailedStage().getFailureMessage());
			return 1;
		}

		if (Log.isVerbose())
		{
			Log.info("Compilation completed successfully!");
		}
		else
		{
			System.out.println("Successfully analysed " + inputFile);
		}
		return 0;
	}

	/**
	 * Bundled defaults first, then ~/.config/c2en/c2en.conf on top.
	 */
	private static CompilerConfig loadConfiguration()
	{
		Properties props = new Properties();
		try
		{
			props.putAll(CompilerConfig.loadDefaults());
		}
		catch (IOException e)
		{
			Log.warning("Could not read bundled defaults: %s", e.getMessage());
		}

		Path configPath = Paths.get(System.getProperty("user.home"), ".config", "c2en", "c2en.conf");
		if (Files.exists(configPath))
		{
			try (InputStream input = new FileInputStream(configPath.toFile()))
			{
				props.load(input);
				Log.info("Loaded configuration from: %s", configPath);
			}
			catch (IOException e)
			{
				Log.warning("Could not read config file at %s. Using default settings.", configPath);
			}
		}
		else
		{
			Log.info("No config file found at ~/.config/c2en/c2en.conf. Using default settings.");
		}
		return new CompilerConfig(props);
	}

	private static void printUsage()
	{
		System.out.println("C to British English Compiler (c2en) - Version " + VERSION + "\n");
		System.out.println("Usage: c2en <input.c> [options]\n");
		System.out.println("Options:");
		System.out.println("  -v              Verbose mode (show compilation stages)");
		System.out.println("  --show-tokens   Display tokenization result");
		System.out.println("  --show-ast      Display abstract syntax tree");
		System.out.println("  --show-symbols  Display symbol tables after analysis");
		System.out.println("  --help          Display this help message");
		System.out.println("  --version       Display compiler version\n");
		System.out.println("Examples:");
		System.out.println("  c2en hello.c                    # Check hello.c");
		System.out.println("  c2en test.c -v --show-ast       # Verbose, with the syntax tree");
	}

	private static void printVersion()
	{
		System.out.println("C to British English Compiler (c2en)");
		System.out.println("Version: " + VERSION);
		System.out.println("Java: " + System.getProperty("java.version"));
		System.out.println("C Standard: C99 subset");
	}
}
