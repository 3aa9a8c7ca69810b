package com.juanpa.c2en.util;

import java.io.PrintStream;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Collects and prints compilation diagnostics.
 * Lexical and syntax errors use {@code [ERROR] file:line:column: message};
 * semantic errors use {@code [SEMANTIC ERROR] file:line: message}.
 */
public class ErrorReporter
{
	private final PrintStream out;
	private final List<String> diagnostics = new ArrayList<>();
	private int errorCount = 0;

	public ErrorReporter()
	{
		this(System.err);
	}

	/**
	 * @param out Where diagnostics are printed, one per line.
	 */
	public ErrorReporter(PrintStream out)
	{
		this.out = out;
	}

	/**
	 * Reports a lexical or syntax error.
	 *
	 * @param file    The source file name.
	 * @param line    The line number where the error occurred.
	 * @param column  The column number where the error occurred.
	 * @param message The error message.
	 */
	public void report(String file, int line, int column, String message)
	{
		emit("[ERROR] " + file + ":" + line + ":" + column + ": " + message);
	}

	/**
	 * Reports a semantic error. Semantic diagnostics carry no column.
	 *
	 * @param file    The source file name.
	 * @param line    The line number of the offending node.
	 * @param message The error message.
	 */
	public void reportSemantic(String file, int line, String message)
	{
		emit("[SEMANTIC ERROR] " + file + ":" + line + ": " + message);
	}

	private void emit(String diagnostic)
	{
		out.println(diagnostic);
		diagnostics.add(diagnostic);
		errorCount++;
	}

	/**
	 * Checks if any errors have been reported.
	 *
	 * @return True if errors exist, false otherwise.
	 */
	public boolean hasErrors()
	{
		return errorCount > 0;
	}

	public int getErrorCount()
	{
		return errorCount;
	}

	/**
	 * @return Every diagnostic line printed so far, in order.
	 */
	public List<String> getDiagnostics()
	{
		return Collections.unmodifiableList(diagnostics);
	}

	/**
	 * Clears the error count and the recorded diagnostics.
	 */
	public void reset()
	{
		errorCount = 0;
		diagnostics.clear();
	}
}
