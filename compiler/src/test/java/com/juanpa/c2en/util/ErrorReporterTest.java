package com.juanpa.c2en.util;

import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

class ErrorReporterTest
{
	@Test
	void formatsSyntaxAndSemanticDiagnostics()
	{
		ByteArrayOutputStream buffer = new ByteArrayOutputStream();
		ErrorReporter reporter = new ErrorReporter(new PrintStream(buffer, true, StandardCharsets.UTF_8));

		reporter.report("main.c", 3, 14, "Expected ';' after expression");
		reporter.reportSemantic("main.c", 7, "Undeclared variable 'y'");

		String newline = System.lineSeparator();
		assertEquals("[ERROR] main.c:3:14: Expected ';' after expression" + newline
				+ "[SEMANTIC ERROR] main.c:7: Undeclared variable 'y'" + newline, buffer.toString(StandardCharsets.UTF_8));
		assertEquals(2, reporter.getErrorCount());
		assertTrue(reporter.hasErrors());
	}

	@Test
	void diagnosticsAreReadOnlyAndResettable()
	{
		ErrorReporter reporter = new ErrorReporter(new PrintStream(new ByteArrayOutputStream()));
		reporter.report("a.c", 1, 1, "Expected expression");

		assertThrows(UnsupportedOperationException.class, () -> reporter.getDiagnostics().clear());

		reporter.reset();
		assertFalse(reporter.hasErrors());
		assertTrue(reporter.getDiagnostics().isEmpty());
	}
}
