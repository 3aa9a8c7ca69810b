package com.juanpa.c2en;

import com.juanpa.c2en.util.Debug;
import com.juanpa.c2en.util.Log;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class MainTest
{
	private final PrintStream originalOut = System.out;
	private final PrintStream originalErr = System.err;
	private ByteArrayOutputStream out;
	private ByteArrayOutputStream err;

	@BeforeEach
	void captureStreams()
	{
		out = new ByteArrayOutputStream();
		err = new ByteArrayOutputStream();
		System.setOut(new PrintStream(out, true, StandardCharsets.UTF_8));
		System.setErr(new PrintStream(err, true, StandardCharsets.UTF_8));
	}

	@AfterEach
	void restoreStreams()
	{
		System.setOut(originalOut);
		System.setErr(originalErr);
		Log.setVerbose(false);
		Debug.setEnabled(false);
	}

	private String stdout()
	{
		return out.toString(StandardCharsets.UTF_8);
	}

	private String stderr()
	{
		return err.toString(StandardCharsets.UTF_8);
	}

	private static Path write(Path dir, String name, String source) throws IOException
	{
		Path file = dir.resolve(name);
		Files.write(file, source.getBytes(StandardCharsets.UTF_8));
		return file;
	}

	@Test
	void versionAndHelpExitCleanly()
	{
		assertEquals(0, Main.run(new String[] { "--version" }));
		assertTrue(stdout().contains("Version: " + Main.VERSION));

		assertEquals(0, Main.run(new String[] { "--help" }));
		assertTrue(stdout().contains("Usage: c2en <input.c> [options]"));
	}

	@Test
	void missingInputFails()
	{
		assertEquals(1, Main.run(new String[0]));
		assertTrue(stderr().contains("[ERROR] No input file specified"));
	}

	@Test
	void unknownOptionFails()
	{
		assertEquals(1, Main.run(new String[] { "--optimise" }));
		assertTrue(stderr().contains("Unknown option: --optimise"));
	}

	@Test
	void nonexistentFileFails(@TempDir Path dir)
	{
		String path = dir.resolve("absent.c").toString();

		assertEquals(1, Main.run(new String[] { path }));
		assertTrue(stderr().contains("Failed to read input file: " + path));
	}

	@Test
	void validFileSucceeds(@TempDir Path dir) throws IOException
	{
		Path file = write(dir, "ok.c", "int main() { return 0; }\n");

		assertEquals(0, Main.run(new String[] { file.toString() }));
		assertTrue(stdout().contains("Successfully analysed " + file));
	}

	@Test
	void invalidFileReportsTheFailedStage(@TempDir Path dir) throws IOException
	{
		Path file = write(dir, "bad.c", "int main() { return y; }\n");

		assertEquals(1, Main.run(new String[] { file.toString() }));
		assertTrue(stderr().contains("Undeclared variable 'y'"));
		assertTrue(stderr().contains("[ERROR] Semantic analysis failed"));
	}

	@Test
	void dumpsRequestedSections(@TempDir Path dir) throws IOException
	{
		Path file = write(dir, "dump.c", "int main() { int x = 1; return x; }\n");

		assertEquals(0, Main.run(new String[] { file.toString(), "--show-tokens", "--show-ast", "--show-symbols" }));

		String printed = stdout();
		assertTrue(printed.contains("=== TOKENS ==="));
		assertTrue(printed.contains("=== ABSTRACT SYNTAX TREE ==="));
		assertTrue(printed.contains("FUNCTION main: int"));
		assertTrue(printed.contains("=== SYMBOL TABLES ==="));
		assertTrue(printed.contains("Symbol Table [main]:"));
	}
}
