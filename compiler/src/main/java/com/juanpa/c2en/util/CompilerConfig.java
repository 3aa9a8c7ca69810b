package com.juanpa.c2en.util;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Properties;

/**
 * Holds configuration settings for the c2en front end, loaded from properties.
 * Provides sensible defaults if settings are not specified.
 */
public class CompilerConfig
{
	/**
	 * Classpath resource holding the bundled defaults.
	 */
	public static final String DEFAULTS_RESOURCE = "/c2en.properties";

	private final boolean verbose;
	private final boolean debugTrace;
	private final boolean showTokens;
	private final boolean showAst;
	private final boolean showSymbols;
	private final List<String> libraryFunctions;

	public CompilerConfig(Properties props)
	{
		this.verbose = Boolean.parseBoolean(props.getProperty("log.verbose", "false"));
		this.debugTrace = Boolean.parseBoolean(props.getProperty("debug.trace", "false"));
		this.showTokens = Boolean.parseBoolean(props.getProperty("output.show_tokens", "false"));
		this.showAst = Boolean.parseBoolean(props.getProperty("output.show_ast", "false"));
		this.showSymbols = Boolean.parseBoolean(props.getProperty("output.show_symbols", "false"));

		List<String> names = new ArrayList<>();
		for (String name : props.getProperty("analysis.library_functions", "").split(","))
		{
			if (!name.isBlank())
			{
				names.add(name.trim());
			}
		}
		this.libraryFunctions = Collections.unmodifiableList(names);
	}

	/**
	 * Reads the bundled defaults from the classpath.
	 *
	 * @return The default properties, empty if the resource is missing.
	 * @throws IOException if the resource exists but cannot be read.
	 */
	public static Properties loadDefaults() throws IOException
	{
		Properties props = new Properties();
		try (InputStream input = CompilerConfig.class.getResourceAsStream(DEFAULTS_RESOURCE))
		{
			if (input != null)
			{
				props.load(input);
			}
		}
		return props;
	}

	public boolean isVerbose()
	{
		return verbose;
	}

	public boolean isDebugTrace()
	{
		return debugTrace;
	}

	public boolean isShowTokens()
	{
		return showTokens;
	}

	public boolean isShowAst()
	{
		return showAst;
	}

	public boolean isShowSymbols()
	{
		return showSymbols;
	}

	/**
	 * Extra function names accepted as library calls, on top of the built-in list.
	 */
	public List<String> getLibraryFunctions()
	{
		return libraryFunctions;
	}
}
