package com.juanpa.c2en.util;

/**
 * Driver-level messages on standard error, prefixed with their level.
 * INFO messages are only printed in verbose mode.
 */
public final class Log
{
	public enum Level
	{
		INFO, WARNING, ERROR
	}

	private static boolean verbose = false;

	private Log()
	{
	}

	public static void setVerbose(boolean value)
	{
		verbose = value;
	}

	public static boolean isVerbose()
	{
		return verbose;
	}

	public static void info(String format, Object... args)
	{
		if (verbose)
		{
			message(Level.INFO, format, args);
		}
	}

	public static void warning(String format, Object... args)
	{
		message(Level.WARNING, format, args);
	}

	public static void error(String format, Object... args)
	{
		message(Level.ERROR, format, args);
	}

	private static void message(Level level, String format, Object... args)
	{
		System.err.println("[" + level + "] " + String.format(format, args));
	}
}
