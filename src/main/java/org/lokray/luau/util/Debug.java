package org.lokray.luau.util;

public class Debug
{
	// ANSI escape codes for colors
	public static final String ANSI_RESET = "\u001B[0m";
	public static final String ANSI_YELLOW = "\u001B[33m";
	public static final String ANSI_RED = "\u001B[31m";
	public static final String ANSI_GREEN = "\u001B[32m";

	// Set by GeneratorOptions when -v/--verbose is present.
	public static boolean ENABLE_DEBUG = false;

	public static void log(String log)
	{
		System.out.println(log);
	}

	public static void logInfo(String log)
	{
		System.out.println(ANSI_GREEN + log + ANSI_RESET);
	}

	public static void logDebug(String log)
	{
		if (ENABLE_DEBUG)
		{
			System.out.println(log);
		}
	}

	/**
	 * Debug output for one module's generation pass, prefixed with the module name so the
	 * passes of several modules can be told apart.
	 */
	public static void logDebug(String moduleName, String log)
	{
		if (ENABLE_DEBUG)
		{
			System.out.println(moduleTag(moduleName) + log);
		}
	}

	public static void logWarning(String log)
	{
		System.out.println(ANSI_YELLOW + log + ANSI_RESET);
	}

	public static void logError(String log)
	{
		System.err.println(ANSI_RED + log + ANSI_RESET);
	}

	public static void logError(String moduleName, String log)
	{
		logError(moduleTag(moduleName) + log);
	}

	private static String moduleTag(String moduleName)
	{
		return moduleName == null || moduleName.isEmpty() ? "" : "[" + moduleName + "] ";
	}
}
