package org.lokray.luau.util;

/**
 * Tuning flags for constraint generation, parsed from option strings in the same
 * shape as the compiler command line.
 */
public class GeneratorOptions
{
	public static final int DEFAULT_RECURSION_LIMIT = 500;

	private int recursionLimit = DEFAULT_RECURSION_LIMIT;
	private boolean magicTypes = false;
	private boolean logJson = false;
	private boolean verboseFlag = false;

	// Private constructor, use parse() or defaults()
	private GeneratorOptions()
	{
	}

	public static GeneratorOptions defaults()
	{
		return new GeneratorOptions();
	}

	/**
	 * Parses generator flags.
	 *
	 * @param args flags such as {@code --recursion-limit=200}, {@code -r 200}, {@code --magic-types},
	 *             {@code --log-json}, {@code -v}
	 * @return the parsed options
	 * @throws IllegalArgumentException on an unknown flag or a malformed value
	 */
	public static GeneratorOptions parse(String[] args)
	{
		GeneratorOptions parsed = new GeneratorOptions();

		for (int i = 0; i < args.length; i++)
		{
			String arg = args[i];

			if (arg.equals("-v") || arg.equals("--verbose"))
			{
				parsed.verboseFlag = true;
				Debug.ENABLE_DEBUG = true;
				continue;
			}
			if (arg.equals("--magic-types"))
			{
				parsed.magicTypes = true;
				continue;
			}
			if (arg.equals("--log-json"))
			{
				parsed.logJson = true;
				continue;
			}
			if (arg.equals("-r"))
			{
				parsed.recursionLimit = parseLimit(getNextArg(args, ++i, arg));
				continue;
			}
			if (arg.startsWith("--recursion-limit="))
			{
				parsed.recursionLimit = parseLimit(arg.substring(arg.indexOf('=') + 1));
				continue;
			}

			throw new IllegalArgumentException("Unknown option: " + arg);
		}

		Debug.logDebug("Generator options: recursionLimit=" + parsed.recursionLimit + ", magicTypes=" + parsed.magicTypes + ", logJson=" + parsed.logJson);
		return parsed;
	}

	private static int parseLimit(String value)
	{
		try
		{
			int limit = Integer.parseInt(value);
			if (limit <= 0)
			{
				throw new IllegalArgumentException("Recursion limit must be positive: " + value);
			}
			return limit;
		}
		catch (NumberFormatException e)
		{
			throw new IllegalArgumentException("Invalid value for --recursion-limit: " + value, e);
		}
	}

	private static String getNextArg(String[] args, int i, String flag)
	{
		if (i >= args.length || args[i].startsWith("-"))
		{
			throw new IllegalArgumentException("Missing argument after " + flag);
		}
		return args[i];
	}

	// --- Getters ---

	public int getRecursionLimit()
	{
		return recursionLimit;
	}

	public boolean isMagicTypes()
	{
		return magicTypes;
	}

	public boolean isLogJson()
	{
		return logJson;
	}

	public boolean isVerboseFlag()
	{
		return verboseFlag;
	}
}
