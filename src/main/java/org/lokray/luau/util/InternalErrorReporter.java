package org.lokray.luau.util;

import org.lokray.luau.ast.Location;

public class InternalErrorReporter
{
	private final String moduleName;

	public InternalErrorReporter(String moduleName)
	{
		this.moduleName = moduleName;
	}

	public InternalCompilerError ice(String message)
	{
		Debug.logError(moduleName, "[Internal Error] " + message);
		throw new InternalCompilerError(message);
	}

	public InternalCompilerError ice(String message, Location location)
	{
		Debug.logError(moduleName, "[Internal Error] " + location + " - " + message);
		throw new InternalCompilerError(message, location);
	}
}
