package org.lokray.luau.util;

import org.lokray.luau.ast.Location;

/**
 * Raised when the generator reaches a branch that well-formed input can never reach.
 * This signals a defect in the generator, not in the analysed program.
 */
public class InternalCompilerError extends RuntimeException
{
	private final Location location;

	public InternalCompilerError(String message)
	{
		this(message, null);
	}

	public InternalCompilerError(String message, Location location)
	{
		super(location == null ? message : message + " at " + location);
		this.location = location;
	}

	/**
	 * @return the source location of the failure, or null if none was known
	 */
	public Location getLocation()
	{
		return location;
	}
}
