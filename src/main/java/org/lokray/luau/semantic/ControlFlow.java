package org.lokray.luau.semantic;

/**
 * How a statement or block exits.
 */
public enum ControlFlow
{
	NONE,
	RETURNS,
	THROWS,
	BREAKS,
	CONTINUES;

	public boolean isExit()
	{
		return this == RETURNS || this == THROWS;
	}
}
