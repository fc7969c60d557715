package org.lokray.luau.semantic.type;

import org.lokray.luau.ast.Location;

public class FunctionArgument
{
	private final String name;
	private final Location location;

	public FunctionArgument(String name, Location location)
	{
		this.name = name;
		this.location = location;
	}

	public String getName()
	{
		return name;
	}

	public Location getLocation()
	{
		return location;
	}
}
