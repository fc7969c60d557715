package org.lokray.luau.semantic.error;

import org.lokray.luau.ast.Location;

public class TypeError
{
	private final Location location;
	private final String moduleName;
	private final TypeErrorData data;

	public TypeError(Location location, String moduleName, TypeErrorData data)
	{
		this.location = location;
		this.moduleName = moduleName;
		this.data = data;
	}

	public Location getLocation()
	{
		return location;
	}

	public String getModuleName()
	{
		return moduleName;
	}

	public TypeErrorData getData()
	{
		return data;
	}

	@Override
	public String toString()
	{
		return String.format("[Type Error] %s - line %d:%d - %s", moduleName,
				location.getBegin().getLine() + 1, location.getBegin().getColumn() + 1, data.getMessage());
	}
}
