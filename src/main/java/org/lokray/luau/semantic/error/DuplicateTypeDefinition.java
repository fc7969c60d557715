package org.lokray.luau.semantic.error;

import org.lokray.luau.ast.Location;

public class DuplicateTypeDefinition extends TypeErrorData
{
	private final String name;
	private final Location previousLocation;

	public DuplicateTypeDefinition(String name, Location previousLocation)
	{
		this.name = name;
		this.previousLocation = previousLocation;
	}

	public String getName()
	{
		return name;
	}

	public Location getPreviousLocation()
	{
		return previousLocation;
	}

	@Override
	protected String getErrMsg()
	{
		return "Redefinition of type '" + name + "', previously defined at line " + (previousLocation.getBegin().getLine() + 1);
	}
}
