package org.lokray.luau.ast;

public class AstArgumentName
{
	public final String name;
	public final Location location;

	public AstArgumentName(String name, Location location)
	{
		this.name = name;
		this.location = location;
	}
}
