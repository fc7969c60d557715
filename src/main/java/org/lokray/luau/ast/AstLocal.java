package org.lokray.luau.ast;

/**
 * A local variable declaration site: a {@code local} name, a parameter, a loop variable.
 */
public class AstLocal
{
	public final String name;
	public final Location location;
	public final AstType annotation;

	public AstLocal(String name, Location location, AstType annotation)
	{
		this.name = name;
		this.location = location;
		this.annotation = annotation;
	}

	@Override
	public String toString()
	{
		return name;
	}
}
