package org.lokray.luau.ast;

/**
 * A generic type parameter {@code T} or {@code T = default}.
 */
public class AstGenericType
{
	public final String name;
	public final Location location;
	public final AstType defaultValue;

	public AstGenericType(String name, Location location, AstType defaultValue)
	{
		this.name = name;
		this.location = location;
		this.defaultValue = defaultValue;
	}

	public AstGenericType(String name, Location location)
	{
		this(name, location, null);
	}
}
