package org.lokray.luau.ast;

/**
 * A generic pack parameter {@code T...} or {@code T... = default}.
 */
public class AstGenericTypePack
{
	public final String name;
	public final Location location;
	public final AstTypePack defaultValue;

	public AstGenericTypePack(String name, Location location, AstTypePack defaultValue)
	{
		this.name = name;
		this.location = location;
		this.defaultValue = defaultValue;
	}

	public AstGenericTypePack(String name, Location location)
	{
		this(name, location, null);
	}
}
