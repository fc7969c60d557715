package org.lokray.luau.ast;

/**
 * Base of every syntax tree node. Nodes are compared by identity, so they can key the
 * per-node annotation maps of a module.
 */
public abstract class AstNode
{
	public final Location location;

	protected AstNode(Location location)
	{
		this.location = location;
	}

	public Location getLocation()
	{
		return location;
	}
}
