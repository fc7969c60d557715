package org.lokray.luau.dfg;

/**
 * Property path handle for a read such as {@code a.b.c}: the key for {@code c} has
 * {@code propName = "c"} and a parent key for {@code a.b}. The root key has no property name.
 */
public final class RefinementKey
{
	private final RefinementKey parent;
	private final Def def;
	private final String propName;

	public RefinementKey(RefinementKey parent, Def def, String propName)
	{
		this.parent = parent;
		this.def = def;
		this.propName = propName;
	}

	public RefinementKey getParent()
	{
		return parent;
	}

	public Def getDef()
	{
		return def;
	}

	public String getPropName()
	{
		return propName;
	}

	public boolean hasPropName()
	{
		return propName != null;
	}
}
