package org.lokray.luau.semantic.symbol;

import org.lokray.luau.ast.AstLocal;

import java.util.Objects;

/**
 * A name that can be bound in a scope: either a local declaration site, compared by identity,
 * or a global name, compared by text.
 */
public final class Symbol
{
	private final AstLocal local;
	private final String global;

	private Symbol(AstLocal local, String global)
	{
		this.local = local;
		this.global = global;
	}

	public static Symbol local(AstLocal local)
	{
		return new Symbol(Objects.requireNonNull(local), null);
	}

	public static Symbol global(String name)
	{
		return new Symbol(null, Objects.requireNonNull(name));
	}

	public boolean isLocal()
	{
		return local != null;
	}

	public AstLocal getLocal()
	{
		return local;
	}

	public String getName()
	{
		return local != null ? local.name : global;
	}

	@Override
	public boolean equals(Object obj)
	{
		if (this == obj)
		{
			return true;
		}
		if (!(obj instanceof Symbol other))
		{
			return false;
		}
		return local == other.local && Objects.equals(global, other.global);
	}

	@Override
	public int hashCode()
	{
		return local != null ? System.identityHashCode(local) : global.hashCode();
	}

	@Override
	public String toString()
	{
		return getName();
	}
}
