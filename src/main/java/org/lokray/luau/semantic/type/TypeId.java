package org.lokray.luau.semantic.type;

import org.lokray.luau.util.InternalCompilerError;

import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.Set;

/**
 * Stable handle to a type term allocated in a {@link TypeArena}. The term behind a handle can
 * be replaced in place (a Blocked placeholder becomes Bound once its owner resolves it);
 * handles themselves are compared by identity.
 */
public final class TypeId
{
	private final int index;
	private final boolean persistent;
	private Type type;

	TypeId(int index, Type type, boolean persistent)
	{
		this.index = index;
		this.type = type;
		this.persistent = persistent;
	}

	public int getIndex()
	{
		return index;
	}

	public boolean isPersistent()
	{
		return persistent;
	}

	public Type get()
	{
		return type;
	}

	/**
	 * The term as {@code kind} without following bound links, or null if it is another kind.
	 */
	public <T extends Type> T get(Class<T> kind)
	{
		return kind.isInstance(type) ? kind.cast(type) : null;
	}

	public boolean is(Class<? extends Type> kind)
	{
		return kind.isInstance(type);
	}

	/**
	 * Replaces the term behind this handle. Builtin handles are shared by every module and
	 * never change.
	 */
	public void emplace(Type replacement)
	{
		if (persistent)
		{
			throw new InternalCompilerError("Cannot mutate persistent type " + this);
		}
		this.type = replacement;
	}

	/**
	 * Follows {@link BoundType} links to the representative handle.
	 */
	public TypeId follow()
	{
		TypeId current = this;
		Set<TypeId> seen = null;
		while (current.type instanceof BoundType bound)
		{
			if (seen == null)
			{
				seen = Collections.newSetFromMap(new IdentityHashMap<>());
			}
			if (!seen.add(current))
			{
				throw new InternalCompilerError("Bound type cycle at " + current);
			}
			current = bound.getBoundTo();
		}
		return current;
	}

	@Override
	public String toString()
	{
		return "t" + index + (persistent ? "*" : "") + ":" + type.getName();
	}
}
