package org.lokray.luau.semantic.type;

import org.lokray.luau.util.InternalCompilerError;

import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.Set;

/**
 * Stable handle to a type pack term; the pack counterpart of {@link TypeId}.
 */
public final class TypePackId
{
	private final int index;
	private final boolean persistent;
	private TypePackVar pack;

	TypePackId(int index, TypePackVar pack, boolean persistent)
	{
		this.index = index;
		this.pack = pack;
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

	public TypePackVar get()
	{
		return pack;
	}

	public <T extends TypePackVar> T get(Class<T> kind)
	{
		return kind.isInstance(pack) ? kind.cast(pack) : null;
	}

	public boolean is(Class<? extends TypePackVar> kind)
	{
		return kind.isInstance(pack);
	}

	public void emplace(TypePackVar replacement)
	{
		if (persistent)
		{
			throw new InternalCompilerError("Cannot mutate persistent type pack " + this);
		}
		this.pack = replacement;
	}

	public TypePackId follow()
	{
		TypePackId current = this;
		Set<TypePackId> seen = null;
		while (current.pack instanceof BoundTypePack bound)
		{
			if (seen == null)
			{
				seen = Collections.newSetFromMap(new IdentityHashMap<>());
			}
			if (!seen.add(current))
			{
				throw new InternalCompilerError("Bound type pack cycle at " + current);
			}
			current = bound.getBoundTo();
		}
		return current;
	}

	@Override
	public String toString()
	{
		return "tp" + index + (persistent ? "*" : "") + ":" + pack.getName();
	}
}
