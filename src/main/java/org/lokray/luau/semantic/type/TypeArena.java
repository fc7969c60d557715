package org.lokray.luau.semantic.type;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Append-only storage for the type and pack terms of one generation pass. Terms are never
 * removed, so handle indices stay valid for the lifetime of the arena.
 */
public class TypeArena
{
	private final List<TypeId> types = new ArrayList<>();
	private final List<TypePackId> typePacks = new ArrayList<>();
	private final boolean persistent;

	public TypeArena()
	{
		this(false);
	}

	TypeArena(boolean persistent)
	{
		this.persistent = persistent;
	}

	public TypeId addType(Type type)
	{
		TypeId id = new TypeId(types.size(), type, persistent);
		types.add(id);
		return id;
	}

	public TypePackId addTypePack(TypePackVar pack)
	{
		TypePackId id = new TypePackId(typePacks.size(), pack, persistent);
		typePacks.add(id);
		return id;
	}

	public TypePackId addTypePack(List<TypeId> head)
	{
		return addTypePack(new TypePack(head, null));
	}

	public TypePackId addTypePack(List<TypeId> head, TypePackId tail)
	{
		return addTypePack(new TypePack(head, tail));
	}

	public List<TypeId> getTypes()
	{
		return Collections.unmodifiableList(types);
	}

	public List<TypePackId> getTypePacks()
	{
		return Collections.unmodifiableList(typePacks);
	}
}
