package org.lokray.luau.semantic.type;

public class MetatableType implements Type
{
	private final TypeId table;
	private final TypeId metatable;

	public MetatableType(TypeId table, TypeId metatable)
	{
		this.table = table;
		this.metatable = metatable;
	}

	public TypeId getTable()
	{
		return table;
	}

	public TypeId getMetatable()
	{
		return metatable;
	}

	@Override
	public String getName()
	{
		return "metatable";
	}
}
