package org.lokray.luau.semantic.symbol;

import org.lokray.luau.ast.Location;
import org.lokray.luau.semantic.type.TypeId;

public class Binding
{
	private TypeId typeId;
	private final Location location;

	public Binding(TypeId typeId, Location location)
	{
		this.typeId = typeId;
		this.location = location;
	}

	public TypeId getTypeId()
	{
		return typeId;
	}

	public void setTypeId(TypeId typeId)
	{
		this.typeId = typeId;
	}

	public Location getLocation()
	{
		return location;
	}
}
