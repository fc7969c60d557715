package org.lokray.luau.semantic.type;

import java.util.List;

public class IntersectionType implements Type
{
	private final List<TypeId> parts;

	public IntersectionType(List<TypeId> parts)
	{
		this.parts = parts;
	}

	public List<TypeId> getParts()
	{
		return parts;
	}

	@Override
	public String getName()
	{
		return "intersection(" + parts.size() + ")";
	}
}
