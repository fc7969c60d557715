package org.lokray.luau.semantic.type;

import java.util.List;

public class UnionType implements Type
{
	private final List<TypeId> options;

	public UnionType(List<TypeId> options)
	{
		this.options = options;
	}

	public List<TypeId> getOptions()
	{
		return options;
	}

	@Override
	public String getName()
	{
		return "union(" + options.size() + ")";
	}
}
