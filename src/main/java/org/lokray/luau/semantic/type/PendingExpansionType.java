package org.lokray.luau.semantic.type;

import java.util.List;

/**
 * A generic alias reference such as {@code Map<K, V>} awaiting expansion by the solver.
 */
public class PendingExpansionType implements Type
{
	private final String prefix;
	private final String name;
	private final List<TypeId> typeArguments;
	private final List<TypePackId> packArguments;

	public PendingExpansionType(String prefix, String name, List<TypeId> typeArguments, List<TypePackId> packArguments)
	{
		this.prefix = prefix;
		this.name = name;
		this.typeArguments = typeArguments;
		this.packArguments = packArguments;
	}

	public String getPrefix()
	{
		return prefix;
	}

	public List<TypeId> getTypeArguments()
	{
		return typeArguments;
	}

	public List<TypePackId> getPackArguments()
	{
		return packArguments;
	}

	@Override
	public String getName()
	{
		return prefix == null ? name : prefix + "." + name;
	}
}
