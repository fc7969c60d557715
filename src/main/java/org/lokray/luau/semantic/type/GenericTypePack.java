package org.lokray.luau.semantic.type;

import org.lokray.luau.semantic.symbol.Scope;

public class GenericTypePack implements TypePackVar
{
	private final Scope scope;
	private final String name;

	public GenericTypePack(Scope scope, String name)
	{
		this.scope = scope;
		this.name = name;
	}

	public Scope getScope()
	{
		return scope;
	}

	@Override
	public String getName()
	{
		return name + "...";
	}
}
