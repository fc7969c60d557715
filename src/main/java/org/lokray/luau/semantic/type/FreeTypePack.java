package org.lokray.luau.semantic.type;

import org.lokray.luau.semantic.symbol.Scope;

public class FreeTypePack implements TypePackVar
{
	private final Scope scope;

	public FreeTypePack(Scope scope)
	{
		this.scope = scope;
	}

	public Scope getScope()
	{
		return scope;
	}

	@Override
	public String getName()
	{
		return "free...";
	}
}
