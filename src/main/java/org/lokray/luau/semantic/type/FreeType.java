package org.lokray.luau.semantic.type;

import org.lokray.luau.semantic.symbol.Scope;

/**
 * A type the solver has yet to infer, bounded below and above. The owning scope decides
 * where the type may be generalized.
 */
public class FreeType implements Type
{
	private final Scope scope;
	private final TypeId lowerBound;
	private final TypeId upperBound;

	public FreeType(Scope scope, TypeId lowerBound, TypeId upperBound)
	{
		this.scope = scope;
		this.lowerBound = lowerBound;
		this.upperBound = upperBound;
	}

	public Scope getScope()
	{
		return scope;
	}

	public TypeId getLowerBound()
	{
		return lowerBound;
	}

	public TypeId getUpperBound()
	{
		return upperBound;
	}

	@Override
	public String getName()
	{
		return "free";
	}
}
