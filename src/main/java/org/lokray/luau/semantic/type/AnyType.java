package org.lokray.luau.semantic.type;

public class AnyType implements Type
{
	public static final AnyType INSTANCE = new AnyType();

	private AnyType()
	{
	}

	@Override
	public String getName()
	{
		return "any";
	}
}
