package org.lokray.luau.semantic.type;

public class UnknownType implements Type
{
	public static final UnknownType INSTANCE = new UnknownType();

	private UnknownType()
	{
	}

	@Override
	public String getName()
	{
		return "unknown";
	}
}
