package org.lokray.luau.semantic.type;

public class NeverType implements Type
{
	public static final NeverType INSTANCE = new NeverType();

	private NeverType()
	{
	}

	@Override
	public String getName()
	{
		return "never";
	}
}
