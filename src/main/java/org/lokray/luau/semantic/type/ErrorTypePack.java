package org.lokray.luau.semantic.type;

public class ErrorTypePack implements TypePackVar
{
	public static final ErrorTypePack INSTANCE = new ErrorTypePack();

	private ErrorTypePack()
	{
	}

	@Override
	public String getName()
	{
		return "*error-pack*";
	}
}
