package org.lokray.luau.semantic.type;

public class ErrorType implements Type
{
	public static final ErrorType INSTANCE = new ErrorType();

	private ErrorType()
	{
	}

	@Override
	public String getName()
	{
		return "*error-type*";
	}
}
