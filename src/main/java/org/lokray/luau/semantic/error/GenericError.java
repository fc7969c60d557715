package org.lokray.luau.semantic.error;

public class GenericError extends TypeErrorData
{
	private final String message;

	public GenericError(String message)
	{
		this.message = message;
	}

	@Override
	protected String getErrMsg()
	{
		return message;
	}
}
