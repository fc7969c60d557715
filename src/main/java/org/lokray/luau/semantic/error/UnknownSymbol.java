package org.lokray.luau.semantic.error;

public class UnknownSymbol extends TypeErrorData
{
	public enum Context
	{
		BINDING,
		TYPE
	}

	private final String name;
	private final Context context;

	public UnknownSymbol(String name, Context context)
	{
		this.name = name;
		this.context = context;
	}

	public String getName()
	{
		return name;
	}

	public Context getContext()
	{
		return context;
	}

	@Override
	protected String getErrMsg()
	{
		if (context == Context.TYPE)
		{
			return "Unknown type '" + name + "'";
		}
		return "Unknown global '" + name + "'";
	}
}
