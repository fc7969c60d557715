package org.lokray.luau.semantic.error;

public class OccursCheckFailed extends TypeErrorData
{
	@Override
	protected String getErrMsg()
	{
		return "Type contains a self-recursive construct that cannot be resolved";
	}
}
