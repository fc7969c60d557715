package org.lokray.luau.semantic.error;

public class NormalizationTooComplex extends TypeErrorData
{
	@Override
	protected String getErrMsg()
	{
		return "Code is too complex to typecheck! Consider simplifying the code around this area";
	}
}
