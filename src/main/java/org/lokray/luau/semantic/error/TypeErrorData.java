package org.lokray.luau.semantic.error;

/**
 * Payload of a recoverable diagnostic produced during constraint generation.
 */
public abstract class TypeErrorData
{
	protected abstract String getErrMsg();

	/**
	 * Short, stable name of the diagnostic kind, used by the JSON generation log.
	 */
	public String getKind()
	{
		return getClass().getSimpleName();
	}

	public final String getMessage()
	{
		return getErrMsg();
	}

	@Override
	public String toString()
	{
		return getKind() + ": " + getErrMsg();
	}
}
