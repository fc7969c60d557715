package org.lokray.luau.semantic.constraint;

/**
 * The obligation carried by a {@link Constraint}. Implementations are immutable.
 */
public interface ConstraintPayload
{
	default String getKind()
	{
		return getClass().getSimpleName();
	}
}
