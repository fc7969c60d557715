package org.lokray.luau.semantic.constraint;

import org.lokray.luau.semantic.type.TypePackId;

/**
 * subPack <: superPack. {@code returns} marks the obligation of a return statement; those are
 * chained so the solver handles them in source order.
 */
public record PackSubtypeConstraint(TypePackId subPack, TypePackId superPack, boolean returns) implements ConstraintPayload
{
	public PackSubtypeConstraint(TypePackId subPack, TypePackId superPack)
	{
		this(subPack, superPack, false);
	}
}
