package org.lokray.luau.semantic.constraint;

import org.lokray.luau.semantic.type.TypeId;

/**
 * Asks the solver to reduce the type family instances reachable from {@code ty}.
 */
public record ReduceConstraint(TypeId ty) implements ConstraintPayload
{
}
