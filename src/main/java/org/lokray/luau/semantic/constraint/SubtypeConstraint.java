package org.lokray.luau.semantic.constraint;

import org.lokray.luau.semantic.type.TypeId;

/**
 * subType <: superType
 */
public record SubtypeConstraint(TypeId subType, TypeId superType) implements ConstraintPayload
{
}
