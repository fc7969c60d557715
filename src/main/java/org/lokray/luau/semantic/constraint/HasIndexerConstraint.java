package org.lokray.luau.semantic.constraint;

import org.lokray.luau.semantic.type.TypeId;

/**
 * resultType ~ subjectType[indexType]
 */
public record HasIndexerConstraint(TypeId resultType, TypeId subjectType, TypeId indexType) implements ConstraintPayload
{
}
