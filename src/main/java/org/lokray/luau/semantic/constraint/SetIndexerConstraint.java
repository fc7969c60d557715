package org.lokray.luau.semantic.constraint;

import org.lokray.luau.semantic.type.TypeId;

public record SetIndexerConstraint(TypeId subjectType, TypeId indexType, TypeId propType) implements ConstraintPayload
{
}
