package org.lokray.luau.semantic.constraint;

import org.lokray.luau.semantic.type.TypeId;

public record Unpack1Constraint(TypeId resultType, TypeId sourceType, boolean resultIsLValue) implements ConstraintPayload
{
}
