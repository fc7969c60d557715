package org.lokray.luau.semantic.constraint;

import org.lokray.luau.semantic.type.TypeId;

/**
 * Decides whether a literal keeps its singleton type: {@code freeType} is bound to the
 * singleton if {@code expectedType} asks for one, otherwise to {@code primitiveType}.
 */
public record PrimitiveTypeConstraint(TypeId freeType, TypeId expectedType, TypeId primitiveType) implements ConstraintPayload
{
}
