package org.lokray.luau.semantic.constraint;

import org.lokray.luau.semantic.type.TypeId;

public record TypeAliasExpansionConstraint(TypeId target) implements ConstraintPayload
{
}
