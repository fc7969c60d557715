package org.lokray.luau.semantic.constraint;

import org.lokray.luau.semantic.type.TypePackId;

/**
 * Spreads sourcePack over resultPack, element by element.
 */
public record UnpackConstraint(TypePackId resultPack, TypePackId sourcePack, boolean resultIsLValue) implements ConstraintPayload
{
}
