package org.lokray.luau.semantic.constraint;

import org.lokray.luau.semantic.type.TypeId;
import java.util.List;

/**
 * Quantifies {@code sourceType} into {@code generalizedType} once everything inside the
 * function or module is solved. {@code interiorTypes} are the table literals created inside.
 */
public record GeneralizationConstraint(TypeId generalizedType, TypeId sourceType, List<TypeId> interiorTypes) implements ConstraintPayload
{
}
