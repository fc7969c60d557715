package org.lokray.luau.semantic.constraint;

import org.lokray.luau.semantic.type.TypeId;
import java.util.List;

/**
 * resultType is subjectType with the property at {@code path} set to propType.
 */
public record SetPropConstraint(TypeId resultType, TypeId subjectType, List<String> path, TypeId propType) implements ConstraintPayload
{
}
