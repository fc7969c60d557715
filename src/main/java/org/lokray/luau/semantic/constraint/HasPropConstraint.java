package org.lokray.luau.semantic.constraint;

import org.lokray.luau.semantic.type.TypeId;

/**
 * resultType ~ subjectType[prop]
 */
public record HasPropConstraint(TypeId resultType, TypeId subjectType, String prop, ValueContext context,
								boolean inConditional) implements ConstraintPayload
{
}
