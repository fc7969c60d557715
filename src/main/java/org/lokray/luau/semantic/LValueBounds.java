package org.lokray.luau.semantic;

import org.lokray.luau.semantic.type.TypeId;

/**
 * What an assignment target accepts: {@code annotatedTy} is the declared upper bound and
 * {@code assignedTy} the placeholder the write installs. Either may be null.
 */
public record LValueBounds(TypeId annotatedTy, TypeId assignedTy)
{
}
