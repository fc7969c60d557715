package org.lokray.luau.semantic.constraint;

import org.lokray.luau.semantic.type.TypeId;
import org.lokray.luau.semantic.type.TypePackId;
import java.util.List;

/**
 * Gives {@code namedType} a display name. Synthetic names come from {@code local x = {}} at
 * module level rather than from a type alias.
 */
public record NameConstraint(TypeId namedType, String name, boolean synthetic, List<TypeId> typeParameters,
							 List<TypePackId> typePackParameters) implements ConstraintPayload
{
}
