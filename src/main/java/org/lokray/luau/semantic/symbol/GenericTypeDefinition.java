package org.lokray.luau.semantic.symbol;

import org.lokray.luau.semantic.type.TypeId;

/**
 * A generic parameter of a type alias, with its default if one was written.
 */
public record GenericTypeDefinition(TypeId ty, TypeId defaultValue)
{
}
