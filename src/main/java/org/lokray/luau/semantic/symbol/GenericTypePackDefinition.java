package org.lokray.luau.semantic.symbol;

import org.lokray.luau.semantic.type.TypePackId;

public record GenericTypePackDefinition(TypePackId tp, TypePackId defaultValue)
{
}
