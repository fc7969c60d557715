package org.lokray.luau.semantic;

import org.lokray.luau.semantic.symbol.Scope;
import org.lokray.luau.semantic.type.TypeId;

/**
 * A checked function header. Generics and parameters live in {@code signatureScope}; the body's
 * locals live in {@code bodyScope}, a child of it.
 */
public record FunctionSignature(TypeId signature, Scope signatureScope, Scope bodyScope)
{
}
