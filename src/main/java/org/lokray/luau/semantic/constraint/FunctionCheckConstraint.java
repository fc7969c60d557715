package org.lokray.luau.semantic.constraint;

import org.lokray.luau.ast.AstExpr;
import org.lokray.luau.semantic.type.TypeId;
import org.lokray.luau.semantic.type.TypePackId;

/**
 * Checks the arguments of a call against {@code fn} and pushes expected types into them
 * before the call itself is solved.
 */
public record FunctionCheckConstraint(TypeId fn, TypePackId argsPack, AstExpr.Call callSite) implements ConstraintPayload
{
}
