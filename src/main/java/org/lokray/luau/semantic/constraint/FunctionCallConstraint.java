package org.lokray.luau.semantic.constraint;

import org.lokray.luau.ast.AstExpr;
import org.lokray.luau.semantic.type.TypeId;
import org.lokray.luau.semantic.type.TypePackId;
import java.util.List;
import java.util.Map;

/**
 * Calls {@code fn} with {@code argsPack}, producing {@code result}. {@code discriminantTypes}
 * has one entry per argument: the placeholder narrowed by the call, or null. The solver
 * records the overload it picks in {@code astOverloadResolvedTypes}.
 */
public record FunctionCallConstraint(TypeId fn, TypePackId argsPack, TypePackId result, AstExpr.Call callSite,
									 List<TypeId> discriminantTypes, Map<AstExpr, TypeId> astOverloadResolvedTypes)
		implements ConstraintPayload
{
	@Override
	public String toString()
	{
		return "FunctionCallConstraint[fn=" + fn + ", argsPack=" + argsPack + ", result=" + result + "]";
	}
}
