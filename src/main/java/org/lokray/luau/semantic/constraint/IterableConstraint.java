package org.lokray.luau.semantic.constraint;

import org.lokray.luau.ast.AstExpr;
import org.lokray.luau.semantic.type.TypeId;
import org.lokray.luau.semantic.type.TypePackId;
import java.util.List;
import java.util.Map;

/**
 * The values of a generic {@code for} loop: {@code iterator} produces the loop variables.
 * The solver records the type of the {@code next} function under {@code nextAstFragment}
 * in {@code astForInNextTypes}.
 */
public record IterableConstraint(TypePackId iterator, List<TypeId> variables, AstExpr nextAstFragment,
								 Map<AstExpr, TypeId> astForInNextTypes) implements ConstraintPayload
{
	@Override
	public String toString()
	{
		return "IterableConstraint[iterator=" + iterator + ", variables=" + variables + "]";
	}
}
