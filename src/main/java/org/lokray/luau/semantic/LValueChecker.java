package org.lokray.luau.semantic;

import org.lokray.luau.ast.AstExpr;
import org.lokray.luau.dfg.Def;
import org.lokray.luau.dfg.RefinementKey;
import org.lokray.luau.semantic.constraint.Constraint;
import org.lokray.luau.semantic.constraint.HasPropConstraint;
import org.lokray.luau.semantic.constraint.SetIndexerConstraint;
import org.lokray.luau.semantic.constraint.SetPropConstraint;
import org.lokray.luau.semantic.constraint.Unpack1Constraint;
import org.lokray.luau.semantic.constraint.ValueContext;
import org.lokray.luau.semantic.error.NormalizationTooComplex;
import org.lokray.luau.semantic.symbol.Binding;
import org.lokray.luau.semantic.symbol.Scope;
import org.lokray.luau.semantic.symbol.Symbol;
import org.lokray.luau.semantic.type.BlockedType;
import org.lokray.luau.semantic.type.LocalType;
import org.lokray.luau.semantic.type.TypeId;
import org.lokray.luau.semantic.type.UnionType;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Checks the targets of assignments. Each target yields the type the assigned value must be a
 * subtype of (its annotation) and the placeholder that receives the value.
 */
class LValueChecker
{
	private final ConstraintGenerator gen;

	LValueChecker(ConstraintGenerator gen)
	{
		this.gen = gen;
	}

	LValueBounds checkLValue(Scope scope, AstExpr expr)
	{
		if (expr instanceof AstExpr.Local local)
		{
			return checkLocal(scope, local);
		}
		if (expr instanceof AstExpr.Global global)
		{
			return checkGlobal(scope, global);
		}
		if (expr instanceof AstExpr.IndexName || expr instanceof AstExpr.IndexExpr)
		{
			return updateProperty(scope, expr);
		}
		if (expr instanceof AstExpr.Error error)
		{
			gen.expressions.check(scope, error);
			return new LValueBounds(gen.builtinTypes.errorRecoveryType(), gen.builtinTypes.errorRecoveryType());
		}
		throw gen.ice.ice("checkLValue is inexhaustive", expr.location);
	}

	private LValueBounds checkLocal(Scope scope, AstExpr.Local local)
	{
		Optional<TypeId> annotatedTy = scope.lookup(Symbol.local(local.local));
		Def def = gen.dfg.getDef(local);
		Optional<TypeId> existing = scope.lookupUnrefinedType(def);

		TypeId ty;
		if (existing.isPresent())
		{
			ty = existing.get();
			// One more assignment the local has to wait for.
			LocalType localType = ty.get(LocalType.class);
			if (localType != null)
			{
				localType.incrementBlockCount();
			}
			UnionType union = ty.get(UnionType.class);
			if (union != null)
			{
				for (TypeId option : union.getOptions())
				{
					LocalType optionLocal = option.get(LocalType.class);
					if (optionLocal != null)
					{
						optionLocal.incrementBlockCount();
					}
				}
			}
		}
		else
		{
			ty = gen.addType(new LocalType(gen.builtinTypes.neverType, 1, local.local.name));
			if (annotatedTy.isPresent())
			{
				switch (gen.suppressionPolicy.shouldSuppressErrors(annotatedTy.get()))
				{
					case SUPPRESS -> ty = gen.addType(new UnionType(List.of(ty, gen.builtinTypes.errorType)));
					case NORMALIZATION_FAILED -> gen.reportError(local.local.annotation != null ? local.local.annotation.location : local.location,
							new NormalizationTooComplex());
					default ->
					{
					}
				}
			}
			scope.getLvalueTypes().put(def, ty);
		}

		TypeId assignedTy = gen.blockedType();
		Constraint unpack = gen.addConstraint(scope, local.location, new Unpack1Constraint(ty, assignedTy, true));
		BlockedType blocked = ty.get(BlockedType.class);
		if (blocked != null)
		{
			if (blocked.hasOwner())
			{
				unpack.addDependency(blocked.getOwner());
			}
			else
			{
				blocked.setOwner(unpack);
			}
		}

		gen.recordInferredBinding(local.local, ty);
		return new LValueBounds(annotatedTy.orElse(null), assignedTy);
	}

	private LValueBounds checkGlobal(Scope scope, AstExpr.Global global)
	{
		Optional<TypeId> annotatedTy = scope.lookup(Symbol.global(global.name));
		if (annotatedTy.isEmpty())
		{
			return new LValueBounds(null, null);
		}

		Def def = gen.dfg.getDef(global);
		TypeId assignedTy = gen.blockedType();
		gen.rootScope.getLvalueTypes().put(def, assignedTy);
		return new LValueBounds(annotatedTy.get(), assignedTy);
	}

	/**
	 * Emits the constraints for a write through {@code a.b.c} or {@code a[k]}. For a path of
	 * names the root gets a new placeholder that a {@link SetPropConstraint} produces from the
	 * old root, so later reads of the root see the written property.
	 */
	private LValueBounds updateProperty(Scope scope, AstExpr expr)
	{
		if (expr instanceof AstExpr.IndexExpr indexExpr && !(indexExpr.index instanceof AstExpr.ConstantString))
		{
			TypeId subjectType = gen.expressions.check(scope, indexExpr.expr).ty();
			TypeId indexType = gen.expressions.check(scope, indexExpr.index).ty();
			TypeId assignedTy = gen.blockedType();
			Constraint c = gen.addConstraint(scope, expr.location, new SetIndexerConstraint(subjectType, indexType, assignedTy));
			assignedTy.get(BlockedType.class).setOwner(c);
			gen.module.getAstTypes().put(expr, assignedTy);
			return new LValueBounds(assignedTy, assignedTy);
		}

		List<String> segments = new ArrayList<>();
		List<AstExpr> exprs = new ArrayList<>();

		AstExpr current = expr;
		Symbol symbol;
		Def def;
		while (true)
		{
			if (current instanceof AstExpr.Global global)
			{
				symbol = Symbol.global(global.name);
				def = gen.dfg.getDef(global);
				break;
			}
			else if (current instanceof AstExpr.Local local)
			{
				symbol = Symbol.local(local.local);
				def = gen.dfg.getDef(local);
				break;
			}
			else if (current instanceof AstExpr.IndexName indexName)
			{
				segments.add(indexName.index);
				exprs.add(indexName);
				current = indexName.expr;
			}
			else if (current instanceof AstExpr.IndexExpr indexExpr && indexExpr.index instanceof AstExpr.ConstantString constant)
			{
				gen.expressions.check(scope, indexExpr.index);
				segments.add(constant.value);
				exprs.add(indexExpr);
				current = indexExpr.expr;
			}
			else
			{
				return new LValueBounds(gen.expressions.check(scope, expr).ty(), null);
			}
		}

		Collections.reverse(segments);
		Collections.reverse(exprs);

		Optional<Scope.DefLookup> lookup = scope.lookupEx(def);
		if (lookup.isEmpty())
		{
			return new LValueBounds(gen.expressions.check(scope, expr).ty(), null);
		}

		TypeId subjectType = lookup.get().type();
		Scope subjectScope = lookup.get().scope();
		AstExpr rootExpr = current;

		TypeId updatedType = gen.blockedType();
		TypeId assignedTy = gen.blockedType();
		Constraint setC = gen.addConstraint(scope, expr.location, new SetPropConstraint(updatedType, subjectType, List.copyOf(segments), assignedTy));
		updatedType.get(BlockedType.class).setOwner(setC);

		TypeId prevSegmentTy = updatedType;
		for (int i = 0; i < segments.size(); i++)
		{
			TypeId segmentTy = gen.blockedType();
			gen.module.getAstTypes().put(exprs.get(i), segmentTy);
			ValueContext context = i == segments.size() - 1 ? ValueContext.LVALUE : ValueContext.RVALUE;
			Constraint hasC = gen.addConstraint(scope, expr.location, new HasPropConstraint(segmentTy, prevSegmentTy, segments.get(i),
					context, gen.typeContext == TypeContext.CONDITION));
			segmentTy.get(BlockedType.class).setOwner(hasC);
			setC.addDependency(hasC);
			prevSegmentTy = segmentTy;
		}

		gen.module.getAstTypes().put(expr, prevSegmentTy);
		gen.module.getAstTypes().put(rootExpr, updatedType);

		// Builtin terms are never rebound.
		if (!subjectType.isPersistent())
		{
			Binding binding = subjectScope.getBindings().get(symbol);
			if (binding != null)
			{
				binding.setTypeId(updatedType);
			}
			else
			{
				subjectScope.getBindings().put(symbol, new Binding(updatedType, rootExpr.location));
			}

			RefinementKey key = gen.dfg.getRefinementKey(rootExpr);
			if (key != null)
			{
				subjectScope.getLvalueTypes().put(key.getDef(), updatedType);
				subjectScope.getRvalueRefinements().put(key.getDef(), updatedType);
			}
		}

		return new LValueBounds(assignedTy, assignedTy);
	}
}
