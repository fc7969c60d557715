package org.lokray.luau.semantic;

import org.lokray.luau.ast.Location;
import org.lokray.luau.dfg.Def;
import org.lokray.luau.dfg.RefinementKey;
import org.lokray.luau.semantic.error.NormalizationTooComplex;
import org.lokray.luau.semantic.refinement.Refinement;
import org.lokray.luau.semantic.refinement.RefinementContext;
import org.lokray.luau.semantic.refinement.RefinementPartition;
import org.lokray.luau.semantic.symbol.Scope;
import org.lokray.luau.semantic.type.BuiltinTypeFamily;
import org.lokray.luau.semantic.type.IntersectionType;
import org.lokray.luau.semantic.type.NegationType;
import org.lokray.luau.semantic.type.Property;
import org.lokray.luau.semantic.type.TableState;
import org.lokray.luau.semantic.type.TableType;
import org.lokray.luau.semantic.type.TypeFamilyInstanceType;
import org.lokray.luau.semantic.type.TypeId;
import org.lokray.luau.semantic.type.TypeUtils;
import org.lokray.luau.semantic.type.UnionType;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Turns refinement trees into per-definition narrowings and writes them into a scope.
 */
class RefinementEngine
{
	private final ConstraintGenerator gen;

	RefinementEngine(ConstraintGenerator gen)
	{
		this.gen = gen;
	}

	/**
	 * Narrows every definition {@code refinement} talks about, as seen from {@code scope}.
	 */
	void applyRefinements(Scope scope, Location location, Refinement refinement)
	{
		if (refinement == null)
		{
			return;
		}

		RefinementContext context = new RefinementContext();
		computeRefinement(scope, location, refinement, context, true, false);

		for (Map.Entry<Def, RefinementPartition> entry : context.entries())
		{
			Def def = entry.getKey();
			RefinementPartition partition = entry.getValue();
			Optional<TypeId> current = gen.definitions.lookup(scope, location, def);
			if (current.isEmpty())
			{
				continue;
			}

			TypeId ty = current.get();
			if (partition.shouldAppendNilType())
			{
				ty = gen.addType(new UnionType(List.of(ty, gen.builtinTypes.nilType)));
			}

			for (TypeId discriminant : partition.getDiscriminantTypes())
			{
				ty = narrow(scope, location, ty, discriminant);
			}
			scope.getRvalueRefinements().put(def, ty);
		}
	}

	private TypeId narrow(Scope scope, Location location, TypeId ty, TypeId discriminant)
	{
		if (TypeUtils.mustDeferIntersection(ty) || TypeUtils.mustDeferIntersection(discriminant))
		{
			return gen.createFamilyInstance(BuiltinTypeFamily.REFINE, List.of(ty, discriminant), scope, location);
		}

		switch (gen.suppressionPolicy.shouldSuppressErrors(ty))
		{
			case SUPPRESS ->
			{
				TypeId narrowed = gen.makeIntersect(scope, location, ty, discriminant);
				return gen.makeUnion(scope, location, narrowed, gen.builtinTypes.errorType);
			}
			case NORMALIZATION_FAILED ->
			{
				gen.reportError(location, new NormalizationTooComplex());
				return gen.makeIntersect(scope, location, ty, discriminant);
			}
			default ->
			{
				return gen.makeIntersect(scope, location, ty, discriminant);
			}
		}
	}

	/**
	 * Collects into {@code context} what must hold for each definition when
	 * {@code refinement} evaluates to {@code sense}. Under {@code eq} discriminants are
	 * wrapped as singletons, as required for {@code ==} comparisons.
	 */
	void computeRefinement(Scope scope, Location location, Refinement refinement, RefinementContext context, boolean sense, boolean eq)
	{
		if (refinement == null)
		{
			return;
		}

		if (refinement instanceof Refinement.Variadic variadic)
		{
			for (Refinement part : variadic.getRefinements())
			{
				computeRefinement(scope, location, part, context, sense, eq);
			}
		}
		else if (refinement instanceof Refinement.Negation negation)
		{
			computeRefinement(scope, location, negation.getRefinement(), context, !sense, eq);
		}
		else if (refinement instanceof Refinement.Conjunction conjunction)
		{
			if (sense)
			{
				computeRefinement(scope, location, conjunction.getLhs(), context, true, eq);
				computeRefinement(scope, location, conjunction.getRhs(), context, true, eq);
			}
			else
			{
				// not (a and b) == (not a) or (not b)
				RefinementContext lhs = new RefinementContext();
				RefinementContext rhs = new RefinementContext();
				computeRefinement(scope, location, conjunction.getLhs(), lhs, false, eq);
				computeRefinement(scope, location, conjunction.getRhs(), rhs, false, eq);
				unionRefinements(scope, location, lhs, rhs, context);
			}
		}
		else if (refinement instanceof Refinement.Disjunction disjunction)
		{
			if (sense)
			{
				RefinementContext lhs = new RefinementContext();
				RefinementContext rhs = new RefinementContext();
				computeRefinement(scope, location, disjunction.getLhs(), lhs, true, eq);
				computeRefinement(scope, location, disjunction.getRhs(), rhs, true, eq);
				unionRefinements(scope, location, lhs, rhs, context);
			}
			else
			{
				computeRefinement(scope, location, disjunction.getLhs(), context, false, eq);
				computeRefinement(scope, location, disjunction.getRhs(), context, false, eq);
			}
		}
		else if (refinement instanceof Refinement.Equivalence equivalence)
		{
			computeRefinement(scope, location, equivalence.getLhs(), context, sense, true);
			computeRefinement(scope, location, equivalence.getRhs(), context, sense, true);
		}
		else if (refinement instanceof Refinement.Proposition proposition)
		{
			computeProposition(scope, proposition, context, sense, eq);
		}
	}

	private void computeProposition(Scope scope, Refinement.Proposition proposition, RefinementContext context, boolean sense, boolean eq)
	{
		TypeId discriminant = proposition.getDiscriminantTy();
		if (!sense)
		{
			discriminant = gen.addType(new NegationType(discriminant));
		}
		if (eq)
		{
			discriminant = gen.addType(new TypeFamilyInstanceType(BuiltinTypeFamily.SINGLETON, List.of(discriminant), List.of()));
		}

		// a.b.c narrows c, then b to {c: ...}, then a to {b: {c: ...}}
		for (RefinementKey key = proposition.getKey(); key != null; key = key.getParent())
		{
			context.getOrCreate(key.getDef()).getDiscriminantTypes().add(discriminant);
			if (!key.hasPropName())
			{
				break;
			}
			TableType table = new TableType(TableState.SEALED, scope);
			table.getProps().put(key.getPropName(), Property.rw(discriminant));
			discriminant = gen.addType(table);
		}

		Def leaf = proposition.getKey().getDef();
		context.getOrCreate(leaf).setShouldAppendNilType((sense || !eq) && Def.containsSubscriptedDefinition(leaf));
	}

	/**
	 * Keeps only definitions narrowed on both sides; each gets the union of what the two sides
	 * say about it.
	 */
	private void unionRefinements(Scope scope, Location location, RefinementContext lhs, RefinementContext rhs, RefinementContext dest)
	{
		for (Map.Entry<Def, RefinementPartition> entry : lhs.entries())
		{
			Def def = entry.getKey();
			RefinementPartition right = rhs.get(def);
			if (right == null)
			{
				continue;
			}

			TypeId leftTy = intersectAll(scope, location, entry.getValue().getDiscriminantTypes());
			TypeId rightTy = intersectAll(scope, location, right.getDiscriminantTypes());

			RefinementPartition target = dest.getOrCreate(def);
			target.getDiscriminantTypes().add(gen.makeUnion(scope, location, leftTy, rightTy));
			target.setShouldAppendNilType(target.shouldAppendNilType()
					|| entry.getValue().shouldAppendNilType()
					|| right.shouldAppendNilType());
		}
	}

	private TypeId intersectAll(Scope scope, Location location, List<TypeId> discriminants)
	{
		if (discriminants.isEmpty())
		{
			return gen.builtinTypes.unknownType;
		}
		if (discriminants.size() == 1)
		{
			return discriminants.get(0);
		}
		if (discriminants.size() == 2)
		{
			return gen.makeIntersect(scope, location, discriminants.get(0), discriminants.get(1));
		}
		return gen.addType(new IntersectionType(List.copyOf(discriminants)));
	}
}
