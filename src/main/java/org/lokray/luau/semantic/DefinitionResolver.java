package org.lokray.luau.semantic;

import org.lokray.luau.ast.Location;
import org.lokray.luau.dfg.Def;
import org.lokray.luau.semantic.symbol.Scope;
import org.lokray.luau.semantic.type.TypeId;

import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.Optional;
import java.util.Set;

/**
 * Finds the type a definition currently has. A phi node that no scope knows yet becomes the
 * union of its operands; operands with no type get a placeholder in the root scope so a later
 * assignment can fill it in.
 */
class DefinitionResolver
{
	private final ConstraintGenerator gen;

	DefinitionResolver(ConstraintGenerator gen)
	{
		this.gen = gen;
	}

	Optional<TypeId> lookup(Scope scope, Location location, Def def)
	{
		return lookup(scope, location, def, true, Collections.newSetFromMap(new IdentityHashMap<>()));
	}

	Optional<TypeId> lookup(Scope scope, Location location, Def def, boolean prototype)
	{
		return lookup(scope, location, def, prototype, Collections.newSetFromMap(new IdentityHashMap<>()));
	}

	private Optional<TypeId> lookup(Scope scope, Location location, Def def, boolean prototype, Set<Def> visiting)
	{
		if (def instanceof Def.Cell)
		{
			return scope.lookup(def);
		}
		if (!(def instanceof Def.Phi phi))
		{
			throw gen.ice.ice("Unexpected definition kind " + def, location);
		}

		Optional<TypeId> found = scope.lookup(def);
		if (found.isPresent())
		{
			return found;
		}
		if (!visiting.add(def))
		{
			return Optional.empty();
		}

		try
		{
			if (!prototype)
			{
				if (phi.getOperands().size() == 1)
				{
					return lookup(scope, location, phi.getOperands().get(0), false, visiting);
				}
				return Optional.empty();
			}

			TypeId result = gen.builtinTypes.neverType;
			for (Def operand : phi.getOperands())
			{
				TypeId operandTy = lookup(scope, location, operand, false, visiting).orElse(null);
				if (operandTy == null)
				{
					operandTy = gen.blockedType();
					gen.rootScope.getLvalueTypes().put(operand, operandTy);
				}
				result = gen.makeUnion(scope, location, result, operandTy);
			}
			scope.getLvalueTypes().put(def, result);
			return Optional.of(result);
		}
		finally
		{
			visiting.remove(def);
		}
	}
}
