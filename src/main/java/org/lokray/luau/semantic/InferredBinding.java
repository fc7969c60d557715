package org.lokray.luau.semantic;

import org.lokray.luau.ast.Location;
import org.lokray.luau.semantic.symbol.Scope;
import org.lokray.luau.semantic.type.TypeId;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Every type an unannotated local was seen with. Once generation ends the local's binding is
 * replaced by their union.
 */
class InferredBinding
{
	private final Scope scope;
	private final Location location;
	// TypeId has identity equality
	private final Set<TypeId> types = new LinkedHashSet<>();

	InferredBinding(Scope scope, Location location, TypeId initial)
	{
		this.scope = scope;
		this.location = location;
		types.add(initial);
	}

	void add(TypeId ty)
	{
		types.add(ty);
	}

	Scope getScope()
	{
		return scope;
	}

	Location getLocation()
	{
		return location;
	}

	Set<TypeId> getTypes()
	{
		return Collections.unmodifiableSet(types);
	}
}
