package org.lokray.luau.semantic.constraint;

import org.lokray.luau.ast.Location;
import org.lokray.luau.semantic.symbol.Scope;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * One deferred typing obligation. The solver handles a constraint only after every constraint
 * in its dependency list.
 */
public class Constraint
{
	private final Scope scope;
	private final Location location;
	private final ConstraintPayload payload;
	private final List<Constraint> dependencies = new ArrayList<>();
	private int index = -1;

	public Constraint(Scope scope, Location location, ConstraintPayload payload)
	{
		this.scope = scope;
		this.location = location;
		this.payload = payload;
	}

	public void addDependency(Constraint dependency)
	{
		dependencies.add(dependency);
	}

	public Scope getScope()
	{
		return scope;
	}

	public Location getLocation()
	{
		return location;
	}

	public ConstraintPayload getPayload()
	{
		return payload;
	}

	public <T extends ConstraintPayload> T getPayload(Class<T> kind)
	{
		return kind.isInstance(payload) ? kind.cast(payload) : null;
	}

	public List<Constraint> getDependencies()
	{
		return Collections.unmodifiableList(dependencies);
	}

	/**
	 * Position in the constraint log, or -1 before the constraint is added to it.
	 */
	public int getIndex()
	{
		return index;
	}

	void setIndex(int index)
	{
		this.index = index;
	}

	@Override
	public String toString()
	{
		return "#" + index + " " + payload.getKind() + " @ " + location;
	}
}
