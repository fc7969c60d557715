package org.lokray.luau.semantic.constraint;

import org.lokray.luau.ast.Location;
import org.lokray.luau.semantic.symbol.Scope;
import org.lokray.luau.util.InternalCompilerError;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Consumer;

/**
 * The ordered, append-only list of constraints generated for one module. Checkpoints are
 * offsets into this list and stay valid for the whole pass.
 */
public class ConstraintLog
{
	private final List<Constraint> constraints = new ArrayList<>();

	public Constraint add(Scope scope, Location location, ConstraintPayload payload)
	{
		return add(new Constraint(scope, location, payload));
	}

	public Constraint add(Constraint constraint)
	{
		if (constraint.getIndex() != -1)
		{
			throw new InternalCompilerError("Constraint " + constraint + " was already added");
		}
		constraint.setIndex(constraints.size());
		constraints.add(constraint);
		return constraint;
	}

	public Checkpoint checkpoint()
	{
		return new Checkpoint(constraints.size());
	}

	public void forEachBetween(Checkpoint start, Checkpoint end, Consumer<Constraint> action)
	{
		for (int i = start.offset(); i < end.offset(); i++)
		{
			action.accept(constraints.get(i));
		}
	}

	/**
	 * Makes {@code governing} depend on every constraint between the two checkpoints except
	 * those in {@code excluded}, and chains the return obligations of that range so each one
	 * depends on the one before it.
	 */
	public void governRange(Constraint governing, Checkpoint start, Checkpoint end, Set<Constraint> excluded)
	{
		Constraint[] previousReturn = new Constraint[1];
		forEachBetween(start, end, constraint ->
		{
			if (!excluded.contains(constraint))
			{
				governing.addDependency(constraint);
			}

			PackSubtypeConstraint packSubtype = constraint.getPayload(PackSubtypeConstraint.class);
			if (packSubtype != null && packSubtype.returns())
			{
				if (previousReturn[0] != null)
				{
					constraint.addDependency(previousReturn[0]);
				}
				previousReturn[0] = constraint;
			}
		});
	}

	public List<Constraint> getConstraints()
	{
		return Collections.unmodifiableList(constraints);
	}

	public int size()
	{
		return constraints.size();
	}

	/**
	 * True if no constraint transitively depends on itself.
	 */
	public boolean isAcyclic()
	{
		// 0 = unvisited, 1 = on the current path, 2 = done
		Map<Constraint, Integer> state = new HashMap<>();
		for (Constraint root : constraints)
		{
			if (state.getOrDefault(root, 0) != 0)
			{
				continue;
			}
			List<Constraint> stack = new ArrayList<>();
			List<Integer> next = new ArrayList<>();
			stack.add(root);
			next.add(0);
			state.put(root, 1);
			while (!stack.isEmpty())
			{
				int top = stack.size() - 1;
				Constraint current = stack.get(top);
				int childIndex = next.get(top);
				List<Constraint> dependencies = current.getDependencies();
				if (childIndex == dependencies.size())
				{
					state.put(current, 2);
					stack.remove(top);
					next.remove(top);
					continue;
				}
				next.set(top, childIndex + 1);
				Constraint dependency = dependencies.get(childIndex);
				int dependencyState = state.getOrDefault(dependency, 0);
				if (dependencyState == 1)
				{
					return false;
				}
				if (dependencyState == 0)
				{
					state.put(dependency, 1);
					stack.add(dependency);
					next.add(0);
				}
			}
		}
		return true;
	}
}
