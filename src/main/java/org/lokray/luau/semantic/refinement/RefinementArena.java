package org.lokray.luau.semantic.refinement;

import org.lokray.luau.dfg.RefinementKey;
import org.lokray.luau.semantic.type.TypeId;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Allocates refinements for one generation pass.
 */
public class RefinementArena
{
	private final List<Refinement> refinements = new ArrayList<>();

	public Refinement variadic(List<Refinement> parts)
	{
		boolean empty = true;
		for (Refinement part : parts)
		{
			if (part != null)
			{
				empty = false;
				break;
			}
		}
		if (empty)
		{
			return null;
		}
		return allocate(new Refinement.Variadic(Collections.unmodifiableList(new ArrayList<>(parts))));
	}

	public Refinement negation(Refinement refinement)
	{
		if (refinement == null)
		{
			return null;
		}
		return allocate(new Refinement.Negation(refinement));
	}

	public Refinement conjunction(Refinement lhs, Refinement rhs)
	{
		if (lhs == null && rhs == null)
		{
			return null;
		}
		return allocate(new Refinement.Conjunction(lhs, rhs));
	}

	public Refinement disjunction(Refinement lhs, Refinement rhs)
	{
		if (lhs == null && rhs == null)
		{
			return null;
		}
		return allocate(new Refinement.Disjunction(lhs, rhs));
	}

	public Refinement equivalence(Refinement lhs, Refinement rhs)
	{
		if (lhs == null && rhs == null)
		{
			return null;
		}
		return allocate(new Refinement.Equivalence(lhs, rhs));
	}

	public Refinement proposition(RefinementKey key, TypeId discriminantTy)
	{
		if (key == null)
		{
			return null;
		}
		return allocate(new Refinement.Proposition(key, discriminantTy, false));
	}

	/**
	 * A proposition whose discriminant the solver fills in from a call's return narrowing.
	 */
	public Refinement implicitProposition(RefinementKey key, TypeId discriminantTy)
	{
		if (key == null)
		{
			return null;
		}
		return allocate(new Refinement.Proposition(key, discriminantTy, true));
	}

	public int size()
	{
		return refinements.size();
	}

	private Refinement allocate(Refinement refinement)
	{
		refinements.add(refinement);
		return refinement;
	}
}
