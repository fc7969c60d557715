package org.lokray.luau.semantic.refinement;

import org.lokray.luau.dfg.RefinementKey;
import org.lokray.luau.semantic.type.TypeId;

import java.util.List;

/**
 * A narrowing fact derived from a condition. Child refinements may be null, meaning "no
 * information".
 */
public abstract class Refinement
{
	Refinement()
	{
	}

	/**
	 * One refinement per value of a multi-valued expression, such as the results of a call.
	 * Positions without information hold null.
	 */
	public static final class Variadic extends Refinement
	{
		private final List<Refinement> refinements;

		Variadic(List<Refinement> refinements)
		{
			this.refinements = refinements;
		}

		public List<Refinement> getRefinements()
		{
			return refinements;
		}
	}

	public static final class Negation extends Refinement
	{
		private final Refinement refinement;

		Negation(Refinement refinement)
		{
			this.refinement = refinement;
		}

		public Refinement getRefinement()
		{
			return refinement;
		}
	}

	public static final class Conjunction extends Refinement
	{
		private final Refinement lhs;
		private final Refinement rhs;

		Conjunction(Refinement lhs, Refinement rhs)
		{
			this.lhs = lhs;
			this.rhs = rhs;
		}

		public Refinement getLhs()
		{
			return lhs;
		}

		public Refinement getRhs()
		{
			return rhs;
		}
	}

	public static final class Disjunction extends Refinement
	{
		private final Refinement lhs;
		private final Refinement rhs;

		Disjunction(Refinement lhs, Refinement rhs)
		{
			this.lhs = lhs;
			this.rhs = rhs;
		}

		public Refinement getLhs()
		{
			return lhs;
		}

		public Refinement getRhs()
		{
			return rhs;
		}
	}

	/**
	 * {@code a == b}: each side is narrowed by the other's value.
	 */
	public static final class Equivalence extends Refinement
	{
		private final Refinement lhs;
		private final Refinement rhs;

		Equivalence(Refinement lhs, Refinement rhs)
		{
			this.lhs = lhs;
			this.rhs = rhs;
		}

		public Refinement getLhs()
		{
			return lhs;
		}

		public Refinement getRhs()
		{
			return rhs;
		}
	}

	/**
	 * The value at {@code key} has type {@code discriminantTy}.
	 */
	public static final class Proposition extends Refinement
	{
		private final RefinementKey key;
		private final TypeId discriminantTy;
		private final boolean implicitFromCall;

		Proposition(RefinementKey key, TypeId discriminantTy, boolean implicitFromCall)
		{
			this.key = key;
			this.discriminantTy = discriminantTy;
			this.implicitFromCall = implicitFromCall;
		}

		public RefinementKey getKey()
		{
			return key;
		}

		public TypeId getDiscriminantTy()
		{
			return discriminantTy;
		}

		public boolean isImplicitFromCall()
		{
			return implicitFromCall;
		}
	}
}
