package org.lokray.luau.dfg;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Set;

/**
 * A definition identity handed out by the data-flow graph. Definitions are compared by
 * identity and come in two kinds: an assignment site ({@link Cell}) or a control-flow merge
 * point ({@link Phi}).
 */
public abstract class Def
{
	private final String debugName;

	Def(String debugName)
	{
		this.debugName = debugName;
	}

	public String getDebugName()
	{
		return debugName;
	}

	/**
	 * True if the definition, or any definition merged into it, was produced by writing
	 * through an index such as {@code t.x = v}.
	 */
	public static boolean containsSubscriptedDefinition(Def def)
	{
		return containsSubscriptedDefinition(def, Collections.newSetFromMap(new IdentityHashMap<>()));
	}

	private static boolean containsSubscriptedDefinition(Def def, Set<Def> seen)
	{
		if (!seen.add(def))
		{
			return false;
		}
		if (def instanceof Cell cell)
		{
			return cell.isSubscripted();
		}
		if (def instanceof Phi phi)
		{
			for (Def operand : phi.getOperands())
			{
				if (containsSubscriptedDefinition(operand, seen))
				{
					return true;
				}
			}
		}
		return false;
	}

	@Override
	public String toString()
	{
		return debugName;
	}

	public static final class Cell extends Def
	{
		private final boolean subscripted;

		public Cell(String debugName, boolean subscripted)
		{
			super(debugName);
			this.subscripted = subscripted;
		}

		public boolean isSubscripted()
		{
			return subscripted;
		}
	}

	public static final class Phi extends Def
	{
		private final List<Def> operands = new ArrayList<>();

		public Phi(String debugName, List<Def> operands)
		{
			super(debugName);
			this.operands.addAll(operands);
		}

		/**
		 * Loop headers learn their back-edge operand after the phi has been created.
		 */
		public void addOperand(Def operand)
		{
			operands.add(operand);
		}

		public List<Def> getOperands()
		{
			return Collections.unmodifiableList(operands);
		}
	}
}
