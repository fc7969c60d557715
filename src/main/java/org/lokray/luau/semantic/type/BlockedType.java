package org.lokray.luau.semantic.type;

import org.lokray.luau.semantic.constraint.Constraint;
import org.lokray.luau.util.InternalCompilerError;

/**
 * Placeholder for a type that one constraint will produce. The owner is assigned at most
 * once.
 */
public class BlockedType implements Type
{
	private Constraint owner;

	public Constraint getOwner()
	{
		return owner;
	}

	public boolean hasOwner()
	{
		return owner != null;
	}

	public void setOwner(Constraint owner)
	{
		if (this.owner != null)
		{
			throw new InternalCompilerError("Blocked type already owned by constraint #" + this.owner.getIndex());
		}
		this.owner = owner;
	}

	@Override
	public String getName()
	{
		return owner == null ? "blocked" : "blocked(#" + owner.getIndex() + ")";
	}
}
