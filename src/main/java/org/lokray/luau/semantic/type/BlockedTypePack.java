package org.lokray.luau.semantic.type;

import org.lokray.luau.semantic.constraint.Constraint;
import org.lokray.luau.util.InternalCompilerError;

public class BlockedTypePack implements TypePackVar
{
	private Constraint owner;

	public Constraint getOwner()
	{
		return owner;
	}

	public void setOwner(Constraint owner)
	{
		if (this.owner != null)
		{
			throw new InternalCompilerError("Blocked type pack already owned by constraint #" + this.owner.getIndex());
		}
		this.owner = owner;
	}

	@Override
	public String getName()
	{
		return "blocked...";
	}
}
