package org.lokray.luau.semantic;

import org.lokray.luau.semantic.refinement.Refinement;
import org.lokray.luau.semantic.type.TypeId;

/**
 * The type of one checked expression and what it says about the program when it is truthy.
 * {@code refinement} may be null.
 */
public record Inference(TypeId ty, Refinement refinement)
{
	public Inference(TypeId ty)
	{
		this(ty, null);
	}
}
