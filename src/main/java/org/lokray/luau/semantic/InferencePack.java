package org.lokray.luau.semantic;

import org.lokray.luau.semantic.refinement.Refinement;
import org.lokray.luau.semantic.type.TypePackId;

import java.util.List;

public record InferencePack(TypePackId tp, List<Refinement> refinements)
{
	public InferencePack(TypePackId tp)
	{
		this(tp, List.of());
	}
}
