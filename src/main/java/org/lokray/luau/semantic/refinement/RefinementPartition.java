package org.lokray.luau.semantic.refinement;

import org.lokray.luau.semantic.type.TypeId;

import java.util.ArrayList;
import java.util.List;

/**
 * What a condition says about one definition: every listed discriminant holds, and nil stays
 * possible if {@code shouldAppendNilType} is set.
 */
public class RefinementPartition
{
	private final List<TypeId> discriminantTypes = new ArrayList<>();
	private boolean shouldAppendNilType = false;

	public List<TypeId> getDiscriminantTypes()
	{
		return discriminantTypes;
	}

	public boolean shouldAppendNilType()
	{
		return shouldAppendNilType;
	}

	public void setShouldAppendNilType(boolean shouldAppendNilType)
	{
		this.shouldAppendNilType = shouldAppendNilType;
	}
}
