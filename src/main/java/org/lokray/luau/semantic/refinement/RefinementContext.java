package org.lokray.luau.semantic.refinement;

import org.lokray.luau.dfg.Def;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

public class RefinementContext
{
	private final Map<Def, RefinementPartition> partitions = new LinkedHashMap<>();

	public RefinementPartition get(Def def)
	{
		return partitions.get(def);
	}

	public RefinementPartition getOrCreate(Def def)
	{
		return partitions.computeIfAbsent(def, d -> new RefinementPartition());
	}

	public Set<Map.Entry<Def, RefinementPartition>> entries()
	{
		return partitions.entrySet();
	}

	public boolean isEmpty()
	{
		return partitions.isEmpty();
	}
}
