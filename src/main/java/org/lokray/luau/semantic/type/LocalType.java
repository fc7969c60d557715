package org.lokray.luau.semantic.type;

/**
 * The widening type of an unannotated local. It starts at {@code never} and the solver unions
 * in each assigned value; {@code blockCount} counts the assignments still pending.
 */
public class LocalType implements Type
{
	private TypeId domain;
	private int blockCount;
	private final String name;

	public LocalType(TypeId domain, int blockCount, String name)
	{
		this.domain = domain;
		this.blockCount = blockCount;
		this.name = name;
	}

	public TypeId getDomain()
	{
		return domain;
	}

	public void setDomain(TypeId domain)
	{
		this.domain = domain;
	}

	public int getBlockCount()
	{
		return blockCount;
	}

	public void incrementBlockCount()
	{
		blockCount++;
	}

	@Override
	public String getName()
	{
		return "local " + name;
	}
}
