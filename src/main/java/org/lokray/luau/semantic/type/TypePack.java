package org.lokray.luau.semantic.type;

import java.util.List;

/**
 * A finite list of types followed by an optional tail pack.
 */
public class TypePack implements TypePackVar
{
	private final List<TypeId> head;
	private final TypePackId tail;

	public TypePack(List<TypeId> head, TypePackId tail)
	{
		this.head = head;
		this.tail = tail;
	}

	public List<TypeId> getHead()
	{
		return head;
	}

	public TypePackId getTail()
	{
		return tail;
	}

	@Override
	public String getName()
	{
		return "(" + head.size() + (tail != null ? ", ..." : "") + ")";
	}
}
