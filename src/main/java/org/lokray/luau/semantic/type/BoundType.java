package org.lokray.luau.semantic.type;

public class BoundType implements Type
{
	private final TypeId boundTo;

	public BoundType(TypeId boundTo)
	{
		this.boundTo = boundTo;
	}

	public TypeId getBoundTo()
	{
		return boundTo;
	}

	@Override
	public String getName()
	{
		return "bound(t" + boundTo.getIndex() + ")";
	}
}
