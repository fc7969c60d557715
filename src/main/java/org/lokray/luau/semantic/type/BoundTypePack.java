package org.lokray.luau.semantic.type;

public class BoundTypePack implements TypePackVar
{
	private final TypePackId boundTo;

	public BoundTypePack(TypePackId boundTo)
	{
		this.boundTo = boundTo;
	}

	public TypePackId getBoundTo()
	{
		return boundTo;
	}

	@Override
	public String getName()
	{
		return "bound(tp" + boundTo.getIndex() + ")";
	}
}
