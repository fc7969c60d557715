package org.lokray.luau.semantic.type;

public class NegationType implements Type
{
	private final TypeId ty;

	public NegationType(TypeId ty)
	{
		this.ty = ty;
	}

	public TypeId getTy()
	{
		return ty;
	}

	@Override
	public String getName()
	{
		return "~t" + ty.getIndex();
	}
}
