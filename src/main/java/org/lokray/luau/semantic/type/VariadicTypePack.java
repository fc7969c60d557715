package org.lokray.luau.semantic.type;

/**
 * Any number of values of one type. A hidden variadic marks a function that was not
 * declared with {@code ...} but still tolerates extra arguments.
 */
public class VariadicTypePack implements TypePackVar
{
	private final TypeId ty;
	private final boolean hidden;

	public VariadicTypePack(TypeId ty)
	{
		this(ty, false);
	}

	public VariadicTypePack(TypeId ty, boolean hidden)
	{
		this.ty = ty;
		this.hidden = hidden;
	}

	public TypeId getTy()
	{
		return ty;
	}

	public boolean isHidden()
	{
		return hidden;
	}

	@Override
	public String getName()
	{
		return "...t" + ty.getIndex();
	}
}
