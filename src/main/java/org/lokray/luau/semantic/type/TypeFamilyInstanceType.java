package org.lokray.luau.semantic.type;

import java.util.List;

public class TypeFamilyInstanceType implements Type
{
	private final BuiltinTypeFamily family;
	private final List<TypeId> typeArguments;
	private final List<TypePackId> packArguments;

	public TypeFamilyInstanceType(BuiltinTypeFamily family, List<TypeId> typeArguments, List<TypePackId> packArguments)
	{
		this.family = family;
		this.typeArguments = typeArguments;
		this.packArguments = packArguments;
	}

	public BuiltinTypeFamily getFamily()
	{
		return family;
	}

	public List<TypeId> getTypeArguments()
	{
		return typeArguments;
	}

	public List<TypePackId> getPackArguments()
	{
		return packArguments;
	}

	@Override
	public String getName()
	{
		return family.getFamilyName() + "<" + typeArguments.size() + ">";
	}
}
