package org.lokray.luau.semantic.symbol;

import org.lokray.luau.semantic.type.TypeId;

import java.util.List;

/**
 * A type alias: its generic parameters and the type it names.
 */
public class TypeFun
{
	private final List<GenericTypeDefinition> typeParams;
	private final List<GenericTypePackDefinition> typePackParams;
	private final TypeId type;

	public TypeFun(TypeId type)
	{
		this(List.of(), List.of(), type);
	}

	public TypeFun(List<GenericTypeDefinition> typeParams, List<GenericTypePackDefinition> typePackParams, TypeId type)
	{
		this.typeParams = typeParams;
		this.typePackParams = typePackParams;
		this.type = type;
	}

	public List<GenericTypeDefinition> getTypeParams()
	{
		return typeParams;
	}

	public List<GenericTypePackDefinition> getTypePackParams()
	{
		return typePackParams;
	}

	public TypeId getType()
	{
		return type;
	}

	public boolean isGeneric()
	{
		return !typeParams.isEmpty() || !typePackParams.isEmpty();
	}
}
