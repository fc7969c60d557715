package org.lokray.luau.semantic.type;

import org.lokray.luau.semantic.symbol.Scope;

import java.util.ArrayList;
import java.util.List;

public class FunctionType implements Type
{
	private final List<TypeId> generics = new ArrayList<>();
	private final List<TypePackId> genericPacks = new ArrayList<>();
	private final TypePackId argTypes;
	private final TypePackId retTypes;
	private final Scope scope;
	// One entry per parameter; null for unnamed ones
	private final List<FunctionArgument> argNames = new ArrayList<>();
	private boolean hasSelf;
	private FunctionDefinition definition;
	private boolean checkedFunction;

	public FunctionType(TypePackId argTypes, TypePackId retTypes)
	{
		this(null, argTypes, retTypes);
	}

	public FunctionType(Scope scope, TypePackId argTypes, TypePackId retTypes)
	{
		this.scope = scope;
		this.argTypes = argTypes;
		this.retTypes = retTypes;
	}

	public FunctionType(List<TypeId> generics, List<TypePackId> genericPacks, TypePackId argTypes, TypePackId retTypes)
	{
		this(null, argTypes, retTypes);
		this.generics.addAll(generics);
		this.genericPacks.addAll(genericPacks);
	}

	public List<TypeId> getGenerics()
	{
		return generics;
	}

	public List<TypePackId> getGenericPacks()
	{
		return genericPacks;
	}

	public TypePackId getArgTypes()
	{
		return argTypes;
	}

	public TypePackId getRetTypes()
	{
		return retTypes;
	}

	public Scope getScope()
	{
		return scope;
	}

	public List<FunctionArgument> getArgNames()
	{
		return argNames;
	}

	public boolean hasSelf()
	{
		return hasSelf;
	}

	public void setHasSelf(boolean hasSelf)
	{
		this.hasSelf = hasSelf;
	}

	public FunctionDefinition getDefinition()
	{
		return definition;
	}

	public void setDefinition(FunctionDefinition definition)
	{
		this.definition = definition;
	}

	public boolean isCheckedFunction()
	{
		return checkedFunction;
	}

	public void setCheckedFunction(boolean checkedFunction)
	{
		this.checkedFunction = checkedFunction;
	}

	@Override
	public String getName()
	{
		return "function";
	}
}
