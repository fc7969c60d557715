package org.lokray.luau.semantic.type;

import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Walks a type graph, visiting each handle once. Returning false from a visit hook stops the
 * walk from descending into that term's children.
 */
public abstract class TypeOnceVisitor
{
	private final Set<TypeId> seenTypes = Collections.newSetFromMap(new IdentityHashMap<>());
	private final Set<TypePackId> seenPacks = Collections.newSetFromMap(new IdentityHashMap<>());

	protected boolean visit(TypeId id, Type type)
	{
		return true;
	}

	protected boolean visit(TypePackId id, TypePackVar pack)
	{
		return true;
	}

	public void traverse(TypeId id)
	{
		if (id == null || !seenTypes.add(id))
		{
			return;
		}
		Type type = id.get();
		if (!visit(id, type))
		{
			return;
		}

		if (type instanceof BoundType bound)
		{
			traverse(bound.getBoundTo());
		}
		else if (type instanceof FreeType free)
		{
			traverse(free.getLowerBound());
			traverse(free.getUpperBound());
		}
		else if (type instanceof LocalType local)
		{
			traverse(local.getDomain());
		}
		else if (type instanceof TableType table)
		{
			traverseProps(table.getProps());
			traverseIndexer(table.getIndexer());
		}
		else if (type instanceof FunctionType function)
		{
			function.getGenerics().forEach(this::traverse);
			function.getGenericPacks().forEach(this::traverse);
			traverse(function.getArgTypes());
			traverse(function.getRetTypes());
		}
		else if (type instanceof UnionType union)
		{
			union.getOptions().forEach(this::traverse);
		}
		else if (type instanceof IntersectionType intersection)
		{
			intersection.getParts().forEach(this::traverse);
		}
		else if (type instanceof NegationType negation)
		{
			traverse(negation.getTy());
		}
		else if (type instanceof ClassType classType)
		{
			traverseProps(classType.getProps());
			traverse(classType.getParent());
			traverse(classType.getMetatable());
			traverseIndexer(classType.getIndexer());
		}
		else if (type instanceof MetatableType metatable)
		{
			traverse(metatable.getTable());
			traverse(metatable.getMetatable());
		}
		else if (type instanceof TypeFamilyInstanceType family)
		{
			family.getTypeArguments().forEach(this::traverse);
			family.getPackArguments().forEach(this::traverse);
		}
		else if (type instanceof PendingExpansionType pending)
		{
			pending.getTypeArguments().forEach(this::traverse);
			pending.getPackArguments().forEach(this::traverse);
		}
	}

	public void traverse(TypePackId id)
	{
		if (id == null || !seenPacks.add(id))
		{
			return;
		}
		TypePackVar pack = id.get();
		if (!visit(id, pack))
		{
			return;
		}

		if (pack instanceof TypePack list)
		{
			list.getHead().forEach(this::traverse);
			traverse(list.getTail());
		}
		else if (pack instanceof BoundTypePack bound)
		{
			traverse(bound.getBoundTo());
		}
		else if (pack instanceof VariadicTypePack variadic)
		{
			traverse(variadic.getTy());
		}
	}

	private void traverseProps(Map<String, Property> props)
	{
		for (Property prop : props.values())
		{
			traverse(prop.getReadTy());
			if (prop.getWriteTy() != prop.getReadTy())
			{
				traverse(prop.getWriteTy());
			}
		}
	}

	private void traverseIndexer(TableIndexer indexer)
	{
		if (indexer != null)
		{
			traverse(indexer.getIndexType());
			traverse(indexer.getIndexResultType());
		}
	}
}
