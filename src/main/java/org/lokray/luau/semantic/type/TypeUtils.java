package org.lokray.luau.semantic.type;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Structural queries over type terms used while generating constraints.
 */
public final class TypeUtils
{
	private TypeUtils()
	{
	}

	/**
	 * The first type a pack would produce, if it is known.
	 */
	public static Optional<TypeId> first(TypePackId pack)
	{
		TypePackId current = pack.follow();
		Set<TypePackId> seen = Collections.newSetFromMap(new IdentityHashMap<>());
		while (seen.add(current))
		{
			TypePackVar var = current.get();
			if (var instanceof TypePack list)
			{
				if (!list.getHead().isEmpty())
				{
					return Optional.of(list.getHead().get(0));
				}
				if (list.getTail() == null)
				{
					return Optional.empty();
				}
				current = list.getTail().follow();
			}
			else if (var instanceof VariadicTypePack variadic)
			{
				return Optional.of(variadic.getTy());
			}
			else
			{
				return Optional.empty();
			}
		}
		return Optional.empty();
	}

	/**
	 * Reads at least {@code length} leading types out of {@code pack}, repeating a variadic
	 * tail as needed. Reading stops early at a tail that is not yet known (free, blocked,
	 * generic), which is then returned as the tail of the result.
	 */
	public static TypePack extendTypePack(TypePackId pack, int length)
	{
		List<TypeId> head = new ArrayList<>();
		TypePackId current = pack.follow();
		Set<TypePackId> seen = Collections.newSetFromMap(new IdentityHashMap<>());
		while (current != null && seen.add(current))
		{
			TypePackVar var = current.get();
			if (var instanceof TypePack list)
			{
				head.addAll(list.getHead());
				current = list.getTail() == null ? null : list.getTail().follow();
			}
			else if (var instanceof VariadicTypePack variadic)
			{
				while (head.size() < length)
				{
					head.add(variadic.getTy());
				}
				return new TypePack(head, current);
			}
			else
			{
				return new TypePack(head, current);
			}
		}
		return new TypePack(head, current);
	}

	/**
	 * The leading types of a pack, following bound and nested pack tails. The returned tail is
	 * the first tail that is not a plain list, or null for a closed pack.
	 */
	public static TypePack flatten(TypePackId pack)
	{
		List<TypeId> head = new ArrayList<>();
		TypePackId current = pack.follow();
		Set<TypePackId> seen = Collections.newSetFromMap(new IdentityHashMap<>());
		while (seen.add(current))
		{
			TypePack list = current.get(TypePack.class);
			if (list == null)
			{
				return new TypePack(head, current);
			}
			head.addAll(list.getHead());
			if (list.getTail() == null)
			{
				return new TypePack(head, null);
			}
			current = list.getTail().follow();
		}
		return new TypePack(head, current);
	}

	/**
	 * Flattens nested unions and drops duplicate members, keeping first-seen order.
	 */
	public static List<TypeId> reduceUnion(List<TypeId> types)
	{
		List<TypeId> result = new ArrayList<>();
		Set<TypeId> seen = Collections.newSetFromMap(new IdentityHashMap<>());
		for (TypeId ty : types)
		{
			addUnionMember(ty.follow(), result, seen);
		}
		return result;
	}

	private static void addUnionMember(TypeId ty, List<TypeId> result, Set<TypeId> seen)
	{
		if (!seen.add(ty))
		{
			return;
		}
		UnionType union = ty.get(UnionType.class);
		if (union == null)
		{
			result.add(ty);
			return;
		}
		for (TypeId option : union.getOptions())
		{
			addUnionMember(option.follow(), result, seen);
		}
	}

	public static boolean isOptional(TypeId ty)
	{
		return isOptional(ty, Collections.newSetFromMap(new IdentityHashMap<>()));
	}

	private static boolean isOptional(TypeId ty, Set<TypeId> seen)
	{
		TypeId followed = ty.follow();
		if (!seen.add(followed))
		{
			return false;
		}
		if (followed.get() == PrimitiveType.NIL)
		{
			return true;
		}
		if (followed.get() instanceof UnionType union)
		{
			for (TypeId option : union.getOptions())
			{
				if (isOptional(option, seen))
				{
					return true;
				}
			}
		}
		return false;
	}

	/**
	 * True for a union whose every member is a table or a table with a metatable.
	 */
	public static boolean isTableUnion(TypeId ty)
	{
		UnionType union = ty.follow().get(UnionType.class);
		if (union == null)
		{
			return false;
		}
		for (TypeId option : union.getOptions())
		{
			TypeId followed = option.follow();
			if (!followed.is(TableType.class) && !followed.is(MetatableType.class))
			{
				return false;
			}
		}
		return true;
	}

	/**
	 * True if {@code needle} is {@code haystack} or one of its union or intersection members.
	 * Anything nested deeper is a legal recursive reference.
	 */
	public static boolean occursCheck(TypeId needle, TypeId haystack)
	{
		return occursCheck(needle.follow(), haystack, Collections.newSetFromMap(new IdentityHashMap<>()));
	}

	private static boolean occursCheck(TypeId needle, TypeId haystack, Set<TypeId> seen)
	{
		TypeId followed = haystack.follow();
		if (needle == followed)
		{
			return true;
		}
		if (!seen.add(followed))
		{
			return false;
		}
		List<TypeId> members = List.of();
		if (followed.get() instanceof UnionType union)
		{
			members = union.getOptions();
		}
		else if (followed.get() instanceof IntersectionType intersection)
		{
			members = intersection.getParts();
		}
		for (TypeId member : members)
		{
			if (occursCheck(needle, member, seen))
			{
				return true;
			}
		}
		return false;
	}

	/**
	 * True if a free type or pack is reachable from {@code ty}. Builtins and classes are never
	 * searched.
	 */
	public static boolean hasFreeType(TypeId ty)
	{
		HasFreeType finder = new HasFreeType();
		finder.traverse(ty);
		return finder.result;
	}

	/**
	 * True if {@code ty} is not solved enough to be intersected right away: it still contains
	 * a blocked, free or pending-expansion term outside of any function or class.
	 */
	public static boolean mustDeferIntersection(TypeId ty)
	{
		FindSimplificationBlockers finder = new FindSimplificationBlockers();
		finder.traverse(ty);
		return finder.found;
	}

	private static class HasFreeType extends TypeOnceVisitor
	{
		private boolean result = false;

		@Override
		protected boolean visit(TypeId id, Type type)
		{
			if (result || id.isPersistent() || type instanceof ClassType)
			{
				return false;
			}
			if (type instanceof FreeType)
			{
				result = true;
				return false;
			}
			return true;
		}

		@Override
		protected boolean visit(TypePackId id, TypePackVar pack)
		{
			if (result)
			{
				return false;
			}
			if (pack instanceof FreeTypePack)
			{
				result = true;
				return false;
			}
			return true;
		}
	}

	private static class FindSimplificationBlockers extends TypeOnceVisitor
	{
		private boolean found = false;

		@Override
		protected boolean visit(TypeId id, Type type)
		{
			if (found)
			{
				return false;
			}
			if (type instanceof BlockedType || type instanceof FreeType || type instanceof PendingExpansionType)
			{
				found = true;
				return false;
			}
			return !(type instanceof FunctionType) && !(type instanceof ClassType);
		}
	}
}
