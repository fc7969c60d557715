package org.lokray.luau.semantic;

import org.lokray.luau.semantic.type.AnyType;
import org.lokray.luau.semantic.type.ErrorType;
import org.lokray.luau.semantic.type.IntersectionType;
import org.lokray.luau.semantic.type.TypeId;
import org.lokray.luau.semantic.type.UnionType;

import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Set;

/**
 * Suppresses errors for types that are, or have a union or intersection member that is,
 * {@code any} or the error type. Gives up with {@link ErrorSuppression#NORMALIZATION_FAILED}
 * when the member tree is larger than {@code memberLimit}.
 */
public class StructuralErrorSuppressionPolicy implements ErrorSuppressionPolicy
{
	public static final int DEFAULT_MEMBER_LIMIT = 1000;

	private final int memberLimit;

	public StructuralErrorSuppressionPolicy()
	{
		this(DEFAULT_MEMBER_LIMIT);
	}

	public StructuralErrorSuppressionPolicy(int memberLimit)
	{
		this.memberLimit = memberLimit;
	}

	@Override
	public ErrorSuppression shouldSuppressErrors(TypeId ty)
	{
		Set<TypeId> seen = Collections.newSetFromMap(new IdentityHashMap<>());
		return scan(ty.follow(), seen);
	}

	private ErrorSuppression scan(TypeId ty, Set<TypeId> seen)
	{
		if (!seen.add(ty))
		{
			return ErrorSuppression.DO_NOT_SUPPRESS;
		}
		if (seen.size() > memberLimit)
		{
			return ErrorSuppression.NORMALIZATION_FAILED;
		}
		if (ty.is(ErrorType.class) || ty.is(AnyType.class))
		{
			return ErrorSuppression.SUPPRESS;
		}

		List<TypeId> members;
		if (ty.get() instanceof UnionType union)
		{
			members = union.getOptions();
		}
		else if (ty.get() instanceof IntersectionType intersection)
		{
			members = intersection.getParts();
		}
		else
		{
			return ErrorSuppression.DO_NOT_SUPPRESS;
		}

		for (TypeId member : members)
		{
			ErrorSuppression result = scan(member.follow(), seen);
			if (result != ErrorSuppression.DO_NOT_SUPPRESS)
			{
				return result;
			}
		}
		return ErrorSuppression.DO_NOT_SUPPRESS;
	}
}
