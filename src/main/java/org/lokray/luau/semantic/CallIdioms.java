package org.lokray.luau.semantic;

import org.lokray.luau.ast.AstExpr;

import java.util.Optional;

/**
 * Recognizes the calls the generator handles structurally. Matching is by the literal name of
 * an unresolved global, so a local that shadows one of these names is still recognized.
 */
public final class CallIdioms
{
	private CallIdioms()
	{
	}

	/**
	 * {@code type(x) == "name"} or {@code typeof(x) ~= "name"}, in either operand order.
	 */
	public record TypeGuard(boolean isTypeof, AstExpr target, String type)
	{
	}

	public static Optional<AstExpr> matchRequire(AstExpr.Call call)
	{
		if (call.args.size() != 1 || !isGlobalNamed(call.func, "require"))
		{
			return Optional.empty();
		}
		return Optional.of(call.args.get(0));
	}

	public static boolean matchSetmetatable(AstExpr.Call call)
	{
		return call.args.size() == 2 && isGlobalNamed(call.func, "setmetatable");
	}

	public static boolean matchAssert(AstExpr.Call call)
	{
		return !call.args.isEmpty() && isGlobalNamed(call.func, "assert");
	}

	public static Optional<TypeGuard> matchTypeGuard(AstExpr.Binary binary)
	{
		if (binary.op != AstExpr.Binary.Op.COMPARE_EQ && binary.op != AstExpr.Binary.Op.COMPARE_NE)
		{
			return Optional.empty();
		}

		AstExpr left = binary.left;
		AstExpr right = binary.right;
		if (right instanceof AstExpr.Call)
		{
			AstExpr swap = left;
			left = right;
			right = swap;
		}

		if (!(left instanceof AstExpr.Call call) || !(right instanceof AstExpr.ConstantString string))
		{
			return Optional.empty();
		}
		if (!(call.func instanceof AstExpr.Global callee))
		{
			return Optional.empty();
		}
		if (!callee.name.equals("type") && !callee.name.equals("typeof"))
		{
			return Optional.empty();
		}
		if (call.args.size() != 1)
		{
			return Optional.empty();
		}

		return Optional.of(new TypeGuard(callee.name.equals("typeof"), call.args.get(0), string.value));
	}

	/**
	 * True for {@code error(...)}, {@code assert()} and {@code assert(false, ...)}.
	 */
	public static boolean doesCallError(AstExpr.Call call)
	{
		if (!(call.func instanceof AstExpr.Global global))
		{
			return false;
		}
		if (global.name.equals("error"))
		{
			return true;
		}
		if (global.name.equals("assert"))
		{
			if (call.args.isEmpty())
			{
				return true;
			}
			return call.args.get(0) instanceof AstExpr.ConstantBool constant && !constant.value;
		}
		return false;
	}

	private static boolean isGlobalNamed(AstExpr expr, String name)
	{
		return expr instanceof AstExpr.Global global && global.name.equals(name);
	}
}
