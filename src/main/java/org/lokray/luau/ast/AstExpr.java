package org.lokray.luau.ast;

import java.util.List;

/**
 * Expression nodes. Dispatch goes through {@link Visitor}, so every consumer handles every
 * expression kind.
 */
public abstract class AstExpr extends AstNode
{
	protected AstExpr(Location location)
	{
		super(location);
	}

	public abstract <R, C> R accept(Visitor<R, C> visitor, C ctx);

	public interface Visitor<R, C>
	{
		R visitGroup(Group expr, C ctx);

		R visitConstantNil(ConstantNil expr, C ctx);

		R visitConstantBool(ConstantBool expr, C ctx);

		R visitConstantNumber(ConstantNumber expr, C ctx);

		R visitConstantString(ConstantString expr, C ctx);

		R visitLocal(Local expr, C ctx);

		R visitGlobal(Global expr, C ctx);

		R visitVarargs(Varargs expr, C ctx);

		R visitCall(Call expr, C ctx);

		R visitIndexName(IndexName expr, C ctx);

		R visitIndexExpr(IndexExpr expr, C ctx);

		R visitFunction(Function expr, C ctx);

		R visitTable(Table expr, C ctx);

		R visitUnary(Unary expr, C ctx);

		R visitBinary(Binary expr, C ctx);

		R visitIfElse(IfElse expr, C ctx);

		R visitTypeAssertion(TypeAssertion expr, C ctx);

		R visitInterpString(InterpString expr, C ctx);

		R visitError(Error expr, C ctx);
	}

	// --- Atoms ---

	public static class Group extends AstExpr
	{
		public final AstExpr expr;

		public Group(Location location, AstExpr expr)
		{
			super(location);
			this.expr = expr;
		}

		@Override
		public <R, C> R accept(Visitor<R, C> visitor, C ctx)
		{
			return visitor.visitGroup(this, ctx);
		}
	}

	public static class ConstantNil extends AstExpr
	{
		public ConstantNil(Location location)
		{
			super(location);
		}

		@Override
		public <R, C> R accept(Visitor<R, C> visitor, C ctx)
		{
			return visitor.visitConstantNil(this, ctx);
		}
	}

	public static class ConstantBool extends AstExpr
	{
		public final boolean value;

		public ConstantBool(Location location, boolean value)
		{
			super(location);
			this.value = value;
		}

		@Override
		public <R, C> R accept(Visitor<R, C> visitor, C ctx)
		{
			return visitor.visitConstantBool(this, ctx);
		}
	}

	public static class ConstantNumber extends AstExpr
	{
		public final double value;

		public ConstantNumber(Location location, double value)
		{
			super(location);
			this.value = value;
		}

		@Override
		public <R, C> R accept(Visitor<R, C> visitor, C ctx)
		{
			return visitor.visitConstantNumber(this, ctx);
		}
	}

	public static class ConstantString extends AstExpr
	{
		public final String value;

		public ConstantString(Location location, String value)
		{
			super(location);
			this.value = value;
		}

		@Override
		public <R, C> R accept(Visitor<R, C> visitor, C ctx)
		{
			return visitor.visitConstantString(this, ctx);
		}
	}

	public static class Local extends AstExpr
	{
		public final AstLocal local;
		public final boolean upvalue;

		public Local(Location location, AstLocal local, boolean upvalue)
		{
			super(location);
			this.local = local;
			this.upvalue = upvalue;
		}

		@Override
		public <R, C> R accept(Visitor<R, C> visitor, C ctx)
		{
			return visitor.visitLocal(this, ctx);
		}
	}

	public static class Global extends AstExpr
	{
		public final String name;

		public Global(Location location, String name)
		{
			super(location);
			this.name = name;
		}

		@Override
		public <R, C> R accept(Visitor<R, C> visitor, C ctx)
		{
			return visitor.visitGlobal(this, ctx);
		}
	}

	public static class Varargs extends AstExpr
	{
		public Varargs(Location location)
		{
			super(location);
		}

		@Override
		public <R, C> R accept(Visitor<R, C> visitor, C ctx)
		{
			return visitor.visitVarargs(this, ctx);
		}
	}

	// --- Calls and indexing ---

	public static class Call extends AstExpr
	{
		public final AstExpr func;
		public final List<AstExpr> args;
		// true for a method call a:m(...)
		public final boolean self;

		public Call(Location location, AstExpr func, List<AstExpr> args, boolean self)
		{
			super(location);
			this.func = func;
			this.args = args;
			this.self = self;
		}

		@Override
		public <R, C> R accept(Visitor<R, C> visitor, C ctx)
		{
			return visitor.visitCall(this, ctx);
		}
	}

	public static class IndexName extends AstExpr
	{
		public final AstExpr expr;
		public final String index;
		public final Location indexLocation;

		public IndexName(Location location, AstExpr expr, String index, Location indexLocation)
		{
			super(location);
			this.expr = expr;
			this.index = index;
			this.indexLocation = indexLocation;
		}

		@Override
		public <R, C> R accept(Visitor<R, C> visitor, C ctx)
		{
			return visitor.visitIndexName(this, ctx);
		}
	}

	public static class IndexExpr extends AstExpr
	{
		public final AstExpr expr;
		public final AstExpr index;

		public IndexExpr(Location location, AstExpr expr, AstExpr index)
		{
			super(location);
			this.expr = expr;
			this.index = index;
		}

		@Override
		public <R, C> R accept(Visitor<R, C> visitor, C ctx)
		{
			return visitor.visitIndexExpr(this, ctx);
		}
	}

	// --- Functions and tables ---

	public static class Function extends AstExpr
	{
		public final List<AstGenericType> generics;
		public final List<AstGenericTypePack> genericPacks;
		public final AstLocal self;
		public final List<AstLocal> args;
		public final boolean vararg;
		public final Location varargLocation;
		public final AstTypePack varargAnnotation;
		public final AstStat.Block body;
		public final AstTypeList returnAnnotation;
		public final String debugName;

		public Function(Location location, List<AstGenericType> generics, List<AstGenericTypePack> genericPacks, AstLocal self,
						List<AstLocal> args, boolean vararg, Location varargLocation, AstTypePack varargAnnotation,
						AstStat.Block body, AstTypeList returnAnnotation, String debugName)
		{
			super(location);
			this.generics = generics;
			this.genericPacks = genericPacks;
			this.self = self;
			this.args = args;
			this.vararg = vararg;
			this.varargLocation = varargLocation;
			this.varargAnnotation = varargAnnotation;
			this.body = body;
			this.returnAnnotation = returnAnnotation;
			this.debugName = debugName;
		}

		@Override
		public <R, C> R accept(Visitor<R, C> visitor, C ctx)
		{
			return visitor.visitFunction(this, ctx);
		}
	}

	public static class Table extends AstExpr
	{
		/**
		 * A table constructor item. {@code key} is null for positional items.
		 */
		public static class Item
		{
			public final AstExpr key;
			public final AstExpr value;

			public Item(AstExpr key, AstExpr value)
			{
				this.key = key;
				this.value = value;
			}
		}

		public final List<Item> items;

		public Table(Location location, List<Item> items)
		{
			super(location);
			this.items = items;
		}

		@Override
		public <R, C> R accept(Visitor<R, C> visitor, C ctx)
		{
			return visitor.visitTable(this, ctx);
		}
	}

	// --- Operators ---

	public static class Unary extends AstExpr
	{
		public enum Op
		{
			NOT,
			MINUS,
			LEN
		}

		public final Op op;
		public final AstExpr expr;

		public Unary(Location location, Op op, AstExpr expr)
		{
			super(location);
			this.op = op;
			this.expr = expr;
		}

		@Override
		public <R, C> R accept(Visitor<R, C> visitor, C ctx)
		{
			return visitor.visitUnary(this, ctx);
		}
	}

	public static class Binary extends AstExpr
	{
		public enum Op
		{
			ADD,
			SUB,
			MUL,
			DIV,
			FLOOR_DIV,
			MOD,
			POW,
			CONCAT,
			COMPARE_NE,
			COMPARE_EQ,
			COMPARE_LT,
			COMPARE_LE,
			COMPARE_GT,
			COMPARE_GE,
			AND,
			OR
		}

		public final Op op;
		public final AstExpr left;
		public final AstExpr right;

		public Binary(Location location, Op op, AstExpr left, AstExpr right)
		{
			super(location);
			this.op = op;
			this.left = left;
			this.right = right;
		}

		@Override
		public <R, C> R accept(Visitor<R, C> visitor, C ctx)
		{
			return visitor.visitBinary(this, ctx);
		}
	}

	public static class IfElse extends AstExpr
	{
		public final AstExpr condition;
		public final AstExpr trueExpr;
		public final AstExpr falseExpr;

		public IfElse(Location location, AstExpr condition, AstExpr trueExpr, AstExpr falseExpr)
		{
			super(location);
			this.condition = condition;
			this.trueExpr = trueExpr;
			this.falseExpr = falseExpr;
		}

		@Override
		public <R, C> R accept(Visitor<R, C> visitor, C ctx)
		{
			return visitor.visitIfElse(this, ctx);
		}
	}

	public static class TypeAssertion extends AstExpr
	{
		public final AstExpr expr;
		public final AstType annotation;

		public TypeAssertion(Location location, AstExpr expr, AstType annotation)
		{
			super(location);
			this.expr = expr;
			this.annotation = annotation;
		}

		@Override
		public <R, C> R accept(Visitor<R, C> visitor, C ctx)
		{
			return visitor.visitTypeAssertion(this, ctx);
		}
	}

	public static class InterpString extends AstExpr
	{
		public final List<String> strings;
		public final List<AstExpr> expressions;

		public InterpString(Location location, List<String> strings, List<AstExpr> expressions)
		{
			super(location);
			this.strings = strings;
			this.expressions = expressions;
		}

		@Override
		public <R, C> R accept(Visitor<R, C> visitor, C ctx)
		{
			return visitor.visitInterpString(this, ctx);
		}
	}

	/**
	 * Placeholder the parser leaves where it could not build an expression.
	 */
	public static class Error extends AstExpr
	{
		public final List<AstExpr> expressions;

		public Error(Location location, List<AstExpr> expressions)
		{
			super(location);
			this.expressions = expressions;
		}

		@Override
		public <R, C> R accept(Visitor<R, C> visitor, C ctx)
		{
			return visitor.visitError(this, ctx);
		}
	}
}
