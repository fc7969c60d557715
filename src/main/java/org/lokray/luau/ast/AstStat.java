package org.lokray.luau.ast;

import java.util.List;

/**
 * Statement nodes.
 */
public abstract class AstStat extends AstNode
{
	protected AstStat(Location location)
	{
		super(location);
	}

	public abstract <R, C> R accept(Visitor<R, C> visitor, C ctx);

	public interface Visitor<R, C>
	{
		R visitBlock(Block stat, C ctx);

		R visitIf(If stat, C ctx);

		R visitWhile(While stat, C ctx);

		R visitRepeat(Repeat stat, C ctx);

		R visitBreak(Break stat, C ctx);

		R visitContinue(Continue stat, C ctx);

		R visitReturn(Return stat, C ctx);

		R visitExpr(Expr stat, C ctx);

		R visitLocal(Local stat, C ctx);

		R visitFor(For stat, C ctx);

		R visitForIn(ForIn stat, C ctx);

		R visitAssign(Assign stat, C ctx);

		R visitCompoundAssign(CompoundAssign stat, C ctx);

		R visitFunction(Function stat, C ctx);

		R visitLocalFunction(LocalFunction stat, C ctx);

		R visitTypeAlias(TypeAlias stat, C ctx);

		R visitDeclareGlobal(DeclareGlobal stat, C ctx);

		R visitDeclareFunction(DeclareFunction stat, C ctx);

		R visitDeclareClass(DeclareClass stat, C ctx);

		R visitError(Error stat, C ctx);
	}

	// --- Control flow ---

	public static class Block extends AstStat
	{
		public final List<AstStat> body;

		public Block(Location location, List<AstStat> body)
		{
			super(location);
			this.body = body;
		}

		@Override
		public <R, C> R accept(Visitor<R, C> visitor, C ctx)
		{
			return visitor.visitBlock(this, ctx);
		}
	}

	public static class If extends AstStat
	{
		public final AstExpr condition;
		public final Block thenBody;
		// Block, a nested If for elseif, or null
		public final AstStat elseBody;
		public final Location elseLocation;

		public If(Location location, AstExpr condition, Block thenBody, AstStat elseBody, Location elseLocation)
		{
			super(location);
			this.condition = condition;
			this.thenBody = thenBody;
			this.elseBody = elseBody;
			this.elseLocation = elseLocation;
		}

		@Override
		public <R, C> R accept(Visitor<R, C> visitor, C ctx)
		{
			return visitor.visitIf(this, ctx);
		}
	}

	public static class While extends AstStat
	{
		public final AstExpr condition;
		public final Block body;

		public While(Location location, AstExpr condition, Block body)
		{
			super(location);
			this.condition = condition;
			this.body = body;
		}

		@Override
		public <R, C> R accept(Visitor<R, C> visitor, C ctx)
		{
			return visitor.visitWhile(this, ctx);
		}
	}

	public static class Repeat extends AstStat
	{
		public final AstExpr condition;
		public final Block body;

		public Repeat(Location location, AstExpr condition, Block body)
		{
			super(location);
			this.condition = condition;
			this.body = body;
		}

		@Override
		public <R, C> R accept(Visitor<R, C> visitor, C ctx)
		{
			return visitor.visitRepeat(this, ctx);
		}
	}

	public static class Break extends AstStat
	{
		public Break(Location location)
		{
			super(location);
		}

		@Override
		public <R, C> R accept(Visitor<R, C> visitor, C ctx)
		{
			return visitor.visitBreak(this, ctx);
		}
	}

	public static class Continue extends AstStat
	{
		public Continue(Location location)
		{
			super(location);
		}

		@Override
		public <R, C> R accept(Visitor<R, C> visitor, C ctx)
		{
			return visitor.visitContinue(this, ctx);
		}
	}

	public static class Return extends AstStat
	{
		public final List<AstExpr> list;

		public Return(Location location, List<AstExpr> list)
		{
			super(location);
			this.list = list;
		}

		@Override
		public <R, C> R accept(Visitor<R, C> visitor, C ctx)
		{
			return visitor.visitReturn(this, ctx);
		}
	}

	public static class Expr extends AstStat
	{
		public final AstExpr expr;

		public Expr(Location location, AstExpr expr)
		{
			super(location);
			this.expr = expr;
		}

		@Override
		public <R, C> R accept(Visitor<R, C> visitor, C ctx)
		{
			return visitor.visitExpr(this, ctx);
		}
	}

	// --- Bindings and assignment ---

	public static class Local extends AstStat
	{
		public final List<AstLocal> vars;
		public final List<AstExpr> values;

		public Local(Location location, List<AstLocal> vars, List<AstExpr> values)
		{
			super(location);
			this.vars = vars;
			this.values = values;
		}

		@Override
		public <R, C> R accept(Visitor<R, C> visitor, C ctx)
		{
			return visitor.visitLocal(this, ctx);
		}
	}

	public static class For extends AstStat
	{
		public final AstLocal var;
		public final AstExpr from;
		public final AstExpr to;
		public final AstExpr step;
		public final Block body;

		public For(Location location, AstLocal var, AstExpr from, AstExpr to, AstExpr step, Block body)
		{
			super(location);
			this.var = var;
			this.from = from;
			this.to = to;
			this.step = step;
			this.body = body;
		}

		@Override
		public <R, C> R accept(Visitor<R, C> visitor, C ctx)
		{
			return visitor.visitFor(this, ctx);
		}
	}

	public static class ForIn extends AstStat
	{
		public final List<AstLocal> vars;
		public final List<AstExpr> values;
		public final Block body;

		public ForIn(Location location, List<AstLocal> vars, List<AstExpr> values, Block body)
		{
			super(location);
			this.vars = vars;
			this.values = values;
			this.body = body;
		}

		@Override
		public <R, C> R accept(Visitor<R, C> visitor, C ctx)
		{
			return visitor.visitForIn(this, ctx);
		}
	}

	public static class Assign extends AstStat
	{
		public final List<AstExpr> vars;
		public final List<AstExpr> values;

		public Assign(Location location, List<AstExpr> vars, List<AstExpr> values)
		{
			super(location);
			this.vars = vars;
			this.values = values;
		}

		@Override
		public <R, C> R accept(Visitor<R, C> visitor, C ctx)
		{
			return visitor.visitAssign(this, ctx);
		}
	}

	public static class CompoundAssign extends AstStat
	{
		public final AstExpr.Binary.Op op;
		public final AstExpr var;
		public final AstExpr value;

		public CompoundAssign(Location location, AstExpr.Binary.Op op, AstExpr var, AstExpr value)
		{
			super(location);
			this.op = op;
			this.var = var;
			this.value = value;
		}

		@Override
		public <R, C> R accept(Visitor<R, C> visitor, C ctx)
		{
			return visitor.visitCompoundAssign(this, ctx);
		}
	}

	// --- Functions ---

	public static class Function extends AstStat
	{
		// Local, Global, IndexName or Error
		public final AstExpr name;
		public final AstExpr.Function func;

		public Function(Location location, AstExpr name, AstExpr.Function func)
		{
			super(location);
			this.name = name;
			this.func = func;
		}

		@Override
		public <R, C> R accept(Visitor<R, C> visitor, C ctx)
		{
			return visitor.visitFunction(this, ctx);
		}
	}

	public static class LocalFunction extends AstStat
	{
		public final AstLocal name;
		public final AstExpr.Function func;

		public LocalFunction(Location location, AstLocal name, AstExpr.Function func)
		{
			super(location);
			this.name = name;
			this.func = func;
		}

		@Override
		public <R, C> R accept(Visitor<R, C> visitor, C ctx)
		{
			return visitor.visitLocalFunction(this, ctx);
		}
	}

	// --- Types and declarations ---

	public static class TypeAlias extends AstStat
	{
		public final String name;
		public final Location nameLocation;
		public final List<AstGenericType> generics;
		public final List<AstGenericTypePack> genericPacks;
		public final AstType type;
		public final boolean exported;

		public TypeAlias(Location location, String name, Location nameLocation, List<AstGenericType> generics,
						 List<AstGenericTypePack> genericPacks, AstType type, boolean exported)
		{
			super(location);
			this.name = name;
			this.nameLocation = nameLocation;
			this.generics = generics;
			this.genericPacks = genericPacks;
			this.type = type;
			this.exported = exported;
		}

		@Override
		public <R, C> R accept(Visitor<R, C> visitor, C ctx)
		{
			return visitor.visitTypeAlias(this, ctx);
		}
	}

	public static class DeclareGlobal extends AstStat
	{
		public final String name;
		public final Location nameLocation;
		public final AstType type;

		public DeclareGlobal(Location location, String name, Location nameLocation, AstType type)
		{
			super(location);
			this.name = name;
			this.nameLocation = nameLocation;
			this.type = type;
		}

		@Override
		public <R, C> R accept(Visitor<R, C> visitor, C ctx)
		{
			return visitor.visitDeclareGlobal(this, ctx);
		}
	}

	public static class DeclareFunction extends AstStat
	{
		public final String name;
		public final Location nameLocation;
		public final List<AstGenericType> generics;
		public final List<AstGenericTypePack> genericPacks;
		public final AstTypeList params;
		public final List<AstArgumentName> paramNames;
		public final AstTypeList retTypes;
		public final boolean checkedFunction;

		public DeclareFunction(Location location, String name, Location nameLocation, List<AstGenericType> generics,
							   List<AstGenericTypePack> genericPacks, AstTypeList params, List<AstArgumentName> paramNames,
							   AstTypeList retTypes, boolean checkedFunction)
		{
			super(location);
			this.name = name;
			this.nameLocation = nameLocation;
			this.generics = generics;
			this.genericPacks = genericPacks;
			this.params = params;
			this.paramNames = paramNames;
			this.retTypes = retTypes;
			this.checkedFunction = checkedFunction;
		}

		@Override
		public <R, C> R accept(Visitor<R, C> visitor, C ctx)
		{
			return visitor.visitDeclareFunction(this, ctx);
		}
	}

	public static class DeclareClass extends AstStat
	{
		public static class Prop
		{
			public final String name;
			public final Location nameLocation;
			public final AstType type;
			public final boolean isMethod;
			public final Location location;

			public Prop(String name, Location nameLocation, AstType type, boolean isMethod, Location location)
			{
				this.name = name;
				this.nameLocation = nameLocation;
				this.type = type;
				this.isMethod = isMethod;
				this.location = location;
			}
		}

		public final String name;
		public final String superName;
		public final List<Prop> props;
		public final AstType.TableIndexer indexer;

		public DeclareClass(Location location, String name, String superName, List<Prop> props, AstType.TableIndexer indexer)
		{
			super(location);
			this.name = name;
			this.superName = superName;
			this.props = props;
			this.indexer = indexer;
		}

		@Override
		public <R, C> R accept(Visitor<R, C> visitor, C ctx)
		{
			return visitor.visitDeclareClass(this, ctx);
		}
	}

	/**
	 * Placeholder the parser leaves where it could not build a statement.
	 */
	public static class Error extends AstStat
	{
		public final List<AstExpr> expressions;
		public final List<AstStat> statements;

		public Error(Location location, List<AstExpr> expressions, List<AstStat> statements)
		{
			super(location);
			this.expressions = expressions;
			this.statements = statements;
		}

		@Override
		public <R, C> R accept(Visitor<R, C> visitor, C ctx)
		{
			return visitor.visitError(this, ctx);
		}
	}
}
