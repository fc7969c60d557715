package org.lokray.luau.ast;

import java.util.List;

/**
 * Syntactic type annotations.
 */
public abstract class AstType extends AstNode
{
	protected AstType(Location location)
	{
		super(location);
	}

	public abstract <R, C> R accept(Visitor<R, C> visitor, C ctx);

	public interface Visitor<R, C>
	{
		R visitReference(Reference type, C ctx);

		R visitTable(Table type, C ctx);

		R visitFunction(Function type, C ctx);

		R visitTypeof(Typeof type, C ctx);

		R visitUnion(Union type, C ctx);

		R visitIntersection(Intersection type, C ctx);

		R visitSingletonBool(SingletonBool type, C ctx);

		R visitSingletonString(SingletonString type, C ctx);

		R visitError(Error type, C ctx);
	}

	public enum Access
	{
		READ_WRITE,
		READ,
		WRITE
	}

	public static class TableProp
	{
		public final String name;
		public final Location location;
		public final AstType type;
		public final Access access;

		public TableProp(String name, Location location, AstType type, Access access)
		{
			this.name = name;
			this.location = location;
			this.type = type;
			this.access = access;
		}
	}

	public static class TableIndexer
	{
		public final AstType indexType;
		public final AstType resultType;
		public final Location location;
		public final Access access;

		public TableIndexer(AstType indexType, AstType resultType, Location location, Access access)
		{
			this.indexType = indexType;
			this.resultType = resultType;
			this.location = location;
			this.access = access;
		}
	}

	public static class Reference extends AstType
	{
		public final String prefix;
		public final String name;
		public final List<AstTypeOrPack> parameters;

		public Reference(Location location, String prefix, String name, List<AstTypeOrPack> parameters)
		{
			super(location);
			this.prefix = prefix;
			this.name = name;
			this.parameters = parameters;
		}

		public boolean hasParameterList()
		{
			return !parameters.isEmpty();
		}

		@Override
		public <R, C> R accept(Visitor<R, C> visitor, C ctx)
		{
			return visitor.visitReference(this, ctx);
		}
	}

	public static class Table extends AstType
	{
		public final List<TableProp> props;
		public final TableIndexer indexer;

		public Table(Location location, List<TableProp> props, TableIndexer indexer)
		{
			super(location);
			this.props = props;
			this.indexer = indexer;
		}

		@Override
		public <R, C> R accept(Visitor<R, C> visitor, C ctx)
		{
			return visitor.visitTable(this, ctx);
		}
	}

	public static class Function extends AstType
	{
		public final List<AstGenericType> generics;
		public final List<AstGenericTypePack> genericPacks;
		public final AstTypeList argTypes;
		// entries may be null for unnamed parameters
		public final List<AstArgumentName> argNames;
		public final AstTypeList returnTypes;
		public final boolean checkedFunction;

		public Function(Location location, List<AstGenericType> generics, List<AstGenericTypePack> genericPacks,
						AstTypeList argTypes, List<AstArgumentName> argNames, AstTypeList returnTypes, boolean checkedFunction)
		{
			super(location);
			this.generics = generics;
			this.genericPacks = genericPacks;
			this.argTypes = argTypes;
			this.argNames = argNames;
			this.returnTypes = returnTypes;
			this.checkedFunction = checkedFunction;
		}

		@Override
		public <R, C> R accept(Visitor<R, C> visitor, C ctx)
		{
			return visitor.visitFunction(this, ctx);
		}
	}

	public static class Typeof extends AstType
	{
		public final AstExpr expr;

		public Typeof(Location location, AstExpr expr)
		{
			super(location);
			this.expr = expr;
		}

		@Override
		public <R, C> R accept(Visitor<R, C> visitor, C ctx)
		{
			return visitor.visitTypeof(this, ctx);
		}
	}

	public static class Union extends AstType
	{
		public final List<AstType> types;

		public Union(Location location, List<AstType> types)
		{
			super(location);
			this.types = types;
		}

		@Override
		public <R, C> R accept(Visitor<R, C> visitor, C ctx)
		{
			return visitor.visitUnion(this, ctx);
		}
	}

	public static class Intersection extends AstType
	{
		public final List<AstType> types;

		public Intersection(Location location, List<AstType> types)
		{
			super(location);
			this.types = types;
		}

		@Override
		public <R, C> R accept(Visitor<R, C> visitor, C ctx)
		{
			return visitor.visitIntersection(this, ctx);
		}
	}

	public static class SingletonBool extends AstType
	{
		public final boolean value;

		public SingletonBool(Location location, boolean value)
		{
			super(location);
			this.value = value;
		}

		@Override
		public <R, C> R accept(Visitor<R, C> visitor, C ctx)
		{
			return visitor.visitSingletonBool(this, ctx);
		}
	}

	public static class SingletonString extends AstType
	{
		public final String value;

		public SingletonString(Location location, String value)
		{
			super(location);
			this.value = value;
		}

		@Override
		public <R, C> R accept(Visitor<R, C> visitor, C ctx)
		{
			return visitor.visitSingletonString(this, ctx);
		}
	}

	public static class Error extends AstType
	{
		public final List<AstType> types;

		public Error(Location location, List<AstType> types)
		{
			super(location);
			this.types = types;
		}

		@Override
		public <R, C> R accept(Visitor<R, C> visitor, C ctx)
		{
			return visitor.visitError(this, ctx);
		}
	}
}
