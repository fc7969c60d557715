package org.lokray.luau.ast;

public abstract class AstTypePack extends AstNode
{
	protected AstTypePack(Location location)
	{
		super(location);
	}

	public abstract <R, C> R accept(Visitor<R, C> visitor, C ctx);

	public interface Visitor<R, C>
	{
		R visitExplicit(Explicit pack, C ctx);

		R visitVariadic(Variadic pack, C ctx);

		R visitGeneric(Generic pack, C ctx);
	}

	public static class Explicit extends AstTypePack
	{
		public final AstTypeList typeList;

		public Explicit(Location location, AstTypeList typeList)
		{
			super(location);
			this.typeList = typeList;
		}

		@Override
		public <R, C> R accept(Visitor<R, C> visitor, C ctx)
		{
			return visitor.visitExplicit(this, ctx);
		}
	}

	public static class Variadic extends AstTypePack
	{
		public final AstType variadicType;

		public Variadic(Location location, AstType variadicType)
		{
			super(location);
			this.variadicType = variadicType;
		}

		@Override
		public <R, C> R accept(Visitor<R, C> visitor, C ctx)
		{
			return visitor.visitVariadic(this, ctx);
		}
	}

	public static class Generic extends AstTypePack
	{
		public final String genericName;

		public Generic(Location location, String genericName)
		{
			super(location);
			this.genericName = genericName;
		}

		@Override
		public <R, C> R accept(Visitor<R, C> visitor, C ctx)
		{
			return visitor.visitGeneric(this, ctx);
		}
	}
}
