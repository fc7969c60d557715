package org.lokray.luau.ast;

/**
 * One type argument of a type reference; exactly one side is set.
 */
public class AstTypeOrPack
{
	public final AstType type;
	public final AstTypePack typePack;

	private AstTypeOrPack(AstType type, AstTypePack typePack)
	{
		this.type = type;
		this.typePack = typePack;
	}

	public static AstTypeOrPack of(AstType type)
	{
		return new AstTypeOrPack(type, null);
	}

	public static AstTypeOrPack of(AstTypePack typePack)
	{
		return new AstTypeOrPack(null, typePack);
	}
}
