package org.lokray.luau.ast;

import java.util.List;

/**
 * A list of types with an optional pack tail, as in {@code (number, string, ...any)}.
 */
public class AstTypeList
{
	public final List<AstType> types;
	public final AstTypePack tailType;

	public AstTypeList(List<AstType> types, AstTypePack tailType)
	{
		this.types = types;
		this.tailType = tailType;
	}

	public static AstTypeList empty()
	{
		return new AstTypeList(List.of(), null);
	}
}
