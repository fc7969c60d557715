package org.lokray.luau.semantic.type;

public class TableIndexer
{
	private final TypeId indexType;
	private final TypeId indexResultType;

	public TableIndexer(TypeId indexType, TypeId indexResultType)
	{
		this.indexType = indexType;
		this.indexResultType = indexResultType;
	}

	public TypeId getIndexType()
	{
		return indexType;
	}

	public TypeId getIndexResultType()
	{
		return indexResultType;
	}
}
