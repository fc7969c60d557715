package org.lokray.luau.semantic.type;

import org.lokray.luau.semantic.symbol.Scope;

import java.util.LinkedHashMap;
import java.util.Map;

public class TableType implements Type
{
	private final Map<String, Property> props = new LinkedHashMap<>();
	private TableIndexer indexer;
	private TableState state;
	private final Scope scope;
	private String name;

	public TableType(TableState state, Scope scope)
	{
		this.state = state;
		this.scope = scope;
	}

	public TableType(Map<String, Property> props, TableIndexer indexer, TableState state, Scope scope)
	{
		this(state, scope);
		this.props.putAll(props);
		this.indexer = indexer;
	}

	public Map<String, Property> getProps()
	{
		return props;
	}

	public TableIndexer getIndexer()
	{
		return indexer;
	}

	public void setIndexer(TableIndexer indexer)
	{
		this.indexer = indexer;
	}

	public TableState getState()
	{
		return state;
	}

	public void setState(TableState state)
	{
		this.state = state;
	}

	public Scope getScope()
	{
		return scope;
	}

	public void setName(String name)
	{
		this.name = name;
	}

	@Override
	public String getName()
	{
		if (name != null)
		{
			return name;
		}
		return "{" + String.join(", ", props.keySet()) + (indexer != null ? ", [indexer]" : "") + "}";
	}
}
