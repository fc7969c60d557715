package org.lokray.luau.semantic.type;

import org.lokray.luau.ast.Location;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A host class declared with {@code declare class}.
 */
public class ClassType implements Type
{
	private final String name;
	private final Map<String, Property> props = new LinkedHashMap<>();
	private final TypeId parent;
	private final TypeId metatable;
	private final String definitionModuleName;
	private final Location definitionLocation;
	private TableIndexer indexer;

	public ClassType(String name, TypeId parent, TypeId metatable, String definitionModuleName, Location definitionLocation)
	{
		this.name = name;
		this.parent = parent;
		this.metatable = metatable;
		this.definitionModuleName = definitionModuleName;
		this.definitionLocation = definitionLocation;
	}

	public Map<String, Property> getProps()
	{
		return props;
	}

	public TypeId getParent()
	{
		return parent;
	}

	public TypeId getMetatable()
	{
		return metatable;
	}

	public String getDefinitionModuleName()
	{
		return definitionModuleName;
	}

	public Location getDefinitionLocation()
	{
		return definitionLocation;
	}

	public TableIndexer getIndexer()
	{
		return indexer;
	}

	public void setIndexer(TableIndexer indexer)
	{
		this.indexer = indexer;
	}

	@Override
	public String getName()
	{
		return name;
	}
}
