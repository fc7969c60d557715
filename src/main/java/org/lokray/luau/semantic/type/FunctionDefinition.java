package org.lokray.luau.semantic.type;

import org.lokray.luau.ast.Location;

/**
 * Where a function type was defined, for diagnostics and tooling.
 */
public class FunctionDefinition
{
	private final String definitionModuleName;
	private final Location definitionLocation;
	private final Location varargLocation;
	private final Location originalNameLocation;

	public FunctionDefinition(String definitionModuleName, Location definitionLocation, Location varargLocation, Location originalNameLocation)
	{
		this.definitionModuleName = definitionModuleName;
		this.definitionLocation = definitionLocation;
		this.varargLocation = varargLocation;
		this.originalNameLocation = originalNameLocation;
	}

	public String getDefinitionModuleName()
	{
		return definitionModuleName;
	}

	public Location getDefinitionLocation()
	{
		return definitionLocation;
	}

	public Location getVarargLocation()
	{
		return varargLocation;
	}

	public Location getOriginalNameLocation()
	{
		return originalNameLocation;
	}
}
