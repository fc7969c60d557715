package org.lokray.luau.semantic.module;

/**
 * A resolved {@code require} target.
 */
public record ModuleInfo(String name, boolean optional)
{
	public ModuleInfo(String name)
	{
		this(name, false);
	}
}
