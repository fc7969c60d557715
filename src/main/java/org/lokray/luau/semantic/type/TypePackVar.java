package org.lokray.luau.semantic.type;

/**
 * A type pack term stored in a {@link TypePackId} slot.
 */
public interface TypePackVar
{
	String getName();
}
