package org.lokray.luau.semantic.type;

/**
 * A type term stored in a {@link TypeId} slot.
 */
public interface Type
{
	String getName();
}
