package org.lokray.luau.semantic.constraint;

/**
 * A position in the constraint log.
 */
public record Checkpoint(int offset)
{
}
