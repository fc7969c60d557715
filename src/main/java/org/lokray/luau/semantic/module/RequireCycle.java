package org.lokray.luau.semantic.module;

import org.lokray.luau.ast.Location;

import java.util.List;

/**
 * A cycle of requires found before checking. {@code path} starts with the module required at
 * {@code location}.
 */
public record RequireCycle(Location location, List<String> path)
{
}
