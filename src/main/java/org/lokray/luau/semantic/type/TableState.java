package org.lokray.luau.semantic.type;

public enum TableState
{
	// Inferred for a table the solver may still widen
	FREE,
	// A table literal; new properties may be added by assignment
	UNSEALED,
	// Fixed shape, from an annotation or a finished inference
	SEALED,
	GENERIC
}
