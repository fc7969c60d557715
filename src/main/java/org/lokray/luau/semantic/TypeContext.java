package org.lokray.luau.semantic;

public enum TypeContext
{
	DEFAULT,
	// Checking the test of an if statement or if-then-else expression
	CONDITION
}
