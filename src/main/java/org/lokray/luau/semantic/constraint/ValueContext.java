package org.lokray.luau.semantic.constraint;

public enum ValueContext
{
	LVALUE,
	RVALUE
}
