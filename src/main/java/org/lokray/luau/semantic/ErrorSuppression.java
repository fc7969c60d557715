package org.lokray.luau.semantic;

public enum ErrorSuppression
{
	DO_NOT_SUPPRESS,
	SUPPRESS,
	NORMALIZATION_FAILED
}
