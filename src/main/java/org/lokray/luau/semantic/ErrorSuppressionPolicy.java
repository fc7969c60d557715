package org.lokray.luau.semantic;

import org.lokray.luau.semantic.type.TypeId;

/**
 * Decides whether narrowing a type would only produce follow-on errors, because the type
 * already is or contains an error or {@code any}.
 */
public interface ErrorSuppressionPolicy
{
	ErrorSuppression shouldSuppressErrors(TypeId ty);
}
