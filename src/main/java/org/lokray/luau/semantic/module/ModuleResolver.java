package org.lokray.luau.semantic.module;

import org.lokray.luau.ast.AstExpr;

import java.util.Optional;

/**
 * Answers {@code require} questions for the generator. Implementations are expected to be
 * synchronous and memoized.
 */
public interface ModuleResolver
{
	Optional<ModuleInfo> resolveModuleInfo(String currentModuleName, AstExpr pathExpr);

	/**
	 * A module that has already been checked, or empty if it is unknown or not loaded yet.
	 */
	Optional<Module> getModule(String moduleName);
}
