package org.lokray.luau.semantic;

import org.lokray.luau.ast.AstBuilder;
import org.lokray.luau.ast.AstExpr;
import org.lokray.luau.ast.AstStat;
import org.lokray.luau.dfg.TestDataFlowGraphBuilder;
import org.lokray.luau.semantic.constraint.Constraint;
import org.lokray.luau.semantic.constraint.ConstraintPayload;
import org.lokray.luau.semantic.error.TypeError;
import org.lokray.luau.semantic.error.TypeErrorData;
import org.lokray.luau.semantic.module.Module;
import org.lokray.luau.semantic.module.ModuleInfo;
import org.lokray.luau.semantic.module.ModuleResolver;
import org.lokray.luau.semantic.module.RequireCycle;
import org.lokray.luau.semantic.symbol.Scope;
import org.lokray.luau.semantic.type.BuiltinTypes;
import org.lokray.luau.util.ErrorHandler;
import org.lokray.luau.util.GeneratorOptions;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Runs the generator over a hand-built tree with an in-memory module resolver.
 */
class GeneratorFixture implements ModuleResolver
{
	final AstBuilder ast = new AstBuilder();
	final BuiltinTypes builtinTypes = new BuiltinTypes();
	final Scope globalScope = builtinTypes.createGlobalScope();
	final Map<String, Module> modules = new HashMap<>();
	final List<RequireCycle> requireCycles = new ArrayList<>();
	final ErrorHandler errorHandler = new ErrorHandler();

	GeneratorOptions options = GeneratorOptions.defaults();
	GenerationLogger logger;
	Module module;
	ConstraintGenerator generator;

	ConstraintGenerator generate(AstStat.Block block)
	{
		return generate("main", block);
	}

	ConstraintGenerator generate(String moduleName, AstStat.Block block)
	{
		module = new Module(moduleName);
		generator = new ConstraintGenerator(module, builtinTypes, this, globalScope, TestDataFlowGraphBuilder.build(block),
				requireCycles, options, errorHandler, logger, new StructuralErrorSuppressionPolicy());
		generator.visitModuleRoot(block);
		return generator;
	}

	List<Constraint> constraintsOf(Class<? extends ConstraintPayload> kind)
	{
		List<Constraint> result = new ArrayList<>();
		for (Constraint constraint : generator.getConstraints())
		{
			if (kind.isInstance(constraint.getPayload()))
			{
				result.add(constraint);
			}
		}
		return result;
	}

	<T extends ConstraintPayload> List<T> payloads(Class<T> kind)
	{
		List<T> result = new ArrayList<>();
		for (Constraint constraint : generator.getConstraints())
		{
			T payload = constraint.getPayload(kind);
			if (payload != null)
			{
				result.add(payload);
			}
		}
		return result;
	}

	List<TypeErrorData> errors()
	{
		List<TypeErrorData> result = new ArrayList<>();
		for (TypeError error : generator.getErrors())
		{
			result.add(error.getData());
		}
		return result;
	}

	// --- ModuleResolver ---

	@Override
	public Optional<ModuleInfo> resolveModuleInfo(String currentModuleName, AstExpr pathExpr)
	{
		if (pathExpr instanceof AstExpr.ConstantString path)
		{
			return Optional.of(new ModuleInfo(path.value));
		}
		return Optional.empty();
	}

	@Override
	public Optional<Module> getModule(String moduleName)
	{
		return Optional.ofNullable(modules.get(moduleName));
	}
}
