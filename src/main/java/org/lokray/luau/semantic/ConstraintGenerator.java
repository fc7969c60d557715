package org.lokray.luau.semantic;

import org.lokray.luau.ast.AstExpr;
import org.lokray.luau.ast.AstLocal;
import org.lokray.luau.ast.AstNode;
import org.lokray.luau.ast.AstStat;
import org.lokray.luau.ast.Location;
import org.lokray.luau.dfg.DataFlowGraph;
import org.lokray.luau.semantic.constraint.Checkpoint;
import org.lokray.luau.semantic.constraint.Constraint;
import org.lokray.luau.semantic.constraint.ConstraintLog;
import org.lokray.luau.semantic.constraint.ConstraintPayload;
import org.lokray.luau.semantic.constraint.GeneralizationConstraint;
import org.lokray.luau.semantic.constraint.PackSubtypeConstraint;
import org.lokray.luau.semantic.constraint.ReduceConstraint;
import org.lokray.luau.semantic.error.CodeTooComplex;
import org.lokray.luau.semantic.error.TypeError;
import org.lokray.luau.semantic.error.TypeErrorData;
import org.lokray.luau.semantic.module.Module;
import org.lokray.luau.semantic.module.ModuleResolver;
import org.lokray.luau.semantic.module.RequireCycle;
import org.lokray.luau.semantic.refinement.RefinementArena;
import org.lokray.luau.semantic.symbol.Binding;
import org.lokray.luau.semantic.symbol.Scope;
import org.lokray.luau.semantic.symbol.Symbol;
import org.lokray.luau.semantic.type.BlockedType;
import org.lokray.luau.semantic.type.BuiltinTypeFamily;
import org.lokray.luau.semantic.type.BuiltinTypes;
import org.lokray.luau.semantic.type.FreeType;
import org.lokray.luau.semantic.type.FreeTypePack;
import org.lokray.luau.semantic.type.FunctionType;
import org.lokray.luau.semantic.type.Type;
import org.lokray.luau.semantic.type.TypeArena;
import org.lokray.luau.semantic.type.TypeFamilyInstanceType;
import org.lokray.luau.semantic.type.TypeId;
import org.lokray.luau.semantic.type.TypePackId;
import org.lokray.luau.util.Debug;
import org.lokray.luau.util.ErrorHandler;
import org.lokray.luau.util.GeneratorOptions;
import org.lokray.luau.util.InternalErrorReporter;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Walks one module's syntax tree and emits the constraints, scopes and per-node type
 * annotations a solver needs to infer its types. Nothing is solved here: every type that
 * depends on another constraint is left as a placeholder owned by that constraint.
 *
 * <p>One generator handles one module and is not reusable.</p>
 */
public class ConstraintGenerator
{
	// --- Inputs ---
	final Module module;
	final BuiltinTypes builtinTypes;
	final TypeArena arena;
	final ModuleResolver moduleResolver;
	final Scope globalScope;
	final DataFlowGraph dfg;
	final List<RequireCycle> requireCycles;
	final GeneratorOptions options;
	final ErrorSuppressionPolicy suppressionPolicy;
	final InternalErrorReporter ice;
	private final ErrorHandler errorHandler;
	private final GenerationLogger logger;

	// --- Pass state ---
	final ConstraintLog constraints = new ConstraintLog();
	final RefinementArena refinementArena = new RefinementArena();
	final RecursionCounter recursion;
	final Deque<List<TypeId>> interiorTypes = new ArrayDeque<>();
	final Map<AstLocal, InferredBinding> inferredBindings = new LinkedHashMap<>();
	final Map<AstStat.TypeAlias, Scope> aliasDefiningScopes = new IdentityHashMap<>();
	TypeContext typeContext = TypeContext.DEFAULT;
	Scope rootScope;

	// --- Collaborators ---
	final DefinitionResolver definitions;
	final RefinementEngine refinements;
	final StatementVisitor statements;
	final ExpressionChecker expressions;
	final LValueChecker lvalues;
	final TypeResolver types;
	final SignatureBuilder signatures;

	public ConstraintGenerator(Module module, BuiltinTypes builtinTypes, ModuleResolver moduleResolver, Scope globalScope,
							   DataFlowGraph dfg, List<RequireCycle> requireCycles, GeneratorOptions options,
							   ErrorHandler errorHandler, GenerationLogger logger, ErrorSuppressionPolicy suppressionPolicy)
	{
		this.module = module;
		this.builtinTypes = builtinTypes;
		this.arena = module.getInternalTypes();
		this.moduleResolver = moduleResolver;
		this.globalScope = globalScope;
		this.dfg = dfg;
		this.requireCycles = requireCycles;
		this.options = options;
		this.errorHandler = errorHandler;
		this.logger = logger;
		this.suppressionPolicy = suppressionPolicy;
		this.ice = new InternalErrorReporter(module.getName());
		this.recursion = new RecursionCounter(options.getRecursionLimit());

		this.definitions = new DefinitionResolver(this);
		this.refinements = new RefinementEngine(this);
		this.statements = new StatementVisitor(this);
		this.expressions = new ExpressionChecker(this);
		this.lvalues = new LValueChecker(this);
		this.types = new TypeResolver(this);
		this.signatures = new SignatureBuilder(this);
	}

	public ConstraintGenerator(Module module, BuiltinTypes builtinTypes, ModuleResolver moduleResolver, Scope globalScope,
							   DataFlowGraph dfg, List<RequireCycle> requireCycles, GeneratorOptions options,
							   ErrorHandler errorHandler)
	{
		this(module, builtinTypes, moduleResolver, globalScope, dfg, requireCycles, options, errorHandler, null,
				new StructuralErrorSuppressionPolicy());
	}

	/**
	 * Generates constraints for the whole module. The module body is treated as a function of
	 * no arguments whose generalization depends on everything emitted for the body.
	 */
	public void visitModuleRoot(AstStat.Block block)
	{
		Debug.logDebug(module.getName(), "Generating constraints...");

		rootScope = new Scope(globalScope);
		globalScope.addChild(rootScope);
		rootScope.setLocation(block.location);
		module.getScopes().add(new Module.ScopeEntry(block.location, rootScope));
		module.getAstScopes().put(block, rootScope);

		rootScope.setReturnType(freshTypePack(rootScope));
		TypeId moduleFnTy = arena.addType(new FunctionType(rootScope, builtinTypes.anyTypePack, rootScope.getReturnType()));

		List<TypeId> interior = new ArrayList<>();
		interiorTypes.push(interior);

		Debug.logDebug(module.getName(), "Prepopulating global scope...");
		new GlobalPrepopulator(rootScope, arena, dfg).walk(block);

		Checkpoint start = constraints.checkpoint();
		ControlFlow cf = statements.visitBlockWithoutChildScope(rootScope, block);
		if (cf == ControlFlow.NONE)
		{
			addConstraint(rootScope, block.location, new PackSubtypeConstraint(builtinTypes.emptyTypePack, rootScope.getReturnType()));
		}
		Checkpoint end = constraints.checkpoint();

		TypeId result = arena.addType(new BlockedType());
		Constraint generalization = new Constraint(rootScope, block.location, new GeneralizationConstraint(result, moduleFnTy, interior));
		constraints.forEachBetween(start, end, generalization::addDependency);
		constraints.add(generalization);
		result.get(BlockedType.class).setOwner(generalization);

		interiorTypes.pop();
		fillInInferredBindings(block);
		module.getExportedTypeBindings().putAll(rootScope.getExportedTypeBindings());

		if (logger != null)
		{
			logger.captureGenerationModule(module, constraints.getConstraints());
		}

		if (Debug.ENABLE_DEBUG && !constraints.isAcyclic())
		{
			throw ice.ice("Constraint dependency graph has a cycle", block.location);
		}

		Debug.logDebug(module.getName(), "Generated " + constraints.size() + " constraints and " + module.getScopes().size() + " scopes");
	}

	public List<Constraint> getConstraints()
	{
		return constraints.getConstraints();
	}

	public Scope getRootScope()
	{
		return rootScope;
	}

	public List<TypeError> getErrors()
	{
		return module.getErrors();
	}

	// --- Allocation helpers ---

	TypeId freshType(Scope scope)
	{
		return arena.addType(new FreeType(scope, builtinTypes.neverType, builtinTypes.unknownType));
	}

	TypePackId freshTypePack(Scope scope)
	{
		return arena.addTypePack(new FreeTypePack(scope));
	}

	TypeId addType(Type type)
	{
		return arena.addType(type);
	}

	TypeId blockedType()
	{
		return arena.addType(new BlockedType());
	}

	/**
	 * A pack of {@code head} followed by {@code tail}; an empty head collapses to the tail.
	 */
	TypePackId addTypePack(List<TypeId> head, TypePackId tail)
	{
		if (head.isEmpty())
		{
			return tail != null ? tail : builtinTypes.emptyTypePack;
		}
		return arena.addTypePack(new ArrayList<>(head), tail);
	}

	Scope childScope(AstNode node, Scope parent)
	{
		Scope scope = new Scope(parent);
		parent.addChild(scope);
		scope.setLocation(node.location);
		module.getScopes().add(new Module.ScopeEntry(node.location, scope));
		module.getAstScopes().put(node, scope);
		return scope;
	}

	Constraint addConstraint(Scope scope, Location location, ConstraintPayload payload)
	{
		return constraints.add(scope, location, payload);
	}

	/**
	 * Allocates a deferred type family application and the constraint that reduces it.
	 */
	TypeId createFamilyInstance(BuiltinTypeFamily family, List<TypeId> args, Scope scope, Location location)
	{
		TypeId result = arena.addType(new TypeFamilyInstanceType(family, List.copyOf(args), List.of()));
		addConstraint(scope, location, new ReduceConstraint(result));
		return result;
	}

	TypeId makeUnion(Scope scope, Location location, TypeId lhs, TypeId rhs)
	{
		return createFamilyInstance(BuiltinTypeFamily.UNION, List.of(lhs, rhs), scope, location);
	}

	TypeId makeIntersect(Scope scope, Location location, TypeId lhs, TypeId rhs)
	{
		return createFamilyInstance(BuiltinTypeFamily.INTERSECT, List.of(lhs, rhs), scope, location);
	}

	// --- Diagnostics ---

	void reportError(Location location, TypeErrorData data)
	{
		TypeError error = new TypeError(location, module.getName(), data);
		module.getErrors().add(error);
		errorHandler.report(error);
		if (logger != null)
		{
			logger.captureGenerationError(error);
		}
	}

	void reportCodeTooComplex(Location location)
	{
		reportError(location, new CodeTooComplex());
	}

	// --- Inferred bindings ---

	void recordInferredBinding(AstLocal local, TypeId ty)
	{
		InferredBinding binding = inferredBindings.get(local);
		if (binding != null)
		{
			binding.add(ty);
		}
	}

	private void fillInInferredBindings(AstStat.Block block)
	{
		for (Map.Entry<AstLocal, InferredBinding> entry : inferredBindings.entrySet())
		{
			InferredBinding inferred = entry.getValue();
			List<TypeId> tys = new ArrayList<>(inferred.getTypes());
			TypeId ty;
			if (tys.size() == 1)
			{
				ty = tys.get(0);
			}
			else
			{
				ty = createFamilyInstance(BuiltinTypeFamily.UNION, tys, rootScope, block.location);
			}
			inferred.getScope().getBindings().put(Symbol.local(entry.getKey()), new Binding(ty, inferred.getLocation()));
		}
	}
}
