package org.lokray.luau.semantic;

import org.lokray.luau.ast.AstArgumentName;
import org.lokray.luau.ast.AstExpr;
import org.lokray.luau.ast.AstLocal;
import org.lokray.luau.ast.AstStat;
import org.lokray.luau.ast.Location;
import org.lokray.luau.dfg.Def;
import org.lokray.luau.semantic.constraint.Checkpoint;
import org.lokray.luau.semantic.constraint.Constraint;
import org.lokray.luau.semantic.constraint.GeneralizationConstraint;
import org.lokray.luau.semantic.constraint.IterableConstraint;
import org.lokray.luau.semantic.constraint.NameConstraint;
import org.lokray.luau.semantic.constraint.PackSubtypeConstraint;
import org.lokray.luau.semantic.constraint.SubtypeConstraint;
import org.lokray.luau.semantic.constraint.Unpack1Constraint;
import org.lokray.luau.semantic.constraint.UnpackConstraint;
import org.lokray.luau.semantic.error.DuplicateTypeDefinition;
import org.lokray.luau.semantic.error.GenericError;
import org.lokray.luau.semantic.error.OccursCheckFailed;
import org.lokray.luau.semantic.error.UnknownSymbol;
import org.lokray.luau.semantic.module.Module;
import org.lokray.luau.semantic.module.ModuleInfo;
import org.lokray.luau.semantic.module.RequireCycle;
import org.lokray.luau.semantic.refinement.Refinement;
import org.lokray.luau.semantic.symbol.Binding;
import org.lokray.luau.semantic.symbol.GenericTypeDefinition;
import org.lokray.luau.semantic.symbol.GenericTypePackDefinition;
import org.lokray.luau.semantic.symbol.Scope;
import org.lokray.luau.semantic.symbol.Symbol;
import org.lokray.luau.semantic.symbol.TypeFun;
import org.lokray.luau.semantic.type.BlockedType;
import org.lokray.luau.semantic.type.BoundType;
import org.lokray.luau.semantic.type.ClassType;
import org.lokray.luau.semantic.type.FunctionArgument;
import org.lokray.luau.semantic.type.FunctionDefinition;
import org.lokray.luau.semantic.type.FunctionType;
import org.lokray.luau.semantic.type.IntersectionType;
import org.lokray.luau.semantic.type.LocalType;
import org.lokray.luau.semantic.type.Property;
import org.lokray.luau.semantic.type.TableIndexer;
import org.lokray.luau.semantic.type.TableState;
import org.lokray.luau.semantic.type.TableType;
import org.lokray.luau.semantic.type.TypeId;
import org.lokray.luau.semantic.type.TypePackId;
import org.lokray.luau.semantic.type.TypeUtils;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Generates constraints for statements and reports how control leaves each one.
 */
class StatementVisitor implements AstStat.Visitor<ControlFlow, Scope>
{
	private static final Set<String> METAMETHODS = Set.of(
			"__index", "__newindex", "__call", "__concat", "__unm", "__add", "__sub", "__mul", "__div",
			"__mod", "__pow", "__tostring", "__metatable", "__eq", "__lt", "__le", "__mode", "__iter",
			"__len", "__idiv");

	private final ConstraintGenerator gen;

	StatementVisitor(ConstraintGenerator gen)
	{
		this.gen = gen;
	}

	ControlFlow visit(Scope scope, AstStat stat)
	{
		try (RecursionCounter.Entry entry = gen.recursion.enter())
		{
			if (entry.isExceeded())
			{
				gen.reportCodeTooComplex(stat.location);
				return ControlFlow.NONE;
			}
			return stat.accept(this, scope);
		}
	}

	/**
	 * Visits the statements of {@code block} directly in {@code scope}. Type aliases are
	 * declared before any statement is visited so that they can refer to each other.
	 */
	ControlFlow visitBlockWithoutChildScope(Scope scope, AstStat.Block block)
	{
		try (RecursionCounter.Entry entry = gen.recursion.enter())
		{
			if (entry.isExceeded())
			{
				gen.reportCodeTooComplex(block.location);
				return ControlFlow.NONE;
			}

			prepopulateTypeAliases(scope, block);

			ControlFlow first = ControlFlow.NONE;
			for (AstStat stat : block.body)
			{
				ControlFlow cf = visit(scope, stat);
				if (cf != ControlFlow.NONE && first == ControlFlow.NONE)
				{
					first = cf;
				}
			}
			return first;
		}
	}

	private void prepopulateTypeAliases(Scope scope, AstStat.Block block)
	{
		Map<String, Location> definitionLocations = new LinkedHashMap<>();
		for (AstStat stat : block.body)
		{
			if (!(stat instanceof AstStat.TypeAlias alias))
			{
				continue;
			}

			if (scope.getExportedTypeBindings().containsKey(alias.name) || scope.getPrivateTypeBindings().containsKey(alias.name))
			{
				Location previous = definitionLocations.getOrDefault(alias.name, scope.getTypeAliasLocations().getOrDefault(alias.name, Location.NONE));
				gen.reportError(alias.location, new DuplicateTypeDefinition(alias.name, previous));
				continue;
			}

			if (alias.name.equals("typeof"))
			{
				continue;
			}

			Scope defnScope = gen.childScope(alias, scope);
			TypeId initialType = gen.blockedType();
			List<GenericTypeDefinition> typeParams = new ArrayList<>(gen.types.createGenerics(defnScope, alias.generics, true, true).values());
			List<GenericTypePackDefinition> typePackParams = new ArrayList<>(gen.types.createGenericPacks(defnScope, alias.genericPacks, true, true).values());
			TypeFun initialFun = new TypeFun(typeParams, typePackParams, initialType);

			if (alias.exported)
			{
				scope.getExportedTypeBindings().put(alias.name, initialFun);
			}
			else
			{
				scope.getPrivateTypeBindings().put(alias.name, initialFun);
			}

			gen.aliasDefiningScopes.put(alias, defnScope);
			definitionLocations.put(alias.name, alias.location);
			scope.getTypeAliasLocations().put(alias.name, alias.location);
		}
	}

	// --- Blocks and control flow ---

	@Override
	public ControlFlow visitBlock(AstStat.Block block, Scope scope)
	{
		Scope inner = gen.childScope(block, scope);
		ControlFlow flow = visitBlockWithoutChildScope(inner, block);

		// A block has one entry and one exit, so everything it learned holds after it.
		scope.inheritRefinements(inner);
		scope.inheritAssignments(inner);
		return flow;
	}

	@Override
	public ControlFlow visitBreak(AstStat.Break stat, Scope scope)
	{
		return ControlFlow.BREAKS;
	}

	@Override
	public ControlFlow visitContinue(AstStat.Continue stat, Scope scope)
	{
		return ControlFlow.CONTINUES;
	}

	@Override
	public ControlFlow visitExpr(AstStat.Expr stat, Scope scope)
	{
		gen.expressions.checkPack(scope, stat.expr, List.of(), true);
		if (stat.expr instanceof AstExpr.Call call && CallIdioms.doesCallError(call))
		{
			return ControlFlow.THROWS;
		}
		return ControlFlow.NONE;
	}

	@Override
	public ControlFlow visitReturn(AstStat.Return ret, Scope scope)
	{
		// Only an annotated return type has anything useful in it at this point.
		List<TypeId> expectedTypes = new ArrayList<>(TypeUtils.flatten(scope.getReturnType()).getHead());
		TypePackId exprTypes = gen.expressions.checkPack(scope, ret.list, expectedTypes);
		gen.addConstraint(scope, ret.location, new PackSubtypeConstraint(exprTypes, scope.getReturnType(), true));
		return ControlFlow.RETURNS;
	}

	@Override
	public ControlFlow visitIf(AstStat.If stat, Scope scope)
	{
		Refinement refinement;
		TypeContext saved = gen.typeContext;
		gen.typeContext = TypeContext.CONDITION;
		try
		{
			refinement = gen.expressions.check(scope, stat.condition).refinement();
		}
		finally
		{
			gen.typeContext = saved;
		}

		Scope thenScope = gen.childScope(stat.thenBody, scope);
		gen.refinements.applyRefinements(thenScope, stat.condition.location, refinement);

		Scope elseScope = gen.childScope(stat.elseBody != null ? stat.elseBody : stat, scope);
		Location elseLocation = stat.elseLocation != null && !stat.elseLocation.equals(Location.NONE) ? stat.elseLocation : stat.condition.location;
		gen.refinements.applyRefinements(elseScope, elseLocation, gen.refinementArena.negation(refinement));

		ControlFlow thencf = visit(thenScope, stat.thenBody);
		ControlFlow elsecf = stat.elseBody != null ? visit(elseScope, stat.elseBody) : ControlFlow.NONE;

		// If one branch leaves, whatever the other branch learned holds afterwards.
		if (thencf != ControlFlow.NONE && elsecf == ControlFlow.NONE)
		{
			scope.inheritRefinements(elseScope);
		}
		else if (thencf == ControlFlow.NONE && elsecf != ControlFlow.NONE)
		{
			scope.inheritRefinements(thenScope);
		}

		if (thencf == ControlFlow.NONE)
		{
			scope.inheritAssignments(thenScope);
		}
		if (elsecf == ControlFlow.NONE)
		{
			scope.inheritAssignments(elseScope);
		}

		if (thencf == elsecf)
		{
			return thencf;
		}
		if (thencf.isExit() && elsecf.isExit())
		{
			return ControlFlow.RETURNS;
		}
		return ControlFlow.NONE;
	}

	@Override
	public ControlFlow visitWhile(AstStat.While stat, Scope scope)
	{
		Refinement refinement = gen.expressions.check(scope, stat.condition).refinement();
		Scope whileScope = gen.childScope(stat, scope);
		gen.refinements.applyRefinements(whileScope, stat.condition.location, refinement);
		visit(whileScope, stat.body);
		return ControlFlow.NONE;
	}

	@Override
	public ControlFlow visitRepeat(AstStat.Repeat stat, Scope scope)
	{
		Scope repeatScope = gen.childScope(stat, scope);
		visitBlockWithoutChildScope(repeatScope, stat.body);
		// The condition sees the body's locals.
		gen.expressions.check(repeatScope, stat.condition);
		return ControlFlow.NONE;
	}

	@Override
	public ControlFlow visitFor(AstStat.For stat, Scope scope)
	{
		TypeId annotationTy = gen.builtinTypes.numberType;
		if (stat.var.annotation != null)
		{
			annotationTy = gen.types.resolveType(scope, stat.var.annotation, false);
		}

		for (AstExpr bound : new AstExpr[]{stat.from, stat.to, stat.step})
		{
			if (bound != null)
			{
				TypeId t = gen.expressions.check(scope, bound).ty();
				gen.addConstraint(scope, bound.location, new SubtypeConstraint(t, gen.builtinTypes.numberType));
			}
		}

		Scope forScope = gen.childScope(stat, scope);
		forScope.getBindings().put(Symbol.local(stat.var), new Binding(annotationTy, stat.var.location));
		Def def = gen.dfg.getDef(stat.var);
		forScope.getLvalueTypes().put(def, annotationTy);
		forScope.getRvalueRefinements().put(def, annotationTy);

		visit(forScope, stat.body);
		return ControlFlow.NONE;
	}

	@Override
	public ControlFlow visitForIn(AstStat.ForIn stat, Scope scope)
	{
		Scope loopScope = gen.childScope(stat, scope);
		TypePackId iterator = gen.expressions.checkPack(scope, stat.values, List.of());

		List<TypeId> variableTypes = new ArrayList<>();
		for (AstLocal var : stat.vars)
		{
			TypeId assignee = gen.addType(new LocalType(gen.builtinTypes.neverType, 1, var.name));
			variableTypes.add(assignee);

			if (var.annotation != null)
			{
				TypeId annotationTy = gen.types.resolveType(loopScope, var.annotation, false);
				loopScope.getBindings().put(Symbol.local(var), new Binding(annotationTy, var.location));
				gen.addConstraint(scope, var.location, new SubtypeConstraint(assignee, annotationTy));
			}
			else
			{
				loopScope.getBindings().put(Symbol.local(var), new Binding(assignee, var.location));
			}

			loopScope.getLvalueTypes().put(gen.dfg.getDef(var), assignee);
		}

		Location valuesLocation = new Location(stat.values.get(0).location.getBegin(), stat.values.get(stat.values.size() - 1).location.getEnd());
		gen.addConstraint(loopScope, valuesLocation, new IterableConstraint(iterator, variableTypes, stat.values.get(0), gen.module.getAstForInNextTypes()));

		visit(loopScope, stat.body);
		return ControlFlow.NONE;
	}

	// --- Declarations ---

	@Override
	public ControlFlow visitLocal(AstStat.Local stat, Scope scope)
	{
		List<TypeId> annotatedTypes = new ArrayList<>();
		List<TypeId> expectedTypes = new ArrayList<>();
		List<TypeId> assignees = new ArrayList<>();
		boolean hasAnnotation = false;

		for (AstLocal local : stat.vars)
		{
			TypeId assignee = gen.addType(new LocalType(gen.builtinTypes.neverType, 1, local.name));
			assignees.add(assignee);

			if (local.annotation != null)
			{
				hasAnnotation = true;
				TypeId annotationTy = gen.types.resolveType(scope, local.annotation, false);
				annotatedTypes.add(annotationTy);
				expectedTypes.add(annotationTy);
				scope.getBindings().put(Symbol.local(local), new Binding(annotationTy, local.location));
			}
			else
			{
				// Unannotated locals accept anything.
				annotatedTypes.add(gen.builtinTypes.unknownType);
				expectedTypes.add(null);
				scope.getBindings().put(Symbol.local(local), new Binding(gen.builtinTypes.unknownType, local.location));
				gen.inferredBindings.put(local, new InferredBinding(scope, local.location, assignee));
			}

			scope.getLvalueTypes().put(gen.dfg.getDef(local), assignee);
		}

		TypePackId resultPack = gen.expressions.checkPack(scope, stat.values, expectedTypes);
		TypePackId assigneePack = gen.arena.addTypePack(assignees);

		if (hasAnnotation)
		{
			TypePackId annotatedPack = gen.arena.addTypePack(annotatedTypes);
			gen.addConstraint(scope, stat.location, new UnpackConstraint(assigneePack, annotatedPack, true));
			gen.addConstraint(scope, stat.location, new PackSubtypeConstraint(resultPack, annotatedPack));
		}
		else
		{
			gen.addConstraint(scope, stat.location, new UnpackConstraint(assigneePack, resultPack, true));
		}

		if (stat.vars.size() == 1 && stat.values.size() == 1 && scope == gen.rootScope && !hasAnnotation)
		{
			nameTopLevelValue(scope, stat.vars.get(0), stat.values.get(0), assignees.get(0));
		}

		for (int i = 0; i < stat.values.size() && i < stat.vars.size(); i++)
		{
			if (stat.values.get(i) instanceof AstExpr.Call call)
			{
				Optional<AstExpr> path = CallIdioms.matchRequire(call);
				if (path.isPresent())
				{
					importRequiredTypes(scope, stat.vars.get(i).name, path.get());
				}
			}
		}

		return ControlFlow.NONE;
	}

	/**
	 * {@code local Point = {}} and {@code local Point = setmetatable(...)} give the value's
	 * type the local's name.
	 */
	private void nameTopLevelValue(Scope scope, AstLocal var, AstExpr value, TypeId valueType)
	{
		boolean named = value instanceof AstExpr.Table
				|| value instanceof AstExpr.Call call && call.func instanceof AstExpr.Global global && global.name.equals("setmetatable");
		if (named)
		{
			gen.addConstraint(scope, value.location, new NameConstraint(valueType, var.name, true, List.of(), List.of()));
		}
	}

	private void importRequiredTypes(Scope scope, String localName, AstExpr path)
	{
		Optional<ModuleInfo> info = gen.moduleResolver.resolveModuleInfo(gen.module.getName(), path);
		if (info.isEmpty())
		{
			return;
		}
		Optional<Module> required = gen.moduleResolver.getModule(info.get().name());
		if (required.isEmpty())
		{
			return;
		}

		Map<String, TypeFun> imported = new LinkedHashMap<>(required.get().getExportedTypeBindings());
		scope.getImportedTypeBindings().put(localName, imported);
		scope.getImportedModules().put(localName, info.get().name());

		// Types from a module that requires this one back are not available yet.
		for (RequireCycle cycle : gen.requireCycles)
		{
			if (!cycle.path().isEmpty() && cycle.path().get(0).equals(info.get().name()))
			{
				imported.replaceAll((name, typeFun) -> new TypeFun(gen.builtinTypes.anyType));
			}
		}
	}

	@Override
	public ControlFlow visitLocalFunction(AstStat.LocalFunction stat, Scope scope)
	{
		TypeId functionType = gen.blockedType();
		scope.getBindings().put(Symbol.local(stat.name), new Binding(functionType, stat.name.location));

		FunctionSignature sig = gen.signatures.checkFunctionSignature(scope, stat.func, null, stat.name.location);
		// Inside its own body the function refers to its ungeneralized signature.
		sig.bodyScope().getBindings().put(Symbol.local(stat.name), new Binding(sig.signature(), stat.func.location));

		boolean sigFullyDefined = !TypeUtils.hasFreeType(sig.signature());
		if (sigFullyDefined)
		{
			functionType.emplace(new BoundType(sig.signature()));
		}

		Def def = gen.dfg.getDef(stat.name);
		scope.getLvalueTypes().put(def, functionType);
		scope.getRvalueRefinements().put(def, functionType);
		sig.bodyScope().getLvalueTypes().put(def, sig.signature());
		sig.bodyScope().getRvalueRefinements().put(def, sig.signature());

		Checkpoint start = gen.constraints.checkpoint();
		gen.signatures.checkFunctionBody(sig.bodyScope(), stat.func);
		Checkpoint end = gen.constraints.checkpoint();

		if (!sigFullyDefined)
		{
			Constraint c = new Constraint(sig.signatureScope(), stat.name.location,
					new GeneralizationConstraint(functionType, sig.signature(), List.of()));
			gen.constraints.governRange(c, start, end, Set.of());
			gen.constraints.add(c);
			functionType.get(BlockedType.class).setOwner(c);
			gen.module.getAstTypes().put(stat.func, functionType);
		}
		else
		{
			gen.module.getAstTypes().put(stat.func, sig.signature());
		}

		return ControlFlow.NONE;
	}

	@Override
	public ControlFlow visitFunction(AstStat.Function stat, Scope scope)
	{
		TypeId generalizedType = gen.blockedType();
		Checkpoint start = gen.constraints.checkpoint();
		FunctionSignature sig = gen.signatures.checkFunctionSignature(scope, stat.func, null, stat.name.location);

		boolean sigFullyDefined = !TypeUtils.hasFreeType(sig.signature());
		if (sigFullyDefined)
		{
			generalizedType.emplace(new BoundType(sig.signature()));
		}

		Set<Constraint> excluded = Collections.newSetFromMap(new IdentityHashMap<>());
		Def def = gen.dfg.getDef(stat.name);
		TypeId existingFunctionTy = gen.definitions.lookup(scope, stat.name.location, def).map(TypeId::follow).orElse(null);

		if (existingFunctionTy != null && existingFunctionTy.is(BlockedType.class) && sigFullyDefined)
		{
			existingFunctionTy.emplace(new BoundType(sig.signature()));
		}

		if (stat.name instanceof AstExpr.Local localName)
		{
			if (existingFunctionTy != null)
			{
				gen.addConstraint(scope, stat.name.location, new SubtypeConstraint(generalizedType, existingFunctionTy));
			}
			scope.getBindings().put(Symbol.local(localName.local), new Binding(sig.signature(), localName.location));
			scope.getLvalueTypes().put(def, sig.signature());
			scope.getRvalueRefinements().put(def, sig.signature());
		}
		else if (stat.name instanceof AstExpr.Global globalName)
		{
			if (existingFunctionTy == null)
			{
				throw gen.ice.ice("global function '" + globalName.name + "' was not prepopulated", globalName.location);
			}
			// Earlier uses already refer to the prepopulated placeholder.
			if (!sigFullyDefined)
			{
				generalizedType = existingFunctionTy;
			}
			scope.getBindings().put(Symbol.global(globalName.name), new Binding(sig.signature(), globalName.location));
			scope.getLvalueTypes().put(def, sig.signature());
			scope.getRvalueRefinements().put(def, sig.signature());
		}
		else if (stat.name instanceof AstExpr.IndexName indexName)
		{
			Checkpoint lvalueBegin = gen.constraints.checkpoint();
			LValueBounds bounds = gen.lvalues.checkLValue(scope, indexName);
			Checkpoint lvalueEnd = gen.constraints.checkpoint();
			gen.constraints.forEachBetween(lvalueBegin, lvalueEnd, excluded::add);

			TypeId lvalueType = bounds.assignedTy();
			if (lvalueType != null && lvalueType != generalizedType)
			{
				if (!lvalueType.is(BlockedType.class))
				{
					throw gen.ice.ice("assignment target of a function statement is not a placeholder", indexName.location);
				}
				lvalueType.emplace(new BoundType(generalizedType));
			}
		}
		else if (stat.name instanceof AstExpr.Error)
		{
			generalizedType = gen.builtinTypes.errorRecoveryType();
		}

		scope.getRvalueRefinements().put(def, generalizedType);

		gen.signatures.checkFunctionBody(sig.bodyScope(), stat.func);
		Checkpoint end = gen.constraints.checkpoint();

		if (!sigFullyDefined)
		{
			Constraint c = new Constraint(sig.signatureScope(), stat.name.location,
					new GeneralizationConstraint(generalizedType, sig.signature(), List.of()));
			gen.constraints.governRange(c, start, end, excluded);
			gen.constraints.add(c);

			BlockedType blocked = generalizedType.get(BlockedType.class);
			if (blocked != null && !blocked.hasOwner())
			{
				blocked.setOwner(c);
			}
		}

		// A placeholder nobody produces yet takes the generalized function.
		if (existingFunctionTy != null)
		{
			TypeId existing = existingFunctionTy.follow();
			BlockedType blocked = existing.get(BlockedType.class);
			if (blocked != null && !blocked.hasOwner())
			{
				Constraint unpack = gen.addConstraint(scope, stat.name.location, new Unpack1Constraint(existing, generalizedType, false));
				blocked.setOwner(unpack);
			}
		}

		return ControlFlow.NONE;
	}

	// --- Assignments ---

	@Override
	public ControlFlow visitAssign(AstStat.Assign stat, Scope scope)
	{
		List<TypeId> upperBounds = new ArrayList<>();
		List<TypeId> typeStates = new ArrayList<>();
		List<TypeId> expectedTypes = new ArrayList<>();

		Checkpoint lvalueBegin = gen.constraints.checkpoint();
		for (AstExpr var : stat.vars)
		{
			LValueBounds bounds = gen.lvalues.checkLValue(scope, var);
			upperBounds.add(bounds.annotatedTy() != null ? bounds.annotatedTy() : gen.builtinTypes.unknownType);
			typeStates.add(bounds.assignedTy() != null ? bounds.assignedTy() : gen.builtinTypes.unknownType);
			expectedTypes.add(bounds.annotatedTy());
		}
		Checkpoint lvalueEnd = gen.constraints.checkpoint();

		TypePackId resultPack = gen.expressions.checkPack(scope, stat.values, expectedTypes);

		Constraint uc = gen.addConstraint(scope, stat.location, new UnpackConstraint(gen.arena.addTypePack(typeStates), resultPack, true));
		gen.constraints.forEachBetween(lvalueBegin, lvalueEnd, uc::addDependency);

		Constraint psc = gen.addConstraint(scope, stat.location, new PackSubtypeConstraint(resultPack, gen.arena.addTypePack(upperBounds)));
		psc.addDependency(uc);

		for (TypeId assignee : typeStates)
		{
			BlockedType blocked = assignee.get(BlockedType.class);
			if (blocked != null && !blocked.hasOwner())
			{
				blocked.setOwner(uc);
			}
		}

		return ControlFlow.NONE;
	}

	@Override
	public ControlFlow visitCompoundAssign(AstStat.CompoundAssign stat, Scope scope)
	{
		AstExpr.Binary binop = new AstExpr.Binary(stat.location, stat.op, stat.var, stat.value);
		TypeId resultTy = gen.expressions.check(scope, binop).ty();

		LValueBounds bounds = gen.lvalues.checkLValue(scope, stat.var);

		Constraint sc = null;
		if (bounds.annotatedTy() != null)
		{
			sc = gen.addConstraint(scope, stat.location, new SubtypeConstraint(resultTy, bounds.annotatedTy()));
		}

		if (bounds.assignedTy() != null)
		{
			Constraint uc = gen.addConstraint(scope, stat.location, new Unpack1Constraint(bounds.assignedTy(), resultTy, true));
			BlockedType blocked = bounds.assignedTy().get(BlockedType.class);
			if (blocked != null && !blocked.hasOwner())
			{
				blocked.setOwner(uc);
			}
			if (sc != null)
			{
				uc.addDependency(sc);
			}
		}

		scope.getLvalueTypes().put(gen.dfg.getDef(stat.var), resultTy);
		return ControlFlow.NONE;
	}

	// --- Type declarations ---

	@Override
	public ControlFlow visitTypeAlias(AstStat.TypeAlias alias, Scope scope)
	{
		if (alias.name.equals("typeof"))
		{
			gen.reportError(alias.location, new GenericError("Type aliases cannot be named typeof"));
			return ControlFlow.NONE;
		}

		Scope defnScope = gen.aliasDefiningScopes.get(alias);
		Map<String, TypeFun> typeBindings = alias.exported ? scope.getExportedTypeBindings() : scope.getPrivateTypeBindings();

		// Duplicate definitions were reported by the prepass and have no defining scope.
		TypeFun binding = typeBindings.get(alias.name);
		if (binding == null || defnScope == null)
		{
			return ControlFlow.NONE;
		}

		TypeId ty = gen.types.resolveType(defnScope, alias.type, false, false);
		TypeId aliasTy = binding.getType();

		if (TypeUtils.occursCheck(aliasTy, ty))
		{
			aliasTy.emplace(new BoundType(gen.builtinTypes.anyType));
			gen.reportError(alias.nameLocation, new OccursCheckFailed());
		}
		else
		{
			aliasTy.emplace(new BoundType(ty));
		}

		List<TypeId> typeParams = new ArrayList<>();
		for (GenericTypeDefinition def : gen.types.createGenerics(defnScope, alias.generics, true, false).values())
		{
			typeParams.add(def.ty());
		}
		List<TypePackId> typePackParams = new ArrayList<>();
		for (GenericTypePackDefinition def : gen.types.createGenericPacks(defnScope, alias.genericPacks, true, false).values())
		{
			typePackParams.add(def.tp());
		}

		gen.addConstraint(scope, alias.type.location, new NameConstraint(ty, alias.name, false, typeParams, typePackParams));
		return ControlFlow.NONE;
	}

	@Override
	public ControlFlow visitDeclareGlobal(AstStat.DeclareGlobal stat, Scope scope)
	{
		TypeId globalTy = gen.types.resolveType(scope, stat.type, false);
		gen.module.getDeclaredGlobals().put(stat.name, globalTy);
		gen.rootScope.getBindings().put(Symbol.global(stat.name), new Binding(globalTy, stat.location));

		Def def = gen.dfg.getDef(stat);
		gen.rootScope.getLvalueTypes().put(def, globalTy);
		gen.rootScope.getRvalueRefinements().put(def, globalTy);
		return ControlFlow.NONE;
	}

	@Override
	public ControlFlow visitDeclareFunction(AstStat.DeclareFunction stat, Scope scope)
	{
		Map<String, GenericTypeDefinition> generics = gen.types.createGenerics(scope, stat.generics, false, true);
		Map<String, GenericTypePackDefinition> genericPacks = gen.types.createGenericPacks(scope, stat.genericPacks, false, true);

		List<TypeId> genericTys = new ArrayList<>();
		for (GenericTypeDefinition def : generics.values())
		{
			genericTys.add(def.ty());
		}
		List<TypePackId> genericTps = new ArrayList<>();
		for (GenericTypePackDefinition def : genericPacks.values())
		{
			genericTps.add(def.tp());
		}

		Scope funScope = scope;
		if (!generics.isEmpty() || !genericPacks.isEmpty())
		{
			funScope = gen.childScope(stat, scope);
		}

		TypePackId paramPack = gen.types.resolveTypePack(funScope, stat.params, false);
		TypePackId retPack = gen.types.resolveTypePack(funScope, stat.retTypes, false);

		FunctionType ftv = new FunctionType(genericTys, genericTps, paramPack, retPack);
		ftv.setCheckedFunction(stat.checkedFunction);
		ftv.setDefinition(new FunctionDefinition(gen.module.getName(), stat.location, null, stat.nameLocation));
		for (AstArgumentName paramName : stat.paramNames)
		{
			ftv.getArgNames().add(new FunctionArgument(paramName.name, paramName.location));
		}
		TypeId fnType = gen.addType(ftv);

		gen.module.getDeclaredGlobals().put(stat.name, fnType);
		scope.getBindings().put(Symbol.global(stat.name), new Binding(fnType, stat.location));

		Def def = gen.dfg.getDef(stat);
		gen.rootScope.getLvalueTypes().put(def, fnType);
		gen.rootScope.getRvalueRefinements().put(def, fnType);
		return ControlFlow.NONE;
	}

	@Override
	public ControlFlow visitDeclareClass(AstStat.DeclareClass stat, Scope scope)
	{
		TypeId superTy = gen.builtinTypes.classType;
		if (stat.superName != null)
		{
			Optional<TypeFun> lookup = scope.lookupType(stat.superName);
			if (lookup.isEmpty())
			{
				gen.reportError(stat.location, new UnknownSymbol(stat.superName, UnknownSymbol.Context.TYPE));
				return ControlFlow.NONE;
			}

			superTy = lookup.get().getType().follow();
			if (!superTy.is(ClassType.class))
			{
				gen.reportError(stat.location, new GenericError(String.format("Cannot use non-class type '%s' as a superclass of class '%s'",
						stat.superName, stat.name)));
				return ControlFlow.NONE;
			}
		}

		TableType metatable = new TableType(TableState.SEALED, scope);
		TypeId metaTy = gen.addType(metatable);
		ClassType classType = new ClassType(stat.name, superTy, metaTy, gen.module.getName(), stat.location);
		TypeId classTy = gen.addType(classType);

		scope.getExportedTypeBindings().put(stat.name, new TypeFun(classTy));

		if (stat.indexer != null)
		{
			try (RecursionCounter.Entry entry = gen.recursion.enter())
			{
				if (entry.isExceeded())
				{
					gen.reportCodeTooComplex(stat.indexer.location);
				}
				else
				{
					classType.setIndexer(new TableIndexer(
							gen.types.resolveType(scope, stat.indexer.indexType, false),
							gen.types.resolveType(scope, stat.indexer.resultType, false)));
				}
			}
		}

		for (AstStat.DeclareClass.Prop prop : stat.props)
		{
			TypeId propTy = gen.types.resolveType(scope, prop.type, false);
			boolean toMetatable = METAMETHODS.contains(prop.name);

			if (prop.isMethod)
			{
				addSelfParameter(propTy, classTy);
			}

			Map<String, Property> target = toMetatable ? metatable.getProps() : classType.getProps();
			if (!target.containsKey(prop.name))
			{
				target.put(prop.name, Property.rw(propTy));
				continue;
			}

			// Redeclaring a method adds an overload.
			TypeId currentTy = target.get(prop.name).type();
			IntersectionType intersection = currentTy.get(IntersectionType.class);
			if (intersection != null)
			{
				List<TypeId> parts = new ArrayList<>(intersection.getParts());
				parts.add(propTy);
				target.put(prop.name, Property.rw(gen.addType(new IntersectionType(parts))));
			}
			else if (currentTy.is(FunctionType.class))
			{
				target.put(prop.name, Property.rw(gen.addType(new IntersectionType(List.of(currentTy, propTy)))));
			}
			else
			{
				gen.reportError(stat.location, new GenericError(String.format("Cannot overload non-function class member '%s'", prop.name)));
			}
		}

		return ControlFlow.NONE;
	}

	/**
	 * Rewrites a declared method's function type so that it takes the class as its first
	 * argument.
	 */
	private void addSelfParameter(TypeId propTy, TypeId classTy)
	{
		FunctionType method = propTy.get(FunctionType.class);
		if (method == null)
		{
			return;
		}

		FunctionType withSelf = new FunctionType(method.getScope(), gen.addTypePack(List.of(classTy), method.getArgTypes()), method.getRetTypes());
		withSelf.getGenerics().addAll(method.getGenerics());
		withSelf.getGenericPacks().addAll(method.getGenericPacks());
		withSelf.getArgNames().add(new FunctionArgument("self", Location.NONE));
		withSelf.getArgNames().addAll(method.getArgNames());
		withSelf.setHasSelf(true);
		withSelf.setCheckedFunction(method.isCheckedFunction());
		withSelf.setDefinition(method.getDefinition());
		propTy.emplace(withSelf);
	}

	@Override
	public ControlFlow visitError(AstStat.Error stat, Scope scope)
	{
		for (AstStat inner : stat.statements)
		{
			visit(scope, inner);
		}
		for (AstExpr expr : stat.expressions)
		{
			gen.expressions.check(scope, expr);
		}
		return ControlFlow.NONE;
	}
}
