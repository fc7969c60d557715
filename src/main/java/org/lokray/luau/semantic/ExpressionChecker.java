package org.lokray.luau.semantic;

import org.lokray.luau.ast.AstExpr;
import org.lokray.luau.ast.Location;
import org.lokray.luau.dfg.Def;
import org.lokray.luau.dfg.RefinementKey;
import org.lokray.luau.semantic.constraint.Checkpoint;
import org.lokray.luau.semantic.constraint.Constraint;
import org.lokray.luau.semantic.constraint.FunctionCallConstraint;
import org.lokray.luau.semantic.constraint.FunctionCheckConstraint;
import org.lokray.luau.semantic.constraint.GeneralizationConstraint;
import org.lokray.luau.semantic.constraint.HasIndexerConstraint;
import org.lokray.luau.semantic.constraint.HasPropConstraint;
import org.lokray.luau.semantic.constraint.PrimitiveTypeConstraint;
import org.lokray.luau.semantic.constraint.UnpackConstraint;
import org.lokray.luau.semantic.constraint.ValueContext;
import org.lokray.luau.semantic.refinement.Refinement;
import org.lokray.luau.semantic.symbol.Binding;
import org.lokray.luau.semantic.symbol.Scope;
import org.lokray.luau.semantic.symbol.Symbol;
import org.lokray.luau.semantic.symbol.TypeFun;
import org.lokray.luau.semantic.type.BlockedType;
import org.lokray.luau.semantic.type.BlockedTypePack;
import org.lokray.luau.semantic.type.BuiltinTypeFamily;
import org.lokray.luau.semantic.type.ClassType;
import org.lokray.luau.semantic.type.FreeType;
import org.lokray.luau.semantic.type.FunctionType;
import org.lokray.luau.semantic.type.IntersectionType;
import org.lokray.luau.semantic.type.MetatableType;
import org.lokray.luau.semantic.type.Property;
import org.lokray.luau.semantic.type.SingletonType;
import org.lokray.luau.semantic.type.TableIndexer;
import org.lokray.luau.semantic.type.TableState;
import org.lokray.luau.semantic.type.TableType;
import org.lokray.luau.semantic.type.TypeId;
import org.lokray.luau.semantic.type.TypePack;
import org.lokray.luau.semantic.type.TypePackId;
import org.lokray.luau.semantic.type.TypeUtils;
import org.lokray.luau.semantic.type.UnionType;
import org.lokray.luau.semantic.type.VariadicTypePack;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Infers expressions. Every result is also recorded in the module's per-node type map.
 */
class ExpressionChecker implements AstExpr.Visitor<Inference, ExpressionChecker.Request>
{
	/**
	 * @param expected       type the surrounding context expects, or null
	 * @param forceSingleton give literals their singleton type instead of a widenable free type
	 * @param generalize     return the generalized placeholder of a function literal
	 */
	record Request(Scope scope, TypeId expected, boolean forceSingleton, boolean generalize)
	{
	}

	private record BinaryOperands(TypeId left, TypeId right, Refinement refinement)
	{
	}

	private final ConstraintGenerator gen;

	ExpressionChecker(ConstraintGenerator gen)
	{
		this.gen = gen;
	}

	// --- Single values ---

	Inference check(Scope scope, AstExpr expr)
	{
		return check(scope, expr, null, false, true);
	}

	Inference check(Scope scope, AstExpr expr, TypeId expected)
	{
		return check(scope, expr, expected, false, true);
	}

	Inference check(Scope scope, AstExpr expr, TypeId expected, boolean forceSingleton, boolean generalize)
	{
		try (RecursionCounter.Entry entry = gen.recursion.enter())
		{
			if (entry.isExceeded())
			{
				gen.reportCodeTooComplex(expr.location);
				return new Inference(gen.builtinTypes.errorRecoveryType());
			}

			Inference result = expr.accept(this, new Request(scope, expected, forceSingleton, generalize));
			gen.module.getAstTypes().put(expr, result.ty());
			if (expected != null)
			{
				gen.module.getAstExpectedTypes().put(expr, expected);
			}
			return result;
		}
	}

	// --- Packs ---

	/**
	 * Checks an expression list. Only the last expression may contribute more than one value.
	 */
	TypePackId checkPack(Scope scope, List<AstExpr> exprs, List<TypeId> expectedTypes)
	{
		List<TypeId> head = new ArrayList<>();
		TypePackId tail = null;
		for (int i = 0; i < exprs.size(); i++)
		{
			AstExpr expr = exprs.get(i);
			if (i < exprs.size() - 1)
			{
				TypeId expected = i < expectedTypes.size() ? expectedTypes.get(i) : null;
				head.add(check(scope, expr, expected).ty());
			}
			else
			{
				List<TypeId> expectedTail = i < expectedTypes.size() ? expectedTypes.subList(i, expectedTypes.size()) : List.of();
				tail = checkPack(scope, expr, expectedTail, true).tp();
			}
		}
		return gen.addTypePack(head, tail);
	}

	InferencePack checkPack(Scope scope, AstExpr expr, List<TypeId> expectedTypes, boolean generalize)
	{
		try (RecursionCounter.Entry entry = gen.recursion.enter())
		{
			if (entry.isExceeded())
			{
				gen.reportCodeTooComplex(expr.location);
				return new InferencePack(gen.builtinTypes.errorRecoveryTypePack());
			}

			InferencePack result;
			if (expr instanceof AstExpr.Call call)
			{
				result = checkCallPack(scope, call);
			}
			else if (expr instanceof AstExpr.Varargs)
			{
				TypePackId varargs = scope.getVarargPack();
				result = new InferencePack(varargs != null ? varargs : gen.builtinTypes.errorRecoveryTypePack());
			}
			else
			{
				TypeId expected = expectedTypes.isEmpty() ? null : expectedTypes.get(0);
				TypeId ty = check(scope, expr, expected, false, generalize).ty();
				result = new InferencePack(gen.arena.addTypePack(List.of(ty)));
			}

			gen.module.getAstTypePacks().put(expr, result.tp());
			return result;
		}
	}

	private InferencePack checkCallPack(Scope scope, AstExpr.Call call)
	{
		List<AstExpr> exprArgs = new ArrayList<>();
		List<Refinement> returnRefinements = new ArrayList<>();
		List<TypeId> discriminantTypes = new ArrayList<>();

		if (call.self)
		{
			if (!(call.func instanceof AstExpr.IndexName indexName))
			{
				throw gen.ice.ice("method call expression has no 'self'", call.location);
			}
			exprArgs.add(indexName.expr);
		}
		exprArgs.addAll(call.args);

		// The solver narrows each argument that can be refined by what the callee returns.
		for (AstExpr arg : exprArgs)
		{
			RefinementKey key = gen.dfg.getRefinementKey(arg);
			if (key != null)
			{
				TypeId discriminant = gen.blockedType();
				returnRefinements.add(gen.refinementArena.implicitProposition(key, discriminant));
				discriminantTypes.add(discriminant);
			}
			else
			{
				discriminantTypes.add(null);
			}
		}

		Checkpoint funcBegin = gen.constraints.checkpoint();
		TypeId fnType = check(scope, call.func).ty();
		Checkpoint funcEnd = gen.constraints.checkpoint();

		List<TypeId> expectedTypes = expectedCallTypes(fnType, call.args.size());

		gen.module.getAstOriginalCallTypes().put(call.func, fnType);
		gen.module.getAstOriginalCallTypes().put(call, fnType);

		Checkpoint argBegin = gen.constraints.checkpoint();
		List<TypeId> args = new ArrayList<>();
		List<Refinement> argumentRefinements = new ArrayList<>();
		TypePackId argTail = null;
		int selfOffset = call.self ? 1 : 0;

		for (int i = 0; i < exprArgs.size(); i++)
		{
			AstExpr arg = exprArgs.get(i);
			if (i == 0 && call.self)
			{
				// Already inferred while checking the callee.
				TypeId selfTy = gen.module.getAstTypes().get(exprArgs.get(0));
				args.add(selfTy != null ? selfTy : gen.freshType(scope));
			}
			else if (i < exprArgs.size() - 1 || !(arg instanceof AstExpr.Call || arg instanceof AstExpr.Varargs))
			{
				int expectedIndex = i - selfOffset;
				TypeId expected = expectedIndex < expectedTypes.size() ? expectedTypes.get(expectedIndex) : null;
				Inference inference = check(scope, arg, expected, false, false);
				args.add(inference.ty());
				argumentRefinements.add(inference.refinement());
			}
			else
			{
				InferencePack pack = checkPack(scope, arg, List.of(), true);
				argTail = pack.tp();
				argumentRefinements.addAll(pack.refinements());
			}
		}

		Checkpoint argEnd = gen.constraints.checkpoint();

		if (CallIdioms.matchSetmetatable(call))
		{
			return checkSetmetatable(scope, call, args, argTail, returnRefinements);
		}

		if (CallIdioms.matchAssert(call) && !argumentRefinements.isEmpty())
		{
			gen.refinements.applyRefinements(scope, call.args.get(0).location, argumentRefinements.get(0));
		}

		TypePackId rets = gen.arena.addTypePack(new BlockedTypePack());
		TypePackId argPack = gen.addTypePack(args, argTail);

		// The callee must be known before arguments are checked against it, and the call is
		// resolved only after every argument has been.
		Constraint checkConstraint = gen.addConstraint(scope, call.func.location, new FunctionCheckConstraint(fnType, argPack, call));
		gen.constraints.forEachBetween(funcBegin, funcEnd, checkConstraint::addDependency);

		Constraint callConstraint = gen.addConstraint(scope, call.func.location,
				new FunctionCallConstraint(fnType, argPack, rets, call, discriminantTypes, gen.module.getAstOverloadResolvedTypes()));
		rets.get(BlockedTypePack.class).setOwner(callConstraint);
		callConstraint.addDependency(checkConstraint);

		gen.constraints.forEachBetween(argBegin, argEnd, constraint ->
		{
			constraint.addDependency(checkConstraint);
			callConstraint.addDependency(constraint);
		});

		return new InferencePack(rets, Collections.singletonList(gen.refinementArena.variadic(returnRefinements)));
	}

	private InferencePack checkSetmetatable(Scope scope, AstExpr.Call call, List<TypeId> args, TypePackId argTail,
											List<Refinement> returnRefinements)
	{
		TypePack tailPack = new TypePack(List.of(), null);
		if (argTail != null && args.size() < 2)
		{
			tailPack = TypeUtils.extendTypePack(argTail, 2 - args.size());
		}

		TypeId target;
		TypeId metatable;
		if (args.size() + tailPack.getHead().size() == 2)
		{
			target = !args.isEmpty() ? args.get(0) : tailPack.getHead().get(0);
			metatable = args.size() > 1 ? args.get(1) : tailPack.getHead().get(args.isEmpty() ? 1 : 0);
		}
		else
		{
			if (argTail == null)
			{
				throw gen.ice.ice("setmetatable call has neither two arguments nor an argument tail", call.location);
			}
			List<TypeId> unpacked = new ArrayList<>();
			if (!args.isEmpty())
			{
				target = args.get(0).follow();
			}
			else
			{
				target = gen.blockedType();
				unpacked.add(target);
			}
			metatable = gen.blockedType();
			unpacked.add(metatable);

			Constraint unpack = gen.addConstraint(scope, call.location,
					new UnpackConstraint(gen.arena.addTypePack(unpacked), argTail, false));
			metatable.get(BlockedType.class).setOwner(unpack);
			BlockedType blockedTarget = target.get(BlockedType.class);
			if (blockedTarget != null && !blockedTarget.hasOwner())
			{
				blockedTarget.setOwner(unpack);
			}
		}

		target = target.follow();
		TypeId resultTy;
		if (TypeUtils.isTableUnion(target))
		{
			List<TypeId> parts = new ArrayList<>();
			for (TypeId option : target.get(UnionType.class).getOptions())
			{
				parts.add(gen.addType(new MetatableType(option, metatable)));
			}
			resultTy = gen.addType(new UnionType(parts));
		}
		else
		{
			resultTy = gen.addType(new MetatableType(target, metatable));
		}

		// setmetatable(t, mt) also changes what the local t holds from here on.
		if (call.args.get(0) instanceof AstExpr.Local targetLocal)
		{
			Symbol symbol = Symbol.local(targetLocal.local);
			Binding binding = scope.getBindings().get(symbol);
			if (binding != null)
			{
				binding.setTypeId(resultTy);
			}
			else
			{
				scope.getBindings().put(symbol, new Binding(resultTy, targetLocal.location));
			}
			Def def = gen.dfg.getDef(targetLocal);
			scope.getLvalueTypes().put(def, resultTy);
			scope.getRvalueRefinements().put(def, resultTy);
			gen.recordInferredBinding(targetLocal.local, resultTy);
		}

		return new InferencePack(gen.arena.addTypePack(List.of(resultTy)),
				Collections.singletonList(gen.refinementArena.variadic(returnRefinements)));
	}

	/**
	 * For each argument position, the union of what the callee's overloads accept there. A
	 * plain function counts as a single overload.
	 */
	List<TypeId> expectedCallTypes(TypeId fnType, int argCount)
	{
		TypeId fn = fnType.follow();
		List<TypeId> overloads = new ArrayList<>();
		IntersectionType intersection = fn.get(IntersectionType.class);
		if (intersection != null)
		{
			overloads.addAll(intersection.getParts());
		}
		else if (fn.is(FunctionType.class))
		{
			overloads.add(fn);
		}

		List<TypeId> expectedTypes = new ArrayList<>();
		for (TypeId overload : overloads)
		{
			FunctionType ftv = overload.follow().get(FunctionType.class);
			if (ftv == null)
			{
				continue;
			}

			TypePack args = TypeUtils.flatten(ftv.getArgTypes());
			int index = 0;
			for (int i = ftv.hasSelf() ? 1 : 0; i < args.getHead().size(); i++)
			{
				assignOption(expectedTypes, index++, args.getHead().get(i));
			}

			if (args.getTail() != null)
			{
				VariadicTypePack variadic = args.getTail().follow().get(VariadicTypePack.class);
				if (variadic != null)
				{
					while (index < argCount)
					{
						assignOption(expectedTypes, index++, variadic.getTy());
					}
				}
			}
		}
		return expectedTypes;
	}

	private void assignOption(List<TypeId> expectedTypes, int index, TypeId ty)
	{
		if (index == expectedTypes.size())
		{
			expectedTypes.add(ty);
			return;
		}

		TypeId existing = expectedTypes.get(index);
		if (existing == null)
		{
			expectedTypes.set(index, ty);
			return;
		}

		List<TypeId> reduced = TypeUtils.reduceUnion(List.of(existing, ty));
		if (reduced.isEmpty())
		{
			expectedTypes.set(index, gen.builtinTypes.neverType);
		}
		else if (reduced.size() == 1)
		{
			expectedTypes.set(index, reduced.get(0));
		}
		else
		{
			expectedTypes.set(index, gen.addType(new UnionType(reduced)));
		}
	}

	/**
	 * The first value of a pack. When the pack's shape is not known yet the value is a
	 * placeholder filled in by an unpack.
	 */
	private Inference flattenPack(Scope scope, Location location, InferencePack pack)
	{
		Refinement refinement = pack.refinements().isEmpty() ? null : pack.refinements().get(0);

		Optional<TypeId> first = TypeUtils.first(pack.tp());
		if (first.isPresent())
		{
			return new Inference(first.get(), refinement);
		}

		TypeId result = gen.blockedType();
		TypePackId resultPack = gen.arena.addTypePack(List.of(result), gen.freshTypePack(scope));
		Constraint unpack = gen.addConstraint(scope, location, new UnpackConstraint(resultPack, pack.tp(), false));
		result.get(BlockedType.class).setOwner(unpack);
		return new Inference(result, refinement);
	}

	// --- Visitor ---

	@Override
	public Inference visitGroup(AstExpr.Group expr, Request req)
	{
		return check(req.scope(), expr.expr, req.expected(), req.forceSingleton(), req.generalize());
	}

	@Override
	public Inference visitConstantNil(AstExpr.ConstantNil expr, Request req)
	{
		return new Inference(gen.builtinTypes.nilType);
	}

	@Override
	public Inference visitConstantBool(AstExpr.ConstantBool expr, Request req)
	{
		TypeId singleton = expr.value ? gen.builtinTypes.trueType : gen.builtinTypes.falseType;
		if (req.forceSingleton())
		{
			return new Inference(singleton);
		}

		TypeId freeTy = gen.addType(new FreeType(req.scope(), singleton, gen.builtinTypes.booleanType));
		gen.addConstraint(req.scope(), expr.location, new PrimitiveTypeConstraint(freeTy, req.expected(), gen.builtinTypes.booleanType));
		return new Inference(freeTy);
	}

	@Override
	public Inference visitConstantNumber(AstExpr.ConstantNumber expr, Request req)
	{
		return new Inference(gen.builtinTypes.numberType);
	}

	@Override
	public Inference visitConstantString(AstExpr.ConstantString expr, Request req)
	{
		if (req.forceSingleton())
		{
			return new Inference(gen.addType(SingletonType.ofString(expr.value)));
		}

		TypeId singleton = gen.addType(SingletonType.ofString(expr.value));
		TypeId freeTy = gen.addType(new FreeType(req.scope(), singleton, gen.builtinTypes.stringType));
		gen.addConstraint(req.scope(), expr.location, new PrimitiveTypeConstraint(freeTy, req.expected(), gen.builtinTypes.stringType));
		return new Inference(freeTy);
	}

	@Override
	public Inference visitLocal(AstExpr.Local expr, Request req)
	{
		RefinementKey key = gen.dfg.getRefinementKey(expr);
		Optional<Def> rvalueDef = gen.dfg.getRValueDefForCompoundAssign(expr);

		Optional<TypeId> ty = Optional.empty();
		if (key != null)
		{
			ty = gen.definitions.lookup(req.scope(), expr.location, key.getDef());
		}
		if (ty.isEmpty() && rvalueDef.isPresent())
		{
			ty = gen.definitions.lookup(req.scope(), expr.location, rvalueDef.get());
		}

		if (ty.isEmpty())
		{
			throw gen.ice.ice("local '" + expr.local.name + "' used before its declaration", expr.location);
		}

		TypeId result = ty.get().follow();
		gen.recordInferredBinding(expr.local, result);
		return new Inference(result, gen.refinementArena.proposition(key, gen.builtinTypes.truthyType));
	}

	@Override
	public Inference visitGlobal(AstExpr.Global expr, Request req)
	{
		RefinementKey key = gen.dfg.getRefinementKey(expr);
		Optional<Def> rvalueDef = gen.dfg.getRValueDefForCompoundAssign(expr);
		Def def = key != null ? key.getDef() : rvalueDef.orElse(null);
		if (def == null)
		{
			return new Inference(gen.builtinTypes.errorRecoveryType());
		}

		// Globals may be assigned anywhere, so phi nodes over them are not widened into unions.
		Optional<TypeId> ty = gen.definitions.lookup(req.scope(), expr.location, def, false);
		if (ty.isEmpty())
		{
			return new Inference(gen.builtinTypes.errorRecoveryType());
		}

		gen.rootScope.getLvalueTypes().put(def, ty.get());
		return new Inference(ty.get(), gen.refinementArena.proposition(key, gen.builtinTypes.truthyType));
	}

	@Override
	public Inference visitVarargs(AstExpr.Varargs expr, Request req)
	{
		return flattenPack(req.scope(), expr.location, checkPack(req.scope(), expr, List.of(), true));
	}

	@Override
	public Inference visitCall(AstExpr.Call expr, Request req)
	{
		return flattenPack(req.scope(), expr.location, checkPack(req.scope(), expr, List.of(), true));
	}

	@Override
	public Inference visitIndexName(AstExpr.IndexName expr, Request req)
	{
		RefinementKey key = gen.dfg.getRefinementKey(expr);
		return checkIndexName(req.scope(), key, expr.expr, expr.index, expr.indexLocation);
	}

	@Override
	public Inference visitIndexExpr(AstExpr.IndexExpr expr, Request req)
	{
		RefinementKey key = gen.dfg.getRefinementKey(expr);
		if (expr.index instanceof AstExpr.ConstantString constant)
		{
			return checkIndexName(req.scope(), key, expr.expr, constant.value, expr.location);
		}

		TypeId obj = check(req.scope(), expr.expr).ty();
		TypeId indexType = check(req.scope(), expr.index).ty();
		TypeId result = gen.blockedType();

		if (key != null)
		{
			Optional<TypeId> known = gen.definitions.lookup(req.scope(), expr.location, key.getDef());
			if (known.isPresent())
			{
				return new Inference(known.get(), gen.refinementArena.proposition(key, gen.builtinTypes.truthyType));
			}
			req.scope().getRvalueRefinements().put(key.getDef(), result);
		}

		Constraint c = gen.addConstraint(req.scope(), expr.expr.location, new HasIndexerConstraint(result, obj, indexType));
		result.get(BlockedType.class).setOwner(c);

		return new Inference(result, gen.refinementArena.proposition(key, gen.builtinTypes.truthyType));
	}

	private Inference checkIndexName(Scope scope, RefinementKey key, AstExpr indexee, String index, Location indexLocation)
	{
		TypeId obj = check(scope, indexee).ty();
		TypeId result = gen.blockedType();

		if (key != null)
		{
			Optional<TypeId> known = gen.definitions.lookup(scope, indexLocation, key.getDef());
			if (known.isPresent())
			{
				return new Inference(known.get(), gen.refinementArena.proposition(key, gen.builtinTypes.truthyType));
			}
			scope.getRvalueRefinements().put(key.getDef(), result);
		}

		Constraint c = gen.addConstraint(scope, indexee.location,
				new HasPropConstraint(result, obj, index, ValueContext.RVALUE, gen.typeContext == TypeContext.CONDITION));
		result.get(BlockedType.class).setOwner(c);

		return new Inference(result, gen.refinementArena.proposition(key, gen.builtinTypes.truthyType));
	}

	@Override
	public Inference visitFunction(AstExpr.Function fn, Request req)
	{
		Checkpoint start = gen.constraints.checkpoint();
		FunctionSignature sig = gen.signatures.checkFunctionSignature(req.scope(), fn, req.expected(), null);

		List<TypeId> interior = new ArrayList<>();
		gen.interiorTypes.push(interior);
		gen.signatures.checkFunctionBody(sig.bodyScope(), fn);
		Checkpoint end = gen.constraints.checkpoint();

		TypeId generalized = gen.blockedType();
		Constraint gc = gen.addConstraint(sig.signatureScope(), fn.location,
				new GeneralizationConstraint(generalized, sig.signature(), interior));
		generalized.get(BlockedType.class).setOwner(gc);
		gen.interiorTypes.pop();

		gen.constraints.governRange(gc, start, end, Set.of());

		if (req.generalize() && TypeUtils.hasFreeType(sig.signature()))
		{
			return new Inference(generalized);
		}
		return new Inference(sig.signature());
	}

	@Override
	public Inference visitTable(AstExpr.Table expr, Request req)
	{
		TableType table = new TableType(TableState.UNSEALED, req.scope());
		TypeId ty = gen.addType(table);
		if (!gen.interiorTypes.isEmpty())
		{
			gen.interiorTypes.peek().add(ty);
		}

		TypeId expected = req.expected() == null ? null : req.expected().follow();
		TableType expectedTable = expected == null ? null : expected.get(TableType.class);

		Set<TypeId> indexKeys = Collections.newSetFromMap(new IdentityHashMap<>());
		Set<TypeId> indexValues = Collections.newSetFromMap(new IdentityHashMap<>());
		List<TypeId> keyOrder = new ArrayList<>();
		List<TypeId> valueOrder = new ArrayList<>();

		for (AstExpr.Table.Item item : expr.items)
		{
			TypeId expectedValue = null;
			if (item.key instanceof AstExpr.ConstantString stringKey && expected != null)
			{
				expectedValue = expectedPropType(req.scope(), expected, expectedTable, stringKey, item.value.location);
			}
			else if (expectedTable != null && expectedTable.getIndexer() != null)
			{
				expectedValue = expectedTable.getIndexer().getIndexResultType();
			}

			TypeId itemTy = check(req.scope(), item.value, expectedValue).ty();

			if (item.key != null)
			{
				// String keys are checked too so that they get recorded.
				TypeId keyTy = check(req.scope(), item.key).ty();
				if (item.key instanceof AstExpr.ConstantString stringKey)
				{
					table.getProps().put(stringKey.value, Property.rw(itemTy));
				}
				else
				{
					addBound(indexKeys, keyOrder, keyTy.follow());
					addBound(indexValues, valueOrder, itemTy.follow());
				}
			}
			else
			{
				addBound(indexKeys, keyOrder, gen.builtinTypes.numberType);
				addBound(indexValues, valueOrder, itemTy.follow());
			}
		}

		if (!keyOrder.isEmpty())
		{
			TypeId indexKey = keyOrder.size() == 1 ? keyOrder.get(0) : gen.addType(new UnionType(keyOrder));
			TypeId indexValue = valueOrder.size() == 1 ? valueOrder.get(0) : gen.addType(new UnionType(valueOrder));
			table.setIndexer(new TableIndexer(indexKey, indexValue));
		}

		return new Inference(ty);
	}

	private TypeId expectedPropType(Scope scope, TypeId expected, TableType expectedTable, AstExpr.ConstantString key, Location valueLocation)
	{
		if (expectedTable != null)
		{
			Property prop = expectedTable.getProps().get(key.value);
			if (prop != null && prop.getReadTy() != null)
			{
				return prop.getReadTy();
			}
		}

		TypeId propTy = gen.blockedType();
		Constraint c = gen.addConstraint(scope, valueLocation,
				new HasPropConstraint(propTy, expected, key.value, ValueContext.RVALUE, gen.typeContext == TypeContext.CONDITION));
		propTy.get(BlockedType.class).setOwner(c);
		return propTy;
	}

	private static void addBound(Set<TypeId> seen, List<TypeId> order, TypeId ty)
	{
		if (seen.add(ty))
		{
			order.add(ty);
		}
	}

	@Override
	public Inference visitUnary(AstExpr.Unary expr, Request req)
	{
		Inference operand = check(req.scope(), expr.expr);
		BuiltinTypeFamily family = switch (expr.op)
		{
			case NOT -> BuiltinTypeFamily.NOT;
			case LEN -> BuiltinTypeFamily.LEN;
			case MINUS -> BuiltinTypeFamily.UNM;
		};
		TypeId result = gen.createFamilyInstance(family, List.of(operand.ty()), req.scope(), expr.location);
		return new Inference(result, gen.refinementArena.negation(operand.refinement()));
	}

	@Override
	public Inference visitBinary(AstExpr.Binary expr, Request req)
	{
		BinaryOperands operands = checkBinary(req.scope(), expr, req.expected());
		TypeId left = operands.left();
		TypeId right = operands.right();

		// a > b becomes le(b, a) and a >= b becomes lt(b, a)
		TypeId result = switch (expr.op)
		{
			case ADD -> family(BuiltinTypeFamily.ADD, left, right, req, expr);
			case SUB -> family(BuiltinTypeFamily.SUB, left, right, req, expr);
			case MUL -> family(BuiltinTypeFamily.MUL, left, right, req, expr);
			case DIV -> family(BuiltinTypeFamily.DIV, left, right, req, expr);
			case FLOOR_DIV -> family(BuiltinTypeFamily.IDIV, left, right, req, expr);
			case POW -> family(BuiltinTypeFamily.POW, left, right, req, expr);
			case MOD -> family(BuiltinTypeFamily.MOD, left, right, req, expr);
			case CONCAT -> family(BuiltinTypeFamily.CONCAT, left, right, req, expr);
			case AND -> family(BuiltinTypeFamily.AND, left, right, req, expr);
			case OR -> family(BuiltinTypeFamily.OR, left, right, req, expr);
			case COMPARE_LT -> family(BuiltinTypeFamily.LT, left, right, req, expr);
			case COMPARE_GE -> family(BuiltinTypeFamily.LT, right, left, req, expr);
			case COMPARE_LE -> family(BuiltinTypeFamily.LE, left, right, req, expr);
			case COMPARE_GT -> family(BuiltinTypeFamily.LE, right, left, req, expr);
			case COMPARE_EQ, COMPARE_NE -> family(BuiltinTypeFamily.EQ, left, right, req, expr);
		};
		return new Inference(result, operands.refinement());
	}

	private TypeId family(BuiltinTypeFamily family, TypeId left, TypeId right, Request req, AstExpr expr)
	{
		return gen.createFamilyInstance(family, List.of(left, right), req.scope(), expr.location);
	}

	private BinaryOperands checkBinary(Scope scope, AstExpr.Binary binary, TypeId expected)
	{
		if (binary.op == AstExpr.Binary.Op.AND)
		{
			TypeId relaxedExpected = expected != null
					? gen.addType(new UnionType(List.of(gen.builtinTypes.falsyType, expected)))
					: null;
			Inference left = check(scope, binary.left, relaxedExpected);

			Scope rightScope = gen.childScope(binary.right, scope);
			gen.refinements.applyRefinements(rightScope, binary.right.location, left.refinement());
			Inference right = check(rightScope, binary.right, expected);

			return new BinaryOperands(left.ty(), right.ty(), gen.refinementArena.conjunction(left.refinement(), right.refinement()));
		}

		if (binary.op == AstExpr.Binary.Op.OR)
		{
			TypeId relaxedExpected = expected != null
					? gen.addType(new UnionType(List.of(gen.builtinTypes.falsyType, expected)))
					: null;
			Inference left = check(scope, binary.left, relaxedExpected);

			Scope rightScope = gen.childScope(binary.right, scope);
			gen.refinements.applyRefinements(rightScope, binary.right.location, gen.refinementArena.negation(left.refinement()));
			Inference right = check(rightScope, binary.right, expected);

			return new BinaryOperands(left.ty(), right.ty(), gen.refinementArena.disjunction(left.refinement(), right.refinement()));
		}

		Optional<CallIdioms.TypeGuard> typeGuard = CallIdioms.matchTypeGuard(binary);
		if (typeGuard.isPresent())
		{
			TypeId leftType = check(scope, binary.left).ty();
			TypeId rightType = check(scope, binary.right).ty();

			RefinementKey key = gen.dfg.getRefinementKey(typeGuard.get().target());
			if (key == null)
			{
				return new BinaryOperands(leftType, rightType, null);
			}

			Refinement proposition = gen.refinementArena.proposition(key, typeGuardDiscriminant(typeGuard.get()));
			if (binary.op == AstExpr.Binary.Op.COMPARE_EQ)
			{
				return new BinaryOperands(leftType, rightType, proposition);
			}
			return new BinaryOperands(leftType, rightType, gen.refinementArena.negation(proposition));
		}

		if (binary.op == AstExpr.Binary.Op.COMPARE_EQ || binary.op == AstExpr.Binary.Op.COMPARE_NE)
		{
			TypeId leftType = check(scope, binary.left, null, true, true).ty();
			TypeId rightType = check(scope, binary.right, null, true, true).ty();

			Refinement leftRefinement = gen.refinementArena.proposition(gen.dfg.getRefinementKey(binary.left), rightType);
			Refinement rightRefinement = gen.refinementArena.proposition(gen.dfg.getRefinementKey(binary.right), leftType);
			if (binary.op == AstExpr.Binary.Op.COMPARE_NE)
			{
				leftRefinement = gen.refinementArena.negation(leftRefinement);
				rightRefinement = gen.refinementArena.negation(rightRefinement);
			}
			return new BinaryOperands(leftType, rightType, gen.refinementArena.equivalence(leftRefinement, rightRefinement));
		}

		TypeId leftType = check(scope, binary.left).ty();
		TypeId rightType = check(scope, binary.right).ty();
		return new BinaryOperands(leftType, rightType, null);
	}

	private TypeId typeGuardDiscriminant(CallIdioms.TypeGuard typeGuard)
	{
		switch (typeGuard.type())
		{
			case "nil":
				return gen.builtinTypes.nilType;
			case "string":
				return gen.builtinTypes.stringType;
			case "number":
				return gen.builtinTypes.numberType;
			case "boolean":
				return gen.builtinTypes.booleanType;
			case "thread":
				return gen.builtinTypes.threadType;
			case "buffer":
				return gen.builtinTypes.bufferType;
			case "table":
				return gen.builtinTypes.tableType;
			case "function":
				return gen.builtinTypes.functionType;
			case "userdata":
				return gen.builtinTypes.classType;
			default:
				break;
		}

		if (!typeGuard.isTypeof())
		{
			return gen.builtinTypes.neverType;
		}

		// typeof(x) == "Instance" narrows to the global type with that name; declared subclasses are skipped.
		Optional<TypeFun> typeFun = gen.globalScope.lookupType(typeGuard.type());
		if (typeFun.isPresent() && !typeFun.get().isGeneric())
		{
			TypeId ty = typeFun.get().getType().follow();
			ClassType classType = ty.get(ClassType.class);
			if (classType == null || classType.getParent() == gen.builtinTypes.classType)
			{
				return ty;
			}
		}
		return gen.builtinTypes.neverType;
	}

	@Override
	public Inference visitIfElse(AstExpr.IfElse expr, Request req)
	{
		Scope conditionScope = gen.childScope(expr.condition, req.scope());
		TypeContext saved = gen.typeContext;
		Refinement refinement;
		gen.typeContext = TypeContext.CONDITION;
		try
		{
			refinement = check(conditionScope, expr.condition).refinement();
		}
		finally
		{
			gen.typeContext = saved;
		}

		Scope thenScope = gen.childScope(expr.trueExpr, req.scope());
		gen.refinements.applyRefinements(thenScope, expr.trueExpr.location, refinement);
		TypeId thenType = check(thenScope, expr.trueExpr, req.expected()).ty();

		Scope elseScope = gen.childScope(expr.falseExpr, req.scope());
		gen.refinements.applyRefinements(elseScope, expr.falseExpr.location, gen.refinementArena.negation(refinement));
		TypeId elseType = check(elseScope, expr.falseExpr, req.expected()).ty();

		if (req.expected() != null)
		{
			return new Inference(req.expected());
		}
		return new Inference(gen.makeUnion(req.scope(), expr.location, thenType, elseType));
	}

	@Override
	public Inference visitTypeAssertion(AstExpr.TypeAssertion expr, Request req)
	{
		check(req.scope(), expr.expr);
		return new Inference(gen.types.resolveType(req.scope(), expr.annotation, false));
	}

	@Override
	public Inference visitInterpString(AstExpr.InterpString expr, Request req)
	{
		for (AstExpr part : expr.expressions)
		{
			check(req.scope(), part);
		}
		return new Inference(gen.builtinTypes.stringType);
	}

	@Override
	public Inference visitError(AstExpr.Error expr, Request req)
	{
		for (AstExpr sub : expr.expressions)
		{
			check(req.scope(), sub);
		}
		return new Inference(gen.builtinTypes.errorRecoveryType());
	}
}
