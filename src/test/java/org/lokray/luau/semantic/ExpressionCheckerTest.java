package org.lokray.luau.semantic;

import org.lokray.luau.ast.AstBuilder;
import org.lokray.luau.ast.AstExpr;
import org.lokray.luau.ast.AstLocal;
import org.lokray.luau.ast.AstStat;
import org.lokray.luau.ast.Location;
import org.lokray.luau.dfg.Def;
import org.lokray.luau.semantic.constraint.Constraint;
import org.lokray.luau.semantic.constraint.FunctionCallConstraint;
import org.lokray.luau.semantic.constraint.FunctionCheckConstraint;
import org.lokray.luau.semantic.constraint.GeneralizationConstraint;
import org.lokray.luau.semantic.constraint.HasIndexerConstraint;
import org.lokray.luau.semantic.constraint.HasPropConstraint;
import org.lokray.luau.semantic.constraint.NameConstraint;
import org.lokray.luau.semantic.constraint.PrimitiveTypeConstraint;
import org.lokray.luau.semantic.constraint.ReduceConstraint;
import org.lokray.luau.semantic.symbol.Scope;
import org.lokray.luau.semantic.symbol.Symbol;
import org.lokray.luau.semantic.symbol.TypeFun;
import org.lokray.luau.semantic.type.BlockedType;
import org.lokray.luau.semantic.type.BuiltinTypeFamily;
import org.lokray.luau.semantic.type.ClassType;
import org.lokray.luau.semantic.type.FreeType;
import org.lokray.luau.semantic.type.FunctionType;
import org.lokray.luau.semantic.type.MetatableType;
import org.lokray.luau.semantic.type.NegationType;
import org.lokray.luau.semantic.type.TableState;
import org.lokray.luau.semantic.type.TableType;
import org.lokray.luau.semantic.type.TypeArena;
import org.lokray.luau.semantic.type.TypeFamilyInstanceType;
import org.lokray.luau.semantic.type.TypeId;
import org.lokray.luau.semantic.type.TypeUtils;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("ExpressionChecker")
class ExpressionCheckerTest
{
	private final GeneratorFixture fixture = new GeneratorFixture();
	private final AstBuilder ast = fixture.ast;

	/**
	 * The scope a branch body was checked in. The body block registers its own inner scope
	 * under the same node, so the branch scope is its parent.
	 */
	private Scope branchScope(AstStat.Block body)
	{
		return fixture.module.getAstScopes().get(body).getParent();
	}

	private static TypeFamilyInstanceType onlyRefinement(Scope scope)
	{
		assertThat(scope.getRvalueRefinements()).hasSize(1);
		TypeId refined = scope.getRvalueRefinements().values().iterator().next();
		TypeFamilyInstanceType family = refined.get(TypeFamilyInstanceType.class);
		assertThat(family).isNotNull();
		return family;
	}

	@Nested
	@DisplayName("refinements")
	class Refinements
	{
		@Test
		@DisplayName("if x narrows the branches to truthy and not truthy")
		void truthinessComplements()
		{
			AstLocal x = ast.var("x");
			AstStat.Block thenBody = ast.block();
			AstStat.Block elseBody = ast.block();
			ConstraintGenerator gen = fixture.generate(ast.block(
					ast.local(x, ast.number(1)),
					ast.ifStat(ast.read(x), thenBody, elseBody)));

			TypeId xType = gen.getRootScope().lookup(Symbol.local(x)).orElseThrow();

			TypeFamilyInstanceType positive = onlyRefinement(branchScope(thenBody));
			assertThat(positive.getFamily()).isEqualTo(BuiltinTypeFamily.INTERSECT);
			assertThat(positive.getTypeArguments().get(0)).isSameAs(xType);
			assertThat(positive.getTypeArguments().get(1)).isSameAs(fixture.builtinTypes.truthyType);

			TypeFamilyInstanceType negative = onlyRefinement(branchScope(elseBody));
			assertThat(negative.getFamily()).isEqualTo(BuiltinTypeFamily.INTERSECT);
			assertThat(negative.getTypeArguments().get(0)).isSameAs(xType);
			NegationType negation = negative.getTypeArguments().get(1).get(NegationType.class);
			assertThat(negation).isNotNull();
			assertThat(negation.getTy()).isSameAs(fixture.builtinTypes.truthyType);

			assertThat(gen.getRootScope().getRvalueRefinements()).isEmpty();
		}

		@Test
		@DisplayName("a and b narrows both in the then branch and neither in the else branch")
		void conjunction()
		{
			AstLocal x = ast.var("x");
			AstLocal y = ast.var("y");
			AstExpr.Local right = ast.read(y);
			AstStat.Block thenBody = ast.block();
			AstStat.Block elseBody = ast.block();
			fixture.generate(ast.block(
					ast.local(x, ast.number(1)),
					ast.local(y, ast.number(2)),
					ast.ifStat(ast.binary(AstExpr.Binary.Op.AND, ast.read(x), right), thenBody, elseBody)));

			assertThat(branchScope(thenBody).getRvalueRefinements()).hasSize(2);
			assertThat(branchScope(elseBody).getRvalueRefinements()).isEmpty();

			// The right operand is checked knowing the left one is truthy.
			Scope rightScope = fixture.module.getAstScopes().get(right);
			TypeFamilyInstanceType leftTruthy = onlyRefinement(rightScope);
			assertThat(leftTruthy.getTypeArguments().get(1)).isSameAs(fixture.builtinTypes.truthyType);
		}

		@Test
		@DisplayName("a or b narrows neither in the then branch and both in the else branch")
		void disjunction()
		{
			AstLocal x = ast.var("x");
			AstLocal y = ast.var("y");
			AstStat.Block thenBody = ast.block();
			AstStat.Block elseBody = ast.block();
			fixture.generate(ast.block(
					ast.local(x, ast.number(1)),
					ast.local(y, ast.number(2)),
					ast.ifStat(ast.binary(AstExpr.Binary.Op.OR, ast.read(x), ast.read(y)), thenBody, elseBody)));

			assertThat(branchScope(thenBody).getRvalueRefinements()).isEmpty();
			assertThat(branchScope(elseBody).getRvalueRefinements()).hasSize(2);
		}

		@Test
		@DisplayName("type(x) == \"string\" narrows x to string")
		void typeGuard()
		{
			AstLocal x = ast.var("x");
			AstStat.Block thenBody = ast.block();
			AstExpr guard = ast.binary(AstExpr.Binary.Op.COMPARE_EQ,
					ast.call(ast.global("type"), ast.read(x)), ast.string("string"));
			fixture.generate(ast.block(ast.local(x, ast.number(1)), ast.ifStat(guard, thenBody, null)));

			TypeFamilyInstanceType narrowed = onlyRefinement(branchScope(thenBody));
			assertThat(narrowed.getTypeArguments().get(1)).isSameAs(fixture.builtinTypes.stringType);
		}

		@Test
		@DisplayName("typeof(x) == \"Name\" narrows to a root class or a non-class global type")
		void typeofGuard()
		{
			TypeArena globals = new TypeArena();
			TypeId vector = globals.addType(new TableType(TableState.SEALED, fixture.globalScope));
			TypeId instance = globals.addType(new ClassType("Instance", fixture.builtinTypes.classType, null, "globals", Location.NONE));
			TypeId part = globals.addType(new ClassType("Part", instance, null, "globals", Location.NONE));
			fixture.globalScope.getExportedTypeBindings().put("Vector", new TypeFun(vector));
			fixture.globalScope.getExportedTypeBindings().put("Instance", new TypeFun(instance));
			fixture.globalScope.getExportedTypeBindings().put("Part", new TypeFun(part));

			AstLocal x = ast.var("x");
			AstStat.Block vectorBody = ast.block();
			AstStat.Block instanceBody = ast.block();
			AstStat.Block partBody = ast.block();
			fixture.generate(ast.block(
					ast.local(x, ast.number(1)),
					ast.ifStat(typeofIs(x, "Vector"), vectorBody, null),
					ast.ifStat(typeofIs(x, "Instance"), instanceBody, null),
					ast.ifStat(typeofIs(x, "Part"), partBody, null)));

			assertThat(onlyRefinement(branchScope(vectorBody)).getTypeArguments().get(1)).isSameAs(vector);
			assertThat(onlyRefinement(branchScope(instanceBody)).getTypeArguments().get(1)).isSameAs(instance);
			assertThat(onlyRefinement(branchScope(partBody)).getTypeArguments().get(1)).isSameAs(fixture.builtinTypes.neverType);
		}

		private AstExpr typeofIs(AstLocal x, String name)
		{
			return ast.binary(AstExpr.Binary.Op.COMPARE_EQ, ast.call(ast.global("typeof"), ast.read(x)), ast.string(name));
		}

		@Test
		@DisplayName("x == \"a\" compares against a singleton")
		void equalityUsesSingletons()
		{
			AstLocal x = ast.var("x");
			AstStat.Block thenBody = ast.block();
			fixture.generate(ast.block(
					ast.local(x, ast.number(1)),
					ast.ifStat(ast.binary(AstExpr.Binary.Op.COMPARE_EQ, ast.read(x), ast.string("a")), thenBody, null)));

			assertThat(fixture.payloads(PrimitiveTypeConstraint.class)).isEmpty();

			TypeFamilyInstanceType narrowed = onlyRefinement(branchScope(thenBody));
			TypeFamilyInstanceType singleton = narrowed.getTypeArguments().get(1).get(TypeFamilyInstanceType.class);
			assertThat(singleton).isNotNull();
			assertThat(singleton.getFamily()).isEqualTo(BuiltinTypeFamily.SINGLETON);
		}

		@Test
		@DisplayName("assert(x) narrows x for the rest of the block")
		void assertNarrows()
		{
			AstLocal x = ast.var("x");
			ConstraintGenerator gen = fixture.generate(ast.block(
					ast.local(x, ast.number(1)),
					ast.exprStat(ast.call(ast.global("assert"), ast.read(x)))));

			TypeFamilyInstanceType narrowed = onlyRefinement(gen.getRootScope());
			assertThat(narrowed.getTypeArguments().get(1)).isSameAs(fixture.builtinTypes.truthyType);
		}

		@Test
		@DisplayName("a branch that returns leaves the other branch's narrowing in place")
		void earlyReturnKeepsNarrowing()
		{
			AstLocal x = ast.var("x");
			AstExpr.Function fn = ast.func(List.of(x), ast.block(
					ast.ifStat(ast.not(ast.read(x)), ast.block(ast.ret()), null),
					ast.ret(ast.read(x))));
			fixture.generate(ast.block(ast.local(ast.var("f"), fn)));

			Scope bodyScope = fixture.module.getAstScopes().get(fn.body);
			assertThat(bodyScope.getRvalueRefinements()).hasSize(1);
		}
	}

	@Nested
	@DisplayName("literals")
	class Literals
	{
		@Test
		@DisplayName("a string literal is a free type bounded by its singleton and string")
		void stringLiteral()
		{
			AstExpr.ConstantString hello = ast.string("hello");
			fixture.generate(ast.block(ast.local(ast.var("s"), hello)));

			TypeId ty = fixture.module.getAstTypes().get(hello);
			FreeType free = ty.get(FreeType.class);
			assertThat(free).isNotNull();
			assertThat(free.getUpperBound()).isSameAs(fixture.builtinTypes.stringType);

			List<PrimitiveTypeConstraint> primitives = fixture.payloads(PrimitiveTypeConstraint.class);
			assertThat(primitives).hasSize(1);
			assertThat(primitives.get(0).freeType()).isSameAs(ty);
			assertThat(primitives.get(0).primitiveType()).isSameAs(fixture.builtinTypes.stringType);
			assertThat(primitives.get(0).expectedType()).isNull();
		}

		@Test
		@DisplayName("a table literal collects string keys as properties and the rest as an indexer")
		void tableShape()
		{
			AstExpr.Table table = ast.table(ast.item("x", ast.number(1)), ast.item(ast.number(2)), ast.item(ast.number(3)));
			fixture.generate(ast.block(ast.local(ast.var("t"), table)));

			TableType shape = fixture.module.getAstTypes().get(table).get(TableType.class);
			assertThat(shape.getProps()).containsOnlyKeys("x");
			assertThat(shape.getProps().get("x").getReadTy()).isSameAs(fixture.builtinTypes.numberType);
			assertThat(shape.getIndexer()).isNotNull();
			assertThat(shape.getIndexer().getIndexType()).isSameAs(fixture.builtinTypes.numberType);
			assertThat(shape.getIndexer().getIndexResultType()).isSameAs(fixture.builtinTypes.numberType);
		}

		@Test
		@DisplayName("a function literal is generalized when it is a value")
		void generalizedFunction()
		{
			AstLocal a = ast.var("a");
			AstExpr.Function fn = ast.func(List.of(a), ast.block(ast.ret(ast.read(a))));
			fixture.generate(ast.block(ast.local(ast.var("id"), fn)));

			TypeId ty = fixture.module.getAstTypes().get(fn);
			BlockedType blocked = ty.get(BlockedType.class);
			assertThat(blocked).isNotNull();
			GeneralizationConstraint generalization = blocked.getOwner().getPayload(GeneralizationConstraint.class);
			assertThat(generalization).isNotNull();
			assertThat(generalization.sourceType().is(FunctionType.class)).isTrue();
		}

		@Test
		@DisplayName("a function literal passed as an argument keeps its signature")
		void argumentFunction()
		{
			AstExpr.Function fn = ast.func(List.of(ast.var("a")), ast.block());
			fixture.generate(ast.block(ast.exprStat(ast.call(ast.global("apply"), fn))));

			assertThat(fixture.module.getAstTypes().get(fn).is(FunctionType.class)).isTrue();
		}
	}

	@Nested
	@DisplayName("calls and indexing")
	class CallsAndIndexing
	{
		@Test
		@DisplayName("a call is checked before it is resolved")
		void callConstraints()
		{
			AstExpr.Call call = ast.call(ast.global("print"), ast.number(1));
			fixture.generate(ast.block(ast.exprStat(call)));

			List<Constraint> checks = fixture.constraintsOf(FunctionCheckConstraint.class);
			List<Constraint> calls = fixture.constraintsOf(FunctionCallConstraint.class);
			assertThat(checks).hasSize(1);
			assertThat(calls).hasSize(1);
			assertThat(calls.get(0).getDependencies()).contains(checks.get(0));

			FunctionCallConstraint payload = calls.get(0).getPayload(FunctionCallConstraint.class);
			assertThat(payload.callSite()).isSameAs(call);
			assertThat(fixture.module.getAstOriginalCallTypes().get(call)).isSameAs(payload.fn());
			assertThat(payload.astOverloadResolvedTypes()).isSameAs(fixture.module.getAstOverloadResolvedTypes());
		}

		@Test
		@DisplayName("setmetatable pairs a table with its metatable and names the local")
		void setmetatableOnLiteral()
		{
			AstExpr.Call call = ast.call(ast.global("setmetatable"), ast.table(), ast.table());
			fixture.generate(ast.block(ast.local(ast.var("Class"), call)));

			TypeId result = TypeUtils.first(fixture.module.getAstTypePacks().get(call)).orElseThrow();
			MetatableType metatable = result.get(MetatableType.class);
			assertThat(metatable).isNotNull();
			assertThat(metatable.getTable().get(TableType.class)).isNotNull();
			assertThat(fixture.payloads(FunctionCallConstraint.class)).isEmpty();

			List<NameConstraint> names = fixture.payloads(NameConstraint.class);
			assertThat(names).hasSize(1);
			assertThat(names.get(0).name()).isEqualTo("Class");
		}

		@Test
		@DisplayName("setmetatable(t, mt) changes what t holds afterwards")
		void setmetatableRebindsLocal()
		{
			AstLocal t = ast.var("t");
			ConstraintGenerator gen = fixture.generate(ast.block(
					ast.local(t, ast.table()),
					ast.exprStat(ast.call(ast.global("setmetatable"), ast.read(t), ast.table()))));

			boolean rebound = false;
			for (Map.Entry<Def, TypeId> entry : gen.getRootScope().getRvalueRefinements().entrySet())
			{
				rebound |= entry.getValue().is(MetatableType.class);
			}
			assertThat(rebound).isTrue();

			// Both the literal and the metatable-wrapped value flow into t.
			TypeFamilyInstanceType binding = gen.getRootScope().lookup(Symbol.local(t)).orElseThrow().get(TypeFamilyInstanceType.class);
			assertThat(binding).isNotNull();
			assertThat(binding.getFamily()).isEqualTo(BuiltinTypeFamily.UNION);
		}

		@Test
		@DisplayName("t.x reads a property through a has-prop constraint")
		void propertyRead()
		{
			AstLocal t = ast.var("t");
			AstExpr.IndexName read = ast.index(ast.read(t), "x");
			fixture.generate(ast.block(ast.local(t, ast.table()), ast.local(ast.var("v"), read)));

			List<HasPropConstraint> props = fixture.payloads(HasPropConstraint.class);
			assertThat(props).hasSize(1);
			assertThat(props.get(0).prop()).isEqualTo("x");
			assertThat(props.get(0).inConditional()).isFalse();
			assertThat(fixture.module.getAstTypes().get(read)).isSameAs(props.get(0).resultType());
		}

		@Test
		@DisplayName("a property read in a condition is marked as conditional")
		void conditionalPropertyRead()
		{
			AstLocal t = ast.var("t");
			fixture.generate(ast.block(
					ast.local(t, ast.table()),
					ast.ifStat(ast.index(ast.read(t), "x"), ast.block(), null)));

			List<HasPropConstraint> props = fixture.payloads(HasPropConstraint.class);
			assertThat(props).hasSize(1);
			assertThat(props.get(0).inConditional()).isTrue();
		}

		@Test
		@DisplayName("t[k] reads through a has-indexer constraint")
		void indexerRead()
		{
			AstLocal t = ast.var("t");
			AstLocal k = ast.var("k");
			AstExpr.IndexExpr read = new AstExpr.IndexExpr(ast.loc(), ast.read(t), ast.read(k));
			fixture.generate(ast.block(
					ast.local(t, ast.table()),
					ast.local(k, ast.number(1)),
					ast.local(ast.var("v"), read)));

			List<HasIndexerConstraint> indexers = fixture.payloads(HasIndexerConstraint.class);
			assertThat(indexers).hasSize(1);
			assertThat(fixture.module.getAstTypes().get(read)).isSameAs(indexers.get(0).resultType());
		}
	}

	@Nested
	@DisplayName("operators")
	class Operators
	{
		@Test
		@DisplayName("operators lower to type families")
		void families()
		{
			AstLocal x = ast.var("x");
			AstExpr notX = ast.not(ast.read(x));
			AstExpr greater = ast.binary(AstExpr.Binary.Op.COMPARE_GT, ast.read(x), ast.number(2));
			fixture.generate(ast.block(
					ast.local(x, ast.number(1)),
					ast.local(ast.var("a"), notX),
					ast.local(ast.var("b"), greater)));

			TypeFamilyInstanceType not = fixture.module.getAstTypes().get(notX).get(TypeFamilyInstanceType.class);
			assertThat(not.getFamily()).isEqualTo(BuiltinTypeFamily.NOT);

			// a > b becomes le(b, a)
			TypeFamilyInstanceType le = fixture.module.getAstTypes().get(greater).get(TypeFamilyInstanceType.class);
			assertThat(le.getFamily()).isEqualTo(BuiltinTypeFamily.LE);
			assertThat(le.getTypeArguments().get(0)).isSameAs(fixture.builtinTypes.numberType);
		}

		@Test
		@DisplayName("if-then-else expressions union their branches")
		void ifElseExpression()
		{
			AstLocal x = ast.var("x");
			AstExpr trueExpr = ast.number(1);
			AstExpr.IfElse choice = new AstExpr.IfElse(ast.loc(), ast.read(x), trueExpr, ast.number(2));
			fixture.generate(ast.block(ast.local(x, ast.number(0)), ast.local(ast.var("r"), choice)));

			TypeFamilyInstanceType union = fixture.module.getAstTypes().get(choice).get(TypeFamilyInstanceType.class);
			assertThat(union.getFamily()).isEqualTo(BuiltinTypeFamily.UNION);

			Scope thenScope = fixture.module.getAstScopes().get(trueExpr);
			assertThat(thenScope.getRvalueRefinements()).hasSize(1);
		}

		@Test
		@DisplayName("every family instance is reduced by its own constraint")
		void familiesAreReduced()
		{
			AstLocal x = ast.var("x");
			fixture.generate(ast.block(
					ast.local(x, ast.number(1)),
					ast.local(ast.var("y"), ast.binary(AstExpr.Binary.Op.ADD, ast.read(x), ast.number(1)))));

			List<TypeId> reduced = new ArrayList<>();
			for (ReduceConstraint reduce : fixture.payloads(ReduceConstraint.class))
			{
				reduced.add(reduce.ty());
			}
			assertThat(reduced).hasSize(1);
			assertThat(reduced.get(0).get(TypeFamilyInstanceType.class).getFamily()).isEqualTo(BuiltinTypeFamily.ADD);
		}
	}
}
