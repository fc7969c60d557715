package org.lokray.luau.semantic;

import org.lokray.luau.ast.AstBuilder;
import org.lokray.luau.ast.AstExpr;
import org.lokray.luau.ast.AstLocal;
import org.lokray.luau.ast.AstStat;
import org.lokray.luau.semantic.constraint.Constraint;
import org.lokray.luau.semantic.constraint.FunctionCallConstraint;
import org.lokray.luau.semantic.constraint.GeneralizationConstraint;
import org.lokray.luau.semantic.constraint.HasPropConstraint;
import org.lokray.luau.semantic.constraint.IterableConstraint;
import org.lokray.luau.semantic.constraint.NameConstraint;
import org.lokray.luau.semantic.constraint.PackSubtypeConstraint;
import org.lokray.luau.semantic.constraint.SetPropConstraint;
import org.lokray.luau.semantic.constraint.SubtypeConstraint;
import org.lokray.luau.semantic.constraint.Unpack1Constraint;
import org.lokray.luau.semantic.constraint.UnpackConstraint;
import org.lokray.luau.semantic.constraint.ValueContext;
import org.lokray.luau.semantic.error.GenericError;
import org.lokray.luau.semantic.error.TypeErrorData;
import org.lokray.luau.semantic.error.UnknownSymbol;
import org.lokray.luau.semantic.symbol.Scope;
import org.lokray.luau.semantic.symbol.Symbol;
import org.lokray.luau.semantic.type.BlockedType;
import org.lokray.luau.semantic.type.BuiltinTypeFamily;
import org.lokray.luau.semantic.type.ClassType;
import org.lokray.luau.semantic.type.FunctionArgument;
import org.lokray.luau.semantic.type.FunctionType;
import org.lokray.luau.semantic.type.IntersectionType;
import org.lokray.luau.semantic.type.LocalType;
import org.lokray.luau.semantic.type.TableType;
import org.lokray.luau.semantic.type.TypeFamilyInstanceType;
import org.lokray.luau.semantic.type.TypeId;
import org.lokray.luau.semantic.type.TypeUtils;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("StatementVisitor")
class StatementVisitorTest
{
	private final GeneratorFixture fixture = new GeneratorFixture();
	private final AstBuilder ast = fixture.ast;

	private List<PackSubtypeConstraint> emptyReturnsAt(AstExpr.Function fn)
	{
		List<PackSubtypeConstraint> result = new ArrayList<>();
		for (Constraint c : fixture.constraintsOf(PackSubtypeConstraint.class))
		{
			PackSubtypeConstraint pack = c.getPayload(PackSubtypeConstraint.class);
			if (c.getLocation().equals(fn.location) && pack.subPack() == fixture.builtinTypes.emptyTypePack)
			{
				result.add(pack);
			}
		}
		return result;
	}

	@Nested
	@DisplayName("local")
	class Locals
	{
		@Test
		@DisplayName("local x = 5 binds x to its local-kind assignee")
		void unannotatedLocal()
		{
			AstLocal x = ast.var("x");
			ConstraintGenerator gen = fixture.generate(ast.block(ast.local(x, ast.number(5))));

			assertThat(fixture.errors()).isEmpty();

			List<UnpackConstraint> unpacks = fixture.payloads(UnpackConstraint.class);
			assertThat(unpacks).hasSize(1);
			assertThat(unpacks.get(0).resultIsLValue()).isTrue();
			TypeId assignee = TypeUtils.flatten(unpacks.get(0).resultPack()).getHead().get(0);
			LocalType local = assignee.get(LocalType.class);
			assertThat(local).isNotNull();
			assertThat(local.getName()).isEqualTo("x");
			assertThat(local.getDomain()).isSameAs(fixture.builtinTypes.neverType);
			assertThat(TypeUtils.first(unpacks.get(0).sourcePack())).contains(fixture.builtinTypes.numberType);

			assertThat(gen.getRootScope().lookup(Symbol.local(x))).contains(assignee);
		}

		@Test
		@DisplayName("an annotated local binds the annotation and checks the values against it")
		void annotatedLocal()
		{
			AstLocal x = ast.var("x", ast.ref("number"));
			ConstraintGenerator gen = fixture.generate(ast.block(ast.local(x, ast.number(5))));

			assertThat(gen.getRootScope().lookup(Symbol.local(x))).contains(fixture.builtinTypes.numberType);

			List<UnpackConstraint> unpacks = fixture.payloads(UnpackConstraint.class);
			assertThat(unpacks).hasSize(1);
			assertThat(TypeUtils.first(unpacks.get(0).sourcePack())).contains(fixture.builtinTypes.numberType);

			PackSubtypeConstraint check = fixture.payloads(PackSubtypeConstraint.class).get(0);
			assertThat(check.superPack()).isSameAs(unpacks.get(0).sourcePack());
		}

		@Test
		@DisplayName("a table at the top level is named after its local")
		void namedTable()
		{
			fixture.generate(ast.block(ast.local(ast.var("Point"), ast.table())));

			List<NameConstraint> names = fixture.payloads(NameConstraint.class);
			assertThat(names).hasSize(1);
			assertThat(names.get(0).name()).isEqualTo("Point");
			assertThat(names.get(0).synthetic()).isTrue();
		}

		@Test
		@DisplayName("a table inside a block is not named")
		void nestedTableNotNamed()
		{
			fixture.generate(ast.block(ast.whileStat(ast.bool(true), ast.block(ast.local(ast.var("Point"), ast.table())))));

			assertThat(fixture.payloads(NameConstraint.class)).isEmpty();
		}

		@Test
		@DisplayName("expected property types flow from the annotation into a table literal")
		void expectedTableType()
		{
			AstExpr.ConstantNumber one = ast.number(1);
			AstLocal p = ast.var("p", ast.tableType(ast.tableProp("x", ast.ref("number"))));
			fixture.generate(ast.block(ast.local(p, ast.table(ast.item("x", one)))));

			assertThat(fixture.module.getAstExpectedTypes().get(one)).isSameAs(fixture.builtinTypes.numberType);
		}
	}

	@Nested
	@DisplayName("functions")
	class Functions
	{
		@Test
		@DisplayName("a recursive local function calls its ungeneralized signature")
		void recursiveLocalFunction()
		{
			AstLocal f = ast.var("f");
			AstExpr.Call recursiveCall = ast.call(ast.read(f));
			AstExpr.Function fn = ast.func(List.of(), ast.block(ast.ret(recursiveCall)));
			ConstraintGenerator gen = fixture.generate(ast.block(ast.localFunction(f, fn)));

			assertThat(fixture.errors()).isEmpty();

			TypeId functionType = gen.getRootScope().lookup(Symbol.local(f)).orElseThrow();
			assertThat(fixture.module.getAstTypes().get(fn)).isSameAs(functionType);

			Constraint generalization = null;
			for (Constraint c : fixture.constraintsOf(GeneralizationConstraint.class))
			{
				if (c.getPayload(GeneralizationConstraint.class).generalizedType() == functionType)
				{
					generalization = c;
				}
			}
			assertThat(generalization).isNotNull();
			assertThat(functionType.get(BlockedType.class).getOwner()).isSameAs(generalization);

			Constraint call = fixture.constraintsOf(FunctionCallConstraint.class).get(0);
			assertThat(call.getPayload(FunctionCallConstraint.class).fn().is(FunctionType.class)).isTrue();
			assertThat(generalization.getDependencies()).contains(call);

			assertThat(emptyReturnsAt(fn)).isEmpty();
		}

		@Test
		@DisplayName("a fully annotated local function is bound without generalization")
		void annotatedLocalFunction()
		{
			AstLocal g = ast.var("g");
			AstLocal a = ast.var("a", ast.ref("number"));
			AstExpr.Function fn = ast.func(List.of(a), ast.typeList(ast.ref("number")), ast.block(ast.ret(ast.read(a))));
			ConstraintGenerator gen = fixture.generate(ast.block(ast.localFunction(g, fn)));

			assertThat(fixture.payloads(GeneralizationConstraint.class)).hasSize(1);
			TypeId bound = gen.getRootScope().lookup(Symbol.local(g)).orElseThrow().follow();
			assertThat(bound.get(FunctionType.class)).isNotNull();
			assertThat(fixture.module.getAstTypes().get(fn)).isSameAs(bound);
		}

		@Test
		@DisplayName("a body that falls off its end returns the empty pack")
		void fallthroughBody()
		{
			AstExpr.Function fn = ast.func(List.of(), ast.block());
			fixture.generate(ast.block(ast.local(ast.var("f"), fn)));

			List<PackSubtypeConstraint> fallthrough = emptyReturnsAt(fn);
			assertThat(fallthrough).hasSize(1);
			assertThat(fallthrough.get(0).returns()).isFalse();
		}

		@Test
		@DisplayName("a body that raises an error does not fall through")
		void throwingBody()
		{
			AstExpr.Function fn = ast.func(List.of(), ast.block(ast.exprStat(ast.call(ast.global("error"), ast.string("boom")))));
			fixture.generate(ast.block(ast.local(ast.var("f"), fn)));

			assertThat(emptyReturnsAt(fn)).isEmpty();
		}

		@Test
		@DisplayName("a body whose if returns on both branches does not fall through")
		void returningOnBothBranches()
		{
			AstLocal x = ast.var("x");
			AstExpr.Function fn = ast.func(List.of(x), ast.block(
					ast.ifStat(ast.read(x), ast.block(ast.ret(ast.number(1))), ast.block(ast.ret(ast.number(2))))));
			fixture.generate(ast.block(ast.local(ast.var("f"), fn)));

			assertThat(emptyReturnsAt(fn)).isEmpty();
			List<Constraint> returns = new ArrayList<>();
			for (Constraint c : fixture.constraintsOf(PackSubtypeConstraint.class))
			{
				if (c.getPayload(PackSubtypeConstraint.class).returns())
				{
					returns.add(c);
				}
			}
			assertThat(returns).hasSize(2);
		}

		@Test
		@DisplayName("a global function takes over its prepopulated placeholder")
		void globalFunction()
		{
			AstExpr.Global name = ast.global("g");
			AstExpr.Function fn = ast.func(List.of(), ast.block(ast.ret(ast.number(1))));
			ConstraintGenerator gen = fixture.generate(ast.block(ast.function(name, fn)));

			Constraint generalization = null;
			for (Constraint c : fixture.constraintsOf(GeneralizationConstraint.class))
			{
				if (c.getLocation().equals(name.location))
				{
					generalization = c;
				}
			}
			assertThat(generalization).isNotNull();
			TypeId placeholder = generalization.getPayload(GeneralizationConstraint.class).generalizedType();
			assertThat(placeholder.get(BlockedType.class).getOwner()).isSameAs(generalization);
			assertThat(fixture.constraintsOf(Unpack1Constraint.class)).isEmpty();
			assertThat(gen.getRootScope().lookup(Symbol.global("g")).orElseThrow().is(FunctionType.class)).isTrue();
		}

		@Test
		@DisplayName("redefining a method gives each definition its own generalization")
		void duplicateMethodDefinition()
		{
			AstLocal t = ast.var("t");
			ConstraintGenerator gen = fixture.generate(ast.block(
					ast.local(t, ast.table()),
					ast.function(ast.index(ast.read(t), "m"), ast.func(List.of(), ast.block())),
					ast.function(ast.index(ast.read(t), "m"), ast.func(List.of(), ast.block()))));

			List<Constraint> methodGeneralizations = new ArrayList<>();
			List<Constraint> all = fixture.constraintsOf(GeneralizationConstraint.class);
			for (Constraint c : all.subList(0, all.size() - 1))
			{
				methodGeneralizations.add(c);
			}
			assertThat(methodGeneralizations).hasSize(2);

			TypeId first = methodGeneralizations.get(0).getPayload(GeneralizationConstraint.class).generalizedType();
			TypeId second = methodGeneralizations.get(1).getPayload(GeneralizationConstraint.class).generalizedType();
			assertThat(first).isNotSameAs(second);
			assertThat(first.get(BlockedType.class).getOwner()).isSameAs(methodGeneralizations.get(0));
			assertThat(second.get(BlockedType.class).getOwner()).isSameAs(methodGeneralizations.get(1));

			// The property write is not something the function body waits on.
			for (Constraint generalization : methodGeneralizations)
			{
				for (Constraint dependency : generalization.getDependencies())
				{
					assertThat(dependency.getPayload()).isNotInstanceOf(SetPropConstraint.class);
					assertThat(dependency.getPayload()).isNotInstanceOf(HasPropConstraint.class);
				}
			}
			assertThat(gen.constraints.isAcyclic()).isTrue();
		}
	}

	@Nested
	@DisplayName("assignment")
	class Assignment
	{
		@Test
		@DisplayName("t.a.b = v reads a, writes b and rebinds t")
		void propertyPath()
		{
			AstLocal t = ast.var("t");
			AstExpr.Local root = ast.read(t);
			AstExpr.IndexName target = ast.index(ast.index(root, "a"), "b");
			ConstraintGenerator gen = fixture.generate(ast.block(
					ast.local(t, ast.table()),
					ast.assign(target, ast.number(1))));

			List<Constraint> sets = fixture.constraintsOf(SetPropConstraint.class);
			assertThat(sets).hasSize(1);
			SetPropConstraint set = sets.get(0).getPayload(SetPropConstraint.class);
			assertThat(set.path()).containsExactly("a", "b");

			List<HasPropConstraint> reads = fixture.payloads(HasPropConstraint.class);
			assertThat(reads).hasSize(2);
			assertThat(reads.get(0).prop()).isEqualTo("a");
			assertThat(reads.get(0).context()).isEqualTo(ValueContext.RVALUE);
			assertThat(reads.get(0).subjectType()).isSameAs(set.resultType());
			assertThat(reads.get(1).prop()).isEqualTo("b");
			assertThat(reads.get(1).context()).isEqualTo(ValueContext.LVALUE);
			assertThat(reads.get(1).subjectType()).isSameAs(reads.get(0).resultType());

			assertThat(sets.get(0).getDependencies()).containsAll(fixture.constraintsOf(HasPropConstraint.class));
			assertThat(fixture.module.getAstTypes().get(root)).isSameAs(set.resultType());
			assertThat(gen.getRootScope().getLvalueTypes()).containsValue(set.resultType());
			assertThat(gen.constraints.isAcyclic()).isTrue();
		}

		@Test
		@DisplayName("the value pack is unpacked into the targets after they are checked")
		void unpackWaitsForTargets()
		{
			AstLocal t = ast.var("t");
			fixture.generate(ast.block(
					ast.local(t, ast.table()),
					ast.assign(ast.index(ast.read(t), "a"), ast.number(1))));

			List<Constraint> unpacks = fixture.constraintsOf(UnpackConstraint.class);
			Constraint assignmentUnpack = unpacks.get(unpacks.size() - 1);
			assertThat(assignmentUnpack.getDependencies()).containsAll(fixture.constraintsOf(SetPropConstraint.class));

			Constraint subtype = null;
			for (Constraint c : fixture.constraintsOf(PackSubtypeConstraint.class))
			{
				if (c.getDependencies().contains(assignmentUnpack))
				{
					subtype = c;
				}
			}
			assertThat(subtype).isNotNull();
		}

		@Test
		@DisplayName("x += 1 checks the sum against x's upper bound before writing it")
		void compoundAssignment()
		{
			AstLocal x = ast.var("x");
			fixture.generate(ast.block(
					ast.local(x, ast.number(1)),
					ast.compoundAssign(AstExpr.Binary.Op.ADD, ast.read(x), ast.number(2))));

			Constraint subtype = fixture.constraintsOf(SubtypeConstraint.class).get(0);
			SubtypeConstraint payload = subtype.getPayload(SubtypeConstraint.class);
			TypeFamilyInstanceType sum = payload.subType().get(TypeFamilyInstanceType.class);
			assertThat(sum).isNotNull();
			assertThat(sum.getFamily()).isEqualTo(BuiltinTypeFamily.ADD);
			assertThat(payload.superType()).isSameAs(fixture.builtinTypes.unknownType);

			Constraint write = null;
			for (Constraint c : fixture.constraintsOf(Unpack1Constraint.class))
			{
				if (c.getPayload(Unpack1Constraint.class).sourceType() == payload.subType())
				{
					write = c;
				}
			}
			assertThat(write).isNotNull();
			assertThat(write.getDependencies()).contains(subtype);
		}
	}

	@Nested
	@DisplayName("control flow")
	class ControlFlowStatements
	{
		@Test
		@DisplayName("numeric for checks its bounds and binds the counter to number")
		void numericFor()
		{
			AstLocal i = ast.var("i");
			AstStat.For loop = ast.forStat(i, ast.number(1), ast.number(10), ast.block());
			fixture.generate(ast.block(loop));

			List<SubtypeConstraint> bounds = fixture.payloads(SubtypeConstraint.class);
			assertThat(bounds).hasSize(2);
			for (SubtypeConstraint bound : bounds)
			{
				assertThat(bound.superType()).isSameAs(fixture.builtinTypes.numberType);
			}

			Scope forScope = fixture.module.getAstScopes().get(loop);
			assertThat(forScope.lookup(Symbol.local(i))).contains(fixture.builtinTypes.numberType);
		}

		@Test
		@DisplayName("for-in emits an iterable constraint over one local per variable")
		void genericFor()
		{
			AstLocal k = ast.var("k");
			AstLocal v = ast.var("v");
			AstExpr.Call iterator = ast.call(ast.global("pairs"), ast.table());
			AstStat.ForIn loop = ast.forIn(List.of(k, v), List.of(iterator), ast.block());
			fixture.generate(ast.block(loop));

			List<IterableConstraint> iterables = fixture.payloads(IterableConstraint.class);
			assertThat(iterables).hasSize(1);
			assertThat(iterables.get(0).variables()).hasSize(2);
			assertThat(iterables.get(0).variables().get(0).get(LocalType.class).getName()).isEqualTo("k");
			assertThat(iterables.get(0).nextAstFragment()).isSameAs(iterator);
			assertThat(iterables.get(0).astForInNextTypes()).isSameAs(fixture.module.getAstForInNextTypes());

			Scope loopScope = fixture.module.getAstScopes().get(loop);
			assertThat(loopScope.lookup(Symbol.local(v))).contains(iterables.get(0).variables().get(1));
		}

		@Test
		@DisplayName("repeat checks its condition with the body's locals in scope")
		void repeatSeesBodyLocals()
		{
			AstLocal done = ast.var("done");
			AstExpr.Local condition = ast.read(done);
			AstStat.Repeat loop = ast.repeat(ast.block(ast.local(done, ast.bool(true))), condition);
			fixture.generate(ast.block(loop));

			assertThat(fixture.module.getAstTypes()).containsKey(condition);
			assertThat(fixture.errors()).isEmpty();
		}

		@Test
		@DisplayName("while narrows its body by the condition")
		void whileRefines()
		{
			AstLocal x = ast.var("x");
			AstStat.While loop = ast.whileStat(ast.read(x), ast.block());
			fixture.generate(ast.block(ast.local(x, ast.number(1)), loop));

			Scope whileScope = fixture.module.getAstScopes().get(loop);
			assertThat(whileScope.getRvalueRefinements()).hasSize(1);
		}
	}

	@Nested
	@DisplayName("declarations")
	class Declarations
	{
		@Test
		@DisplayName("declare x: T records a declared global readable by later code")
		void declareGlobal()
		{
			AstExpr.Global read = ast.global("x");
			fixture.generate(ast.block(
					ast.declareGlobal("x", ast.ref("number")),
					ast.local(ast.var("y"), read)));

			assertThat(fixture.module.getDeclaredGlobals()).containsEntry("x", fixture.builtinTypes.numberType);
			assertThat(fixture.module.getAstTypes().get(read)).isSameAs(fixture.builtinTypes.numberType);
		}

		@Test
		@DisplayName("an undeclared global reads as the error-recovery type")
		void unknownGlobal()
		{
			AstExpr.Global read = ast.global("nowhere");
			fixture.generate(ast.block(ast.local(ast.var("y"), read)));

			assertThat(fixture.module.getAstTypes().get(read)).isSameAs(fixture.builtinTypes.errorRecoveryType());
		}

		@Test
		@DisplayName("declare function builds a named function type")
		void declareFunction()
		{
			fixture.generate(ast.block(ast.declareFunction("len", List.of(ast.ref("string")), List.of(ast.ref("number")))));

			TypeId fnType = fixture.module.getDeclaredGlobals().get("len");
			FunctionType fn = fnType.get(FunctionType.class);
			assertThat(fn).isNotNull();
			assertThat(fn.getArgNames()).extracting(FunctionArgument::getName).containsExactly("a0");
			assertThat(TypeUtils.first(fn.getArgTypes())).contains(fixture.builtinTypes.stringType);
			assertThat(TypeUtils.first(fn.getRetTypes())).contains(fixture.builtinTypes.numberType);
		}

		@Test
		@DisplayName("declared methods take the class as self")
		void classMethods()
		{
			ConstraintGenerator gen = fixture.generate(ast.block(ast.declareClass("Foo", null,
					ast.prop("bar", ast.functionType(List.of(ast.ref("number")), List.of(ast.ref("string"))), true),
					ast.prop("__add", ast.functionType(List.of(ast.ref("number")), List.of(ast.ref("number"))), true))));

			assertThat(fixture.errors()).isEmpty();
			TypeId classTy = gen.getRootScope().getExportedTypeBindings().get("Foo").getType();
			ClassType classType = classTy.get(ClassType.class);
			assertThat(classType.getParent()).isSameAs(fixture.builtinTypes.classType);

			FunctionType bar = classType.getProps().get("bar").type().get(FunctionType.class);
			assertThat(bar.hasSelf()).isTrue();
			assertThat(bar.getArgNames().get(0).getName()).isEqualTo("self");
			assertThat(TypeUtils.first(bar.getArgTypes())).contains(classTy);

			assertThat(classType.getProps()).doesNotContainKey("__add");
			assertThat(classType.getMetatable().get(TableType.class).getProps()).containsKey("__add");
		}

		@Test
		@DisplayName("redeclaring a method adds an overload")
		void methodOverloads()
		{
			ConstraintGenerator gen = fixture.generate(ast.block(ast.declareClass("Foo", null,
					ast.prop("bar", ast.functionType(List.of(ast.ref("number")), List.of()), false),
					ast.prop("bar", ast.functionType(List.of(ast.ref("string")), List.of()), false))));

			ClassType classType = gen.getRootScope().getExportedTypeBindings().get("Foo").getType().get(ClassType.class);
			IntersectionType overloads = classType.getProps().get("bar").type().get(IntersectionType.class);
			assertThat(overloads).isNotNull();
			assertThat(overloads.getParts()).hasSize(2);
		}

		@Test
		@DisplayName("redeclaring a field is an error")
		void fieldOverload()
		{
			fixture.generate(ast.block(ast.declareClass("Foo", null,
					ast.prop("x", ast.ref("number"), false),
					ast.prop("x", ast.ref("number"), false))));

			List<TypeErrorData> errors = fixture.errors();
			assertThat(errors).hasSize(1);
			assertThat(errors.get(0).getMessage()).isEqualTo("Cannot overload non-function class member 'x'");
		}

		@Test
		@DisplayName("a subclass points at its declared superclass")
		void subclass()
		{
			ConstraintGenerator gen = fixture.generate(ast.block(
					ast.declareClass("Base", null),
					ast.declareClass("Derived", "Base")));

			TypeId base = gen.getRootScope().getExportedTypeBindings().get("Base").getType();
			ClassType derived = gen.getRootScope().getExportedTypeBindings().get("Derived").getType().get(ClassType.class);
			assertThat(derived.getParent()).isSameAs(base);
		}

		@Test
		@DisplayName("an unknown superclass is reported and the class is skipped")
		void unknownSuperclass()
		{
			ConstraintGenerator gen = fixture.generate(ast.block(ast.declareClass("Foo", "Missing")));

			List<TypeErrorData> errors = fixture.errors();
			assertThat(errors).hasSize(1);
			UnknownSymbol unknown = (UnknownSymbol) errors.get(0);
			assertThat(unknown.getName()).isEqualTo("Missing");
			assertThat(unknown.getContext()).isEqualTo(UnknownSymbol.Context.TYPE);
			assertThat(gen.getRootScope().getExportedTypeBindings()).doesNotContainKey("Foo");
		}

		@Test
		@DisplayName("a non-class superclass is reported")
		void nonClassSuperclass()
		{
			fixture.generate(ast.block(ast.declareClass("Foo", "number")));

			List<TypeErrorData> errors = fixture.errors();
			assertThat(errors).hasSize(1);
			assertThat(errors.get(0)).isInstanceOf(GenericError.class);
			assertThat(errors.get(0).getMessage()).isEqualTo("Cannot use non-class type 'number' as a superclass of class 'Foo'");
		}
	}
}
