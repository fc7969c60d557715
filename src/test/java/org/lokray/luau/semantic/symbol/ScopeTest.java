package org.lokray.luau.semantic.symbol;

import org.lokray.luau.ast.AstLocal;
import org.lokray.luau.ast.Location;
import org.lokray.luau.dfg.Def;
import org.lokray.luau.semantic.type.BuiltinTypes;
import org.lokray.luau.util.InternalCompilerError;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("Scope")
class ScopeTest
{
	private final BuiltinTypes builtinTypes = new BuiltinTypes();
	private final Scope root = new Scope(builtinTypes.emptyTypePack);

	private Scope child(Scope parent)
	{
		Scope scope = new Scope(parent);
		parent.addChild(scope);
		return scope;
	}

	@Test
	@DisplayName("a child inherits the return and vararg packs")
	void childInheritsPacks()
	{
		root.setVarargPack(builtinTypes.anyTypePack);
		Scope nested = child(root);

		assertThat(nested.getParent()).isSameAs(root);
		assertThat(nested.getReturnType()).isSameAs(builtinTypes.emptyTypePack);
		assertThat(nested.getVarargPack()).isSameAs(builtinTypes.anyTypePack);
		assertThat(root.getChildren()).containsExactly(nested);
	}

	@Test
	@DisplayName("children must be linked to their own parent exactly once")
	void childLinking()
	{
		Scope nested = child(root);
		Scope stranger = new Scope(builtinTypes.emptyTypePack);

		assertThatThrownBy(() -> root.addChild(nested)).isInstanceOf(InternalCompilerError.class);
		assertThatThrownBy(() -> root.addChild(stranger)).isInstanceOf(InternalCompilerError.class);
	}

	@Test
	@DisplayName("bindings are found up the parent chain")
	void bindingLookup()
	{
		AstLocal x = new AstLocal("x", Location.NONE, null);
		root.getBindings().put(Symbol.local(x), new Binding(builtinTypes.numberType, Location.NONE));
		Scope nested = child(child(root));

		assertThat(nested.lookup(Symbol.local(x))).contains(builtinTypes.numberType);
		assertThat(nested.lookupEx(Symbol.local(x)).orElseThrow().scope()).isSameAs(root);
		assertThat(nested.lookup(Symbol.global("x"))).isEmpty();
	}

	@Nested
	@DisplayName("definitions")
	class Definitions
	{
		private final Def def = new Def.Cell("x", false);

		@Test
		@DisplayName("a narrowing shadows the assigned type but not the unrefined lookup")
		void refinementShadowsAssignment()
		{
			root.getLvalueTypes().put(def, builtinTypes.numberType);
			Scope nested = child(root);
			nested.getRvalueRefinements().put(def, builtinTypes.neverType);

			assertThat(nested.lookup(def)).contains(builtinTypes.neverType);
			assertThat(nested.lookupUnrefinedType(def)).contains(builtinTypes.numberType);
			assertThat(root.lookup(def)).contains(builtinTypes.numberType);
		}

		@Test
		@DisplayName("lookupEx prefers the assignment within one scope")
		void lookupExPrefersAssignment()
		{
			root.getRvalueRefinements().put(def, builtinTypes.neverType);
			root.getLvalueTypes().put(def, builtinTypes.numberType);

			Scope.DefLookup found = child(root).lookupEx(def).orElseThrow();
			assertThat(found.type()).isSameAs(builtinTypes.numberType);
			assertThat(found.scope()).isSameAs(root);
		}

		@Test
		@DisplayName("inheritRefinements keeps only definitions the parent knows")
		void inheritRefinements()
		{
			Def local = new Def.Cell("y", false);
			root.getLvalueTypes().put(def, builtinTypes.numberType);
			Scope branch = child(root);
			branch.getLvalueTypes().put(local, builtinTypes.stringType);
			branch.getRvalueRefinements().put(def, builtinTypes.neverType);
			branch.getRvalueRefinements().put(local, builtinTypes.neverType);

			root.inheritRefinements(branch);

			assertThat(root.getRvalueRefinements()).containsOnlyKeys(def);
		}

		@Test
		@DisplayName("inheritAssignments copies everything")
		void inheritAssignments()
		{
			Scope branch = child(root);
			branch.getLvalueTypes().put(def, builtinTypes.stringType);

			root.inheritAssignments(branch);

			assertThat(root.lookup(def)).contains(builtinTypes.stringType);
		}
	}

	@Test
	@DisplayName("private aliases shadow exported ones in the same scope")
	void typeLookup()
	{
		root.getExportedTypeBindings().put("T", new TypeFun(builtinTypes.numberType));
		root.getPrivateTypeBindings().put("T", new TypeFun(builtinTypes.stringType));
		Scope nested = child(root);

		assertThat(nested.lookupType("T").orElseThrow().getType()).isSameAs(builtinTypes.stringType);
		assertThat(nested.lookupType("U")).isEmpty();
	}

	@Test
	@DisplayName("subsumes holds for ancestors only")
	void subsumes()
	{
		Scope nested = child(root);

		assertThat(Scope.subsumes(root, nested)).isTrue();
		assertThat(Scope.subsumes(nested, nested)).isTrue();
		assertThat(Scope.subsumes(nested, root)).isFalse();
	}

	@Test
	@DisplayName("the prelude names the builtin types")
	void prelude()
	{
		Scope prelude = builtinTypes.createGlobalScope();

		assertThat(prelude.lookupType("number").orElseThrow().getType()).isSameAs(builtinTypes.numberType);
		assertThat(prelude.lookupType("any").orElseThrow().getType()).isSameAs(builtinTypes.anyType);
		assertThat(prelude.lookupType("table")).isEmpty();
		assertThat(prelude.getReturnType()).isSameAs(builtinTypes.anyTypePack);
	}
}
