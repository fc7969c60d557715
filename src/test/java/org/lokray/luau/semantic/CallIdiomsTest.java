package org.lokray.luau.semantic;

import org.lokray.luau.ast.AstBuilder;
import org.lokray.luau.ast.AstExpr;
import org.lokray.luau.ast.AstLocal;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("CallIdioms")
class CallIdiomsTest
{
	private final AstBuilder ast = new AstBuilder();

	@Nested
	@DisplayName("type guards")
	class TypeGuards
	{
		@Test
		@DisplayName("type(x) == \"string\" targets x")
		void typeCall()
		{
			AstLocal x = ast.var("x");
			AstExpr.Local target = ast.read(x);
			AstExpr.Binary guard = ast.binary(AstExpr.Binary.Op.COMPARE_EQ,
					ast.call(ast.global("type"), target), ast.string("string"));

			Optional<CallIdioms.TypeGuard> match = CallIdioms.matchTypeGuard(guard);

			assertThat(match).isPresent();
			assertThat(match.get().isTypeof()).isFalse();
			assertThat(match.get().target()).isSameAs(target);
			assertThat(match.get().type()).isEqualTo("string");
		}

		@Test
		@DisplayName("operands may be written in either order")
		void reversedOperands()
		{
			AstExpr.Binary guard = ast.binary(AstExpr.Binary.Op.COMPARE_NE,
					ast.string("Instance"), ast.call(ast.global("typeof"), ast.read(ast.var("x"))));

			Optional<CallIdioms.TypeGuard> match = CallIdioms.matchTypeGuard(guard);

			assertThat(match).isPresent();
			assertThat(match.get().isTypeof()).isTrue();
			assertThat(match.get().type()).isEqualTo("Instance");
		}

		@Test
		@DisplayName("other comparisons and callees are not guards")
		void nonGuards()
		{
			AstExpr x = ast.read(ast.var("x"));
			assertThat(CallIdioms.matchTypeGuard(ast.binary(AstExpr.Binary.Op.COMPARE_LT,
					ast.call(ast.global("type"), x), ast.string("string")))).isEmpty();
			assertThat(CallIdioms.matchTypeGuard(ast.binary(AstExpr.Binary.Op.COMPARE_EQ,
					ast.call(ast.global("kind"), x), ast.string("string")))).isEmpty();
			assertThat(CallIdioms.matchTypeGuard(ast.binary(AstExpr.Binary.Op.COMPARE_EQ,
					ast.call(ast.global("type"), x, x), ast.string("string")))).isEmpty();
		}
	}

	@Test
	@DisplayName("require needs exactly one argument")
	void require()
	{
		AstExpr path = ast.string("shared");
		assertThat(CallIdioms.matchRequire(ast.call(ast.global("require"), path))).contains(path);
		assertThat(CallIdioms.matchRequire(ast.call(ast.global("require")))).isEmpty();
		assertThat(CallIdioms.matchRequire(ast.call(ast.global("load"), path))).isEmpty();
	}

	@Test
	@DisplayName("setmetatable needs two arguments")
	void setmetatable()
	{
		assertThat(CallIdioms.matchSetmetatable(ast.call(ast.global("setmetatable"), ast.table(), ast.table()))).isTrue();
		assertThat(CallIdioms.matchSetmetatable(ast.call(ast.global("setmetatable"), ast.table()))).isFalse();
	}

	@Test
	@DisplayName("error and failing asserts always raise")
	void erroringCalls()
	{
		assertThat(CallIdioms.doesCallError(ast.call(ast.global("error"), ast.string("boom")))).isTrue();
		assertThat(CallIdioms.doesCallError(ast.call(ast.global("assert")))).isTrue();
		assertThat(CallIdioms.doesCallError(ast.call(ast.global("assert"), ast.bool(false), ast.string("no")))).isTrue();
		assertThat(CallIdioms.doesCallError(ast.call(ast.global("assert"), ast.bool(true)))).isFalse();
		assertThat(CallIdioms.doesCallError(ast.call(ast.read(ast.var("error"))))).isFalse();
	}
}
