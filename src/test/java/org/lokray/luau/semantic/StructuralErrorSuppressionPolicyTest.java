package org.lokray.luau.semantic;

import org.lokray.luau.semantic.type.BuiltinTypes;
import org.lokray.luau.semantic.type.IntersectionType;
import org.lokray.luau.semantic.type.TypeArena;
import org.lokray.luau.semantic.type.TypeId;
import org.lokray.luau.semantic.type.UnionType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("StructuralErrorSuppressionPolicy")
class StructuralErrorSuppressionPolicyTest
{
	private final BuiltinTypes builtinTypes = new BuiltinTypes();
	private final TypeArena arena = new TypeArena();

	@Test
	@DisplayName("any and the error type suppress, directly or as a member")
	void suppresses()
	{
		StructuralErrorSuppressionPolicy policy = new StructuralErrorSuppressionPolicy();
		TypeId nested = arena.addType(new IntersectionType(List.of(builtinTypes.numberType,
				arena.addType(new UnionType(List.of(builtinTypes.stringType, builtinTypes.errorType))))));

		assertThat(policy.shouldSuppressErrors(builtinTypes.anyType)).isEqualTo(ErrorSuppression.SUPPRESS);
		assertThat(policy.shouldSuppressErrors(nested)).isEqualTo(ErrorSuppression.SUPPRESS);
		assertThat(policy.shouldSuppressErrors(builtinTypes.numberType)).isEqualTo(ErrorSuppression.DO_NOT_SUPPRESS);
	}

	@Test
	@DisplayName("a member tree over the limit fails normalization")
	void memberLimit()
	{
		StructuralErrorSuppressionPolicy policy = new StructuralErrorSuppressionPolicy(2);
		TypeId union = arena.addType(new UnionType(List.of(builtinTypes.numberType, builtinTypes.stringType, builtinTypes.nilType)));

		assertThat(policy.shouldSuppressErrors(union)).isEqualTo(ErrorSuppression.NORMALIZATION_FAILED);
	}
}
