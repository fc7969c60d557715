package org.lokray.luau.util;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("GeneratorOptions")
class GeneratorOptionsTest
{
	@Test
	@DisplayName("defaults")
	void defaults()
	{
		GeneratorOptions options = GeneratorOptions.defaults();

		assertThat(options.getRecursionLimit()).isEqualTo(GeneratorOptions.DEFAULT_RECURSION_LIMIT);
		assertThat(options.isMagicTypes()).isFalse();
		assertThat(options.isLogJson()).isFalse();
		assertThat(options.isVerboseFlag()).isFalse();
	}

	@Test
	@DisplayName("long and short forms of the recursion limit")
	void recursionLimit()
	{
		assertThat(GeneratorOptions.parse(new String[]{"--recursion-limit=200"}).getRecursionLimit()).isEqualTo(200);
		assertThat(GeneratorOptions.parse(new String[]{"-r", "42"}).getRecursionLimit()).isEqualTo(42);
	}

	@Test
	@DisplayName("boolean flags")
	void flags()
	{
		GeneratorOptions options = GeneratorOptions.parse(new String[]{"--magic-types", "--log-json"});

		assertThat(options.isMagicTypes()).isTrue();
		assertThat(options.isLogJson()).isTrue();
	}

	@Test
	@DisplayName("bad input is rejected")
	void rejects()
	{
		assertThatThrownBy(() -> GeneratorOptions.parse(new String[]{"--strict"}))
				.isInstanceOf(IllegalArgumentException.class)
				.hasMessageContaining("--strict");
		assertThatThrownBy(() -> GeneratorOptions.parse(new String[]{"--recursion-limit=0"}))
				.isInstanceOf(IllegalArgumentException.class);
		assertThatThrownBy(() -> GeneratorOptions.parse(new String[]{"--recursion-limit=deep"}))
				.isInstanceOf(IllegalArgumentException.class)
				.hasCauseInstanceOf(NumberFormatException.class);
		assertThatThrownBy(() -> GeneratorOptions.parse(new String[]{"-r"}))
				.isInstanceOf(IllegalArgumentException.class)
				.hasMessageContaining("Missing argument");
	}
}
