package org.lokray.luau.semantic;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("RecursionCounter")
class RecursionCounterTest
{
	@Test
	@DisplayName("the limit itself is still allowed")
	void limitIsInclusive()
	{
		RecursionCounter counter = new RecursionCounter(2);
		try (RecursionCounter.Entry first = counter.enter(); RecursionCounter.Entry second = counter.enter())
		{
			assertThat(first.isExceeded()).isFalse();
			assertThat(second.isExceeded()).isFalse();
			try (RecursionCounter.Entry third = counter.enter())
			{
				assertThat(third.isExceeded()).isTrue();
			}
		}
		assertThat(counter.getCount()).isZero();
	}

	@Test
	@DisplayName("closing an entry twice only leaves once")
	void doubleClose()
	{
		RecursionCounter counter = new RecursionCounter(5);
		RecursionCounter.Entry outer = counter.enter();
		RecursionCounter.Entry inner = counter.enter();

		inner.close();
		inner.close();

		assertThat(counter.getCount()).isEqualTo(1);
		outer.close();
		assertThat(counter.getCount()).isZero();
	}
}
