package my.mortgagecalculator.engine.service.util;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BatchEvaluatorTest {
	@Test
	void keepsInputOrderOnWorkerPool() {
		List<Integer> items = IntStream.rangeClosed(1, 50).boxed().toList();

		List<Integer> squares = BatchEvaluator.evaluate(items, value -> value * value, 4);

		assertThat(squares).hasSize(50);
		assertThat(squares.get(0)).isEqualTo(1);
		assertThat(squares.get(49)).isEqualTo(2500);
		assertThat(squares).isSorted();
	}

	@Test
	void rethrowsWorkerFailure() {
		assertThatThrownBy(() -> BatchEvaluator.evaluate(List.of(1, 2, 3), value -> {
			if (value == 2) {
				throw new IllegalArgumentException("broken item " + value);
			}
			return value;
		}, 2))
				.isInstanceOf(IllegalArgumentException.class)
				.hasMessage("broken item 2");
	}

	@Test
	void emptyBatchNeedsNoPool() {
		assertThat(BatchEvaluator.evaluate(List.<String>of(), String::length, 8)).isEmpty();
	}
}
