package my.mortgagecalculator.engine.result;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.UnaryOperator;

/**
 * Outcome of a fallible calculation: either a value or a {@link CalculationError}.
 */
public sealed interface Result<T> permits Result.Success, Result.Failure {

	static <T> Result<T> success(T value) {
		return new Success<>(value);
	}

	static <T> Result<T> failure(CalculationError error) {
		return new Failure<>(error);
	}

	static <T> Result<T> failure(ErrorCode code, String message, String operation) {
		return new Failure<>(CalculationError.of(code, message, operation));
	}

	/**
	 * Collects a list of results into a result of a list, stopping at the first failure.
	 */
	static <T> Result<List<T>> sequence(List<Result<T>> results) {
		List<T> values = new ArrayList<>(results.size());
		for (Result<T> result : results) {
			if (result instanceof Failure<T> failure) {
				return new Failure<>(failure.error());
			}
			values.add(((Success<T>) result).value());
		}
		return new Success<>(List.copyOf(values));
	}

	boolean isSuccess();

	default boolean isFailure() {
		return !isSuccess();
	}

	default <U> Result<U> map(Function<? super T, ? extends U> mapper) {
		if (this instanceof Success<T> success) {
			return new Success<>(mapper.apply(success.value()));
		}
		return new Failure<>(((Failure<T>) this).error());
	}

	default <U> Result<U> flatMap(Function<? super T, Result<U>> mapper) {
		if (this instanceof Success<T> success) {
			return Objects.requireNonNull(mapper.apply(success.value()), "mapper returned null");
		}
		return new Failure<>(((Failure<T>) this).error());
	}

	default Result<T> mapError(UnaryOperator<CalculationError> mapper) {
		if (this instanceof Failure<T> failure) {
			return new Failure<>(mapper.apply(failure.error()));
		}
		return this;
	}

	default <U> U fold(Function<? super T, ? extends U> onSuccess,
					   Function<CalculationError, ? extends U> onFailure) {
		if (this instanceof Success<T> success) {
			return onSuccess.apply(success.value());
		}
		return onFailure.apply(((Failure<T>) this).error());
	}

	default Result<T> onFailure(Consumer<CalculationError> action) {
		if (this instanceof Failure<T> failure) {
			action.accept(failure.error());
		}
		return this;
	}

	default Optional<T> toOptional() {
		if (this instanceof Success<T> success) {
			return Optional.of(success.value());
		}
		return Optional.empty();
	}

	default Optional<CalculationError> findError() {
		if (this instanceof Failure<T> failure) {
			return Optional.of(failure.error());
		}
		return Optional.empty();
	}

	/**
	 * Returns the value for results the caller knows to be successful.
	 *
	 * @throws IllegalStateException if this is a failure
	 */
	default T orElseThrow() {
		if (this instanceof Success<T> success) {
			return success.value();
		}
		throw new IllegalStateException(((Failure<T>) this).error().describe());
	}

	record Success<T>(T value) implements Result<T> {
		public Success {
			Objects.requireNonNull(value, "value");
		}

		@Override
		public boolean isSuccess() {
			return true;
		}
	}

	record Failure<T>(CalculationError error) implements Result<T> {
		public Failure {
			Objects.requireNonNull(error, "error");
		}

		@Override
		public boolean isSuccess() {
			return false;
		}
	}
}
