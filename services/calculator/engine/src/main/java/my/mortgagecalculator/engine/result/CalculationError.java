package my.mortgagecalculator.engine.result;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Describes why a calculation could not produce a value.
 * <p>
 * The context map keeps insertion order so that month, balance and similar values read
 * in the order they were recorded.
 */
public record CalculationError(
		ErrorCode code,
		String message,
		String operation,
		Map<String, Object> context,
		CalculationError cause
) {
	public CalculationError {
		Objects.requireNonNull(code, "code");
		message = message == null ? code.name() : message;
		operation = operation == null ? "" : operation;
		context = context == null || context.isEmpty()
				? Map.of()
				: Collections.unmodifiableMap(new LinkedHashMap<>(context));
	}

	public static CalculationError of(ErrorCode code, String message) {
		return new CalculationError(code, message, null, null, null);
	}

	public static CalculationError of(ErrorCode code, String message, String operation) {
		return new CalculationError(code, message, operation, null, null);
	}

	public CalculationError withOperation(String newOperation) {
		return new CalculationError(code, message, newOperation, context, cause);
	}

	public CalculationError withContext(String key, Object value) {
		Map<String, Object> merged = new LinkedHashMap<>(context);
		merged.put(key, value);
		return new CalculationError(code, message, operation, merged, cause);
	}

	/**
	 * Wraps this error as the cause of a new error raised by {@code outerOperation},
	 * keeping the original code.
	 */
	public CalculationError wrap(String outerOperation, String outerMessage) {
		return new CalculationError(code, outerMessage, outerOperation, null, this);
	}

	public CalculationError rootCause() {
		CalculationError current = this;
		while (current.cause() != null) {
			current = current.cause();
		}
		return current;
	}

	public String describe() {
		StringBuilder builder = new StringBuilder();
		builder.append(code).append(" in ").append(operation.isBlank() ? "<unknown>" : operation)
				.append(": ").append(message);
		if (!context.isEmpty()) {
			builder.append(' ').append(context);
		}
		if (cause != null) {
			builder.append(" <- ").append(cause.describe());
		}
		return builder.toString();
	}
}
