package my.mortgagecalculator.engine.domain;

import my.mortgagecalculator.engine.result.ErrorCode;
import my.mortgagecalculator.engine.result.Result;

import java.math.BigDecimal;

/**
 * A value between 0 and 100 inclusive.
 */
public final class Percentage implements Comparable<Percentage> {
	private static final BigDecimal ONE_HUNDRED = new BigDecimal("100");

	public static final Percentage ZERO = new Percentage(BigDecimal.ZERO);
	public static final Percentage HUNDRED = new Percentage(ONE_HUNDRED);

	private final BigDecimal value;

	private Percentage(BigDecimal value) {
		this.value = value;
	}

	public static Result<Percentage> of(BigDecimal value) {
		if (value == null) {
			return Result.failure(ErrorCode.INVALID_PERCENTAGE, "Percentage is required", "Percentage.of");
		}
		if (value.signum() < 0 || value.compareTo(ONE_HUNDRED) > 0) {
			return Result.failure(ErrorCode.INVALID_PERCENTAGE,
					"Percentage must be between 0 and 100: " + value.toPlainString(), "Percentage.of");
		}
		return Result.success(new Percentage(value.stripTrailingZeros()));
	}

	public static Result<Percentage> parse(String value) {
		if (value == null || value.isBlank()) {
			return Result.failure(ErrorCode.INVALID_PERCENTAGE, "Percentage is required", "Percentage.parse");
		}
		try {
			return of(new BigDecimal(value.trim()));
		} catch (NumberFormatException ex) {
			return Result.failure(ErrorCode.INVALID_PERCENTAGE, "Percentage is not a number: " + value, "Percentage.parse");
		}
	}

	public static Result<Percentage> fromFraction(BigDecimal fraction) {
		if (fraction == null) {
			return Result.failure(ErrorCode.INVALID_PERCENTAGE, "Fraction is required", "Percentage.fromFraction");
		}
		return of(fraction.movePointRight(2));
	}

	public BigDecimal value() {
		return value;
	}

	public BigDecimal toFraction() {
		return value.movePointLeft(2);
	}

	public Result<Percentage> add(Percentage other) {
		return of(value.add(other.value));
	}

	public Result<Percentage> subtract(Percentage other) {
		return of(value.subtract(other.value));
	}

	@Override
	public int compareTo(Percentage other) {
		return value.compareTo(other.value);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) {
			return true;
		}
		if (!(o instanceof Percentage other)) {
			return false;
		}
		return value.compareTo(other.value) == 0;
	}

	@Override
	public int hashCode() {
		return value.stripTrailingZeros().hashCode();
	}

	@Override
	public String toString() {
		return value.toPlainString() + "%";
	}
}
