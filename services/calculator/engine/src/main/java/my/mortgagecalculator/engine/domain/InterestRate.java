package my.mortgagecalculator.engine.domain;

import my.mortgagecalculator.engine.result.ErrorCode;
import my.mortgagecalculator.engine.result.Result;

import java.math.BigDecimal;
import java.math.MathContext;

/**
 * Nominal annual interest rate, expressed in percent and bounded to 0..25.
 */
public final class InterestRate implements Comparable<InterestRate> {
	public static final BigDecimal MIN_PERCENT = BigDecimal.ZERO;
	public static final BigDecimal MAX_PERCENT = new BigDecimal("25");
	private static final BigDecimal MONTHS_PER_YEAR = new BigDecimal("12");

	private final BigDecimal percent;

	private InterestRate(BigDecimal percent) {
		this.percent = percent;
	}

	public static Result<InterestRate> ofPercent(BigDecimal percent) {
		if (percent == null) {
			return Result.failure(ErrorCode.INVALID_INTEREST_RATE, "Interest rate is required", "InterestRate.ofPercent");
		}
		if (percent.compareTo(MIN_PERCENT) < 0 || percent.compareTo(MAX_PERCENT) > 0) {
			return Result.failure(ErrorCode.INVALID_INTEREST_RATE,
					"Interest rate must be between 0% and 25%: " + percent.toPlainString() + "%",
					"InterestRate.ofPercent");
		}
		return Result.success(new InterestRate(percent.stripTrailingZeros()));
	}

	public static Result<InterestRate> parsePercent(String percent) {
		if (percent == null || percent.isBlank()) {
			return Result.failure(ErrorCode.INVALID_INTEREST_RATE, "Interest rate is required", "InterestRate.parsePercent");
		}
		try {
			return ofPercent(new BigDecimal(percent.trim()));
		} catch (NumberFormatException ex) {
			return Result.failure(ErrorCode.INVALID_INTEREST_RATE,
					"Interest rate is not a number: " + percent, "InterestRate.parsePercent");
		}
	}

	/**
	 * Creates a rate from an annual fraction, e.g. {@code 0.056} for 5.6%.
	 */
	public static Result<InterestRate> fromFraction(BigDecimal fraction) {
		if (fraction == null) {
			return Result.failure(ErrorCode.INVALID_INTEREST_RATE, "Interest rate is required", "InterestRate.fromFraction");
		}
		return ofPercent(fraction.movePointRight(2));
	}

	public BigDecimal percent() {
		return percent;
	}

	public BigDecimal annualFraction() {
		return percent.movePointLeft(2);
	}

	public BigDecimal monthlyFraction(MathContext mathContext) {
		return annualFraction().divide(MONTHS_PER_YEAR, mathContext);
	}

	public boolean isZero() {
		return percent.signum() == 0;
	}

	public Result<InterestRate> plusPercentagePoints(BigDecimal points) {
		return ofPercent(percent.add(points));
	}

	/**
	 * Shifts the rate by the given percentage points, clamped to the valid range.
	 */
	public InterestRate shiftedWithinBounds(BigDecimal points) {
		BigDecimal shifted = percent.add(points).max(MIN_PERCENT).min(MAX_PERCENT);
		return new InterestRate(shifted.stripTrailingZeros());
	}

	@Override
	public int compareTo(InterestRate other) {
		return percent.compareTo(other.percent);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) {
			return true;
		}
		if (!(o instanceof InterestRate other)) {
			return false;
		}
		return percent.compareTo(other.percent) == 0;
	}

	@Override
	public int hashCode() {
		return percent.stripTrailingZeros().hashCode();
	}

	@Override
	public String toString() {
		return percent.toPlainString() + "%";
	}
}
