package my.mortgagecalculator.engine.domain;

import my.mortgagecalculator.engine.result.ErrorCode;
import my.mortgagecalculator.engine.result.Result;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Non-negative euro amount held as a whole number of cents.
 */
public final class Money implements Comparable<Money> {
	public static final long MAX_CENTS = 99_999_999_900L;
	public static final Money ZERO = new Money(0L);
	public static final Money MAX = new Money(MAX_CENTS);

	private final long cents;

	private Money(long cents) {
		this.cents = cents;
	}

	public static Result<Money> ofCents(long cents) {
		if (cents < 0) {
			return Result.failure(ErrorCode.NEGATIVE_AMOUNT, "Amount must not be negative: " + cents + " cents", "Money.ofCents");
		}
		if (cents > MAX_CENTS) {
			return Result.failure(ErrorCode.EXCEEDS_MAXIMUM, "Amount exceeds maximum: " + cents + " cents", "Money.ofCents");
		}
		return Result.success(new Money(cents));
	}

	/**
	 * Creates money from a euro amount, rounding half up to whole cents.
	 */
	public static Result<Money> of(BigDecimal euros) {
		if (euros == null) {
			return Result.failure(ErrorCode.INVALID_AMOUNT, "Amount is required", "Money.of");
		}
		if (euros.signum() < 0) {
			return Result.failure(ErrorCode.NEGATIVE_AMOUNT, "Amount must not be negative: " + euros.toPlainString(), "Money.of");
		}
		BigDecimal rounded = euros.setScale(2, RoundingMode.HALF_UP);
		if (rounded.compareTo(MAX.toEuros()) > 0) {
			return Result.failure(ErrorCode.EXCEEDS_MAXIMUM, "Amount exceeds maximum: " + euros.toPlainString(), "Money.of");
		}
		return Result.success(new Money(rounded.movePointRight(2).longValueExact()));
	}

	public static Result<Money> parse(String euros) {
		if (euros == null || euros.isBlank()) {
			return Result.failure(ErrorCode.INVALID_AMOUNT, "Amount is required", "Money.parse");
		}
		try {
			return of(new BigDecimal(euros.trim()));
		} catch (NumberFormatException ex) {
			return Result.failure(ErrorCode.INVALID_AMOUNT, "Amount is not a number: " + euros, "Money.parse");
		}
	}

	public long cents() {
		return cents;
	}

	public BigDecimal toEuros() {
		return BigDecimal.valueOf(cents, 2);
	}

	public boolean isZero() {
		return cents == 0L;
	}

	public Result<Money> add(Money other) {
		long sum = cents + other.cents;
		if (sum > MAX_CENTS) {
			return Result.failure(ErrorCode.EXCEEDS_MAXIMUM, "Sum exceeds maximum: " + sum + " cents", "Money.add");
		}
		return Result.success(new Money(sum));
	}

	public Result<Money> subtract(Money other) {
		long difference = cents - other.cents;
		if (difference < 0) {
			return Result.failure(ErrorCode.NEGATIVE_AMOUNT,
					"Difference is negative: " + this + " - " + other, "Money.subtract");
		}
		return Result.success(new Money(difference));
	}

	/**
	 * Difference floored at zero.
	 */
	public Money subtractOrZero(Money other) {
		return new Money(Math.max(0L, cents - other.cents));
	}

	public Result<Money> multiply(BigDecimal factor) {
		if (factor == null) {
			return Result.failure(ErrorCode.INVALID_AMOUNT, "Factor is required", "Money.multiply");
		}
		if (factor.signum() < 0) {
			return Result.failure(ErrorCode.NEGATIVE_AMOUNT, "Factor must not be negative: " + factor, "Money.multiply");
		}
		return of(toEuros().multiply(factor));
	}

	/**
	 * Share of this amount. Never fails because a percentage is at most 100.
	 */
	public Money portion(Percentage percentage) {
		BigDecimal share = BigDecimal.valueOf(cents)
				.multiply(percentage.value())
				.movePointLeft(2)
				.setScale(0, RoundingMode.HALF_UP);
		return new Money(share.longValueExact());
	}

	public Money min(Money other) {
		return cents <= other.cents ? this : other;
	}

	public Money max(Money other) {
		return cents >= other.cents ? this : other;
	}

	public boolean isGreaterThan(Money other) {
		return cents > other.cents;
	}

	public boolean isLessThan(Money other) {
		return cents < other.cents;
	}

	@Override
	public int compareTo(Money other) {
		return Long.compare(cents, other.cents);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) {
			return true;
		}
		if (!(o instanceof Money other)) {
			return false;
		}
		return cents == other.cents;
	}

	@Override
	public int hashCode() {
		return Long.hashCode(cents);
	}

	@Override
	public String toString() {
		return toEuros().toPlainString() + " EUR";
	}
}
