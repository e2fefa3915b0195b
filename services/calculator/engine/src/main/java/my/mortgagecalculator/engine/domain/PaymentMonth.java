package my.mortgagecalculator.engine.domain;

import my.mortgagecalculator.engine.result.ErrorCode;
import my.mortgagecalculator.engine.result.Result;

/**
 * The 1-based number of an instalment, 1 to 480. Month 13 is the first month of the
 * second payment year.
 */
public final class PaymentMonth implements Comparable<PaymentMonth> {
	public static final int FIRST = 1;
	public static final int LAST = 480;

	private final int value;

	private PaymentMonth(int value) {
		this.value = value;
	}

	public static Result<PaymentMonth> of(int month) {
		if (month < FIRST || month > LAST) {
			return Result.failure(ErrorCode.INVALID_PAYMENT_MONTH,
					"Payment month must be between " + FIRST + " and " + LAST + ": " + month,
					"PaymentMonth.of");
		}
		return Result.success(new PaymentMonth(month));
	}

	public static Result<PaymentMonth> fromYearAndMonth(int year, int monthInYear) {
		if (year < 1 || monthInYear < 1 || monthInYear > 12) {
			return Result.failure(ErrorCode.INVALID_PAYMENT_MONTH,
					"Invalid payment year/month: " + year + "/" + monthInYear,
					"PaymentMonth.fromYearAndMonth");
		}
		return of((year - 1) * 12 + monthInYear);
	}

	public int value() {
		return value;
	}

	public int year() {
		return (value - 1) / 12 + 1;
	}

	public int monthInYear() {
		return (value - 1) % 12 + 1;
	}

	public boolean isFirstYear() {
		return value <= 12;
	}

	public boolean isEndOfYear() {
		return value % 12 == 0;
	}

	public Result<PaymentMonth> plus(int months) {
		return of(value + months);
	}

	@Override
	public int compareTo(PaymentMonth other) {
		return Integer.compare(value, other.value);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) {
			return true;
		}
		if (!(o instanceof PaymentMonth other)) {
			return false;
		}
		return value == other.value;
	}

	@Override
	public int hashCode() {
		return Integer.hashCode(value);
	}

	@Override
	public String toString() {
		return "month " + value;
	}
}
