package my.mortgagecalculator.engine.domain;

import my.mortgagecalculator.engine.result.ErrorCode;
import my.mortgagecalculator.engine.result.Result;

/**
 * A duration in months, 1 to 480.
 */
public final class MonthCount implements Comparable<MonthCount> {
	public static final int MIN_MONTHS = 1;
	public static final int MAX_MONTHS = 480;

	private final int value;

	private MonthCount(int value) {
		this.value = value;
	}

	public static Result<MonthCount> of(int months) {
		if (months < MIN_MONTHS || months > MAX_MONTHS) {
			return Result.failure(ErrorCode.INVALID_TERM,
					"Term must be between " + MIN_MONTHS + " and " + MAX_MONTHS + " months: " + months,
					"MonthCount.of");
		}
		return Result.success(new MonthCount(months));
	}

	public static MonthCount fromYears(YearCount years) {
		return new MonthCount(years.value() * 12);
	}

	public int value() {
		return value;
	}

	/**
	 * Whole years contained in this duration.
	 */
	public int years() {
		return value / 12;
	}

	public Result<MonthCount> plus(int months) {
		return of(value + months);
	}

	public Result<MonthCount> minus(int months) {
		return of(value - months);
	}

	@Override
	public int compareTo(MonthCount other) {
		return Integer.compare(value, other.value);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) {
			return true;
		}
		if (!(o instanceof MonthCount other)) {
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
		return value + " months";
	}
}
