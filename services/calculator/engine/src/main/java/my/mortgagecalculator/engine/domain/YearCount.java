package my.mortgagecalculator.engine.domain;

import my.mortgagecalculator.engine.result.ErrorCode;
import my.mortgagecalculator.engine.result.Result;

public final class YearCount implements Comparable<YearCount> {
	public static final int MIN_YEARS = 1;
	public static final int MAX_YEARS = 40;

	private final int value;

	private YearCount(int value) {
		this.value = value;
	}

	public static Result<YearCount> of(int years) {
		if (years < MIN_YEARS || years > MAX_YEARS) {
			return Result.failure(ErrorCode.INVALID_TERM,
					"Term must be between " + MIN_YEARS + " and " + MAX_YEARS + " years: " + years,
					"YearCount.of");
		}
		return Result.success(new YearCount(years));
	}

	public int value() {
		return value;
	}

	public MonthCount toMonths() {
		return MonthCount.fromYears(this);
	}

	@Override
	public int compareTo(YearCount other) {
		return Integer.compare(value, other.value);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) {
			return true;
		}
		if (!(o instanceof YearCount other)) {
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
		return value + " years";
	}
}
