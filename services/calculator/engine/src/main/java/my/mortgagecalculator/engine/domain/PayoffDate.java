package my.mortgagecalculator.engine.domain;

import java.time.YearMonth;

/**
 * Payoff point relative to the first payment: year 1, month 1 is the first instalment.
 */
public record PayoffDate(int year, int month) {
	public PayoffDate {
		if (year < 1 || month < 1 || month > 12) {
			throw new IllegalArgumentException("Invalid payoff date: " + year + "/" + month);
		}
	}

	public static PayoffDate afterMonths(int months) {
		if (months < 1) {
			throw new IllegalArgumentException("months must be positive: " + months);
		}
		return new PayoffDate((months - 1) / 12 + 1, (months - 1) % 12 + 1);
	}

	public int monthNumber() {
		return (year - 1) * 12 + month;
	}

	/**
	 * Calendar month of the payoff when the first instalment is due in {@code firstPayment}.
	 */
	public YearMonth toYearMonth(YearMonth firstPayment) {
		return firstPayment.plusMonths(monthNumber() - 1L);
	}
}
