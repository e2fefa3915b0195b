package my.mortgagecalculator.engine.domain;

import my.mortgagecalculator.engine.result.ErrorCode;
import my.mortgagecalculator.engine.result.Result;

import java.util.Objects;

/**
 * Sondertilgung: an additional principal payment in a given month.
 */
public final class ExtraPayment {
	public static final long MIN_CENTS = 100L;

	private final PaymentMonth month;
	private final Money amount;

	private ExtraPayment(PaymentMonth month, Money amount) {
		this.month = month;
		this.amount = amount;
	}

	public static Result<ExtraPayment> of(PaymentMonth month, Money amount) {
		if (month == null || amount == null) {
			return Result.failure(ErrorCode.INVALID_EXTRA_PAYMENT, "Month and amount are required", "ExtraPayment.of");
		}
		if (amount.cents() < MIN_CENTS) {
			return Result.failure(ErrorCode.INVALID_EXTRA_PAYMENT,
					"Extra payment must be at least 1.00 EUR: " + amount, "ExtraPayment.of");
		}
		return Result.success(new ExtraPayment(month, amount));
	}

	public static Result<ExtraPayment> of(int month, long amountInCents) {
		return PaymentMonth.of(month)
				.flatMap(paymentMonth -> Money.ofCents(amountInCents)
						.flatMap(amount -> of(paymentMonth, amount)));
	}

	/**
	 * Merges two payments scheduled for the same month into one.
	 */
	public static Result<ExtraPayment> combine(ExtraPayment first, ExtraPayment second) {
		if (!first.month.equals(second.month)) {
			return Result.failure(ErrorCode.INVALID_EXTRA_PAYMENT,
					"Cannot combine payments of months " + first.month + " and " + second.month,
					"ExtraPayment.combine");
		}
		return first.amount.add(second.amount)
				.mapError(error -> error.withOperation("ExtraPayment.combine"))
				.map(total -> new ExtraPayment(first.month, total));
	}

	/**
	 * The part of this payment that was actually applied because the outstanding balance
	 * was smaller. The capped amount may fall below the usual minimum.
	 */
	public ExtraPayment capped(Money applied) {
		if (!applied.isLessThan(amount)) {
			return this;
		}
		return new ExtraPayment(month, applied);
	}

	public PaymentMonth month() {
		return month;
	}

	public Money amount() {
		return amount;
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) {
			return true;
		}
		if (!(o instanceof ExtraPayment other)) {
			return false;
		}
		return month.equals(other.month) && amount.equals(other.amount);
	}

	@Override
	public int hashCode() {
		return Objects.hash(month, amount);
	}

	@Override
	public String toString() {
		return "ExtraPayment[month=" + month + ", amount=" + amount + "]";
	}
}
