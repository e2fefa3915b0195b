package my.mortgagecalculator.engine.domain;

import my.mortgagecalculator.engine.result.CalculationError;
import my.mortgagecalculator.engine.result.ErrorCode;
import my.mortgagecalculator.engine.result.Result;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Extra payments ordered by month, at most one per month, together with the yearly
 * allowance they are reported against.
 */
public final class ExtraPaymentPlan {
	private static final ExtraPaymentPlan NONE = new ExtraPaymentPlan(ExtraPaymentLimit.unlimited(), List.of());

	private final ExtraPaymentLimit yearlyLimit;
	private final List<ExtraPayment> payments;

	private ExtraPaymentPlan(ExtraPaymentLimit yearlyLimit, List<ExtraPayment> payments) {
		this.yearlyLimit = yearlyLimit;
		this.payments = payments;
	}

	public static Result<ExtraPaymentPlan> of(ExtraPaymentLimit yearlyLimit, List<ExtraPayment> payments) {
		Objects.requireNonNull(yearlyLimit, "yearlyLimit");
		Objects.requireNonNull(payments, "payments");
		Set<PaymentMonth> seen = new HashSet<>();
		for (ExtraPayment payment : payments) {
			if (!seen.add(payment.month())) {
				return Result.failure(CalculationError.of(ErrorCode.DUPLICATE_PAYMENT_MONTH,
								"More than one extra payment in month " + payment.month(), "ExtraPaymentPlan.of")
						.withContext("month", payment.month().value()));
			}
		}
		List<ExtraPayment> sorted = new ArrayList<>(payments);
		sorted.sort(Comparator.comparing(ExtraPayment::month));
		return Result.success(new ExtraPaymentPlan(yearlyLimit, List.copyOf(sorted)));
	}

	public static Result<ExtraPaymentPlan> unlimited(List<ExtraPayment> payments) {
		return of(ExtraPaymentLimit.unlimited(), payments);
	}

	public static ExtraPaymentPlan none() {
		return NONE;
	}

	public Optional<ExtraPayment> paymentFor(PaymentMonth month) {
		for (ExtraPayment payment : payments) {
			int order = payment.month().compareTo(month);
			if (order == 0) {
				return Optional.of(payment);
			}
			if (order > 0) {
				break;
			}
		}
		return Optional.empty();
	}

	public Result<Money> totalAmount() {
		Result<Money> total = Result.success(Money.ZERO);
		for (ExtraPayment payment : payments) {
			total = total.flatMap(sum -> sum.add(payment.amount()));
		}
		return total.mapError(error -> error.withOperation("ExtraPaymentPlan.totalAmount"));
	}

	/**
	 * Returns a plan with the payment added. An existing payment in the same month is
	 * replaced.
	 */
	public Result<ExtraPaymentPlan> withPayment(ExtraPayment payment) {
		List<ExtraPayment> updated = new ArrayList<>(payments.size() + 1);
		for (ExtraPayment existing : payments) {
			if (!existing.month().equals(payment.month())) {
				updated.add(existing);
			}
		}
		updated.add(payment);
		return of(yearlyLimit, updated);
	}

	public ExtraPaymentPlan withoutPayment(PaymentMonth month) {
		List<ExtraPayment> updated = payments.stream()
				.filter(payment -> !payment.month().equals(month))
				.toList();
		return new ExtraPaymentPlan(yearlyLimit, updated);
	}

	public boolean isEmpty() {
		return payments.isEmpty();
	}

	public List<ExtraPayment> payments() {
		return payments;
	}

	public ExtraPaymentLimit yearlyLimit() {
		return yearlyLimit;
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) {
			return true;
		}
		if (!(o instanceof ExtraPaymentPlan other)) {
			return false;
		}
		return yearlyLimit.equals(other.yearlyLimit) && payments.equals(other.payments);
	}

	@Override
	public int hashCode() {
		return Objects.hash(yearlyLimit, payments);
	}

	@Override
	public String toString() {
		return "ExtraPaymentPlan[yearlyLimit=" + yearlyLimit + ", payments=" + payments + "]";
	}
}
