package my.mortgagecalculator.engine.domain;

import java.util.Objects;
import java.util.Optional;

/**
 * One month of an amortization schedule. {@code extraPayment} is the amount actually
 * applied in that month and is {@code null} when there was none.
 */
public record AmortizationEntry(
		PaymentMonth monthNumber,
		Money startingBalance,
		MonthlyPayment regularPayment,
		ExtraPayment extraPayment,
		Money totalPaymentAmount,
		Money endingBalance,
		Money cumulativeInterest,
		Money cumulativePrincipal,
		Percentage principalPercentage,
		int remainingMonths
) {
	public AmortizationEntry {
		Objects.requireNonNull(monthNumber, "monthNumber");
		Objects.requireNonNull(startingBalance, "startingBalance");
		Objects.requireNonNull(regularPayment, "regularPayment");
		Objects.requireNonNull(totalPaymentAmount, "totalPaymentAmount");
		Objects.requireNonNull(endingBalance, "endingBalance");
		Objects.requireNonNull(cumulativeInterest, "cumulativeInterest");
		Objects.requireNonNull(cumulativePrincipal, "cumulativePrincipal");
		Objects.requireNonNull(principalPercentage, "principalPercentage");
		if (remainingMonths < 0) {
			throw new IllegalArgumentException("remainingMonths must not be negative");
		}
	}

	public boolean hasExtraPayment() {
		return extraPayment != null;
	}

	public Optional<ExtraPayment> findExtraPayment() {
		return Optional.ofNullable(extraPayment);
	}

	public Money extraAmount() {
		return extraPayment == null ? Money.ZERO : extraPayment.amount();
	}
}
