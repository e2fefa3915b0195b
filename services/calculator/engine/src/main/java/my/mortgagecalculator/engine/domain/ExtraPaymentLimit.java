package my.mortgagecalculator.engine.domain;

import java.util.Objects;
import java.util.Optional;

/**
 * Yearly Sondertilgung allowance agreed with the lender, as a share of the original
 * loan amount. Informational: the engine reports against it but never enforces it.
 */
public final class ExtraPaymentLimit {
	private static final ExtraPaymentLimit UNLIMITED = new ExtraPaymentLimit(null);

	private final Percentage yearlyPercentage;

	private ExtraPaymentLimit(Percentage yearlyPercentage) {
		this.yearlyPercentage = yearlyPercentage;
	}

	public static ExtraPaymentLimit percentage(Percentage yearlyPercentage) {
		return new ExtraPaymentLimit(Objects.requireNonNull(yearlyPercentage, "yearlyPercentage"));
	}

	public static ExtraPaymentLimit unlimited() {
		return UNLIMITED;
	}

	public boolean isUnlimited() {
		return yearlyPercentage == null;
	}

	public Optional<Percentage> yearlyPercentage() {
		return Optional.ofNullable(yearlyPercentage);
	}

	public Optional<Money> annualCap(Money loanAmount) {
		if (yearlyPercentage == null) {
			return Optional.empty();
		}
		return Optional.of(loanAmount.portion(yearlyPercentage));
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) {
			return true;
		}
		if (!(o instanceof ExtraPaymentLimit other)) {
			return false;
		}
		return Objects.equals(yearlyPercentage, other.yearlyPercentage);
	}

	@Override
	public int hashCode() {
		return Objects.hashCode(yearlyPercentage);
	}

	@Override
	public String toString() {
		return isUnlimited() ? "Unlimited" : yearlyPercentage + " per year";
	}
}
