package my.mortgagecalculator.engine.domain;

import my.mortgagecalculator.engine.result.Result;

import java.util.Objects;

/**
 * Split of one instalment into principal and interest.
 */
public record MonthlyPayment(Money principal, Money interest, Money total) {
	public MonthlyPayment {
		Objects.requireNonNull(principal, "principal");
		Objects.requireNonNull(interest, "interest");
		Objects.requireNonNull(total, "total");
		if (Math.abs(principal.cents() + interest.cents() - total.cents()) > 1L) {
			throw new IllegalArgumentException("principal + interest must equal total: "
					+ principal + " + " + interest + " != " + total);
		}
	}

	public static Result<MonthlyPayment> of(Money principal, Money interest) {
		return principal.add(interest)
				.map(total -> new MonthlyPayment(principal, interest, total))
				.mapError(error -> error.withOperation("MonthlyPayment.of"));
	}
}
