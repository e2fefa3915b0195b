package my.mortgagecalculator.engine.domain;

import my.mortgagecalculator.engine.config.CalculationSettings;
import my.mortgagecalculator.engine.result.CalculationError;
import my.mortgagecalculator.engine.result.ErrorCode;
import my.mortgagecalculator.engine.result.Result;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.util.Objects;

/**
 * Amount, annual rate, term and monthly payment of an annuity loan. The payment is
 * checked against the annuity formula when the configuration is created.
 */
public final class LoanConfiguration {
	private final Money amount;
	private final InterestRate annualRate;
	private final MonthCount termInMonths;
	private final Money monthlyPayment;

	private LoanConfiguration(Money amount, InterestRate annualRate, MonthCount termInMonths, Money monthlyPayment) {
		this.amount = amount;
		this.annualRate = annualRate;
		this.termInMonths = termInMonths;
		this.monthlyPayment = monthlyPayment;
	}

	public static Result<LoanConfiguration> of(Money amount,
											   InterestRate annualRate,
											   MonthCount termInMonths,
											   Money monthlyPayment) {
		return of(amount, annualRate, termInMonths, monthlyPayment, CalculationSettings.defaults());
	}

	public static Result<LoanConfiguration> of(Money amount,
											   InterestRate annualRate,
											   MonthCount termInMonths,
											   Money monthlyPayment,
											   CalculationSettings settings) {
		Objects.requireNonNull(settings, "settings");
		if (amount == null || annualRate == null || termInMonths == null || monthlyPayment == null) {
			return Result.failure(ErrorCode.INVALID_LOAN_CONFIGURATION,
					"Amount, rate, term and monthly payment are required", "LoanConfiguration.of");
		}
		if (amount.isZero()) {
			return Result.failure(ErrorCode.INVALID_AMOUNT, "Loan amount must be positive", "LoanConfiguration.of");
		}
		MathContext mc = settings.mathContext();
		return Annuity.payment(amount.toEuros(), annualRate.monthlyFraction(mc), termInMonths.value(), mc)
				.mapError(error -> error.wrap("LoanConfiguration.of", "Cannot evaluate annuity formula"))
				.flatMap(expected -> {
					BigDecimal tolerance = annualRate.isZero()
							? settings.zeroRateConsistencyTolerance()
							: settings.consistencyTolerance();
					BigDecimal deviation = monthlyPayment.toEuros().subtract(expected).abs();
					if (deviation.compareTo(tolerance) > 0) {
						return Result.failure(CalculationError.of(ErrorCode.INCONSISTENT_PARAMETERS,
								"Monthly payment does not match the annuity formula", "LoanConfiguration.of")
								.withContext("monthlyPayment", monthlyPayment.toEuros())
								.withContext("expectedPayment", expected.setScale(2, RoundingMode.HALF_UP))
								.withContext("tolerance", tolerance));
					}
					return Result.success(new LoanConfiguration(amount, annualRate, termInMonths, monthlyPayment));
				});
	}

	/**
	 * Creates a configuration whose monthly payment is computed from amount, rate and term.
	 */
	public static Result<LoanConfiguration> withDerivedPayment(Money amount,
															   InterestRate annualRate,
															   MonthCount termInMonths,
															   CalculationSettings settings) {
		if (amount == null || annualRate == null || termInMonths == null) {
			return Result.failure(ErrorCode.INVALID_LOAN_CONFIGURATION,
					"Amount, rate and term are required", "LoanConfiguration.withDerivedPayment");
		}
		MathContext mc = settings.mathContext();
		return Annuity.payment(amount.toEuros(), annualRate.monthlyFraction(mc), termInMonths.value(), mc)
				.flatMap(Money::of)
				.flatMap(payment -> of(amount, annualRate, termInMonths, payment, settings));
	}

	public static Result<LoanConfiguration> withDerivedPayment(Money amount,
															   InterestRate annualRate,
															   MonthCount termInMonths) {
		return withDerivedPayment(amount, annualRate, termInMonths, CalculationSettings.defaults());
	}

	public static Result<LoanConfiguration> fromInput(LoanConfigurationInput input, CalculationSettings settings) {
		String operation = "LoanConfiguration.fromInput";
		if (input == null || input.amount() == null || input.annualRatePercent() == null
				|| input.monthlyPayment() == null
				|| (input.termInMonths() == null && input.termInYears() == null)) {
			return Result.failure(ErrorCode.INVALID_LOAN_CONFIGURATION,
					"Amount, rate, term and monthly payment are required", operation);
		}
		Result<MonthCount> term = input.termInMonths() != null
				? MonthCount.of(input.termInMonths())
				: YearCount.of(input.termInYears()).map(YearCount::toMonths);
		return Money.of(input.amount()).mapError(error -> error.withOperation(operation))
				.flatMap(amount -> InterestRate.ofPercent(input.annualRatePercent())
						.mapError(error -> error.withOperation(operation))
						.flatMap(rate -> term.mapError(error -> error.withOperation(operation))
								.flatMap(months -> Money.of(input.monthlyPayment())
										.mapError(error -> error.withOperation(operation))
										.flatMap(payment -> of(amount, rate, months, payment, settings)))));
	}

	public static Result<LoanConfiguration> fromInput(LoanConfigurationInput input) {
		return fromInput(input, CalculationSettings.defaults());
	}

	public Result<LoanConfiguration> withAnnualRate(InterestRate rate, CalculationSettings settings) {
		return withDerivedPayment(amount, rate, termInMonths, settings);
	}

	public Money amount() {
		return amount;
	}

	public InterestRate annualRate() {
		return annualRate;
	}

	public MonthCount termInMonths() {
		return termInMonths;
	}

	public Money monthlyPayment() {
		return monthlyPayment;
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) {
			return true;
		}
		if (!(o instanceof LoanConfiguration other)) {
			return false;
		}
		return amount.equals(other.amount)
				&& annualRate.equals(other.annualRate)
				&& termInMonths.equals(other.termInMonths)
				&& monthlyPayment.equals(other.monthlyPayment);
	}

	@Override
	public int hashCode() {
		return Objects.hash(amount, annualRate, termInMonths, monthlyPayment);
	}

	@Override
	public String toString() {
		return "LoanConfiguration[amount=" + amount
				+ ", annualRate=" + annualRate
				+ ", termInMonths=" + termInMonths
				+ ", monthlyPayment=" + monthlyPayment + "]";
	}
}
