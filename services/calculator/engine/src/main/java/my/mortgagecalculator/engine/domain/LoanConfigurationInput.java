package my.mortgagecalculator.engine.domain;

import java.math.BigDecimal;

/**
 * Raw loan parameters as entered by a user. Amounts are in euros, the rate in percent.
 * When both term fields are set, {@code termInMonths} wins.
 */
public record LoanConfigurationInput(
		BigDecimal amount,
		BigDecimal annualRatePercent,
		Integer termInMonths,
		Integer termInYears,
		BigDecimal monthlyPayment
) {
	public static LoanConfigurationInput ofMonths(BigDecimal amount,
												  BigDecimal annualRatePercent,
												  int termInMonths,
												  BigDecimal monthlyPayment) {
		return new LoanConfigurationInput(amount, annualRatePercent, termInMonths, null, monthlyPayment);
	}

	public static LoanConfigurationInput ofYears(BigDecimal amount,
												 BigDecimal annualRatePercent,
												 int termInYears,
												 BigDecimal monthlyPayment) {
		return new LoanConfigurationInput(amount, annualRatePercent, null, termInYears, monthlyPayment);
	}
}
