package my.mortgagecalculator.engine.domain;

import my.mortgagecalculator.engine.config.CalculationSettings;
import my.mortgagecalculator.engine.result.CalculationError;
import my.mortgagecalculator.engine.result.ErrorCode;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.assertj.core.api.Assertions.assertThat;

class LoanConfigurationTest {
	private final CalculationSettings settings = CalculationSettings.defaults();

	@Test
	void acceptsPaymentWithinToleranceOfAnnuity() {
		LoanConfigurationInput input = LoanConfigurationInput.ofMonths(
				new BigDecimal("100000"), new BigDecimal("5.6"), 84, new BigDecimal("1442.50"));

		LoanConfiguration config = LoanConfiguration.fromInput(input, settings).orElseThrow();

		assertThat(config.amount().toEuros()).isEqualByComparingTo("100000.00");
		assertThat(config.termInMonths().value()).isEqualTo(84);
		assertThat(config.monthlyPayment().toEuros()).isEqualByComparingTo("1442.50");
	}

	@Test
	void rejectsPaymentInconsistentWithAnnuity() {
		LoanConfigurationInput input = LoanConfigurationInput.ofMonths(
				new BigDecimal("100000"), new BigDecimal("5.6"), 84, new BigDecimal("1500.00"));

		CalculationError error = LoanConfiguration.fromInput(input, settings).findError().orElseThrow();

		assertThat(error.code()).isEqualTo(ErrorCode.INCONSISTENT_PARAMETERS);
		assertThat(error.context()).containsKeys("monthlyPayment", "expectedPayment", "tolerance");
	}

	@Test
	void zeroRateRequiresCentExactPayment() {
		LoanConfigurationInput exact = LoanConfigurationInput.ofYears(
				new BigDecimal("60000"), BigDecimal.ZERO, 5, new BigDecimal("1000.00"));
		LoanConfigurationInput off = LoanConfigurationInput.ofYears(
				new BigDecimal("60000"), BigDecimal.ZERO, 5, new BigDecimal("1000.50"));

		assertThat(LoanConfiguration.fromInput(exact, settings).orElseThrow().termInMonths().value()).isEqualTo(60);
		assertThat(LoanConfiguration.fromInput(off, settings).findError().orElseThrow().code())
				.isEqualTo(ErrorCode.INCONSISTENT_PARAMETERS);
	}

	@Test
	void monthsWinOverYears() {
		LoanConfigurationInput input = new LoanConfigurationInput(
				new BigDecimal("60000"), BigDecimal.ZERO, 60, 10, new BigDecimal("1000.00"));

		assertThat(LoanConfiguration.fromInput(input, settings).orElseThrow().termInMonths().value()).isEqualTo(60);
	}

	@Test
	void mapsInvalidFieldsToTheirErrorCodes() {
		assertThat(codeOf(new LoanConfigurationInput(null, BigDecimal.ONE, 12, null, BigDecimal.ONE)))
				.isEqualTo(ErrorCode.INVALID_LOAN_CONFIGURATION);
		assertThat(codeOf(new LoanConfigurationInput(new BigDecimal("1000"), BigDecimal.ONE, null, null, BigDecimal.ONE)))
				.isEqualTo(ErrorCode.INVALID_LOAN_CONFIGURATION);
		assertThat(codeOf(LoanConfigurationInput.ofMonths(new BigDecimal("-5"), BigDecimal.ONE, 12, BigDecimal.ONE)))
				.isEqualTo(ErrorCode.NEGATIVE_AMOUNT);
		assertThat(codeOf(LoanConfigurationInput.ofMonths(BigDecimal.ZERO, BigDecimal.ONE, 12, BigDecimal.ONE)))
				.isEqualTo(ErrorCode.INVALID_AMOUNT);
		assertThat(codeOf(LoanConfigurationInput.ofMonths(new BigDecimal("1000"), new BigDecimal("30"), 12, BigDecimal.ONE)))
				.isEqualTo(ErrorCode.INVALID_INTEREST_RATE);
		assertThat(codeOf(LoanConfigurationInput.ofMonths(new BigDecimal("1000"), BigDecimal.ONE, 600, BigDecimal.ONE)))
				.isEqualTo(ErrorCode.INVALID_TERM);
		assertThat(codeOf(LoanConfigurationInput.ofYears(new BigDecimal("1000"), BigDecimal.ONE, 0, BigDecimal.ONE)))
				.isEqualTo(ErrorCode.INVALID_TERM);
	}

	@Test
	void derivesPaymentFromAmountRateAndTerm() {
		LoanConfiguration config = LoanConfiguration.withDerivedPayment(
				Money.of(new BigDecimal("15000")).orElseThrow(),
				InterestRate.ofPercent(new BigDecimal("8")).orElseThrow(),
				MonthCount.of(120).orElseThrow(),
				settings).orElseThrow();

		assertThat(config.monthlyPayment().toEuros()).isEqualByComparingTo("181.99");

		LoanConfiguration higherRate = config.withAnnualRate(
				InterestRate.ofPercent(new BigDecimal("9")).orElseThrow(), settings).orElseThrow();
		assertThat(higherRate.monthlyPayment()).isGreaterThan(config.monthlyPayment());
		assertThat(higherRate.amount()).isEqualTo(config.amount());
	}

	private ErrorCode codeOf(LoanConfigurationInput input) {
		return LoanConfiguration.fromInput(input, settings).findError().orElseThrow().code();
	}
}
