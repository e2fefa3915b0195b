package my.mortgagecalculator.engine.domain;

import my.mortgagecalculator.engine.result.ErrorCode;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;

import static org.assertj.core.api.Assertions.assertThat;

class InterestRateTest {
	private static final MathContext MC = new MathContext(20, RoundingMode.HALF_UP);

	@Test
	void acceptsRatesFromZeroToTwentyFivePercent() {
		assertThat(InterestRate.ofPercent(BigDecimal.ZERO).orElseThrow().isZero()).isTrue();
		assertThat(InterestRate.ofPercent(new BigDecimal("25")).isSuccess()).isTrue();
		assertThat(InterestRate.ofPercent(new BigDecimal("25.01")).findError().orElseThrow().code())
				.isEqualTo(ErrorCode.INVALID_INTEREST_RATE);
		assertThat(InterestRate.ofPercent(new BigDecimal("-0.1")).findError().orElseThrow().code())
				.isEqualTo(ErrorCode.INVALID_INTEREST_RATE);
		assertThat(InterestRate.parsePercent("abc").findError().orElseThrow().code())
				.isEqualTo(ErrorCode.INVALID_INTEREST_RATE);
	}

	@Test
	void convertsToMonthlyFraction() {
		InterestRate rate = InterestRate.ofPercent(new BigDecimal("6")).orElseThrow();

		assertThat(rate.annualFraction()).isEqualByComparingTo("0.06");
		assertThat(rate.monthlyFraction(MC)).isEqualByComparingTo("0.005");
		assertThat(InterestRate.fromFraction(new BigDecimal("0.035")).orElseThrow().percent()).isEqualByComparingTo("3.5");
	}

	@Test
	void shiftsByPercentagePoints() {
		InterestRate rate = InterestRate.ofPercent(new BigDecimal("0.5")).orElseThrow();

		assertThat(rate.plusPercentagePoints(BigDecimal.ONE).orElseThrow().percent()).isEqualByComparingTo("1.5");
		assertThat(rate.plusPercentagePoints(BigDecimal.ONE.negate()).isFailure()).isTrue();
		assertThat(rate.shiftedWithinBounds(BigDecimal.ONE.negate()).isZero()).isTrue();
		assertThat(InterestRate.ofPercent(new BigDecimal("24.5")).orElseThrow()
				.shiftedWithinBounds(BigDecimal.ONE).percent()).isEqualByComparingTo("25");
	}
}
