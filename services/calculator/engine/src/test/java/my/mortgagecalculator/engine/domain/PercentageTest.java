package my.mortgagecalculator.engine.domain;

import my.mortgagecalculator.engine.result.ErrorCode;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.assertj.core.api.Assertions.assertThat;

class PercentageTest {
	@Test
	void acceptsBoundsAndRejectsValuesOutsideThem() {
		assertThat(Percentage.of(BigDecimal.ZERO).orElseThrow()).isEqualTo(Percentage.ZERO);
		assertThat(Percentage.of(new BigDecimal("100.00")).orElseThrow()).isEqualTo(Percentage.HUNDRED);
		assertThat(Percentage.of(new BigDecimal("-0.01")).findError().orElseThrow().code())
				.isEqualTo(ErrorCode.INVALID_PERCENTAGE);
		assertThat(Percentage.of(new BigDecimal("100.01")).findError().orElseThrow().code())
				.isEqualTo(ErrorCode.INVALID_PERCENTAGE);
		assertThat(Percentage.of(null).findError().orElseThrow().code()).isEqualTo(ErrorCode.INVALID_PERCENTAGE);
	}

	@Test
	void parsesTrimmedDecimals() {
		assertThat(Percentage.parse(" 12.5 ").orElseThrow().value()).isEqualByComparingTo("12.5");
		assertThat(Percentage.parse("abc").findError().orElseThrow().code()).isEqualTo(ErrorCode.INVALID_PERCENTAGE);
		assertThat(Percentage.parse(" ").findError().orElseThrow().code()).isEqualTo(ErrorCode.INVALID_PERCENTAGE);
		assertThat(Percentage.parse("150").findError().orElseThrow().code()).isEqualTo(ErrorCode.INVALID_PERCENTAGE);
	}

	@Test
	void convertsBetweenFractionAndPercent() {
		assertThat(Percentage.fromFraction(new BigDecimal("0.05")).orElseThrow().value()).isEqualByComparingTo("5");
		assertThat(Percentage.fromFraction(new BigDecimal("1.5")).isFailure()).isTrue();
		assertThat(Percentage.of(new BigDecimal("5")).orElseThrow().toFraction()).isEqualByComparingTo("0.05");
	}

	@Test
	void arithmeticStaysWithinBounds() {
		Percentage sixty = Percentage.of(new BigDecimal("60")).orElseThrow();
		Percentage thirty = Percentage.of(new BigDecimal("30")).orElseThrow();
		Percentage fifty = Percentage.of(new BigDecimal("50")).orElseThrow();

		assertThat(sixty.add(thirty).orElseThrow().value()).isEqualByComparingTo("90");
		assertThat(sixty.subtract(thirty).orElseThrow().value()).isEqualByComparingTo("30");
		assertThat(sixty.add(fifty).findError().orElseThrow().code()).isEqualTo(ErrorCode.INVALID_PERCENTAGE);
		assertThat(thirty.subtract(sixty).findError().orElseThrow().code()).isEqualTo(ErrorCode.INVALID_PERCENTAGE);
		assertThat(thirty.compareTo(sixty)).isNegative();
	}
}
