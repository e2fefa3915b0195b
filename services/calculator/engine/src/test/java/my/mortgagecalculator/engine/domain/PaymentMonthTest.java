package my.mortgagecalculator.engine.domain;

import my.mortgagecalculator.engine.result.ErrorCode;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class PaymentMonthTest {
	@Test
	void mapsToPaymentYearAndMonth() {
		PaymentMonth thirteenth = PaymentMonth.of(13).orElseThrow();
		PaymentMonth twelfth = PaymentMonth.of(12).orElseThrow();

		assertThat(thirteenth.year()).isEqualTo(2);
		assertThat(thirteenth.monthInYear()).isEqualTo(1);
		assertThat(thirteenth.isFirstYear()).isFalse();
		assertThat(twelfth.isEndOfYear()).isTrue();
		assertThat(PaymentMonth.fromYearAndMonth(3, 6).orElseThrow().value()).isEqualTo(30);
	}

	@Test
	void rejectsMonthsOutsideRange() {
		assertThat(PaymentMonth.of(0).findError().orElseThrow().code()).isEqualTo(ErrorCode.INVALID_PAYMENT_MONTH);
		assertThat(PaymentMonth.of(481).findError().orElseThrow().code()).isEqualTo(ErrorCode.INVALID_PAYMENT_MONTH);
		assertThat(PaymentMonth.fromYearAndMonth(1, 13).isFailure()).isTrue();
		assertThat(PaymentMonth.of(480).orElseThrow().plus(1).isFailure()).isTrue();
	}

	@Test
	void durationsUseTheirOwnErrorCode() {
		assertThat(MonthCount.of(0).findError().orElseThrow().code()).isEqualTo(ErrorCode.INVALID_TERM);
		assertThat(MonthCount.of(481).findError().orElseThrow().code()).isEqualTo(ErrorCode.INVALID_TERM);
		assertThat(YearCount.of(41).findError().orElseThrow().code()).isEqualTo(ErrorCode.INVALID_TERM);
		assertThat(YearCount.of(30).orElseThrow().toMonths().value()).isEqualTo(360);
		assertThat(MonthCount.of(125).orElseThrow().years()).isEqualTo(10);
	}

	@Test
	void shiftsStayWithinRange() {
		assertThat(MonthCount.of(120).orElseThrow().plus(12).orElseThrow().value()).isEqualTo(132);
		assertThat(MonthCount.of(120).orElseThrow().minus(12).orElseThrow().value()).isEqualTo(108);
		assertThat(MonthCount.of(1).orElseThrow().minus(1).findError().orElseThrow().code()).isEqualTo(ErrorCode.INVALID_TERM);
		assertThat(MonthCount.of(480).orElseThrow().plus(1).findError().orElseThrow().code()).isEqualTo(ErrorCode.INVALID_TERM);
		assertThat(PaymentMonth.of(12).orElseThrow().plus(1).orElseThrow().value()).isEqualTo(13);
	}
}
