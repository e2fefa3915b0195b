package my.mortgagecalculator.engine.service;

import my.mortgagecalculator.engine.domain.ExtraPayment;
import my.mortgagecalculator.engine.domain.ExtraPaymentLimit;
import my.mortgagecalculator.engine.domain.ExtraPaymentPlan;
import my.mortgagecalculator.engine.domain.Money;
import my.mortgagecalculator.engine.domain.Percentage;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

class ExtraPaymentAggregatorTest {
	private final ExtraPaymentAggregator aggregator = new ExtraPaymentAggregator();
	private final Money loanAmount = Money.of(new BigDecimal("200000")).orElseThrow();

	@Test
	void summarisesPaymentsPerYear() {
		ExtraPaymentPlan plan = limited("5", extra(3, 200_000), extra(12, 300_000), extra(18, 1_200_000));

		List<ExtraPaymentAggregator.YearlyExtraPaymentSummary> summaries = aggregator.yearlySummaries(plan).orElseThrow();

		assertThat(summaries).hasSize(2);
		assertThat(summaries.get(0).year()).isEqualTo(1);
		assertThat(summaries.get(0).count()).isEqualTo(2);
		assertThat(summaries.get(0).total().toEuros()).isEqualByComparingTo("5000.00");
		assertThat(summaries.get(0).average().toEuros()).isEqualByComparingTo("2500.00");
		assertThat(summaries.get(1).year()).isEqualTo(2);
		assertThat(summaries.get(1).total().toEuros()).isEqualByComparingTo("12000.00");
	}

	@Test
	void reportsAllowanceWithoutEnforcingIt() {
		ExtraPaymentPlan plan = limited("5", extra(3, 200_000), extra(12, 300_000), extra(18, 1_200_000));

		assertThat(aggregator.yearlyLimitAmount(plan, loanAmount)).contains(Money.of(new BigDecimal("10000")).orElseThrow());
		assertThat(aggregator.remainingYearlyAllowance(plan, loanAmount, 1).orElseThrow())
				.contains(Money.of(new BigDecimal("5000")).orElseThrow());
		assertThat(aggregator.remainingYearlyAllowance(plan, loanAmount, 2).orElseThrow()).contains(Money.ZERO);
		assertThat(aggregator.remainingYearlyAllowance(plan, loanAmount, 3).orElseThrow())
				.contains(Money.of(new BigDecimal("10000")).orElseThrow());
		assertThat(aggregator.yearsExceedingLimit(plan, loanAmount).orElseThrow()).containsExactly(2);
	}

	@Test
	void unlimitedPlanHasNoAllowance() {
		ExtraPaymentPlan plan = ExtraPaymentPlan.unlimited(List.of(extra(18, 5_000_000))).orElseThrow();

		assertThat(aggregator.yearlyLimitAmount(plan, loanAmount)).isEmpty();
		assertThat(aggregator.remainingYearlyAllowance(plan, loanAmount, 2).orElseThrow()).isEqualTo(Optional.empty());
		assertThat(aggregator.yearsExceedingLimit(plan, loanAmount).orElseThrow()).isEmpty();
	}

	@Test
	void averageRoundsHalfCentUp() {
		ExtraPaymentPlan plan = limited("5", extra(2, 10_000), extra(5, 10_001), extra(14, 10_000), extra(15, 10_000),
				extra(16, 10_001));

		List<ExtraPaymentAggregator.YearlyExtraPaymentSummary> summaries = aggregator.yearlySummaries(plan).orElseThrow();

		assertThat(summaries.get(0).total().toEuros()).isEqualByComparingTo("200.01");
		assertThat(summaries.get(0).average().toEuros()).isEqualByComparingTo("100.01");
		assertThat(summaries.get(1).total().toEuros()).isEqualByComparingTo("300.01");
		assertThat(summaries.get(1).average().toEuros()).isEqualByComparingTo("100.00");
	}

	@Test
	void emptyPlanHasNoSummaries() {
		assertThat(aggregator.yearlySummaries(ExtraPaymentPlan.none()).orElseThrow()).isEmpty();
	}

	private static ExtraPaymentPlan limited(String percent, ExtraPayment... payments) {
		ExtraPaymentLimit limit = ExtraPaymentLimit.percentage(Percentage.of(new BigDecimal(percent)).orElseThrow());
		return ExtraPaymentPlan.of(limit, List.of(payments)).orElseThrow();
	}

	private static ExtraPayment extra(int month, long cents) {
		return ExtraPayment.of(month, cents).orElseThrow();
	}
}
