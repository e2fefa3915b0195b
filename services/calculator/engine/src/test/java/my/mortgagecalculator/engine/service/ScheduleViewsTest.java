package my.mortgagecalculator.engine.service;

import my.mortgagecalculator.engine.config.CalculationSettings;
import my.mortgagecalculator.engine.domain.AmortizationSchedule;
import my.mortgagecalculator.engine.domain.ExtraPayment;
import my.mortgagecalculator.engine.domain.ExtraPaymentPlan;
import my.mortgagecalculator.engine.domain.InterestRate;
import my.mortgagecalculator.engine.domain.LoanConfiguration;
import my.mortgagecalculator.engine.domain.Money;
import my.mortgagecalculator.engine.domain.MonthCount;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ScheduleViewsTest {
	private final CalculationSettings settings = CalculationSettings.defaults();
	private final AmortizationEngine engine = new AmortizationEngine(new LoanCalculationService(settings), settings);
	private final ScheduleViews views = new ScheduleViews();

	@Test
	void firstYearOfStandardLoan() {
		AmortizationSchedule schedule = engine.generateSchedule(loan()).orElseThrow();

		ScheduleViews.YearlyScheduleSummary firstYear = views.firstYearSummary(schedule).orElseThrow();

		assertThat(firstYear.year()).isEqualTo(1);
		assertThat(firstYear.months()).isEqualTo(12);
		assertThat(firstYear.interestPaid().toEuros()).isEqualByComparingTo("4820.43");
		assertThat(firstYear.principalPaid().toEuros()).isEqualByComparingTo("7907.45");
		assertThat(firstYear.extraPayments()).isEqualTo(Money.ZERO);
		assertThat(firstYear.endingBalance().toEuros()).isEqualByComparingTo("92092.56");
	}

	@Test
	void yearlySummariesCoverWholeSchedule() {
		ExtraPaymentPlan plan = ExtraPaymentPlan.unlimited(List.of(ExtraPayment.of(12, 1_000_000).orElseThrow())).orElseThrow();
		AmortizationSchedule schedule = engine.generateSchedule(loan(), plan).orElseThrow();

		List<ScheduleViews.YearlyScheduleSummary> summaries = views.yearlySummaries(schedule).orElseThrow();

		assertThat(summaries).hasSize(9);
		assertThat(summaries).extracting(ScheduleViews.YearlyScheduleSummary::year)
				.containsExactly(1, 2, 3, 4, 5, 6, 7, 8, 9);
		assertThat(summaries.get(0).extraPayments().toEuros()).isEqualByComparingTo("10000.00");
		assertThat(summaries.get(8).months()).isEqualTo(10);
		assertThat(summaries.get(8).endingBalance()).isEqualTo(Money.ZERO);
		long months = summaries.stream().mapToInt(ScheduleViews.YearlyScheduleSummary::months).sum();
		assertThat(months).isEqualTo(106L);
		long totalCents = summaries.stream().mapToLong(summary -> summary.totalPayments().cents()).sum();
		assertThat(totalCents).isEqualTo(schedule.metrics().totalPayments().cents());
	}

	private LoanConfiguration loan() {
		return LoanConfiguration.withDerivedPayment(
				Money.of(new BigDecimal("100000")).orElseThrow(),
				InterestRate.ofPercent(new BigDecimal("5")).orElseThrow(),
				MonthCount.of(120).orElseThrow(),
				settings).orElseThrow();
	}
}
