package my.mortgagecalculator.engine.service;

import my.mortgagecalculator.engine.domain.AmortizationEntry;
import my.mortgagecalculator.engine.domain.AmortizationSchedule;
import my.mortgagecalculator.engine.domain.Money;
import my.mortgagecalculator.engine.result.ErrorCode;
import my.mortgagecalculator.engine.result.Result;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Yearly projections of a schedule for display.
 */
@Service
public class ScheduleViews {

	public Result<List<YearlyScheduleSummary>> yearlySummaries(AmortizationSchedule schedule) {
		Map<Integer, List<AmortizationEntry>> byYear = new TreeMap<>();
		for (AmortizationEntry entry : schedule.entries()) {
			byYear.computeIfAbsent(entry.monthNumber().year(), year -> new ArrayList<>()).add(entry);
		}
		List<Result<YearlyScheduleSummary>> summaries = new ArrayList<>(byYear.size());
		for (Map.Entry<Integer, List<AmortizationEntry>> year : byYear.entrySet()) {
			summaries.add(summarize(year.getKey(), year.getValue()));
		}
		return Result.sequence(summaries).mapError(error -> error.withOperation("yearlySummaries"));
	}

	public Result<YearlyScheduleSummary> firstYearSummary(AmortizationSchedule schedule) {
		return yearlySummaries(schedule).flatMap(summaries -> summaries.isEmpty()
				? Result.failure(ErrorCode.SCHEDULE_ANALYSIS_ERROR, "Schedule has no entries", "firstYearSummary")
				: Result.success(summaries.get(0)));
	}

	private static Result<YearlyScheduleSummary> summarize(int year, List<AmortizationEntry> entries) {
		long interest = 0L;
		long principal = 0L;
		long extras = 0L;
		long payments = 0L;
		for (AmortizationEntry entry : entries) {
			interest += entry.regularPayment().interest().cents();
			principal += entry.regularPayment().principal().cents();
			extras += entry.extraAmount().cents();
			payments += entry.totalPaymentAmount().cents();
		}
		long extraCents = extras;
		long paymentCents = payments;
		long principalCents = principal;
		Money endingBalance = entries.get(entries.size() - 1).endingBalance();
		return Money.ofCents(interest).flatMap(interestPaid ->
				Money.ofCents(principalCents).flatMap(principalPaid ->
						Money.ofCents(extraCents).flatMap(extraPayments ->
								Money.ofCents(paymentCents).map(totalPayments -> new YearlyScheduleSummary(
										year, entries.size(), interestPaid, principalPaid, extraPayments,
										totalPayments, endingBalance)))));
	}

	/**
	 * {@code principalPaid} is regular principal only; extra payments are reported
	 * separately.
	 */
	public record YearlyScheduleSummary(
			int year,
			int months,
			Money interestPaid,
			Money principalPaid,
			Money extraPayments,
			Money totalPayments,
			Money endingBalance
	) {
	}
}
