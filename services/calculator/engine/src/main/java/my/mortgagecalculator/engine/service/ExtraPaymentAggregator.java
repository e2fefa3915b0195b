package my.mortgagecalculator.engine.service;

import my.mortgagecalculator.engine.domain.ExtraPayment;
import my.mortgagecalculator.engine.domain.ExtraPaymentPlan;
import my.mortgagecalculator.engine.domain.Money;
import my.mortgagecalculator.engine.result.Result;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Groups extra payments by payment year and reports them against the plan's yearly
 * allowance. Nothing here rejects a plan.
 */
@Service
public class ExtraPaymentAggregator {

	public Result<List<YearlyExtraPaymentSummary>> yearlySummaries(ExtraPaymentPlan plan) {
		Map<Integer, List<ExtraPayment>> byYear = groupByYear(plan);
		List<Result<YearlyExtraPaymentSummary>> summaries = new ArrayList<>(byYear.size());
		for (Map.Entry<Integer, List<ExtraPayment>> entry : byYear.entrySet()) {
			summaries.add(summarize(entry.getKey(), entry.getValue()));
		}
		return Result.sequence(summaries).mapError(error -> error.withOperation("yearlySummaries"));
	}

	public Optional<Money> yearlyLimitAmount(ExtraPaymentPlan plan, Money loanAmount) {
		return plan.yearlyLimit().annualCap(loanAmount);
	}

	/**
	 * Allowance left in {@code year}, or empty when the plan has no limit.
	 */
	public Result<Optional<Money>> remainingYearlyAllowance(ExtraPaymentPlan plan, Money loanAmount, int year) {
		Optional<Money> cap = yearlyLimitAmount(plan, loanAmount);
		if (cap.isEmpty()) {
			return Result.success(Optional.empty());
		}
		return totalForYear(plan, year).map(used -> Optional.of(cap.get().subtractOrZero(used)));
	}

	/**
	 * Payment years whose total exceeds the yearly allowance.
	 */
	public Result<List<Integer>> yearsExceedingLimit(ExtraPaymentPlan plan, Money loanAmount) {
		Optional<Money> cap = yearlyLimitAmount(plan, loanAmount);
		if (cap.isEmpty()) {
			return Result.success(List.of());
		}
		return yearlySummaries(plan).map(summaries -> summaries.stream()
				.filter(summary -> summary.total().isGreaterThan(cap.get()))
				.map(YearlyExtraPaymentSummary::year)
				.toList());
	}

	private Result<Money> totalForYear(ExtraPaymentPlan plan, int year) {
		Result<Money> total = Result.success(Money.ZERO);
		for (ExtraPayment payment : plan.payments()) {
			if (payment.month().year() == year) {
				total = total.flatMap(sum -> sum.add(payment.amount()));
			}
		}
		return total;
	}

	private static Map<Integer, List<ExtraPayment>> groupByYear(ExtraPaymentPlan plan) {
		Map<Integer, List<ExtraPayment>> byYear = new TreeMap<>();
		for (ExtraPayment payment : plan.payments()) {
			byYear.computeIfAbsent(payment.month().year(), year -> new ArrayList<>()).add(payment);
		}
		return byYear;
	}

	private static Result<YearlyExtraPaymentSummary> summarize(int year, List<ExtraPayment> payments) {
		long cents = 0L;
		for (ExtraPayment payment : payments) {
			cents += payment.amount().cents();
		}
		long averageCents = BigDecimal.valueOf(cents)
				.divide(BigDecimal.valueOf(payments.size()), 0, RoundingMode.HALF_UP)
				.longValueExact();
		int count = payments.size();
		return Money.ofCents(cents)
				.flatMap(total -> Money.ofCents(averageCents)
						.map(average -> new YearlyExtraPaymentSummary(year, total, count, average)));
	}

	public record YearlyExtraPaymentSummary(int year, Money total, int count, Money average) {
	}
}
