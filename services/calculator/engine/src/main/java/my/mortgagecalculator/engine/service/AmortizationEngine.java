package my.mortgagecalculator.engine.service;

import my.mortgagecalculator.engine.config.CalculationSettings;
import my.mortgagecalculator.engine.domain.AmortizationEntry;
import my.mortgagecalculator.engine.domain.AmortizationSchedule;
import my.mortgagecalculator.engine.domain.ExtraPayment;
import my.mortgagecalculator.engine.domain.ExtraPaymentPlan;
import my.mortgagecalculator.engine.domain.LoanConfiguration;
import my.mortgagecalculator.engine.domain.Money;
import my.mortgagecalculator.engine.domain.MonthlyPayment;
import my.mortgagecalculator.engine.domain.PaymentMonth;
import my.mortgagecalculator.engine.domain.PayoffDate;
import my.mortgagecalculator.engine.domain.Percentage;
import my.mortgagecalculator.engine.domain.ScheduleMetrics;
import my.mortgagecalculator.engine.result.CalculationError;
import my.mortgagecalculator.engine.result.ErrorCode;
import my.mortgagecalculator.engine.result.Result;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * Month-by-month simulation of an annuity loan with optional extra payments.
 * <p>
 * The balance is carried unrounded at the configured precision; every emitted entry is
 * rounded to whole cents. The regular payment is fixed once per run from the loan
 * configuration.
 */
@Service
public class AmortizationEngine {
	private static final Logger logger = LoggerFactory.getLogger(AmortizationEngine.class);
	private static final BigDecimal ONE_HUNDRED = new BigDecimal("100");

	private final LoanCalculationService loanCalculationService;
	private final CalculationSettings settings;

	public AmortizationEngine(LoanCalculationService loanCalculationService, CalculationSettings settings) {
		this.loanCalculationService = loanCalculationService;
		this.settings = settings;
	}

	public Result<AmortizationSchedule> generateSchedule(LoanConfiguration config) {
		return generateSchedule(config, null);
	}

	public Result<AmortizationSchedule> generateSchedule(LoanConfiguration config, ExtraPaymentPlan plan) {
		return loanCalculationService.annuityPayment(config)
				.mapError(error -> error.wrap("generateSchedule", "Cannot determine the regular payment"))
				.flatMap(payment -> simulate(config, plan, payment));
	}

	/**
	 * Runs the simulation with an explicit regular payment. A payment that does not cover
	 * the interest lets the balance grow until the safety ceiling is reached.
	 */
	Result<AmortizationSchedule> simulate(LoanConfiguration config, ExtraPaymentPlan plan, BigDecimal regularPayment) {
		MathContext mc = settings.mathContext();
		BigDecimal monthlyRate = config.annualRate().monthlyFraction(mc);
		int term = config.termInMonths().value();
		int ceiling = Math.min(term * settings.safetyTermMultiplier(), PaymentMonth.LAST);
		ExtraPaymentPlan extras = plan == null ? ExtraPaymentPlan.none() : plan;
		logger.debug("Generating schedule for {} with {} extra payments (ceiling {} months)",
				config, extras.payments().size(), ceiling);

		List<AmortizationEntry> entries = new ArrayList<>(term);
		BigDecimal balance = config.amount().toEuros();
		BigDecimal cumulativeInterest = BigDecimal.ZERO;
		BigDecimal cumulativePrincipal = BigDecimal.ZERO;

		for (int month = 1; month <= ceiling; month++) {
			BigDecimal startingBalance = balance;
			BigDecimal interest = balance.multiply(monthlyRate, mc);
			BigDecimal interestPaid = interest.min(regularPayment);
			// unpaid interest is added to the balance
			balance = balance.add(interest.subtract(interestPaid), mc);
			BigDecimal principal = regularPayment.subtract(interestPaid, mc).min(balance).max(BigDecimal.ZERO);

			Optional<ExtraPayment> planned = PaymentMonth.of(month).toOptional().flatMap(extras::paymentFor);
			BigDecimal extraAmount = BigDecimal.ZERO;
			if (planned.isPresent()) {
				extraAmount = planned.get().amount().toEuros().min(balance.subtract(principal, mc)).max(BigDecimal.ZERO);
			}

			balance = balance.subtract(principal, mc).subtract(extraAmount, mc).max(BigDecimal.ZERO);
			cumulativeInterest = cumulativeInterest.add(interestPaid, mc);
			cumulativePrincipal = cumulativePrincipal.add(principal, mc).add(extraAmount, mc);
			boolean paidOff = isPaidOff(balance, regularPayment, month, term);

			Result<AmortizationEntry> entry = buildEntry(month, startingBalance, principal, interestPaid,
					planned.orElse(null), extraAmount, balance, cumulativeInterest, cumulativePrincipal,
					monthlyRate, regularPayment, term, paidOff);
			if (entry.isFailure()) {
				return Result.failure(entry.findError().orElseThrow()
						.withOperation("generateSchedule.entry")
						.withContext("month", month)
						.withContext("balance", balance.setScale(2, RoundingMode.HALF_UP)));
			}
			entries.add(entry.orElseThrow());

			if (paidOff) {
				return calculateMetrics(config, entries)
						.map(metrics -> new AmortizationSchedule(config, plan, entries, metrics))
						.onFailure(error -> logger.debug("Schedule metrics failed: {}", error.describe()));
			}
		}

		logger.warn("Simulation reached its safety ceiling of {} months with {} outstanding",
				ceiling, balance.setScale(2, RoundingMode.HALF_UP));
		return Result.failure(CalculationError.of(ErrorCode.SIMULATION_ERROR,
						"Loan is not repaid within the safety ceiling", "generateSchedule")
				.withContext("month", ceiling)
				.withContext("balance", balance.setScale(2, RoundingMode.HALF_UP))
				.withContext("ceiling", ceiling));
	}

	public Result<ScheduleMetrics> calculateMetrics(LoanConfiguration config, List<AmortizationEntry> entries) {
		String operation = "calculateMetrics";
		if (entries == null || entries.isEmpty()) {
			return Result.failure(ErrorCode.SCHEDULE_ANALYSIS_ERROR, "Schedule has no entries", operation);
		}
		AmortizationEntry last = entries.get(entries.size() - 1);
		long extraCents = 0L;
		long paymentCents = 0L;
		Money largest = Money.ZERO;
		Money smallest = null;
		for (AmortizationEntry entry : entries) {
			extraCents += entry.extraAmount().cents();
			paymentCents += entry.totalPaymentAmount().cents();
			largest = largest.max(entry.totalPaymentAmount());
			smallest = smallest == null ? entry.totalPaymentAmount() : smallest.min(entry.totalPaymentAmount());
		}
		Money largestPayment = largest;
		Money smallestPayment = smallest;
		int actualTerm = entries.size();
		int termReduction = Math.max(0, config.termInMonths().value() - actualTerm);
		long averageCents = BigDecimal.valueOf(paymentCents)
				.divide(BigDecimal.valueOf(actualTerm), 0, RoundingMode.HALF_UP)
				.longValueExact();

		Result<Money> totalExtras = Money.ofCents(extraCents);
		Result<Money> totalPayments = Money.ofCents(paymentCents);
		Result<Money> average = Money.ofCents(averageCents);
		Result<Money> originalInterest = loanCalculationService.totalInterest(config);
		return originalInterest.flatMap(original -> totalExtras.flatMap(extras -> totalPayments.flatMap(payments ->
						average.map(averagePayment -> {
							Money saved = original.subtractOrZero(last.cumulativeInterest());
							return new ScheduleMetrics(
									last.cumulativeInterest(),
									last.cumulativePrincipal(),
									extras,
									payments,
									actualTerm,
									saved,
									termReduction,
									returnOnExtraPayments(saved, extras),
									averagePayment,
									largestPayment,
									smallestPayment,
									PayoffDate.afterMonths(actualTerm));
						}))))
				.mapError(error -> error.wrap(operation, "Cannot compute schedule metrics"));
	}

	/**
	 * Regenerates the schedule of the same loan with a different plan.
	 */
	public Result<AmortizationSchedule> applyExtraPayments(AmortizationSchedule schedule, ExtraPaymentPlan plan) {
		return generateSchedule(schedule.loanConfiguration(), plan);
	}

	public ScheduleComparison compareSchedules(AmortizationSchedule base, AmortizationSchedule comparison) {
		ScheduleMetrics baseMetrics = base.metrics();
		ScheduleMetrics comparisonMetrics = comparison.metrics();
		Money savings = baseMetrics.totalInterestPaid().subtractOrZero(comparisonMetrics.totalInterestPaid());
		int termReduction = Math.max(0, baseMetrics.actualTermMonths() - comparisonMetrics.actualTermMonths());
		BigDecimal returnOnInvestment = returnOnExtraPayments(savings, comparisonMetrics.totalExtraPayments());
		boolean worthwhile = !savings.isZero()
				&& returnOnInvestment.compareTo(settings.worthwhileReturnThreshold()) > 0;
		return new ScheduleComparison(savings, termReduction, comparisonMetrics.totalExtraPayments(),
				returnOnInvestment, worthwhile);
	}

	public Optional<AmortizationEntry> entryFor(AmortizationSchedule schedule, PaymentMonth month) {
		int index = month.value() - 1;
		if (index >= schedule.entries().size()) {
			return Optional.empty();
		}
		AmortizationEntry entry = schedule.entries().get(index);
		return entry.monthNumber().equals(month) ? Optional.of(entry) : Optional.empty();
	}

	/**
	 * Ending balance after {@code month}.
	 */
	public Result<Money> remainingBalance(AmortizationSchedule schedule, PaymentMonth month) {
		return entryFor(schedule, month)
				.map(entry -> Result.success(entry.endingBalance()))
				.orElseGet(() -> Result.failure(CalculationError.of(ErrorCode.SCHEDULE_ANALYSIS_ERROR,
								"Schedule has no entry for month " + month, "remainingBalance")
						.withContext("month", month.value())
						.withContext("scheduleMonths", schedule.entries().size())));
	}

	/**
	 * A balance under the payoff threshold ends the schedule, except while the regular
	 * payment itself is below the threshold: such a loan runs to the end of its term.
	 */
	private boolean isPaidOff(BigDecimal balance, BigDecimal regularPayment, int month, int term) {
		if (balance.compareTo(settings.payoffThreshold()) > 0) {
			return false;
		}
		return balance.signum() == 0 || month >= term || regularPayment.compareTo(settings.payoffThreshold()) > 0;
	}

	private Result<AmortizationEntry> buildEntry(int month,
												 BigDecimal startingBalance,
												 BigDecimal principal,
												 BigDecimal interestPaid,
												 ExtraPayment planned,
												 BigDecimal extraAmount,
												 BigDecimal endingBalance,
												 BigDecimal cumulativeInterest,
												 BigDecimal cumulativePrincipal,
												 BigDecimal monthlyRate,
												 BigDecimal regularPayment,
												 int term,
												 boolean paidOff) {
		int remainingMonths = 0;
		if (!paidOff) {
			OptionalInt needed = loanCalculationService.monthsToRepay(endingBalance, monthlyRate, regularPayment);
			remainingMonths = needed.isPresent() ? needed.getAsInt() : Math.max(0, term - month);
		}
		int remaining = remainingMonths;
		List<Result<Money>> amounts = List.of(
				Money.of(startingBalance),
				Money.of(principal),
				Money.of(interestPaid),
				Money.of(extraAmount),
				Money.of(paidOff ? BigDecimal.ZERO : endingBalance),
				Money.of(cumulativeInterest),
				Money.of(cumulativePrincipal));
		return PaymentMonth.of(month).flatMap(paymentMonth -> Result.sequence(amounts).flatMap(values -> {
			Money extraMoney = values.get(3);
			ExtraPayment applied = planned == null || extraMoney.isZero() ? null : planned.capped(extraMoney);
			return MonthlyPayment.of(values.get(1), values.get(2))
					.flatMap(regular -> regular.total().add(extraMoney)
							.flatMap(total -> principalShare(regular.principal(), extraMoney, total)
									.map(share -> new AmortizationEntry(
											paymentMonth,
											values.get(0),
											regular,
											applied,
											total,
											values.get(4),
											values.get(5),
											values.get(6),
											share,
											remaining))));
		}));
	}

	private static Result<Percentage> principalShare(Money principal, Money extra, Money total) {
		if (total.isZero()) {
			return Result.success(Percentage.HUNDRED);
		}
		BigDecimal share = BigDecimal.valueOf(principal.cents() + extra.cents())
				.multiply(ONE_HUNDRED)
				.divide(BigDecimal.valueOf(total.cents()), 2, RoundingMode.HALF_UP)
				.min(ONE_HUNDRED);
		return Percentage.of(share);
	}

	static BigDecimal returnOnExtraPayments(Money saved, Money extras) {
		if (extras.isZero()) {
			return BigDecimal.ZERO.setScale(4);
		}
		return BigDecimal.valueOf(saved.cents())
				.multiply(ONE_HUNDRED)
				.divide(BigDecimal.valueOf(extras.cents()), 4, RoundingMode.HALF_UP);
	}

	/**
	 * Difference between a base schedule and one with extra payments.
	 * {@code returnOnInvestment} is the interest saved per euro of extra payment in percent.
	 */
	public record ScheduleComparison(
			Money interestSavings,
			int termReductionMonths,
			Money extraPayments,
			BigDecimal returnOnInvestment,
			boolean worthwhile
	) {
	}
}
