package my.mortgagecalculator.engine.service;

import my.mortgagecalculator.engine.config.CalculationSettings;
import my.mortgagecalculator.engine.domain.AmortizationSchedule;
import my.mortgagecalculator.engine.domain.ExtraPayment;
import my.mortgagecalculator.engine.domain.ExtraPaymentPlan;
import my.mortgagecalculator.engine.domain.InterestRate;
import my.mortgagecalculator.engine.domain.LoanConfiguration;
import my.mortgagecalculator.engine.domain.Money;
import my.mortgagecalculator.engine.domain.MonthCount;
import my.mortgagecalculator.engine.domain.PaymentMonth;
import my.mortgagecalculator.engine.result.Result;
import my.mortgagecalculator.engine.service.util.BatchEvaluator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Impact and comparison of Sondertilgung plans.
 */
@Service
public class SondertilgungAnalysisService {
	private static final Logger logger = LoggerFactory.getLogger(SondertilgungAnalysisService.class);
	private static final BigDecimal ONE_PERCENTAGE_POINT = BigDecimal.ONE;
	private static final BigDecimal ONE_HUNDRED = new BigDecimal("100");

	private final LoanCalculationService loanCalculationService;
	private final AmortizationEngine amortizationEngine;
	private final CalculationSettings settings;

	public SondertilgungAnalysisService(LoanCalculationService loanCalculationService,
										AmortizationEngine amortizationEngine,
										CalculationSettings settings) {
		this.loanCalculationService = loanCalculationService;
		this.amortizationEngine = amortizationEngine;
		this.settings = settings;
	}

	public Result<SondertilgungImpact> sondertilgungImpact(LoanConfiguration config, ExtraPaymentPlan plan) {
		String operation = "sondertilgungImpact";
		return loanCalculationService.totalInterest(config)
				.flatMap(originalInterest -> amortizationEngine.generateSchedule(config, plan)
						.map(schedule -> toImpact(config, plan, originalInterest, schedule)))
				.mapError(error -> error.wrap(operation, "Cannot analyse extra payment plan"));
	}

	/**
	 * Largest useful extra payment in {@code month}: the requested maximum, but never more
	 * than the balance outstanding before that month.
	 */
	public Result<Money> optimalExtraPayment(LoanConfiguration config, PaymentMonth month, Money maxAmount) {
		return loanCalculationService.remainingBalance(config, month.value() - 1)
				.map(balance -> balance.min(maxAmount))
				.mapError(error -> error.withOperation("optimalExtraPayment"));
	}

	/**
	 * Impacts of all plans ordered by interest saved, highest first. Plans with equal
	 * savings keep their input order.
	 */
	public Result<List<SondertilgungImpact>> compareStrategies(LoanConfiguration config, List<ExtraPaymentPlan> plans) {
		List<Result<SondertilgungImpact>> impacts = BatchEvaluator.evaluate(plans,
				plan -> sondertilgungImpact(config, plan), settings.analysisParallelism());
		Result<List<SondertilgungImpact>> combined = Result.sequence(impacts)
				.map(list -> {
					List<SondertilgungImpact> ranked = new ArrayList<>(list);
					ranked.sort(Comparator.comparing(SondertilgungImpact::totalInterestSaved).reversed());
					return List.copyOf(ranked);
				})
				.mapError(error -> error.wrap("compareStrategies", "Strategy evaluation failed"));
		combined.onFailure(error -> logger.warn("Strategy comparison failed: {}", error.describe()));
		return combined;
	}

	/**
	 * How strongly the savings of one extra payment depend on the interest rate: the
	 * payment is evaluated at the loan's rate and one percentage point below and above.
	 */
	public Result<InterestSensitivity> interestSensitivity(LoanConfiguration config, Money amount, PaymentMonth month) {
		String operation = "interestSensitivity";
		InterestRate lowRate = config.annualRate().shiftedWithinBounds(ONE_PERCENTAGE_POINT.negate());
		InterestRate highRate = config.annualRate().shiftedWithinBounds(ONE_PERCENTAGE_POINT);
		Result<ExtraPaymentPlan> plan = ExtraPayment.of(month, amount)
				.flatMap(payment -> ExtraPaymentPlan.unlimited(List.of(payment)));
		return plan.flatMap(singlePayment -> savingsAt(config, config.annualRate(), singlePayment)
						.flatMap(base -> savingsAt(config, lowRate, singlePayment)
								.flatMap(low -> savingsAt(config, highRate, singlePayment)
										.map(high -> new InterestSensitivity(base, low, high, lowRate, highRate,
												sensitivity(base, low, high))))))
				.mapError(error -> error.wrap(operation, "Cannot evaluate interest sensitivity"));
	}

	public Result<MonthCount> payoffMonth(LoanConfiguration config, ExtraPaymentPlan plan) {
		return amortizationEngine.generateSchedule(config, plan)
				.flatMap(schedule -> MonthCount.of(schedule.metrics().actualTermMonths()))
				.mapError(error -> error.wrap("payoffMonth", "Cannot determine payoff month"));
	}

	private Result<Money> savingsAt(LoanConfiguration config, InterestRate rate, ExtraPaymentPlan plan) {
		Result<LoanConfiguration> adjusted = rate.equals(config.annualRate())
				? Result.success(config)
				: config.withAnnualRate(rate, settings);
		return adjusted.flatMap(loan -> sondertilgungImpact(loan, plan))
				.map(SondertilgungImpact::totalInterestSaved);
	}

	private SondertilgungImpact toImpact(LoanConfiguration config,
										 ExtraPaymentPlan plan,
										 Money originalInterest,
										 AmortizationSchedule schedule) {
		Money newInterest = schedule.metrics().totalInterestPaid();
		Money saved = originalInterest.subtractOrZero(newInterest);
		Money extras = schedule.metrics().totalExtraPayments();
		int originalTerm = config.termInMonths().value();
		int newTerm = schedule.metrics().actualTermMonths();
		logger.debug("Plan with {} payments saves {} over {} months", plan == null ? 0 : plan.payments().size(),
				saved, originalTerm - newTerm);
		return new SondertilgungImpact(
				plan,
				originalInterest,
				newInterest,
				saved,
				originalTerm,
				newTerm,
				Math.max(0, originalTerm - newTerm),
				extras,
				AmortizationEngine.returnOnExtraPayments(saved, extras));
	}

	private static BigDecimal sensitivity(Money base, Money low, Money high) {
		if (base.isZero()) {
			return BigDecimal.ZERO;
		}
		return BigDecimal.valueOf(high.cents() - low.cents())
				.multiply(ONE_HUNDRED)
				.divide(BigDecimal.valueOf(base.cents() * 2), 4, RoundingMode.HALF_UP);
	}

	public record SondertilgungImpact(
			ExtraPaymentPlan plan,
			Money originalTotalInterest,
			Money newTotalInterest,
			Money totalInterestSaved,
			int originalTermMonths,
			int newTermMonths,
			int termReductionMonths,
			Money totalExtraPayments,
			BigDecimal effectiveInterestRate
	) {
	}

	public record InterestSensitivity(
			Money baseSavings,
			Money lowRateSavings,
			Money highRateSavings,
			InterestRate lowRate,
			InterestRate highRate,
			BigDecimal sensitivity
	) {
	}
}
