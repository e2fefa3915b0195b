package my.mortgagecalculator.engine.service;

import my.mortgagecalculator.engine.config.CalculationSettings;
import my.mortgagecalculator.engine.domain.Annuity;
import my.mortgagecalculator.engine.domain.InterestRate;
import my.mortgagecalculator.engine.domain.LoanConfiguration;
import my.mortgagecalculator.engine.domain.Money;
import my.mortgagecalculator.engine.domain.MonthCount;
import my.mortgagecalculator.engine.domain.MonthlyPayment;
import my.mortgagecalculator.engine.result.CalculationError;
import my.mortgagecalculator.engine.result.ErrorCode;
import my.mortgagecalculator.engine.result.Result;
import my.mortgagecalculator.engine.service.util.BatchEvaluator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.List;
import java.util.OptionalInt;

/**
 * Closed-form and numerical relations between loan amount, rate, term and payment.
 */
@Service
public class LoanCalculationService {
	private static final Logger logger = LoggerFactory.getLogger(LoanCalculationService.class);
	private static final BigDecimal ONE_CENT = new BigDecimal("0.01");
	private static final BigDecimal ONE_HUNDRED = new BigDecimal("100");
	private static final BigDecimal MONTHS_PER_YEAR = new BigDecimal("12");

	private final CalculationSettings settings;

	public LoanCalculationService(CalculationSettings settings) {
		this.settings = settings;
	}

	public CalculationSettings settings() {
		return settings;
	}

	/**
	 * Unrounded level payment of the configured loan.
	 */
	public Result<BigDecimal> annuityPayment(LoanConfiguration config) {
		MathContext mc = settings.mathContext();
		return Annuity.payment(config.amount().toEuros(), config.annualRate().monthlyFraction(mc),
						config.termInMonths().value(), mc)
				.mapError(error -> error.withOperation("annuityPayment"));
	}

	/**
	 * Level payment split into the principal and interest of the first month.
	 */
	public Result<MonthlyPayment> monthlyPayment(LoanConfiguration config) {
		MathContext mc = settings.mathContext();
		BigDecimal firstInterest = config.amount().toEuros()
				.multiply(config.annualRate().monthlyFraction(mc), mc);
		return annuityPayment(config)
				.mapError(error -> error.withOperation("monthlyPayment"))
				.flatMap(payment -> Money.of(payment)
						.flatMap(total -> Money.of(firstInterest)
								.map(interest -> interest.min(total))
								.map(interest -> new MonthlyPayment(total.subtractOrZero(interest), interest, total)))
						.mapError(error -> error.withOperation("monthlyPayment")));
	}

	/**
	 * Number of payments needed to repay {@code amount} at {@code payment} per month,
	 * rounded up.
	 */
	public Result<MonthCount> loanTerm(Money amount, InterestRate rate, Money payment) {
		String operation = "loanTerm";
		MathContext mc = settings.mathContext();
		BigDecimal principal = amount.toEuros();
		BigDecimal instalment = payment.toEuros();
		if (instalment.signum() <= 0) {
			return Result.failure(ErrorCode.INSUFFICIENT_PAYMENT, "Monthly payment must be positive", operation);
		}
		if (rate.isZero()) {
			BigDecimal months = principal.divide(instalment, 0, RoundingMode.CEILING);
			return toMonthCount(months.max(BigDecimal.ONE), operation);
		}

		BigDecimal monthlyRate = rate.monthlyFraction(mc);
		BigDecimal firstInterest = principal.multiply(monthlyRate, mc);
		if (instalment.compareTo(firstInterest) <= 0) {
			return Result.failure(CalculationError.of(ErrorCode.INSUFFICIENT_PAYMENT,
							"Monthly payment does not cover the interest", operation)
					.withContext("payment", instalment)
					.withContext("firstMonthInterest", firstInterest.setScale(2, RoundingMode.HALF_UP)));
		}
		BigDecimal payoffInOneInstalment = principal.add(firstInterest, mc);
		if (instalment.compareTo(payoffInOneInstalment.add(ONE_CENT)) > 0) {
			return Result.failure(CalculationError.of(ErrorCode.PAYMENT_TOO_HIGH,
							"Monthly payment exceeds the amount due for a single instalment", operation)
					.withContext("payment", instalment)
					.withContext("amountDue", payoffInOneInstalment.setScale(2, RoundingMode.HALF_UP)));
		}

		double ratio = principal.multiply(monthlyRate, mc).divide(instalment, mc).doubleValue();
		double months = -Math.log(1.0 - ratio) / Math.log1p(monthlyRate.doubleValue());
		if (!Double.isFinite(months) || months <= 0) {
			return Result.failure(CalculationError.of(ErrorCode.MATHEMATICAL_ERROR,
							"Loan term is not a finite positive number", operation)
					.withContext("payment", instalment));
		}
		BigDecimal rounded = BigDecimal.valueOf(months).setScale(6, RoundingMode.HALF_UP)
				.setScale(0, RoundingMode.CEILING);
		return toMonthCount(rounded.max(BigDecimal.ONE), operation);
	}

	/**
	 * Annual rate at which {@code payment} repays {@code amount} over {@code term}, found
	 * by bisection.
	 */
	public Result<InterestRate> interestRate(Money amount, Money payment, MonthCount term) {
		String operation = "interestRate";
		MathContext mc = settings.mathContext();
		CalculationSettings.RateSearch search = settings.rateSearch();
		BigDecimal principal = amount.toEuros();
		BigDecimal target = payment.toEuros();
		int months = term.value();

		BigDecimal zeroRatePayment = principal.divide(BigDecimal.valueOf(months), mc);
		if (target.subtract(zeroRatePayment).abs().compareTo(ONE_CENT) <= 0) {
			return Result.success(InterestRate.ofPercent(BigDecimal.ZERO).orElseThrow());
		}
		if (target.compareTo(zeroRatePayment) < 0) {
			return Result.failure(CalculationError.of(ErrorCode.INSUFFICIENT_PAYMENT,
							"Monthly payment does not repay the amount within the term", operation)
					.withContext("payment", target)
					.withContext("minimumPayment", zeroRatePayment.setScale(2, RoundingMode.HALF_UP)));
		}

		BigDecimal low = search.lowerBound();
		BigDecimal high = search.upperBound();
		Result<BigDecimal> lowPayment = paymentAtAnnualRate(principal, low, months);
		Result<BigDecimal> highPayment = paymentAtAnnualRate(principal, high, months);
		if (lowPayment.isFailure() || highPayment.isFailure()) {
			return Result.failure(ErrorCode.MATHEMATICAL_ERROR, "Cannot evaluate payment at search bounds", operation);
		}
		if (target.compareTo(lowPayment.orElseThrow()) < 0 || target.compareTo(highPayment.orElseThrow()) > 0) {
			return Result.failure(CalculationError.of(ErrorCode.MATHEMATICAL_ERROR,
							"Monthly payment is outside the searchable rate range", operation)
					.withContext("payment", target)
					.withContext("lowerBound", low)
					.withContext("upperBound", high));
		}

		BigDecimal two = BigDecimal.valueOf(2);
		for (int iteration = 1; iteration <= search.maxIterations(); iteration++) {
			BigDecimal mid = low.add(high).divide(two, mc);
			Result<BigDecimal> midPayment = paymentAtAnnualRate(principal, mid, months);
			if (midPayment.isFailure()) {
				return Result.failure(midPayment.findError().orElseThrow().withOperation(operation));
			}
			BigDecimal difference = midPayment.orElseThrow().subtract(target);
			if (difference.abs().compareTo(search.tolerance()) <= 0) {
				logger.debug("Rate search converged after {} iterations at {}", iteration, mid);
				BigDecimal percent = mid.multiply(ONE_HUNDRED).setScale(8, RoundingMode.HALF_UP).stripTrailingZeros();
				if (percent.compareTo(InterestRate.MAX_PERCENT) > 0) {
					if (paysAtMaximumRate(principal, target, months)) {
						return InterestRate.ofPercent(InterestRate.MAX_PERCENT).mapError(error -> error.withOperation(operation));
					}
					return Result.failure(CalculationError.of(ErrorCode.INVALID_INTEREST_RATE,
									"Implied interest rate exceeds the supported maximum", operation)
							.withContext("ratePercent", percent));
				}
				return InterestRate.ofPercent(percent).mapError(error -> error.withOperation(operation));
			}
			if (difference.signum() < 0) {
				low = mid;
			} else {
				high = mid;
			}
		}
		logger.debug("Rate search did not converge after {} iterations", search.maxIterations());
		return Result.failure(CalculationError.of(ErrorCode.MATHEMATICAL_ERROR,
						"Interest rate search did not converge", operation)
				.withContext("iterations", search.maxIterations()));
	}

	/**
	 * Total interest of the loan without extra payments: {@code P * n - L}.
	 */
	public Result<Money> totalInterest(LoanConfiguration config) {
		MathContext mc = settings.mathContext();
		return annuityPayment(config)
				.map(payment -> payment.multiply(BigDecimal.valueOf(config.termInMonths().value()), mc)
						.subtract(config.amount().toEuros(), mc)
						.max(BigDecimal.ZERO))
				.flatMap(Money::of)
				.mapError(error -> error.withOperation("totalInterest"));
	}

	public Result<Money> remainingBalance(LoanConfiguration config, int paymentsMade) {
		if (paymentsMade < 0) {
			return Result.failure(CalculationError.of(ErrorCode.INVALID_PARAMETERS,
							"Number of payments made must not be negative", "remainingBalance")
					.withContext("paymentsMade", paymentsMade));
		}
		MathContext mc = settings.mathContext();
		BigDecimal balance = Annuity.balanceAfter(config.amount().toEuros(), config.annualRate().monthlyFraction(mc),
				config.termInMonths().value(), paymentsMade, mc);
		return Money.of(balance).mapError(error -> error.withOperation("remainingBalance"));
	}

	/**
	 * Months until the payment savings of {@code newLoan} cover {@code refinancingCosts}.
	 */
	public Result<Integer> breakEvenPoint(LoanConfiguration currentLoan, LoanConfiguration newLoan,
										  Money refinancingCosts) {
		String operation = "breakEvenPoint";
		Result<MonthlyPayment> current = monthlyPayment(currentLoan);
		Result<MonthlyPayment> proposed = monthlyPayment(newLoan);
		if (current.isFailure()) {
			return Result.failure(current.findError().orElseThrow().withOperation(operation));
		}
		if (proposed.isFailure()) {
			return Result.failure(proposed.findError().orElseThrow().withOperation(operation));
		}
		long savingsCents = current.orElseThrow().total().cents() - proposed.orElseThrow().total().cents();
		if (savingsCents <= 0) {
			return Result.failure(CalculationError.of(ErrorCode.INSUFFICIENT_PAYMENT,
							"New loan does not lower the monthly payment", operation)
					.withContext("currentPayment", current.orElseThrow().total().toEuros())
					.withContext("newPayment", proposed.orElseThrow().total().toEuros()));
		}
		long months = (refinancingCosts.cents() + savingsCents - 1) / savingsCents;
		if (months > MonthCount.MAX_MONTHS) {
			return Result.failure(CalculationError.of(ErrorCode.INVALID_PARAMETERS,
							"Break-even point lies beyond the maximum term", operation)
					.withContext("months", months));
		}
		return Result.success((int) months);
	}

	/**
	 * What-if payments for variations of {@code baseLoan}. Any invalid variation fails the
	 * whole batch; the error context names the failing index.
	 */
	public Result<List<MonthlyPayment>> paymentScenarios(LoanConfiguration baseLoan, List<PaymentAdjustment> adjustments) {
		List<Integer> indexes = new ArrayList<>(adjustments.size());
		for (int i = 0; i < adjustments.size(); i++) {
			indexes.add(i);
		}
		List<Result<MonthlyPayment>> results = BatchEvaluator.evaluate(indexes,
				index -> scenarioPayment(baseLoan, adjustments.get(index))
						.mapError(error -> new CalculationError(ErrorCode.INVALID_PARAMETERS,
								"Scenario " + index + " is invalid: " + error.message(),
								"paymentScenarios", null, error)
								.withContext("scenarioIndex", index)),
				settings.analysisParallelism());
		Result<List<MonthlyPayment>> combined = Result.sequence(results);
		combined.onFailure(error -> logger.warn("Payment scenario batch failed: {}", error.describe()));
		return combined;
	}

	/**
	 * Months needed to clear {@code balance} at {@code payment}, or empty if the payment
	 * never clears it.
	 */
	public OptionalInt monthsToRepay(BigDecimal balance, BigDecimal monthlyRate, BigDecimal payment) {
		if (balance.signum() <= 0) {
			return OptionalInt.of(0);
		}
		if (payment.signum() <= 0) {
			return OptionalInt.empty();
		}
		if (monthlyRate.signum() == 0) {
			return OptionalInt.of(balance.divide(payment, 0, RoundingMode.CEILING).intValueExact());
		}
		MathContext mc = settings.mathContext();
		BigDecimal ratio = balance.multiply(monthlyRate, mc).divide(payment, mc);
		if (ratio.compareTo(BigDecimal.ONE) >= 0) {
			return OptionalInt.empty();
		}
		double months = -Math.log(1.0 - ratio.doubleValue()) / Math.log1p(monthlyRate.doubleValue());
		if (!Double.isFinite(months)) {
			return OptionalInt.empty();
		}
		BigDecimal rounded = BigDecimal.valueOf(months).setScale(6, RoundingMode.HALF_UP)
				.setScale(0, RoundingMode.CEILING);
		return OptionalInt.of(rounded.intValue());
	}

	private Result<MonthlyPayment> scenarioPayment(LoanConfiguration base, PaymentAdjustment adjustment) {
		MathContext mc = settings.mathContext();
		BigDecimal amount = base.amount().toEuros();
		if (adjustment.amountMultiplier() != null) {
			amount = amount.multiply(adjustment.amountMultiplier(), mc);
		}
		BigDecimal ratePercent = base.annualRate().percent();
		if (adjustment.rateAdjustment() != null) {
			ratePercent = ratePercent.add(adjustment.rateAdjustment());
		}
		int months = base.termInMonths().value();
		if (adjustment.termAdjustment() != null) {
			months += adjustment.termAdjustment();
		}
		int term = months;
		BigDecimal percent = ratePercent;
		return Money.of(amount)
				.flatMap(money -> InterestRate.ofPercent(percent)
						.flatMap(rate -> MonthCount.of(term)
								.flatMap(count -> LoanConfiguration.withDerivedPayment(money, rate, count, settings))))
				.flatMap(this::monthlyPayment);
	}

	private Result<BigDecimal> paymentAtAnnualRate(BigDecimal principal, BigDecimal annualRate, int months) {
		MathContext mc = settings.mathContext();
		return Annuity.payment(principal, annualRate.divide(MONTHS_PER_YEAR, mc), months, mc);
	}

	private boolean paysAtMaximumRate(BigDecimal principal, BigDecimal target, int months) {
		BigDecimal maximum = InterestRate.MAX_PERCENT.movePointLeft(2);
		return paymentAtAnnualRate(principal, maximum, months)
				.map(payment -> payment.subtract(target).abs().compareTo(settings.rateSearch().tolerance()) <= 0)
				.toOptional()
				.orElse(false);
	}

	private static Result<MonthCount> toMonthCount(BigDecimal months, String operation) {
		// a payment rounded down to the cent can leave a remainder for one month past the limit
		if (months.compareTo(BigDecimal.valueOf(MonthCount.MAX_MONTHS + 1L)) == 0) {
			return MonthCount.of(MonthCount.MAX_MONTHS).mapError(error -> error.withOperation(operation));
		}
		if (months.compareTo(BigDecimal.valueOf(MonthCount.MAX_MONTHS)) > 0) {
			return Result.failure(CalculationError.of(ErrorCode.INVALID_TERM,
							"Loan term exceeds the maximum of " + MonthCount.MAX_MONTHS + " months", operation)
					.withContext("months", months));
		}
		return MonthCount.of(months.intValueExact()).mapError(error -> error.withOperation(operation));
	}

	/**
	 * Variation of a base loan. Null fields leave the corresponding parameter unchanged;
	 * the rate adjustment is in percentage points, the term adjustment in months.
	 */
	public record PaymentAdjustment(
			BigDecimal amountMultiplier,
			BigDecimal rateAdjustment,
			Integer termAdjustment
	) {
		public static PaymentAdjustment rate(BigDecimal percentagePoints) {
			return new PaymentAdjustment(null, percentagePoints, null);
		}

		public static PaymentAdjustment term(int months) {
			return new PaymentAdjustment(null, null, months);
		}

		public static PaymentAdjustment amount(BigDecimal multiplier) {
			return new PaymentAdjustment(multiplier, null, null);
		}
	}
}
