package my.mortgagecalculator.engine.domain;

import my.mortgagecalculator.engine.result.CalculationError;
import my.mortgagecalculator.engine.result.ErrorCode;
import my.mortgagecalculator.engine.result.Result;

import java.math.BigDecimal;
import java.math.MathContext;

/**
 * Level payment of an annuity loan: {@code P = L * c * (1 + c)^n / ((1 + c)^n - 1)},
 * degrading to {@code L / n} at a zero rate.
 */
public final class Annuity {
	private Annuity() {
	}

	public static Result<BigDecimal> payment(BigDecimal amount, BigDecimal monthlyRate, int months, MathContext mathContext) {
		if (months <= 0) {
			return Result.failure(ErrorCode.MATHEMATICAL_ERROR, "Number of payments must be positive: " + months,
					"Annuity.payment");
		}
		if (monthlyRate.signum() == 0) {
			return Result.success(amount.divide(BigDecimal.valueOf(months), mathContext));
		}
		BigDecimal factor = BigDecimal.ONE.add(monthlyRate, mathContext).pow(months, mathContext);
		BigDecimal denominator = factor.subtract(BigDecimal.ONE, mathContext);
		if (denominator.signum() == 0) {
			return Result.failure(CalculationError.of(ErrorCode.MATHEMATICAL_ERROR, "Degenerate annuity denominator", "Annuity.payment")
					.withContext("monthlyRate", monthlyRate)
					.withContext("months", months));
		}
		BigDecimal numerator = amount.multiply(monthlyRate, mathContext).multiply(factor, mathContext);
		return Result.success(numerator.divide(denominator, mathContext));
	}

	/**
	 * Outstanding balance after {@code paymentsMade} regular instalments:
	 * {@code B(k) = L * ((1 + c)^n - (1 + c)^k) / ((1 + c)^n - 1)}.
	 */
	public static BigDecimal balanceAfter(BigDecimal amount, BigDecimal monthlyRate, int months, int paymentsMade,
										  MathContext mathContext) {
		if (paymentsMade >= months) {
			return BigDecimal.ZERO;
		}
		if (monthlyRate.signum() == 0) {
			BigDecimal repaid = amount.multiply(BigDecimal.valueOf(paymentsMade), mathContext)
					.divide(BigDecimal.valueOf(months), mathContext);
			return amount.subtract(repaid, mathContext).max(BigDecimal.ZERO);
		}
		BigDecimal onePlusRate = BigDecimal.ONE.add(monthlyRate, mathContext);
		BigDecimal full = onePlusRate.pow(months, mathContext);
		BigDecimal elapsed = onePlusRate.pow(paymentsMade, mathContext);
		BigDecimal balance = amount.multiply(full.subtract(elapsed, mathContext), mathContext)
				.divide(full.subtract(BigDecimal.ONE, mathContext), mathContext);
		return balance.max(BigDecimal.ZERO);
	}
}
