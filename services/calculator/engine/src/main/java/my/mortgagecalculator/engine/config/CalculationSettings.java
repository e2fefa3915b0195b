package my.mortgagecalculator.engine.config;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.util.Objects;

/**
 * Numeric settings threaded through every calculation. Instances are immutable and are
 * passed explicitly; there is no global precision state.
 */
public record CalculationSettings(
		MathContext mathContext,
		BigDecimal consistencyTolerance,
		BigDecimal zeroRateConsistencyTolerance,
		BigDecimal payoffThreshold,
		int safetyTermMultiplier,
		RateSearch rateSearch,
		int analysisParallelism,
		BigDecimal worthwhileReturnThreshold
) {
	public CalculationSettings {
		Objects.requireNonNull(mathContext, "mathContext");
		Objects.requireNonNull(rateSearch, "rateSearch");
		if (safetyTermMultiplier < 1) {
			throw new IllegalArgumentException("safetyTermMultiplier must be at least 1");
		}
		consistencyTolerance = consistencyTolerance == null ? new BigDecimal("1.00") : consistencyTolerance;
		zeroRateConsistencyTolerance = zeroRateConsistencyTolerance == null
				? new BigDecimal("0.01")
				: zeroRateConsistencyTolerance;
		payoffThreshold = payoffThreshold == null ? new BigDecimal("0.01") : payoffThreshold;
		analysisParallelism = Math.max(1, analysisParallelism);
		worthwhileReturnThreshold = worthwhileReturnThreshold == null
				? new BigDecimal("2")
				: worthwhileReturnThreshold;
	}

	public static CalculationSettings defaults() {
		return new CalculationSettings(
				new MathContext(20, RoundingMode.HALF_UP),
				new BigDecimal("1.00"),
				new BigDecimal("0.01"),
				new BigDecimal("0.01"),
				2,
				RateSearch.defaults(),
				1,
				new BigDecimal("2")
		);
	}

	public CalculationSettings withAnalysisParallelism(int parallelism) {
		return new CalculationSettings(mathContext, consistencyTolerance, zeroRateConsistencyTolerance,
				payoffThreshold, safetyTermMultiplier, rateSearch, parallelism, worthwhileReturnThreshold);
	}

	/**
	 * Bounds of the bisection used to solve for the interest rate. Bounds are annual rates
	 * as fractions, the tolerance is in euros of monthly payment.
	 */
	public record RateSearch(
			BigDecimal lowerBound,
			BigDecimal upperBound,
			BigDecimal tolerance,
			int maxIterations
	) {
		public RateSearch {
			Objects.requireNonNull(lowerBound, "lowerBound");
			Objects.requireNonNull(upperBound, "upperBound");
			Objects.requireNonNull(tolerance, "tolerance");
			if (lowerBound.signum() <= 0 || upperBound.compareTo(lowerBound) <= 0) {
				throw new IllegalArgumentException("rate search bounds must satisfy 0 < lower < upper");
			}
			if (maxIterations < 1) {
				throw new IllegalArgumentException("maxIterations must be at least 1");
			}
		}

		public static RateSearch defaults() {
			return new RateSearch(new BigDecimal("0.0001"), new BigDecimal("0.30"), new BigDecimal("0.01"), 50);
		}
	}
}
