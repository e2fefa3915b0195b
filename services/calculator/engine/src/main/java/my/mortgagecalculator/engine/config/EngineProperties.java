package my.mortgagecalculator.engine.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.math.BigDecimal;
import java.math.RoundingMode;

@Validated
@ConfigurationProperties(prefix = "engine")
public record EngineProperties(
		@Min(10) @Max(64) Integer precision,
		RoundingMode rounding,
		@DecimalMin("0.00") BigDecimal consistencyTolerance,
		@DecimalMin("0.00") BigDecimal zeroRateConsistencyTolerance,
		@DecimalMin("0.00") BigDecimal payoffThreshold,
		@Min(1) @Max(10) Integer safetyTermMultiplier,
		@Valid RateSearch rateSearch,
		@Valid Analysis analysis
) {
	public record RateSearch(
			@NotNull @DecimalMin(value = "0", inclusive = false) BigDecimal lowerBound,
			@NotNull @DecimalMin(value = "0", inclusive = false) BigDecimal upperBound,
			@NotNull @DecimalMin(value = "0", inclusive = false) BigDecimal tolerance,
			@Min(1) @Max(500) Integer maxIterations
	) {
	}

	public record Analysis(
			@Min(1) @Max(64) Integer parallelism,
			@DecimalMin("0") BigDecimal worthwhileReturnThreshold
	) {
	}
}
