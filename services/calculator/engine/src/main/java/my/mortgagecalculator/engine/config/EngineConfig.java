package my.mortgagecalculator.engine.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.math.MathContext;
import java.math.RoundingMode;

@Configuration
@EnableConfigurationProperties(EngineProperties.class)
public class EngineConfig {
	private static final Logger logger = LoggerFactory.getLogger(EngineConfig.class);

	@Bean
	public CalculationSettings calculationSettings(EngineProperties properties) {
		CalculationSettings settings = toSettings(properties);
		logger.info("Calculation settings (precision={}, rounding={}, safetyTermMultiplier={}, parallelism={}).",
				settings.mathContext().getPrecision(),
				settings.mathContext().getRoundingMode(),
				settings.safetyTermMultiplier(),
				settings.analysisParallelism());
		return settings;
	}

	static CalculationSettings toSettings(EngineProperties properties) {
		CalculationSettings defaults = CalculationSettings.defaults();
		if (properties == null) {
			return defaults;
		}
		int precision = properties.precision() == null
				? defaults.mathContext().getPrecision()
				: properties.precision();
		RoundingMode rounding = properties.rounding() == null
				? defaults.mathContext().getRoundingMode()
				: properties.rounding();
		CalculationSettings.RateSearch rateSearch = defaults.rateSearch();
		if (properties.rateSearch() != null) {
			EngineProperties.RateSearch configured = properties.rateSearch();
			rateSearch = new CalculationSettings.RateSearch(
					configured.lowerBound(),
					configured.upperBound(),
					configured.tolerance(),
					configured.maxIterations() == null
							? defaults.rateSearch().maxIterations()
							: configured.maxIterations());
		}
		int parallelism = properties.analysis() == null || properties.analysis().parallelism() == null
				? defaults.analysisParallelism()
				: properties.analysis().parallelism();
		return new CalculationSettings(
				new MathContext(precision, rounding),
				properties.consistencyTolerance(),
				properties.zeroRateConsistencyTolerance(),
				properties.payoffThreshold(),
				properties.safetyTermMultiplier() == null
						? defaults.safetyTermMultiplier()
						: properties.safetyTermMultiplier(),
				rateSearch,
				parallelism,
				properties.analysis() == null ? null : properties.analysis().worthwhileReturnThreshold()
		);
	}
}
