package my.mortgagecalculator.engine.config;

import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.math.RoundingMode;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class EngineConfigTest {
	@Test
	void missingPropertiesFallBackToDefaults() {
		CalculationSettings settings = EngineConfig.toSettings(
				new EngineProperties(null, null, null, null, null, null, null, null));

		assertThat(settings).isEqualTo(CalculationSettings.defaults());
	}

	@Test
	void mapsConfiguredValues() {
		EngineProperties properties = new EngineProperties(
				32,
				RoundingMode.HALF_EVEN,
				new BigDecimal("0.50"),
				new BigDecimal("0.02"),
				new BigDecimal("0.05"),
				3,
				new EngineProperties.RateSearch(new BigDecimal("0.001"), new BigDecimal("0.25"), new BigDecimal("0.001"), 80),
				new EngineProperties.Analysis(4, new BigDecimal("5"))
		);

		CalculationSettings settings = EngineConfig.toSettings(properties);

		assertThat(settings.mathContext().getPrecision()).isEqualTo(32);
		assertThat(settings.mathContext().getRoundingMode()).isEqualTo(RoundingMode.HALF_EVEN);
		assertThat(settings.consistencyTolerance()).isEqualByComparingTo("0.50");
		assertThat(settings.zeroRateConsistencyTolerance()).isEqualByComparingTo("0.02");
		assertThat(settings.payoffThreshold()).isEqualByComparingTo("0.05");
		assertThat(settings.safetyTermMultiplier()).isEqualTo(3);
		assertThat(settings.rateSearch().maxIterations()).isEqualTo(80);
		assertThat(settings.rateSearch().upperBound()).isEqualByComparingTo("0.25");
		assertThat(settings.analysisParallelism()).isEqualTo(4);
		assertThat(settings.worthwhileReturnThreshold()).isEqualByComparingTo("5");
	}

	@Test
	void partialSectionsKeepDefaultsForMissingValues() {
		EngineProperties properties = new EngineProperties(null, null, null, null, null, null,
				new EngineProperties.RateSearch(new BigDecimal("0.001"), new BigDecimal("0.25"), new BigDecimal("0.01"), null),
				new EngineProperties.Analysis(null, new BigDecimal("3")));

		CalculationSettings settings = EngineConfig.toSettings(properties);

		assertThat(settings.analysisParallelism()).isEqualTo(CalculationSettings.defaults().analysisParallelism());
		assertThat(settings.worthwhileReturnThreshold()).isEqualByComparingTo("3");
		assertThat(settings.rateSearch().maxIterations()).isEqualTo(CalculationSettings.defaults().rateSearch().maxIterations());
		assertThat(settings.rateSearch().upperBound()).isEqualByComparingTo("0.25");
	}

	@Test
	void rejectsInvertedRateSearchBounds() {
		EngineProperties properties = new EngineProperties(null, null, null, null, null, null,
				new EngineProperties.RateSearch(new BigDecimal("0.30"), new BigDecimal("0.01"), new BigDecimal("0.01"), 50),
				null);

		assertThatThrownBy(() -> EngineConfig.toSettings(properties))
				.isInstanceOf(IllegalArgumentException.class)
				.hasMessageContaining("rate search bounds");
	}
}
