package my.mortgagecalculator.engine.domain;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

public record AmortizationSchedule(
		LoanConfiguration loanConfiguration,
		ExtraPaymentPlan extraPaymentPlan,
		List<AmortizationEntry> entries,
		ScheduleMetrics metrics
) {
	public AmortizationSchedule {
		Objects.requireNonNull(loanConfiguration, "loanConfiguration");
		Objects.requireNonNull(metrics, "metrics");
		entries = List.copyOf(entries);
	}

	public Optional<ExtraPaymentPlan> findExtraPaymentPlan() {
		return Optional.ofNullable(extraPaymentPlan);
	}

	public AmortizationEntry lastEntry() {
		return entries.get(entries.size() - 1);
	}
}
