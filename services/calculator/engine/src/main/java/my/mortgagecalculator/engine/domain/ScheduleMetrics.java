package my.mortgagecalculator.engine.domain;

import java.math.BigDecimal;

/**
 * Totals derived from a complete schedule. {@code effectiveInterestRate} is the interest
 * saved per euro of extra payment, in percent.
 */
public record ScheduleMetrics(
		Money totalInterestPaid,
		Money totalPrincipalPaid,
		Money totalExtraPayments,
		Money totalPayments,
		int actualTermMonths,
		Money interestSavedVsOriginal,
		int termReductionMonths,
		BigDecimal effectiveInterestRate,
		Money averageMonthlyPayment,
		Money largestMonthlyPayment,
		Money smallestMonthlyPayment,
		PayoffDate payoffDate
) {
}
