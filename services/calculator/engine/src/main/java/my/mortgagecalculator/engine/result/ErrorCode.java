package my.mortgagecalculator.engine.result;

public enum ErrorCode {
	NEGATIVE_AMOUNT,
	EXCEEDS_MAXIMUM,
	INVALID_AMOUNT,
	INVALID_INTEREST_RATE,
	INVALID_TERM,
	INVALID_PAYMENT_MONTH,
	INVALID_PERCENTAGE,
	INVALID_EXTRA_PAYMENT,
	DUPLICATE_PAYMENT_MONTH,
	INSUFFICIENT_PAYMENT,
	MATHEMATICAL_ERROR,
	PAYMENT_TOO_HIGH,
	INVALID_PARAMETERS,
	INCONSISTENT_PARAMETERS,
	INVALID_LOAN_CONFIGURATION,
	SIMULATION_ERROR,
	SCHEDULE_ANALYSIS_ERROR
}
