package my.finstatements.app.domain;

/**
 * A single debit/credit posted to an account in a fiscal period.
 * <p>
 * {@code period} is the fiscal month (1-12). The value {@link #ALL_PERIODS} marks
 * rows that were exported as a full-year aggregate.
 */
public record MovementRecord(
		int year,
		int period,
		String accountCode,
		String accountDescription,
		String code0,
		String name0,
		String code1,
		String name1,
		String code2,
		String name2,
		String code3,
		String name3,
		String statementType,
		Double movementAmount
) {
	public static final int ALL_PERIODS = 999;

	public double amount() {
		return movementAmount == null ? 0.0 : movementAmount;
	}

	public boolean isAllPeriods() {
		return period == ALL_PERIODS;
	}

	public MovementRecord withAmount(Double amount) {
		return new MovementRecord(year, period, accountCode, accountDescription, code0, name0, code1, name1,
				code2, name2, code3, name3, statementType, amount);
	}
}
