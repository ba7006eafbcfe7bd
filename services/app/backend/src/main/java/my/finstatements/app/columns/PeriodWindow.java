package my.finstatements.app.columns;

import my.finstatements.app.domain.MovementRecord;

/**
 * Inclusive period range inside one fiscal year.
 */
public record PeriodWindow(int year, int fromPeriod, int toPeriod) {

	public static PeriodWindow fullYear(int year) {
		return new PeriodWindow(year, 1, 12);
	}

	public boolean isFullYear() {
		return fromPeriod <= 1 && toPeriod >= 12;
	}

	public boolean contains(MovementRecord row) {
		if (row.year() != year) {
			return false;
		}
		if (row.isAllPeriods()) {
			return isFullYear();
		}
		return row.period() >= fromPeriod && row.period() <= toPeriod;
	}

	public int periodCount() {
		return Math.max(0, toPeriod - fromPeriod + 1);
	}
}
