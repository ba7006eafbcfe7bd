package my.finstatements.app.columns;

import my.finstatements.app.domain.MovementRecord;

import java.util.List;

/**
 * One output amount column. A row falls into the column when any of its windows contains it.
 */
public record ColumnDescriptor(String key, String label, List<PeriodWindow> windows, Kind kind) {

	public enum Kind {
		AMOUNT,
		MONTH,
		TOTAL
	}

	public ColumnDescriptor {
		windows = List.copyOf(windows);
	}

	public static ColumnDescriptor amount(String key, String label, PeriodWindow window) {
		return new ColumnDescriptor(key, label, List.of(window), Kind.AMOUNT);
	}

	public static ColumnDescriptor month(int index, int year, int period) {
		return new ColumnDescriptor("month_" + index, year + " P" + pad(period),
				List.of(new PeriodWindow(year, period, period)), Kind.MONTH);
	}

	public static ColumnDescriptor total(String key, String label, List<PeriodWindow> windows) {
		return new ColumnDescriptor(key, label, windows, Kind.TOTAL);
	}

	public boolean contains(MovementRecord row) {
		for (PeriodWindow window : windows) {
			if (window.contains(row)) {
				return true;
			}
		}
		return false;
	}

	/**
	 * Fiscal year of the last window, the year the column "belongs" to.
	 */
	public int year() {
		return windows.isEmpty() ? 0 : windows.get(windows.size() - 1).year();
	}

	static String pad(int period) {
		return period < 10 ? "0" + period : Integer.toString(period);
	}
}
