package my.finstatements.app.statement;

import java.util.Locale;

public enum ViewType {
	/**
	 * Year to date: periods 1 up to and including the selected period.
	 */
	CUMULATIVE,
	/**
	 * Only the selected period (or the three months of a quarter).
	 */
	PERIOD;

	public static ViewType from(String raw) {
		if (raw == null || raw.isBlank()) {
			return CUMULATIVE;
		}
		String normalized = raw.trim().toLowerCase(Locale.ROOT);
		return normalized.startsWith("period") || normalized.equals("single") ? PERIOD : CUMULATIVE;
	}
}
