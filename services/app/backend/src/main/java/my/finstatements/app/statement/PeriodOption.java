package my.finstatements.app.statement;

import my.finstatements.app.columns.PeriodWindow;

/**
 * A parsed period selection. {@code year} is 0 for an unqualified "ltm".
 */
public record PeriodOption(int year, Kind kind, int value) {

	public enum Kind {
		ALL,
		PERIOD,
		QUARTER,
		LTM
	}

	public boolean isLtm() {
		return kind == Kind.LTM;
	}

	public PeriodWindow toWindow(ViewType view) {
		return switch (kind) {
			case ALL, LTM -> PeriodWindow.fullYear(year);
			case PERIOD -> view == ViewType.PERIOD
					? new PeriodWindow(year, value, value)
					: new PeriodWindow(year, 1, value);
			case QUARTER -> view == ViewType.PERIOD
					? new PeriodWindow(year, value * 3 - 2, value * 3)
					: new PeriodWindow(year, 1, value * 3);
		};
	}

	public String label(ViewType view) {
		String suffix = view == ViewType.CUMULATIVE && kind != Kind.ALL ? " YTD" : "";
		return switch (kind) {
			case ALL -> Integer.toString(year);
			case PERIOD -> year + " P" + (value < 10 ? "0" + value : Integer.toString(value)) + suffix;
			case QUARTER -> year + " Q" + value + suffix;
			case LTM -> year == 0 ? "LTM" : year + " LTM";
		};
	}
}
