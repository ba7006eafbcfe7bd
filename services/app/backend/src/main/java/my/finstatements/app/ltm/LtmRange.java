package my.finstatements.app.ltm;

import my.finstatements.app.columns.PeriodWindow;

public record LtmRange(int year, int startPeriod, int endPeriod) {

	public int periodCount() {
		return endPeriod - startPeriod + 1;
	}

	public PeriodWindow toWindow() {
		return new PeriodWindow(year, startPeriod, endPeriod);
	}
}
