package my.finstatements.app.statement;

import my.finstatements.app.columns.ColumnLayout;
import my.finstatements.app.ltm.LtmInfo;

/**
 * Columns for one generation. {@code ltmInfo} is null outside LTM mode.
 */
public record ColumnPlan(ColumnLayout layout, LtmInfo ltmInfo) {
	public boolean ltmMode() {
		return ltmInfo != null;
	}
}
