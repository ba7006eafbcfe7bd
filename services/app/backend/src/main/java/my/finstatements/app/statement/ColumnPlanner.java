package my.finstatements.app.statement;

import my.finstatements.app.columns.ColumnDescriptor;
import my.finstatements.app.columns.ColumnLayout;
import my.finstatements.app.domain.MovementTable;
import my.finstatements.app.domain.StatementType;
import my.finstatements.app.errors.DataException;
import my.finstatements.app.ltm.LtmCalculator;
import my.finstatements.app.ltm.LtmInfo;
import my.finstatements.app.rollup.RollupSpecBuilder;

import java.util.ArrayList;
import java.util.List;

/**
 * Turns period option strings into column descriptors.
 */
public class ColumnPlanner {
	private final PeriodOptionParser parser = new PeriodOptionParser();
	private final LtmCalculator ltmCalculator;
	private final int ltmMonths;

	public ColumnPlanner(LtmCalculator ltmCalculator, int ltmMonths) {
		this.ltmCalculator = ltmCalculator;
		this.ltmMonths = ltmMonths;
	}

	public ColumnPlan plan(StatementType type, MovementTable table, GenerationOptions options) {
		PeriodOption first = parser.parse(options.period1());
		PeriodOption second = options.period2() == null || options.period2().isBlank()
				? null : parser.parse(options.period2());
		if (first.isLtm() || (second != null && second.isLtm())) {
			return planLtm(type, table, first.isLtm() ? first : second);
		}
		// balance positions are always year to date
		ViewType view = type == StatementType.BALANCE ? ViewType.CUMULATIVE : options.viewType();
		List<ColumnDescriptor> columns = new ArrayList<>();
		columns.add(ColumnDescriptor.amount("amount_1", first.label(view), first.toWindow(view)));
		if (second != null) {
			columns.add(ColumnDescriptor.amount("amount_2", second.label(view), second.toWindow(view)));
		}
		return new ColumnPlan(new ColumnLayout(columns, false), null);
	}

	private ColumnPlan planLtm(StatementType type, MovementTable table, PeriodOption option) {
		MovementTable scope = option.year() == 0 ? table : table.filter(row -> row.year() <= option.year());
		LtmInfo info = ltmCalculator.calculateLTMInfo(scope, table.years(), ltmMonths);
		if (info.ranges().isEmpty()) {
			throw new DataException("No data available for an LTM statement");
		}
		ColumnLayout layout = RollupSpecBuilder.ltmLayout(info.ranges(), type);
		return new ColumnPlan(layout, info);
	}
}
