package my.finstatements.app.statement.specialrows;

import my.finstatements.app.columns.ColumnLayout;
import my.finstatements.app.dto.GridRow;
import my.finstatements.app.dto.RowStyle;
import my.finstatements.app.dto.RowType;
import my.finstatements.app.dto.StatementMetrics;

import java.util.ArrayList;
import java.util.List;

public class CashFlowSpecialRows implements SpecialRowsInjector {
	public static final String STARTING_CASH = "startingCash";
	public static final String NET_CHANGE = "netChange";
	public static final String ENDING_CASH = "endingCash";

	@Override
	public List<GridRow> inject(List<GridRow> rows, StatementMetrics metrics, ColumnLayout layout) {
		List<GridRow> result = new ArrayList<>(rows);
		result.add(ComputedRows.spacer(layout));
		result.add(ComputedRows.metric("Starting Cash", RowType.METRIC, RowStyle.NORMAL, metrics.get(STARTING_CASH), layout));
		result.add(ComputedRows.metric("Net Change in Cash", RowType.METRIC, RowStyle.SUBTOTAL, metrics.get(NET_CHANGE), layout));
		result.add(ComputedRows.metric("Ending Cash", RowType.TOTAL, RowStyle.TOTAL, metrics.get(ENDING_CASH), layout));
		return ComputedRows.renumber(result);
	}
}
