package my.finstatements.app.statement.specialrows;

import my.finstatements.app.category.CategoryClassifier;
import my.finstatements.app.columns.ColumnLayout;
import my.finstatements.app.dto.GridRow;
import my.finstatements.app.dto.RowStyle;
import my.finstatements.app.dto.RowType;
import my.finstatements.app.dto.StatementMetrics;
import my.finstatements.app.statement.StatementMetricsCalculator;

import java.util.ArrayList;
import java.util.List;

/**
 * Total Assets before the first liability/equity row, the result for the year after the last
 * equity row, and Total Liabilities &amp; Equity at the end.
 */
public class BalanceSheetSpecialRows implements SpecialRowsInjector {
	private final CategoryClassifier classifier;

	public BalanceSheetSpecialRows(CategoryClassifier classifier) {
		this.classifier = classifier;
	}

	@Override
	public List<GridRow> inject(List<GridRow> rows, StatementMetrics metrics, ColumnLayout layout) {
		List<GridRow> result = new ArrayList<>(rows);

		int firstPassiva = -1;
		for (int i = 0; i < result.size(); i++) {
			GridRow row = result.get(i);
			if (classifier.isLiabilityOrEquityRow(row.metadata().section(), row.metadata().category())) {
				firstPassiva = i;
				break;
			}
		}
		GridRow totalAssets = ComputedRows.metric("Total Assets", RowType.TOTAL, RowStyle.TOTAL,
				metrics.get(StatementMetricsCalculator.TOTAL_ASSETS), layout);
		int insertAt = firstPassiva < 0 ? result.size() : firstPassiva;
		result.add(insertAt, ComputedRows.spacer(layout));
		result.add(insertAt, totalAssets);

		int lastEquity = -1;
		for (int i = 0; i < result.size(); i++) {
			String category = result.get(i).metadata().category();
			if (category != null && classifier.isEquity(category)) {
				lastEquity = i;
			}
		}
		GridRow resultRow = ComputedRows.metric("Result for the year", RowType.METRIC, RowStyle.NORMAL,
				metrics.get(StatementMetricsCalculator.RESULT_FOR_THE_YEAR), layout);
		if (lastEquity >= 0) {
			GridRow anchor = result.get(lastEquity);
			result.add(lastEquity + 1, withIndent(resultRow, anchor.indent()));
		} else {
			result.add(resultRow);
		}

		result.add(ComputedRows.spacer(layout));
		result.add(ComputedRows.metric("Total Liabilities & Equity", RowType.TOTAL, RowStyle.TOTAL,
				metrics.get(StatementMetricsCalculator.TOTAL_LIABILITIES_EQUITY), layout));
		return ComputedRows.renumber(result);
	}

	private static GridRow withIndent(GridRow row, int indent) {
		return new GridRow(row.order(), row.label(), row.type(), row.style(), indent, row.amounts(),
				row.varianceAmount(), row.variancePercent(), row.formatted(), row.formattedVarianceAmount(),
				row.formattedVariancePercent(), row.metadata());
	}
}
