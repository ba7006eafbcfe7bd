package my.finstatements.app.statement.specialrows;

import my.finstatements.app.category.CategoryClassifier;
import my.finstatements.app.category.IncomeCategory;
import my.finstatements.app.columns.ColumnLayout;
import my.finstatements.app.dto.GridRow;
import my.finstatements.app.dto.RowStyle;
import my.finstatements.app.dto.RowType;
import my.finstatements.app.dto.StatementMetrics;
import my.finstatements.app.statement.StatementMetricsCalculator;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Gross Margin, Operating Result and Result Before Tax at the category boundaries where they
 * apply, each followed by a spacer, and Net Income at the bottom.
 */
public class IncomeStatementSpecialRows implements SpecialRowsInjector {
	private final CategoryClassifier classifier;

	public IncomeStatementSpecialRows(CategoryClassifier classifier) {
		this.classifier = classifier;
	}

	@Override
	public List<GridRow> inject(List<GridRow> rows, StatementMetrics metrics, ColumnLayout layout) {
		List<GridRow> result = new ArrayList<>();
		Set<IncomeCategory> seen = EnumSet.noneOf(IncomeCategory.class);
		boolean grossMarginDone = false;
		boolean operatingResultDone = false;
		boolean resultBeforeTaxDone = false;

		for (GridRow row : rows) {
			String category = row.metadata().category();
			IncomeCategory kind = category == null ? IncomeCategory.UNCLASSIFIED
					: classifier.classifyIncomeCategory(category);
			if (kind != IncomeCategory.UNCLASSIFIED && !seen.contains(kind)) {
				if (!grossMarginDone && isAfterGrossMargin(kind)
						&& (seen.contains(IncomeCategory.REVENUE) || seen.contains(IncomeCategory.COGS))) {
					append(result, "Gross Margin", StatementMetricsCalculator.GROSS_MARGIN, metrics, layout);
					grossMarginDone = true;
				}
				if (!operatingResultDone && (kind == IncomeCategory.OTHER_RESULT || kind == IncomeCategory.TAX)
						&& (grossMarginDone || seen.contains(IncomeCategory.OPERATING_EXPENSE))) {
					append(result, "Operating Result", StatementMetricsCalculator.OPERATING_RESULT, metrics, layout);
					operatingResultDone = true;
				}
				if (!resultBeforeTaxDone && kind == IncomeCategory.TAX && seen.contains(IncomeCategory.OTHER_RESULT)) {
					append(result, "Result Before Tax", StatementMetricsCalculator.RESULT_BEFORE_TAX, metrics, layout);
					resultBeforeTaxDone = true;
				}
				seen.add(kind);
			}
			result.add(row);
		}
		result.add(ComputedRows.spacer(layout));
		result.add(ComputedRows.metric("Net Income", RowType.TOTAL, RowStyle.TOTAL,
				metrics.get(StatementMetricsCalculator.NET_INCOME), layout));
		return ComputedRows.renumber(result);
	}

	private static boolean isAfterGrossMargin(IncomeCategory kind) {
		return kind == IncomeCategory.OPERATING_EXPENSE || kind == IncomeCategory.OTHER_RESULT
				|| kind == IncomeCategory.TAX;
	}

	private void append(List<GridRow> result, String label, String metric, StatementMetrics metrics,
						ColumnLayout layout) {
		result.add(ComputedRows.metric(label, RowType.METRIC, RowStyle.SUBTOTAL, metrics.get(metric), layout));
		result.add(ComputedRows.spacer(layout));
	}
}
