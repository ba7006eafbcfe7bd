package my.finstatements.app.statement.specialrows;

import my.finstatements.app.columns.ColumnLayout;
import my.finstatements.app.dto.GridRow;
import my.finstatements.app.dto.RowMetadata;
import my.finstatements.app.dto.RowStyle;
import my.finstatements.app.dto.RowType;
import my.finstatements.app.variance.VarianceCalculator;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

final class ComputedRows {
	private ComputedRows() {
	}

	static GridRow metric(String label, RowType type, RowStyle style, Map<String, Double> values, ColumnLayout layout) {
		Map<String, Double> amounts = new LinkedHashMap<>();
		for (String column : layout.keys()) {
			amounts.put(column, values == null ? 0.0 : values.getOrDefault(column, 0.0));
		}
		GridRow row = GridRow.of(0, label, type, style, 0, amounts, RowMetadata.computed("currency"));
		if (layout.hasVariance()) {
			Double a = amounts.get(layout.baseline().key());
			Double b = amounts.get(layout.comparison().key());
			row = row.withVariance(VarianceCalculator.amount(a, b), VarianceCalculator.percent(a, b));
		}
		return row;
	}

	static GridRow spacer(ColumnLayout layout) {
		return GridRow.spacer(0, layout.keys());
	}

	static List<GridRow> renumber(List<GridRow> rows) {
		List<GridRow> numbered = new ArrayList<>(rows.size());
		int order = 1;
		for (GridRow row : rows) {
			numbered.add(row.withOrder(order++));
		}
		return numbered;
	}
}
