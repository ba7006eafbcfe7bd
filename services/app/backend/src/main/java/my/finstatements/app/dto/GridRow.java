package my.finstatements.app.dto;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One display row. Amounts are keyed by column key in column order; spacer rows carry null amounts.
 */
public record GridRow(
		int order,
		String label,
		RowType type,
		RowStyle style,
		int indent,
		Map<String, Double> amounts,
		Double varianceAmount,
		Double variancePercent,
		Map<String, String> formatted,
		String formattedVarianceAmount,
		String formattedVariancePercent,
		RowMetadata metadata
) {
	public GridRow {
		amounts = amounts == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(amounts));
		formatted = formatted == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(formatted));
		metadata = metadata == null ? RowMetadata.empty() : metadata;
	}

	public static GridRow of(int order, String label, RowType type, RowStyle style, int indent,
							 Map<String, Double> amounts, RowMetadata metadata) {
		return new GridRow(order, label, type, style, indent, amounts, null, null, null, null, null, metadata);
	}

	public static GridRow spacer(int order, Iterable<String> columns) {
		Map<String, Double> amounts = new LinkedHashMap<>();
		for (String column : columns) {
			amounts.put(column, null);
		}
		return new GridRow(order, "", RowType.SPACER, RowStyle.SPACER, 0, amounts, null, null, null, null, null,
				RowMetadata.computed(null));
	}

	public boolean isSpacer() {
		return type == RowType.SPACER;
	}

	public Double amount(String column) {
		return amounts.get(column);
	}

	public double amountOrZero(String column) {
		Double value = amounts.get(column);
		return value == null ? 0.0 : value;
	}

	public GridRow withOrder(int newOrder) {
		return new GridRow(newOrder, label, type, style, indent, amounts, varianceAmount, variancePercent, formatted,
				formattedVarianceAmount, formattedVariancePercent, metadata);
	}

	public GridRow withAmounts(Map<String, Double> newAmounts) {
		return new GridRow(order, label, type, style, indent, newAmounts, varianceAmount, variancePercent, formatted,
				formattedVarianceAmount, formattedVariancePercent, metadata);
	}

	public GridRow withVariance(Double amount, Double percent) {
		return new GridRow(order, label, type, style, indent, amounts, amount, percent, formatted,
				formattedVarianceAmount, formattedVariancePercent, metadata);
	}

	public GridRow withFormatting(Map<String, String> newFormatted, String varianceAmountText, String variancePercentText) {
		return new GridRow(order, label, type, style, indent, amounts, varianceAmount, variancePercent, newFormatted,
				varianceAmountText, variancePercentText, metadata);
	}
}
