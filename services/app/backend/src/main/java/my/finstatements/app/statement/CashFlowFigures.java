package my.finstatements.app.statement;

import my.finstatements.app.rollup.AggregatedRow;

import java.util.List;
import java.util.Map;

/**
 * Indirect-method cash flow per column. {@code changes} holds the cash effect of each
 * non-cash balance category.
 */
public record CashFlowFigures(
		Map<String, Double> netIncome,
		List<AggregatedRow> changes,
		Map<String, Double> startingCash,
		Map<String, Double> netChange,
		Map<String, Double> endingCash,
		Map<String, Double> cashPosition
) {
	public CashFlowFigures {
		changes = List.copyOf(changes);
	}
}
