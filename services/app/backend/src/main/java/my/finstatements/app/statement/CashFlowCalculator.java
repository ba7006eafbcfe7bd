package my.finstatements.app.statement;

import my.finstatements.app.category.CategoryClassifier;
import my.finstatements.app.columns.ColumnDescriptor;
import my.finstatements.app.columns.ColumnLayout;
import my.finstatements.app.columns.PeriodWindow;
import my.finstatements.app.domain.MovementRecord;
import my.finstatements.app.domain.MovementTable;
import my.finstatements.app.rollup.AccountKey;
import my.finstatements.app.rollup.AggregatedRow;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Derives a cash flow from balance positions and income statement movements.
 * <p>
 * A balance position at (year, period) is the sum of that fiscal year's rows up to the period,
 * so exports are expected to carry opening balances inside the year. A column's opening
 * position is the prior year's close when the column starts at period 1, otherwise the
 * position just before the column starts.
 */
public class CashFlowCalculator {
	private static final Logger logger = LoggerFactory.getLogger(CashFlowCalculator.class);

	private final CategoryClassifier classifier;
	private final double tolerance;

	public CashFlowCalculator(CategoryClassifier classifier, double tolerance) {
		this.classifier = classifier;
		this.tolerance = tolerance;
	}

	public CashFlowFigures calculate(MovementTable balanceRows, MovementTable incomeRows, ColumnLayout layout) {
		Map<String, Double> netIncome = new LinkedHashMap<>();
		Map<String, Double> startingCash = new LinkedHashMap<>();
		Map<String, Double> netChange = new LinkedHashMap<>();
		Map<String, Double> endingCash = new LinkedHashMap<>();
		Map<String, Double> cashPosition = new LinkedHashMap<>();
		Map<String, AccountKey> categoryKeys = new LinkedHashMap<>();
		Map<String, Map<String, Double>> categoryChanges = new LinkedHashMap<>();

		for (ColumnDescriptor column : layout.columns()) {
			PeriodWindow first = column.windows().get(0);
			PeriodWindow last = column.windows().get(column.windows().size() - 1);

			double income = 0.0;
			for (MovementRecord row : incomeRows.rows()) {
				if (column.contains(row)) {
					income -= row.amount();
				}
			}

			double openingCash = 0.0;
			double closingCash = 0.0;
			double change = income;
			for (MovementRecord row : balanceRows.rows()) {
				boolean inOpening = isOpening(row, first);
				boolean inClosing = row.year() == last.year() && (row.isAllPeriods() ? last.isFullYear() : row.period() <= last.toPeriod());
				if (!inOpening && !inClosing) {
					continue;
				}
				double delta = (inClosing ? row.amount() : 0.0) - (inOpening ? row.amount() : 0.0);
				if (isCash(row)) {
					openingCash += inOpening ? row.amount() : 0.0;
					closingCash += inClosing ? row.amount() : 0.0;
					continue;
				}
				String category = Objects.toString(row.name1(), "");
				categoryKeys.putIfAbsent(category, AccountKey.category(row));
				categoryChanges.computeIfAbsent(category, k -> new LinkedHashMap<>())
						.merge(column.key(), -delta, Double::sum);
				change -= delta;
			}
			netIncome.put(column.key(), income + 0.0);
			startingCash.put(column.key(), openingCash + 0.0);
			netChange.put(column.key(), change + 0.0);
			endingCash.put(column.key(), openingCash + change + 0.0);
			cashPosition.put(column.key(), closingCash + 0.0);
			double difference = openingCash + change - closingCash;
			if (Math.abs(difference) > tolerance) {
				logger.warn("Cash flow for column {} does not reconcile with the cash position (difference {})",
						column.key(), difference);
			}
		}

		List<AggregatedRow> changes = new ArrayList<>();
		for (Map.Entry<String, AccountKey> entry : categoryKeys.entrySet()) {
			Map<String, Double> amounts = new LinkedHashMap<>();
			Map<String, Double> perColumn = categoryChanges.getOrDefault(entry.getKey(), Map.of());
			for (String key : layout.keys()) {
				amounts.put(key, perColumn.getOrDefault(key, 0.0) + 0.0);
			}
			changes.add(new AggregatedRow(entry.getValue(), amounts));
		}
		return new CashFlowFigures(netIncome, changes, startingCash, netChange, endingCash, cashPosition);
	}

	public boolean isCash(MovementRecord row) {
		return !classifier.isLiabilityOrEquityRow(row) && classifier.isCashRow(row.name1(), row.name2());
	}

	private static boolean isOpening(MovementRecord row, PeriodWindow first) {
		if (first.fromPeriod() <= 1) {
			return row.year() == first.year() - 1;
		}
		return row.year() == first.year() && !row.isAllPeriods() && row.period() < first.fromPeriod();
	}
}
