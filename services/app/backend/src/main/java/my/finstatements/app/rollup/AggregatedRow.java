package my.finstatements.app.rollup;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One rollup group with its amounts in column order. Amounts may contain nulls (N/A).
 */
public record AggregatedRow(AccountKey key, Map<String, Double> amounts) {
	public AggregatedRow {
		amounts = Collections.unmodifiableMap(new LinkedHashMap<>(amounts));
	}

	public Double amount(String column) {
		return amounts.get(column);
	}

	public double amountOrZero(String column) {
		Double value = amounts.get(column);
		return value == null ? 0.0 : value;
	}

	public AggregatedRow withAmounts(Map<String, Double> replaced) {
		return new AggregatedRow(key, replaced);
	}
}
