package my.finstatements.app.dto;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Named metrics per column key, e.g. {@code netIncome -> {amount_1: 1200.0, amount_2: 900.0}}.
 * {@code balanced} and {@code imbalance} are only set for balance sheets.
 */
public record StatementMetrics(Map<String, Map<String, Double>> values, Boolean balanced, Double imbalance) {
	public StatementMetrics {
		Map<String, Map<String, Double>> copy = new LinkedHashMap<>();
		if (values != null) {
			values.forEach((name, perColumn) -> copy.put(name, Collections.unmodifiableMap(new LinkedHashMap<>(perColumn))));
		}
		values = Collections.unmodifiableMap(copy);
	}

	public static StatementMetrics empty() {
		return new StatementMetrics(Map.of(), null, null);
	}

	public Double get(String metric, String column) {
		Map<String, Double> perColumn = values.get(metric);
		return perColumn == null ? null : perColumn.get(column);
	}

	public Map<String, Double> get(String metric) {
		return values.getOrDefault(metric, Map.of());
	}
}
