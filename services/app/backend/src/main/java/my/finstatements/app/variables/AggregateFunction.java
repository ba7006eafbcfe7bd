package my.finstatements.app.variables;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

public enum AggregateFunction {
	SUM("sum"),
	AVERAGE("average"),
	AVG("avg"),
	COUNT("count"),
	MIN("min"),
	MAX("max"),
	FIRST("first"),
	LAST("last");

	private final String id;

	AggregateFunction(String id) {
		this.id = id;
	}

	public String id() {
		return id;
	}

	/**
	 * Applies the aggregate to amounts already in chronological order. Empty input yields 0.
	 */
	public double apply(List<Double> amounts) {
		if (amounts.isEmpty()) {
			return 0.0;
		}
		return switch (this) {
			case SUM -> sum(amounts);
			case AVERAGE, AVG -> sum(amounts) / amounts.size();
			case COUNT -> amounts.size();
			case MIN -> amounts.stream().mapToDouble(AggregateFunction::value).min().orElse(0.0);
			case MAX -> amounts.stream().mapToDouble(AggregateFunction::value).max().orElse(0.0);
			case FIRST -> value(amounts.get(0));
			case LAST -> value(amounts.get(amounts.size() - 1));
		};
	}

	public boolean isPositional() {
		return this == FIRST || this == LAST;
	}

	public static AggregateFunction from(String raw) {
		if (raw == null) {
			return null;
		}
		String normalized = raw.trim().toLowerCase(Locale.ROOT);
		for (AggregateFunction function : values()) {
			if (function.id.equals(normalized)) {
				return function;
			}
		}
		return null;
	}

	public static String validFunctionList() {
		return Arrays.stream(values()).map(AggregateFunction::id).collect(Collectors.joining(", "));
	}

	private static double sum(List<Double> amounts) {
		double total = 0.0;
		for (Double amount : amounts) {
			total += value(amount);
		}
		return total;
	}

	private static double value(Double amount) {
		return amount == null ? 0.0 : amount;
	}
}
