package my.finstatements.app.variance;

/**
 * Variance between a baseline value {@code a} and a comparison value {@code b}.
 * Percent is null (N/A) when the baseline is zero but the comparison is not.
 */
public final class VarianceCalculator {
	private VarianceCalculator() {
	}

	public static Double amount(Double a, Double b) {
		if (a == null && b == null) {
			return null;
		}
		return value(b) - value(a);
	}

	public static Double percent(Double a, Double b) {
		if (a == null && b == null) {
			return null;
		}
		double base = value(a);
		double current = value(b);
		if (base == 0.0) {
			return current == 0.0 ? 0.0 : null;
		}
		return (current - base) / Math.abs(base) * 100.0;
	}

	private static double value(Double v) {
		return v == null ? 0.0 : v;
	}
}
