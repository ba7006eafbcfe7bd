package my.finstatements.app.filter;

import my.finstatements.app.domain.MovementRecord;

import java.util.List;
import java.util.Map;

/**
 * Compiled filter. Field values are compared as text; range bounds compare numerically
 * when both sides parse as numbers.
 */
public sealed interface FilterCondition permits FilterCondition.Exact, FilterCondition.AnyOf,
		FilterCondition.Range, FilterCondition.And {

	boolean matches(MovementRecord row);

	record Exact(FilterField field, String value) implements FilterCondition {
		@Override
		public boolean matches(MovementRecord row) {
			return value.equals(field.valueOf(row));
		}
	}

	record AnyOf(FilterField field, List<String> values) implements FilterCondition {
		public AnyOf {
			values = List.copyOf(values);
		}

		@Override
		public boolean matches(MovementRecord row) {
			String actual = field.valueOf(row);
			return actual != null && values.contains(actual);
		}
	}

	record Range(FilterField field, Map<RangeOperator, String> bounds) implements FilterCondition {
		public Range {
			bounds = Map.copyOf(bounds);
		}

		@Override
		public boolean matches(MovementRecord row) {
			String actual = field.valueOf(row);
			if (actual == null || actual.isEmpty()) {
				return false;
			}
			for (Map.Entry<RangeOperator, String> bound : bounds.entrySet()) {
				if (!bound.getKey().accepts(compare(actual, bound.getValue()))) {
					return false;
				}
			}
			return true;
		}

		static int compare(String left, String right) {
			Double l = asNumber(left);
			Double r = asNumber(right);
			if (l != null && r != null) {
				return Double.compare(l, r);
			}
			return left.compareTo(right);
		}

		private static Double asNumber(String value) {
			try {
				return Double.valueOf(value.trim());
			} catch (NumberFormatException ex) {
				return null;
			}
		}
	}

	record And(List<FilterCondition> conditions) implements FilterCondition {
		public And {
			conditions = List.copyOf(conditions);
		}

		@Override
		public boolean matches(MovementRecord row) {
			for (FilterCondition condition : conditions) {
				if (!condition.matches(row)) {
					return false;
				}
			}
			return true;
		}
	}
}
