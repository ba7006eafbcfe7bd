package my.finstatements.app.filter;

import my.finstatements.app.domain.MovementTable;
import my.finstatements.app.errors.DataException;
import my.finstatements.app.errors.StatementException;
import my.finstatements.app.errors.ValidationException;
import my.finstatements.app.util.Result;
import my.finstatements.app.util.ValidationResult;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.function.UnaryOperator;
import java.util.stream.Collectors;

/**
 * Compiles filter specifications into {@link FilterCondition} trees and applies them to tables.
 * <p>
 * A specification maps a field name to a scalar (exact match), a list (any of) or a range
 * object with {@code gte}, {@code lte}, {@code gt} and {@code lt} bounds. Fields are ANDed.
 * The empty specification matches every row.
 */
public class FilterEngine {
	private static final String VALID_OPERATORS = "gte, lte, gt, lt";

	public List<String> validateFilter(Object spec) {
		List<String> errors = new ArrayList<>();
		if (!(spec instanceof Map<?, ?> map)) {
			errors.add("Filter specification must be an object");
			return errors;
		}
		for (Map.Entry<?, ?> entry : map.entrySet()) {
			String field = String.valueOf(entry.getKey());
			if (FilterField.from(field) == null) {
				errors.add("Invalid filter field: " + field + ". Valid fields are: " + FilterField.validFieldList());
				continue;
			}
			Object value = entry.getValue();
			if (value == null) {
				errors.add("Filter value for " + field + " cannot be null or undefined");
			} else if (value instanceof List<?> list) {
				if (list.isEmpty()) {
					errors.add("Filter array for " + field + " cannot be empty");
				} else if (list.stream().anyMatch(v -> v == null)) {
					errors.add("Filter array for " + field + " contains null or undefined values");
				}
			} else if (value instanceof Map<?, ?> range) {
				validateRange(field, range, errors);
			}
		}
		return errors;
	}

	public ValidationResult validate(Object spec) {
		return ValidationResult.of(validateFilter(spec));
	}

	public boolean isValidFilter(Object spec) {
		return validateFilter(spec).isEmpty();
	}

	/**
	 * @throws ValidationException when the specification is invalid
	 */
	public FilterCondition buildFilterExpression(Map<String, ?> spec) {
		List<String> errors = validateFilter(spec);
		if (!errors.isEmpty()) {
			throw ValidationException.of("Invalid filter specification", errors);
		}
		List<FilterCondition> conditions = new ArrayList<>();
		for (Map.Entry<String, ?> entry : spec.entrySet()) {
			conditions.add(filterByField(entry.getKey(), entry.getValue()));
		}
		if (conditions.size() == 1) {
			return conditions.get(0);
		}
		return new FilterCondition.And(conditions);
	}

	public UnaryOperator<MovementTable> applyFilter(Map<String, ?> spec) {
		if (spec == null || spec.isEmpty()) {
			return table -> requireTable(table);
		}
		FilterCondition condition = buildFilterExpression(spec);
		return table -> requireTable(table).filter(condition::matches);
	}

	public Result<MovementTable> applyFilterSafe(Object spec, MovementTable table) {
		if (table == null) {
			return Result.err(new DataException("Table is required"));
		}
		List<String> errors = validateFilter(spec);
		if (!errors.isEmpty()) {
			return Result.err(ValidationException.of("Invalid filter specification", errors));
		}
		try {
			@SuppressWarnings("unchecked")
			Map<String, ?> map = (Map<String, ?>) spec;
			return Result.ok(applyFilter(map).apply(table));
		} catch (StatementException ex) {
			return Result.err(ex);
		}
	}

	public FilterCondition filterByField(String field, Object value) {
		if (value instanceof List<?> list) {
			return filterArrayMatch(field, list);
		}
		if (value instanceof Map<?, ?> range) {
			return filterRangeMatch(field, range);
		}
		return filterExactMatch(field, value);
	}

	public FilterCondition filterExactMatch(String field, Object value) {
		return new FilterCondition.Exact(requireField(field), toText(value));
	}

	public FilterCondition filterArrayMatch(String field, List<?> values) {
		return new FilterCondition.AnyOf(requireField(field),
				values.stream().map(FilterEngine::toText).collect(Collectors.toList()));
	}

	public FilterCondition filterRangeMatch(String field, Map<?, ?> range) {
		Map<RangeOperator, String> bounds = new EnumMap<>(RangeOperator.class);
		for (Map.Entry<?, ?> bound : range.entrySet()) {
			RangeOperator operator = RangeOperator.from(String.valueOf(bound.getKey()));
			if (operator == null) {
				throw new ValidationException("Invalid range operator for " + field + ": " + bound.getKey());
			}
			bounds.put(operator, toText(bound.getValue()));
		}
		return new FilterCondition.Range(requireField(field), bounds);
	}

	/**
	 * ANDs several specifications together. Null and empty entries are ignored.
	 */
	public FilterCondition combineFilters(List<? extends Map<String, ?>> specs) {
		List<FilterCondition> conditions = new ArrayList<>();
		if (specs != null) {
			for (Map<String, ?> spec : specs) {
				if (spec != null && !spec.isEmpty()) {
					conditions.add(buildFilterExpression(spec));
				}
			}
		}
		return new FilterCondition.And(conditions);
	}

	static String toText(Object value) {
		if (value instanceof Number number) {
			double asDouble = number.doubleValue();
			if (asDouble == Math.rint(asDouble) && !Double.isInfinite(asDouble)) {
				return Long.toString(number.longValue());
			}
			return number.toString();
		}
		return String.valueOf(value);
	}

	private void validateRange(String field, Map<?, ?> range, List<String> errors) {
		if (range.isEmpty()) {
			errors.add("Range filter for " + field + " cannot be empty");
			return;
		}
		List<String> invalid = new ArrayList<>();
		for (Object key : range.keySet()) {
			if (RangeOperator.from(String.valueOf(key)) == null) {
				invalid.add(String.valueOf(key));
			}
		}
		if (!invalid.isEmpty()) {
			errors.add("Invalid range operators for " + field + ": " + String.join(", ", invalid)
					+ ". Valid operators are: " + VALID_OPERATORS);
		}
		for (Map.Entry<?, ?> bound : range.entrySet()) {
			if (bound.getValue() == null) {
				errors.add("Range value for " + field + "." + bound.getKey() + " cannot be null or undefined");
			}
		}
	}

	private FilterField requireField(String field) {
		FilterField resolved = FilterField.from(field);
		if (resolved == null) {
			throw new ValidationException("Invalid filter field: " + field + ". Valid fields are: "
					+ FilterField.validFieldList());
		}
		return resolved;
	}

	private static MovementTable requireTable(MovementTable table) {
		if (table == null) {
			throw new DataException("Table is required");
		}
		return table;
	}
}
