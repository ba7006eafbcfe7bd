package my.finstatements.app.variables;

import my.finstatements.app.columns.ColumnDescriptor;
import my.finstatements.app.columns.ColumnLayout;
import my.finstatements.app.domain.MovementRecord;
import my.finstatements.app.domain.MovementTable;
import my.finstatements.app.errors.DataException;
import my.finstatements.app.errors.ResolutionException;
import my.finstatements.app.errors.StatementException;
import my.finstatements.app.errors.ValidationException;
import my.finstatements.app.filter.FilterCondition;
import my.finstatements.app.filter.FilterEngine;
import my.finstatements.app.util.Result;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * Resolves named (filter, aggregate) pairs into per-year or per-column values.
 * <p>
 * Every year present in the unfiltered table gets an entry, 0 when nothing matches.
 * Matching rows are stably sorted by (year, period) before aggregation so that
 * {@code first} and {@code last} are chronological.
 */
public class VariableResolver {
	private static final Comparator<MovementRecord> CHRONOLOGICAL =
			Comparator.comparingInt(MovementRecord::year).thenComparingInt(MovementRecord::period);

	private final FilterEngine filterEngine;

	public VariableResolver() {
		this(new FilterEngine());
	}

	public VariableResolver(FilterEngine filterEngine) {
		this.filterEngine = filterEngine;
	}

	public List<String> validateVariable(Object definition) {
		List<String> errors = new ArrayList<>();
		if (!(definition instanceof VariableDefinition def)) {
			errors.add("Variable definition must be an object");
			return errors;
		}
		if (def.getFilter() == null) {
			errors.add("Missing required field: filter");
		}
		if (def.getAggregate() == null || def.getAggregate().isBlank()) {
			errors.add("Missing required field: aggregate");
		} else if (!isValidAggregate(def.getAggregate())) {
			errors.add("Invalid aggregate function: " + def.getAggregate() + ". Valid functions are: "
					+ AggregateFunction.validFunctionList());
		}
		if (def.getFilter() != null) {
			for (String error : filterEngine.validateFilter(def.getFilter())) {
				errors.add("Invalid filter: " + error);
			}
		}
		return errors;
	}

	public boolean isValidAggregate(String aggregate) {
		return AggregateFunction.from(aggregate) != null;
	}

	/**
	 * Variables do not reference other variables yet, so this is always empty.
	 */
	public List<String> getDependencies(VariableDefinition definition) {
		return List.of();
	}

	public Function<MovementTable, Result<Map<Integer, Double>>> resolveVariable(VariableDefinition definition) {
		return table -> {
			try {
				return Result.ok(resolveByYear(definition, table));
			} catch (StatementException ex) {
				return Result.err(ex);
			}
		};
	}

	public Function<MovementTable, Result<Map<Integer, Double>>> resolveSum(Map<String, Object> filter) {
		return resolveWithAggregate("sum").apply(filter);
	}

	public Function<MovementTable, Result<Map<Integer, Double>>> resolveAverage(Map<String, Object> filter) {
		return resolveWithAggregate("average").apply(filter);
	}

	public Function<MovementTable, Result<Map<Integer, Double>>> resolveCount(Map<String, Object> filter) {
		return resolveWithAggregate("count").apply(filter);
	}

	public Function<Map<String, Object>, Function<MovementTable, Result<Map<Integer, Double>>>> resolveWithAggregate(
			String aggregate) {
		return filter -> resolveVariable(new VariableDefinition(filter, aggregate));
	}

	/**
	 * Resolves every variable to year values. Fails as a whole, naming the first failing variable.
	 */
	public Result<Map<String, Map<Integer, Double>>> resolveVariables(Map<String, VariableDefinition> definitions,
																	  MovementTable table) {
		return resolveAll(definitions, table, def -> resolveByYear(def, table));
	}

	/**
	 * Same contract as {@link #resolveVariables(Map, MovementTable)} but keyed by output column.
	 */
	public Result<Map<String, Map<String, Double>>> resolveVariableColumns(Map<String, VariableDefinition> definitions,
																		   MovementTable table,
																		   ColumnLayout layout) {
		return resolveAll(definitions, table, def -> resolveByColumn(def, table, layout));
	}

	public Map<String, Double> resolveByColumn(VariableDefinition definition, MovementTable table, ColumnLayout layout) {
		requireTable(table);
		AggregateFunction function = prepare(definition);
		FilterCondition condition = filterEngine.buildFilterExpression(definition.getFilter());
		List<MovementRecord> matching = matching(table, condition, function);
		Map<String, Double> values = new LinkedHashMap<>();
		for (ColumnDescriptor column : layout.columns()) {
			values.put(column.key(), function.apply(amounts(matching, column::contains)));
		}
		return values;
	}

	private Map<Integer, Double> resolveByYear(VariableDefinition definition, MovementTable table) {
		requireTable(table);
		AggregateFunction function = prepare(definition);
		FilterCondition condition = filterEngine.buildFilterExpression(definition.getFilter());
		List<MovementRecord> matching = matching(table, condition, function);
		Map<Integer, Double> values = new LinkedHashMap<>();
		for (Integer year : table.years()) {
			values.put(year, function.apply(amounts(matching, row -> row.year() == year)));
		}
		return values;
	}

	private <V> Result<Map<String, V>> resolveAll(Map<String, VariableDefinition> definitions,
												  MovementTable table,
												  Function<VariableDefinition, V> resolver) {
		if (definitions == null) {
			return Result.err(new ValidationException("Variables must be an object"));
		}
		if (table == null) {
			return Result.err(new DataException("Movements data is required"));
		}
		Map<String, V> cache = new HashMap<>();
		Deque<String> resolving = new ArrayDeque<>();
		Map<String, V> resolved = new LinkedHashMap<>();
		for (Map.Entry<String, VariableDefinition> entry : definitions.entrySet()) {
			String name = entry.getKey();
			try {
				resolved.put(name, resolveCached(name, entry.getValue(), definitions, cache, resolving, resolver));
			} catch (StatementException ex) {
				return Result.err(new ResolutionException(
						"Failed to resolve variable '" + name + "': " + ex.getMessage(), name, null, ex));
			}
		}
		return Result.ok(resolved);
	}

	private <V> V resolveCached(String name,
								VariableDefinition definition,
								Map<String, VariableDefinition> definitions,
								Map<String, V> cache,
								Deque<String> resolving,
								Function<VariableDefinition, V> resolver) {
		V cached = cache.get(name);
		if (cached != null) {
			return cached;
		}
		if (resolving.contains(name)) {
			throw new ResolutionException("Circular dependency detected: " + String.join(" -> ", resolving) + " -> "
					+ name, name);
		}
		resolving.push(name);
		try {
			for (String dependency : getDependencies(definition)) {
				VariableDefinition dependencyDefinition = definitions.get(dependency);
				if (dependencyDefinition == null) {
					throw new ResolutionException("Unknown variable dependency: " + dependency, dependency);
				}
				resolveCached(dependency, dependencyDefinition, definitions, cache, resolving, resolver);
			}
			V value = resolver.apply(definition);
			cache.put(name, value);
			return value;
		} finally {
			resolving.pop();
		}
	}

	private AggregateFunction prepare(VariableDefinition definition) {
		List<String> errors = validateVariable(definition);
		if (!errors.isEmpty()) {
			throw ValidationException.of("Invalid variable definition", errors);
		}
		return AggregateFunction.from(definition.getAggregate());
	}

	private List<MovementRecord> matching(MovementTable table, FilterCondition condition, AggregateFunction function) {
		List<MovementRecord> matching = new ArrayList<>();
		for (MovementRecord row : table.rows()) {
			if (condition.matches(row)) {
				matching.add(row);
			}
		}
		if (function.isPositional()) {
			matching.sort(CHRONOLOGICAL);
		}
		return matching;
	}

	private List<Double> amounts(List<MovementRecord> rows, Predicate<MovementRecord> slice) {
		List<Double> amounts = new ArrayList<>();
		for (MovementRecord row : rows) {
			if (slice.test(row)) {
				amounts.add(row.amount());
			}
		}
		return amounts;
	}

	private static void requireTable(MovementTable table) {
		if (table == null) {
			throw new DataException("Movements data is required");
		}
	}
}
