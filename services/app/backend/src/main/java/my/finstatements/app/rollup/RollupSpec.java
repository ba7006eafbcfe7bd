package my.finstatements.app.rollup;

import my.finstatements.app.domain.MovementRecord;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * Grouped aggregation plan: conditional sums evaluated per group, then derived columns
 * computed from the finished sums in declaration order.
 */
public record RollupSpec(GroupingLevel grouping, List<Reducer> reducers, List<DerivedColumn> derived) {

	public record Reducer(String name, Predicate<MovementRecord> include, double multiplier) {
	}

	public record DerivedColumn(String name, Function<Map<String, Double>, Double> compute) {
	}

	public RollupSpec {
		reducers = List.copyOf(reducers);
		derived = List.copyOf(derived);
	}

	public List<String> columnNames() {
		List<String> names = new ArrayList<>();
		reducers.forEach(reducer -> names.add(reducer.name()));
		derived.forEach(column -> names.add(column.name()));
		return names;
	}
}
