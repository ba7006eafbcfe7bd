package my.finstatements.app.rollup;

import my.finstatements.app.domain.MovementRecord;
import my.finstatements.app.domain.MovementTable;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Runs a {@link RollupSpec} over a table. Groups keep first-appearance order.
 */
public class RollupExecutor {

	public List<AggregatedRow> rollup(MovementTable table, RollupSpec spec) {
		Map<Object, Group> groups = new LinkedHashMap<>();
		for (MovementRecord row : table.rows()) {
			Object groupKey = spec.grouping() == GroupingLevel.CATEGORY
					? Objects.toString(row.name1(), "")
					: AccountKey.of(row);
			Group group = groups.computeIfAbsent(groupKey, k -> new Group(keyFor(row, spec.grouping()), spec));
			for (int i = 0; i < spec.reducers().size(); i++) {
				RollupSpec.Reducer reducer = spec.reducers().get(i);
				if (reducer.include().test(row)) {
					group.sums[i] += row.amount() * reducer.multiplier();
				}
			}
		}
		List<AggregatedRow> rows = new ArrayList<>();
		for (Group group : groups.values()) {
			rows.add(group.finish(spec));
		}
		return rows;
	}

	private static AccountKey keyFor(MovementRecord row, GroupingLevel grouping) {
		return grouping == GroupingLevel.CATEGORY ? AccountKey.category(row) : AccountKey.of(row);
	}

	private static final class Group {
		private final AccountKey key;
		private final double[] sums;

		Group(AccountKey key, RollupSpec spec) {
			this.key = key;
			this.sums = new double[spec.reducers().size()];
		}

		AggregatedRow finish(RollupSpec spec) {
			Map<String, Double> amounts = new LinkedHashMap<>();
			for (int i = 0; i < sums.length; i++) {
				// normalise -0.0 from sign multipliers
				amounts.put(spec.reducers().get(i).name(), sums[i] + 0.0);
			}
			for (RollupSpec.DerivedColumn column : spec.derived()) {
				amounts.put(column.name(), column.compute().apply(amounts));
			}
			return new AggregatedRow(key, amounts);
		}
	}
}
