package my.finstatements.app.rollup;

import my.finstatements.app.columns.ColumnDescriptor;
import my.finstatements.app.columns.ColumnLayout;
import my.finstatements.app.columns.PeriodWindow;
import my.finstatements.app.domain.MovementRecord;
import my.finstatements.app.domain.StatementType;
import my.finstatements.app.ltm.LtmRange;
import my.finstatements.app.variance.VarianceCalculator;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * Builds {@link RollupSpec}s. Use the fluent methods for ad-hoc specs or the static
 * factories for the normal (two column) and LTM (per month) statement layouts.
 */
public class RollupSpecBuilder {
	public static final String VARIANCE_AMOUNT = "variance_amount";
	public static final String VARIANCE_PERCENT = "variance_percent";
	public static final String LTM_TOTAL = "ltm_total";

	private GroupingLevel grouping = GroupingLevel.ACCOUNT;
	private final List<RollupSpec.Reducer> reducers = new ArrayList<>();
	private final List<RollupSpec.DerivedColumn> derived = new ArrayList<>();

	public RollupSpecBuilder groupBy(GroupingLevel level) {
		this.grouping = level;
		return this;
	}

	public RollupSpecBuilder addSum(String name) {
		return addConditionalSum(name, row -> true, 1.0);
	}

	public RollupSpecBuilder addConditionalSum(String name, Predicate<MovementRecord> include, double multiplier) {
		requireUnique(name);
		reducers.add(new RollupSpec.Reducer(name, include, multiplier));
		return this;
	}

	public RollupSpecBuilder addColumn(ColumnDescriptor column, double multiplier) {
		return addConditionalSum(column.key(), column::contains, multiplier);
	}

	public RollupSpecBuilder addDerived(String name, Function<Map<String, Double>, Double> compute) {
		requireUnique(name);
		derived.add(new RollupSpec.DerivedColumn(name, compute));
		return this;
	}

	public RollupSpecBuilder addVariance(String baseline, String comparison) {
		addDerived(VARIANCE_AMOUNT, values -> VarianceCalculator.amount(values.get(baseline), values.get(comparison)));
		return addDerived(VARIANCE_PERCENT, values -> VarianceCalculator.percent(values.get(baseline), values.get(comparison)));
	}

	public RollupSpec build() {
		return new RollupSpec(grouping, reducers, derived);
	}

	public RollupSpecBuilder reset() {
		grouping = GroupingLevel.ACCOUNT;
		reducers.clear();
		derived.clear();
		return this;
	}

	/**
	 * Two whole-year columns {@code amount_1} and {@code amount_2}, grouped by account.
	 */
	public static RollupSpec buildNormalModeSpec(int year1, int year2, double signMultiplier) {
		return buildColumnSpec(normalLayout(year1, year2), signMultiplier, GroupingLevel.ACCOUNT, false);
	}

	public static RollupSpec buildCategoryTotalsSpec(int year1, int year2, double signMultiplier) {
		return buildColumnSpec(normalLayout(year1, year2), signMultiplier, GroupingLevel.CATEGORY, true);
	}

	/**
	 * One reducer per (year, period) slot named {@code month_1..month_N}; income statements
	 * also get {@code ltm_total}.
	 */
	public static RollupSpec buildLTMModeSpec(List<LtmRange> ranges, double signMultiplier, StatementType type) {
		return buildColumnSpec(ltmLayout(ranges, type), signMultiplier, GroupingLevel.ACCOUNT, false);
	}

	public static RollupSpec buildLTMCategoryTotalsSpec(List<LtmRange> ranges, double signMultiplier,
														StatementType type) {
		return buildColumnSpec(ltmLayout(ranges, type), signMultiplier, GroupingLevel.CATEGORY, false);
	}

	/**
	 * General form used by the statement generator. Variance is added only when requested
	 * and the layout has exactly one comparison pair.
	 */
	public static RollupSpec buildColumnSpec(ColumnLayout layout, double signMultiplier, GroupingLevel grouping,
											 boolean withVariance) {
		RollupSpecBuilder builder = new RollupSpecBuilder().groupBy(grouping);
		for (ColumnDescriptor column : layout.columns()) {
			builder.addColumn(column, signMultiplier);
		}
		if (withVariance && layout.hasVariance()) {
			builder.addVariance(layout.baseline().key(), layout.comparison().key());
		}
		return builder.build();
	}

	public static ColumnLayout normalLayout(int year1, int year2) {
		return new ColumnLayout(List.of(
				ColumnDescriptor.amount("amount_1", Integer.toString(year1), PeriodWindow.fullYear(year1)),
				ColumnDescriptor.amount("amount_2", Integer.toString(year2), PeriodWindow.fullYear(year2))
		), false);
	}

	public static ColumnLayout ltmLayout(List<LtmRange> ranges, StatementType type) {
		List<ColumnDescriptor> columns = new ArrayList<>();
		List<PeriodWindow> windows = new ArrayList<>();
		int index = 1;
		for (LtmRange range : ranges) {
			for (int period = range.startPeriod(); period <= range.endPeriod(); period++) {
				columns.add(ColumnDescriptor.month(index++, range.year(), period));
			}
			windows.add(range.toWindow());
		}
		if (type == StatementType.INCOME && !windows.isEmpty()) {
			columns.add(ColumnDescriptor.total(LTM_TOTAL, "LTM Total", windows));
		}
		return new ColumnLayout(columns, true);
	}

	private void requireUnique(String name) {
		boolean exists = reducers.stream().anyMatch(r -> r.name().equals(name))
				|| derived.stream().anyMatch(d -> d.name().equals(name));
		if (exists) {
			throw new IllegalArgumentException("Duplicate rollup column: " + name);
		}
	}
}
