package my.finstatements.app.hierarchy;

import my.finstatements.app.columns.ColumnLayout;
import my.finstatements.app.dto.GridRow;
import my.finstatements.app.dto.RowMetadata;
import my.finstatements.app.dto.RowStyle;
import my.finstatements.app.dto.RowType;
import my.finstatements.app.rollup.AccountKey;
import my.finstatements.app.rollup.AggregatedRow;
import my.finstatements.app.variance.VarianceCalculator;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Expands account rows into group and account nodes. Every group's amount is the sum of the
 * accounts below it, independent of how deep the output is cut with {@code detailLevel}.
 */
public class HierarchyTreeBuilder {
	private final HierarchySorter sorter = new HierarchySorter();

	public List<HierarchyNode> buildTree(List<AggregatedRow> rows, List<String> columns, int detailLevel) {
		Map<String, HierarchyNode> nodes = new LinkedHashMap<>();
		for (AggregatedRow row : rows) {
			for (HierarchyNode candidate : pathNodes(row.key())) {
				// an account can share its path with a group when it skips a level
				HierarchyNode node = nodes.computeIfAbsent(candidate.level() + ":" + candidate.pathKey(), k -> candidate);
				node.initColumns(columns);
				for (String column : columns) {
					node.add(column, row.amountOrZero(column));
				}
			}
		}
		List<HierarchyNode> visible = new ArrayList<>();
		for (HierarchyNode node : nodes.values()) {
			if (node.level() <= detailLevel) {
				visible.add(node);
			}
		}
		return sorter.sort(visible);
	}

	public List<GridRow> toGridRows(List<HierarchyNode> nodes, ColumnLayout layout) {
		List<GridRow> rows = new ArrayList<>();
		int order = 1;
		for (HierarchyNode node : nodes) {
			Map<String, Double> amounts = new LinkedHashMap<>();
			for (String column : layout.keys()) {
				amounts.put(column, node.amounts().getOrDefault(column, 0.0));
			}
			RowStyle style = node.level() == 0 ? RowStyle.TOTAL : RowStyle.NORMAL;
			RowType type = node.isAccount() ? RowType.ACCOUNT : RowType.CATEGORY;
			RowMetadata metadata = new RowMetadata(null, null, null, null, null, node.path(), node.level(),
					node.section(), node.category(), node.accountCode(), !node.isAccount(), false, "currency");
			GridRow row = GridRow.of(order++, node.label(), type, style, node.depth(), amounts, metadata);
			if (layout.hasVariance()) {
				Double a = amounts.get(layout.baseline().key());
				Double b = amounts.get(layout.comparison().key());
				row = row.withVariance(VarianceCalculator.amount(a, b), VarianceCalculator.percent(a, b));
			}
			rows.add(row);
		}
		return rows;
	}

	static HierarchyNode leafOf(AggregatedRow row) {
		List<HierarchyNode> path = pathNodes(row.key());
		return path.get(path.size() - 1);
	}

	/**
	 * The chain of nodes from the top-most present level down to the account.
	 */
	static List<HierarchyNode> pathNodes(AccountKey key) {
		String[] codes = {key.code0(), key.code1(), key.code2(), key.code3()};
		String[] names = {key.name0(), key.name1(), key.name2(), key.name3()};
		String[] keys = new String[HierarchyNode.GROUP_LEVELS];
		List<String> path = new ArrayList<>();
		List<HierarchyNode> nodes = new ArrayList<>();
		for (int level = 0; level < HierarchyNode.GROUP_LEVELS; level++) {
			String code = trim(codes[level]);
			String name = trim(names[level]);
			if (code.isEmpty() && name.isEmpty()) {
				keys[level] = "";
				continue;
			}
			keys[level] = code.isEmpty() ? name : code;
			path.add(keys[level]);
			nodes.add(new HierarchyNode(path, level, label(name, code), codes.clone(), keys.clone(), null,
					key.name0(), level == 0 ? null : key.name1()));
		}
		String accountCode = trim(key.accountCode());
		String description = trim(key.accountDescription());
		path.add(accountCode.isEmpty() ? description : accountCode);
		nodes.add(new HierarchyNode(path, HierarchyNode.ACCOUNT_LEVEL, label(description, accountCode), codes.clone(),
				keys.clone(), accountCode, key.name0(), key.name1()));
		return nodes;
	}

	private static String label(String name, String code) {
		if (name.isEmpty()) {
			return code;
		}
		if (code.isEmpty()) {
			return name;
		}
		return name + " (" + code + ")";
	}

	private static String trim(String value) {
		return value == null ? "" : value.trim();
	}
}
