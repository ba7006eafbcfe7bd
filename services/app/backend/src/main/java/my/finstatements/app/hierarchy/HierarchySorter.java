package my.finstatements.app.hierarchy;

import my.finstatements.app.rollup.AggregatedRow;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Statement order: code0 alphabetically, code1..code3 numerically (blank or non-numeric last),
 * then account code, then the hierarchy path. A group sorts before everything below it.
 */
public class HierarchySorter implements Comparator<HierarchyNode> {
	static final double UNNUMBERED = 999999;

	@Override
	public int compare(HierarchyNode a, HierarchyNode b) {
		for (int i = 0; i < HierarchyNode.GROUP_LEVELS; i++) {
			boolean aReaches = a.reaches(i);
			boolean bReaches = b.reaches(i);
			if (!aReaches || !bReaches) {
				if (aReaches != bReaches) {
					return aReaches ? 1 : -1;
				}
				continue;
			}
			int byCode = i == 0 ? compareAlpha(a.code(i), b.code(i)) : compareCodes(a.code(i), b.code(i));
			if (byCode != 0) {
				return byCode;
			}
			int byKey = nullToEmpty(a.key(i)).compareTo(nullToEmpty(b.key(i)));
			if (byKey != 0) {
				return byKey;
			}
		}
		if (a.isAccount() != b.isAccount()) {
			return a.isAccount() ? 1 : -1;
		}
		int byAccount = nullToEmpty(a.accountCode()).compareTo(nullToEmpty(b.accountCode()));
		if (byAccount != 0) {
			return byAccount;
		}
		return a.pathKey().compareTo(b.pathKey());
	}

	public List<HierarchyNode> sort(List<HierarchyNode> nodes) {
		List<HierarchyNode> sorted = new ArrayList<>(nodes);
		sorted.sort(this);
		return sorted;
	}

	/**
	 * Orders account rows as their leaf nodes would be ordered.
	 */
	public List<AggregatedRow> sortRows(List<AggregatedRow> rows) {
		List<AggregatedRow> sorted = new ArrayList<>(rows);
		sorted.sort((x, y) -> compare(HierarchyTreeBuilder.leafOf(x), HierarchyTreeBuilder.leafOf(y)));
		return sorted;
	}

	static int compareCodes(String a, String b) {
		double left = toNum(a);
		double right = toNum(b);
		if (left == UNNUMBERED && right == UNNUMBERED && !isBlank(a) && !isBlank(b)) {
			return a.compareTo(b);
		}
		return Double.compare(left, right);
	}

	static double toNum(String code) {
		if (isBlank(code)) {
			return UNNUMBERED;
		}
		try {
			return Double.parseDouble(code.trim());
		} catch (NumberFormatException ex) {
			return UNNUMBERED;
		}
	}

	private static int compareAlpha(String a, String b) {
		if (isBlank(a) || isBlank(b)) {
			return Boolean.compare(isBlank(a), isBlank(b));
		}
		return a.compareTo(b);
	}

	private static boolean isBlank(String value) {
		return value == null || value.isBlank();
	}

	private static String nullToEmpty(String value) {
		return value == null ? "" : value;
	}
}
