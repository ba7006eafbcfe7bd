package my.finstatements.app.hierarchy;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A group or account node of the statement tree. Levels are 0-3 for groups and
 * {@link #ACCOUNT_LEVEL} for accounts; level 4 is reserved.
 */
public class HierarchyNode {
	public static final int ACCOUNT_LEVEL = 5;
	static final int GROUP_LEVELS = 4;

	private final List<String> path;
	private final int level;
	private final String label;
	private final String[] codes;
	private final String[] keys;
	private final String accountCode;
	private final String section;
	private final String category;
	private final Map<String, Double> amounts = new LinkedHashMap<>();

	HierarchyNode(List<String> path, int level, String label, String[] codes, String[] keys, String accountCode,
				  String section, String category) {
		this.path = List.copyOf(path);
		this.level = level;
		this.label = label;
		this.codes = codes;
		this.keys = keys;
		this.accountCode = accountCode;
		this.section = section;
		this.category = category;
	}

	public List<String> path() {
		return path;
	}

	public String pathKey() {
		return String.join("/", path);
	}

	public int level() {
		return level;
	}

	/**
	 * Indentation, the number of ancestors actually present in the path.
	 */
	public int depth() {
		return path.size() - 1;
	}

	public String label() {
		return label;
	}

	public boolean isAccount() {
		return level == ACCOUNT_LEVEL;
	}

	public String accountCode() {
		return accountCode;
	}

	public String section() {
		return section;
	}

	public String category() {
		return category;
	}

	public Map<String, Double> amounts() {
		return Collections.unmodifiableMap(amounts);
	}

	void add(String column, double value) {
		amounts.merge(column, value, Double::sum);
	}

	void initColumns(List<String> columns) {
		for (String column : columns) {
			amounts.putIfAbsent(column, 0.0);
		}
	}

	/**
	 * Whether this node's path reaches hierarchy level {@code index} (0-3).
	 */
	boolean reaches(int index) {
		return level >= index;
	}

	String code(int index) {
		return codes[index];
	}

	String key(int index) {
		return keys[index];
	}

	List<String> codes() {
		List<String> values = new ArrayList<>();
		Collections.addAll(values, codes);
		return values;
	}
}
