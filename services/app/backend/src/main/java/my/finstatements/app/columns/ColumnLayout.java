package my.finstatements.app.columns;

import java.util.ArrayList;
import java.util.List;

public record ColumnLayout(List<ColumnDescriptor> columns, boolean ltmMode) {
	public ColumnLayout {
		columns = List.copyOf(columns);
	}

	public List<String> keys() {
		List<String> keys = new ArrayList<>();
		for (ColumnDescriptor column : columns) {
			keys.add(column.key());
		}
		return keys;
	}

	/**
	 * Variance compares the first two columns, and only outside LTM mode.
	 */
	public boolean hasVariance() {
		return !ltmMode && columns.size() == 2;
	}

	public ColumnDescriptor baseline() {
		return columns.get(0);
	}

	public ColumnDescriptor comparison() {
		return columns.get(1);
	}

	public int size() {
		return columns.size();
	}
}
