package my.finstatements.app.dto;

import java.util.List;
import java.util.Map;

/**
 * Provenance of a row, for the grid and export layers.
 */
public record RowMetadata(
		String variable,
		String expression,
		Map<String, Object> filter,
		Integer fromOrder,
		Integer toOrder,
		List<String> hierarchyPath,
		Integer level,
		String section,
		String category,
		String accountCode,
		boolean group,
		boolean alwaysVisible,
		String format
) {
	public RowMetadata {
		hierarchyPath = hierarchyPath == null ? List.of() : List.copyOf(hierarchyPath);
	}

	public static RowMetadata empty() {
		return new RowMetadata(null, null, null, null, null, null, null, null, null, null, false, false, null);
	}

	public static RowMetadata computed(String format) {
		return new RowMetadata(null, null, null, null, null, null, null, null, null, null, false, true, format);
	}
}
