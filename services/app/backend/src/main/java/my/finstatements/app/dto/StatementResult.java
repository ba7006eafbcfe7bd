package my.finstatements.app.dto;

import my.finstatements.app.columns.ColumnDescriptor;
import my.finstatements.app.domain.StatementType;
import my.finstatements.app.errors.LtmAvailabilityWarning;
import my.finstatements.app.ltm.LtmInfo;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public record StatementResult(
		String reportId,
		String reportName,
		String reportVersion,
		StatementType statementType,
		Instant generatedAt,
		List<ColumnDescriptor> columns,
		List<GridRow> rows,
		StatementMetrics metrics,
		LtmInfo ltmInfo,
		List<LtmAvailabilityWarning> warnings,
		Map<String, Object> metadata
) {
	public StatementResult {
		columns = List.copyOf(columns);
		rows = List.copyOf(rows);
		metrics = metrics == null ? StatementMetrics.empty() : metrics;
		warnings = warnings == null ? List.of() : List.copyOf(warnings);
		metadata = metadata == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
	}

	public Boolean balanced() {
		return metrics.balanced();
	}

	public Double imbalance() {
		return metrics.imbalance();
	}

	public StatementResult withMetrics(StatementMetrics newMetrics) {
		return new StatementResult(reportId, reportName, reportVersion, statementType, generatedAt, columns, rows,
				newMetrics, ltmInfo, warnings, metadata);
	}
}
