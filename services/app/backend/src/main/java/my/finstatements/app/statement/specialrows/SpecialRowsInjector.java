package my.finstatements.app.statement.specialrows;

import my.finstatements.app.columns.ColumnLayout;
import my.finstatements.app.dto.GridRow;
import my.finstatements.app.dto.StatementMetrics;

import java.util.List;

/**
 * Inserts statement-specific computed rows into a sorted tree. Anchors are found by category
 * classification, never by position.
 */
public interface SpecialRowsInjector {
	List<GridRow> inject(List<GridRow> rows, StatementMetrics metrics, ColumnLayout layout);
}
