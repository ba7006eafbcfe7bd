package my.finstatements.app.report;

import my.finstatements.app.columns.ColumnDescriptor;
import my.finstatements.app.columns.ColumnLayout;
import my.finstatements.app.domain.MovementTable;
import my.finstatements.app.domain.StatementType;
import my.finstatements.app.dto.GridRow;
import my.finstatements.app.dto.RowMetadata;
import my.finstatements.app.dto.RowStyle;
import my.finstatements.app.dto.RowType;
import my.finstatements.app.dto.StatementResult;
import my.finstatements.app.errors.ResolutionException;
import my.finstatements.app.errors.StatementException;
import my.finstatements.app.errors.ValidationException;
import my.finstatements.app.expression.ExpressionEvaluator;
import my.finstatements.app.util.Result;
import my.finstatements.app.variables.VariableDefinition;
import my.finstatements.app.variables.VariableResolver;
import my.finstatements.app.variance.VarianceCalculator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Walks a report definition's layout in {@code order} and emits one {@link GridRow} per item.
 * <p>
 * The definition is validated before any row is produced. An unresolved variable fails the
 * whole render with a {@link ResolutionException} naming the report and the variable.
 */
public class ReportRenderer {
	private static final Logger logger = LoggerFactory.getLogger(ReportRenderer.class);

	private final ReportValidator validator;
	private final VariableResolver variableResolver;
	private final ExpressionEvaluator expressionEvaluator;
	private final Clock clock;

	public ReportRenderer() {
		this(new ReportValidator(), new VariableResolver(), new ExpressionEvaluator(), Clock.systemUTC());
	}

	public ReportRenderer(ReportValidator validator, VariableResolver variableResolver,
						  ExpressionEvaluator expressionEvaluator, Clock clock) {
		this.validator = validator;
		this.variableResolver = variableResolver;
		this.expressionEvaluator = expressionEvaluator;
		this.clock = clock;
	}

	public StatementResult render(String reportId, ReportRegistry registry, MovementTable table, ColumnLayout layout) {
		ReportDefinition definition = registry.getReport(reportId)
				.orElseThrow(() -> new ValidationException("Report with ID '" + reportId + "' is not registered"));
		return render(definition, table, layout);
	}

	public StatementResult render(ReportDefinition definition, MovementTable table, ColumnLayout layout) {
		List<String> errors = validator.validate(definition);
		if (!errors.isEmpty()) {
			String id = definition == null ? null : definition.getReportId();
			throw ValidationException.of("Invalid report definition '" + id + "'", errors);
		}
		String reportId = definition.getReportId();
		Map<String, VariableDefinition> definitions = definition.getVariables() == null
				? Map.of() : definition.getVariables();
		Result<Map<String, Map<String, Double>>> resolved =
				variableResolver.resolveVariableColumns(definitions, table, layout);
		if (!resolved.isOk()) {
			StatementException cause = resolved.error();
			String variable = cause instanceof ResolutionException re ? re.getVariableName() : null;
			throw new ResolutionException("Report '" + reportId + "': " + cause.getMessage(), variable, reportId, cause);
		}
		Map<String, Map<String, Double>> variables = resolved.value();

		List<LayoutItem> items = new ArrayList<>(definition.getLayout());
		items.sort(Comparator.comparing(LayoutItem::getOrder));

		ValueFormatter formatter = new ValueFormatter(definition.getFormatting());
		List<GridRow> rows = new ArrayList<>();
		for (LayoutItem item : items) {
			GridRow row = renderItem(item, reportId, variables, table, layout, rows);
			rows.add(finish(row, item, layout, formatter));
		}

		Map<String, Object> metadata = new LinkedHashMap<>();
		metadata.put("periodOptions", columnLabels(layout));
		metadata.put("variableCount", definitions.size());
		metadata.put("layoutItemCount", items.size());
		logger.debug("Rendered report {} with {} rows over {} columns", reportId, rows.size(), layout.size());
		return new StatementResult(reportId, definition.getName(), definition.getVersion(),
				StatementType.from(definition.getStatementType()), clock.instant(), layout.columns(), rows,
				null, null, null, metadata);
	}

	private GridRow renderItem(LayoutItem item, String reportId, Map<String, Map<String, Double>> variables,
							   MovementTable table, ColumnLayout layout, List<GridRow> emitted) {
		LayoutType type = LayoutType.from(item.getType());
		int indent = item.getIndent() == null ? 0 : item.getIndent();
		RowStyle style = RowStyle.from(item.getStyle());
		switch (type) {
			case VARIABLE: {
				Map<String, Double> values = variables.get(item.getVariable());
				if (values == null) {
					throw ResolutionException.variableNotFound(item.getVariable(), reportId);
				}
				return GridRow.of(item.getOrder(), item.getLabel(), RowType.VARIABLE, orDefault(style, RowStyle.NORMAL),
						indent, values, metadata(item, false));
			}
			case CALCULATED: {
				Map<String, Double> values = new LinkedHashMap<>();
				for (ColumnDescriptor column : layout.columns()) {
					values.put(column.key(), evaluate(item, reportId, column.key(), variables, emitted));
				}
				return GridRow.of(item.getOrder(), item.getLabel(), RowType.CALCULATED, orDefault(style, RowStyle.METRIC),
						indent, values, metadata(item, true));
			}
			case CATEGORY: {
				String aggregate = item.getAggregate() == null ? "sum" : item.getAggregate();
				Map<String, Double> values = variableResolver.resolveByColumn(
						new VariableDefinition(item.getFilter(), aggregate), table, layout);
				return GridRow.of(item.getOrder(), item.getLabel(), RowType.CATEGORY, orDefault(style, RowStyle.NORMAL),
						indent, values, metadata(item, false));
			}
			case SUBTOTAL: {
				Map<String, Double> values = subtotal(item, indent, layout, emitted);
				return GridRow.of(item.getOrder(), item.getLabel(), RowType.SUBTOTAL, orDefault(style, RowStyle.SUBTOTAL),
						indent, values, metadata(item, true));
			}
			default:
				return GridRow.spacer(item.getOrder(), layout.keys());
		}
	}

	private Double evaluate(LayoutItem item, String reportId, String column, Map<String, Map<String, Double>> variables,
							List<GridRow> emitted) {
		Map<String, Double> context = new HashMap<>();
		for (Map.Entry<String, Map<String, Double>> entry : variables.entrySet()) {
			context.put(entry.getKey(), entry.getValue().get(column));
		}
		Map<Integer, Double> rows = new HashMap<>();
		for (GridRow row : emitted) {
			// spacers carry no amount and count as 0
			rows.put(row.order(), row.isSpacer() ? Double.valueOf(0.0) : row.amount(column));
		}
		try {
			return expressionEvaluator.evaluate(item.getExpression(), context, rows);
		} catch (ResolutionException ex) {
			throw new ResolutionException("Report '" + reportId + "', row '" + item.getLabel() + "': " + ex.getMessage(),
					ex.getVariableName(), reportId, ex);
		}
	}

	/**
	 * With {@code from}/{@code to}: every non-spacer, non-subtotal row in that order range.
	 * Without: variable and category rows since the previous subtotal at the same indent.
	 */
	private Map<String, Double> subtotal(LayoutItem item, int indent, ColumnLayout layout, List<GridRow> emitted) {
		List<GridRow> included = new ArrayList<>();
		if (item.getFrom() != null && item.getTo() != null) {
			for (GridRow row : emitted) {
				if (row.order() >= item.getFrom() && row.order() <= item.getTo()
						&& !row.isSpacer() && row.type() != RowType.SUBTOTAL) {
					included.add(row);
				}
			}
		} else {
			for (int i = emitted.size() - 1; i >= 0; i--) {
				GridRow row = emitted.get(i);
				if (row.type() == RowType.SUBTOTAL && row.indent() == indent) {
					break;
				}
				if ((row.type() == RowType.VARIABLE || row.type() == RowType.CATEGORY) && row.indent() >= indent) {
					included.add(row);
				}
			}
		}
		Map<String, Double> values = new LinkedHashMap<>();
		for (String column : layout.keys()) {
			double sum = 0.0;
			for (GridRow row : included) {
				sum += row.amountOrZero(column);
			}
			values.put(column, sum);
		}
		return values;
	}

	private GridRow finish(GridRow row, LayoutItem item, ColumnLayout layout, ValueFormatter formatter) {
		if (row.isSpacer()) {
			return row;
		}
		GridRow withVariance = row;
		if (layout.hasVariance()) {
			Double a = row.amount(layout.baseline().key());
			Double b = row.amount(layout.comparison().key());
			withVariance = row.withVariance(VarianceCalculator.amount(a, b), VarianceCalculator.percent(a, b));
		}
		FormatType format = FormatType.from(item.getFormat());
		Map<String, String> formatted = new LinkedHashMap<>();
		for (Map.Entry<String, Double> entry : withVariance.amounts().entrySet()) {
			formatted.put(entry.getKey(), formatter.format(entry.getValue(), format, item.getDecimals()));
		}
		String varianceAmount = layout.hasVariance()
				? formatter.format(withVariance.varianceAmount(), format, item.getDecimals()) : null;
		String variancePercent = layout.hasVariance()
				? (withVariance.variancePercent() == null ? "N/A" : formatter.format(withVariance.variancePercent(), FormatType.PERCENT, null))
				: null;
		return withVariance.withFormatting(formatted, varianceAmount, variancePercent);
	}

	private RowMetadata metadata(LayoutItem item, boolean alwaysVisible) {
		return new RowMetadata(item.getVariable(), item.getExpression(), item.getFilter(), item.getFrom(), item.getTo(),
				null, null, null, null, null, false, alwaysVisible, item.getFormat());
	}

	private static List<String> columnLabels(ColumnLayout layout) {
		List<String> labels = new ArrayList<>();
		for (ColumnDescriptor column : layout.columns()) {
			labels.add(column.label());
		}
		return labels;
	}

	private static RowStyle orDefault(RowStyle style, RowStyle fallback) {
		return style == null ? fallback : style;
	}
}
