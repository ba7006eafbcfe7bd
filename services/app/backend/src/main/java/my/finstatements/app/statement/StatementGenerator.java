package my.finstatements.app.statement;

import my.finstatements.app.category.CategoryClassifier;
import my.finstatements.app.columns.ColumnLayout;
import my.finstatements.app.config.AppProperties;
import my.finstatements.app.domain.MovementTable;
import my.finstatements.app.domain.StatementType;
import my.finstatements.app.dto.GridRow;
import my.finstatements.app.dto.RowMetadata;
import my.finstatements.app.dto.RowStyle;
import my.finstatements.app.dto.RowType;
import my.finstatements.app.dto.StatementMetrics;
import my.finstatements.app.dto.StatementResult;
import my.finstatements.app.errors.DataException;
import my.finstatements.app.errors.LtmAvailabilityWarning;
import my.finstatements.app.errors.ValidationException;
import my.finstatements.app.expression.ExpressionEvaluator;
import my.finstatements.app.filter.FilterEngine;
import my.finstatements.app.hierarchy.HierarchyNode;
import my.finstatements.app.hierarchy.HierarchyTreeBuilder;
import my.finstatements.app.ltm.LtmCalculator;
import my.finstatements.app.report.FormatType;
import my.finstatements.app.report.ReportDefinition;
import my.finstatements.app.report.ReportRegistry;
import my.finstatements.app.report.ReportRenderer;
import my.finstatements.app.report.ReportValidator;
import my.finstatements.app.report.ValueFormatter;
import my.finstatements.app.rollup.AggregatedRow;
import my.finstatements.app.rollup.GroupingLevel;
import my.finstatements.app.rollup.RollupExecutor;
import my.finstatements.app.rollup.RollupSpecBuilder;
import my.finstatements.app.sign.AccountSignHandler;
import my.finstatements.app.statement.specialrows.CashFlowSpecialRows;
import my.finstatements.app.statement.specialrows.SpecialRowsFactory;
import my.finstatements.app.variables.VariableResolver;
import my.finstatements.app.variance.VarianceCalculator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Entry point for callers: parses period options into columns and produces either a
 * report-definition statement or an account-tree statement with computed rows and metrics.
 * Tables and definitions are only read, so concurrent generations do not interfere.
 */
@Service
public class StatementGenerator {
	private static final Logger logger = LoggerFactory.getLogger(StatementGenerator.class);

	private final ReportRegistry reportRegistry;
	private final CategoryClassifier classifier;
	private final AppProperties properties;
	private final ReportRenderer renderer;
	private final RollupExecutor rollupExecutor = new RollupExecutor();
	private final HierarchyTreeBuilder treeBuilder = new HierarchyTreeBuilder();
	private final LtmCalculator ltmCalculator = new LtmCalculator();
	private final ColumnPlanner columnPlanner;
	private final AccountSignHandler signHandler;
	private final StatementMetricsCalculator metricsCalculator;
	private final CashFlowCalculator cashFlowCalculator;
	private final Clock clock = Clock.systemUTC();

	public StatementGenerator(ReportRegistry reportRegistry, CategoryClassifier classifier, AppProperties properties) {
		this.reportRegistry = reportRegistry;
		this.classifier = classifier;
		this.properties = properties;
		FilterEngine filterEngine = new FilterEngine();
		ExpressionEvaluator expressionEvaluator = new ExpressionEvaluator();
		this.renderer = new ReportRenderer(new ReportValidator(filterEngine, expressionEvaluator),
				new VariableResolver(filterEngine), expressionEvaluator, clock);
		this.columnPlanner = new ColumnPlanner(ltmCalculator, properties.statements().ltmMonths());
		this.signHandler = AccountSignHandler.forClassifier(classifier);
		double tolerance = properties.statements().balanceTolerance();
		this.metricsCalculator = new StatementMetricsCalculator(classifier, tolerance);
		this.cashFlowCalculator = new CashFlowCalculator(classifier, tolerance);
	}

	public StatementResult generateFromDefinition(String reportId, MovementTable table, GenerationOptions options) {
		ReportDefinition definition = reportRegistry.getReport(reportId)
				.orElseThrow(() -> new ValidationException("Report with ID '" + reportId + "' is not registered"));
		return generateFromDefinition(definition, table, options);
	}

	public StatementResult generateDefault(StatementType type, MovementTable table, GenerationOptions options) {
		ReportDefinition definition = reportRegistry.getDefaultReport(type)
				.orElseThrow(() -> new ValidationException("No report registered for statement type " + type.id()));
		return generateFromDefinition(definition, table, options);
	}

	public StatementResult generateFromDefinition(ReportDefinition definition, MovementTable table,
												  GenerationOptions options) {
		requireData(table);
		StatementType type = StatementType.from(definition == null ? null : definition.getStatementType());
		if (type == null) {
			throw new ValidationException("Report definition has no valid statementType");
		}
		ColumnPlan plan = columnPlanner.plan(type, table, options);
		StatementResult rendered = renderer.render(definition, table, plan.layout());
		StatementMetrics metrics = metricsFor(type, table, plan.layout());
		Map<String, Object> metadata = new LinkedHashMap<>(rendered.metadata());
		metadata.put("mode", "definition");
		logger.debug("Generated {} from report {} with {} rows", type.id(), definition.getReportId(),
				rendered.rows().size());
		return new StatementResult(rendered.reportId(), rendered.reportName(), rendered.reportVersion(), type,
				rendered.generatedAt(), rendered.columns(), rendered.rows(), metrics, plan.ltmInfo(),
				warnings(plan), metadata);
	}

	public StatementResult generateHierarchical(StatementType type, MovementTable table, GenerationOptions options) {
		requireData(table);
		ColumnPlan plan = columnPlanner.plan(type, table, options);
		ColumnLayout layout = plan.layout();

		List<GridRow> rows;
		StatementMetrics metrics;
		switch (type) {
			case BALANCE -> {
				List<AggregatedRow> accounts = rollup(rowsOf(StatementType.BALANCE, table), layout, 1.0, GroupingLevel.ACCOUNT);
				List<AggregatedRow> flipped = signHandler.flipSignForPassiva(accounts, layout.keys());
				rows = tree(flipped, layout, options.detailLevel());
				metrics = metricsFor(type, table, layout);
			}
			case INCOME -> {
				List<AggregatedRow> accounts = rollup(rowsOf(StatementType.INCOME, table), layout, -1.0, GroupingLevel.ACCOUNT);
				rows = tree(accounts, layout, options.detailLevel());
				metrics = metricsFor(type, table, layout);
			}
			default -> {
				CashFlowFigures figures = cashFlowCalculator.calculate(rowsOf(StatementType.BALANCE, table),
						rowsOf(StatementType.INCOME, table), layout);
				rows = cashFlowRows(figures, layout);
				metrics = cashFlowMetrics(figures);
			}
		}
		List<GridRow> injected = SpecialRowsFactory.forType(type, classifier).inject(rows, metrics, layout);
		List<GridRow> formatted = format(injected, layout);

		Map<String, Object> metadata = new LinkedHashMap<>();
		metadata.put("mode", "hierarchical");
		metadata.put("detailLevel", options.detailLevel());
		metadata.put("periodOptions", columnLabels(layout));
		logger.debug("Generated hierarchical {} with {} rows over {} columns", type.id(), formatted.size(),
				layout.size());
		return new StatementResult("hierarchical-" + type.id(), type.title(), "1.0", type, clock.instant(),
				layout.columns(), formatted, metrics, plan.ltmInfo(), warnings(plan), metadata);
	}

	public ColumnPlan planColumns(StatementType type, MovementTable table, GenerationOptions options) {
		return columnPlanner.plan(type, table, options);
	}

	/**
	 * Rows whose {@code statement_type} carries the configured code for {@code type}.
	 */
	public MovementTable rowsOf(StatementType type, MovementTable table) {
		String code = properties.statements().statementTypeCodes().getOrDefault(type.id(), type.code());
		String normalized = code.toLowerCase(Locale.ROOT);
		return table.filter(row -> row.statementType() != null
				&& row.statementType().trim().toLowerCase(Locale.ROOT).equals(normalized));
	}

	StatementMetrics metricsFor(StatementType type, MovementTable table, ColumnLayout layout) {
		switch (type) {
			case INCOME:
				return new StatementMetrics(incomeMetrics(table, layout), null, null);
			case BALANCE:
				Map<String, Double> netIncome = incomeMetrics(table, layout)
						.getOrDefault(StatementMetricsCalculator.NET_INCOME, Map.of());
				List<AggregatedRow> categories = rollup(rowsOf(StatementType.BALANCE, table), layout, 1.0,
						GroupingLevel.CATEGORY);
				return metricsCalculator.balance(categories, netIncome, layout);
			default:
				return cashFlowMetrics(cashFlowCalculator.calculate(rowsOf(StatementType.BALANCE, table),
						rowsOf(StatementType.INCOME, table), layout));
		}
	}

	private Map<String, Map<String, Double>> incomeMetrics(MovementTable table, ColumnLayout layout) {
		List<AggregatedRow> categories = rollup(rowsOf(StatementType.INCOME, table), layout,
				StatementType.INCOME.signMultiplier(), GroupingLevel.CATEGORY);
		return metricsCalculator.income(categories, layout);
	}

	private StatementMetrics cashFlowMetrics(CashFlowFigures figures) {
		Map<String, Map<String, Double>> values = new LinkedHashMap<>();
		values.put(StatementMetricsCalculator.NET_INCOME, figures.netIncome());
		values.put(CashFlowSpecialRows.STARTING_CASH, figures.startingCash());
		values.put(CashFlowSpecialRows.NET_CHANGE, figures.netChange());
		values.put(CashFlowSpecialRows.ENDING_CASH, figures.endingCash());
		values.put("cashPosition", figures.cashPosition());
		return new StatementMetrics(values, null, null);
	}

	private List<GridRow> cashFlowRows(CashFlowFigures figures, ColumnLayout layout) {
		List<GridRow> rows = new ArrayList<>();
		rows.add(withVariance(GridRow.of(0, "Net income", RowType.METRIC, RowStyle.SUBTOTAL, 0, figures.netIncome(),
				RowMetadata.computed("currency")), layout));
		for (AggregatedRow change : figures.changes()) {
			String name = change.key().name1() == null || change.key().name1().isBlank()
					? "other balance items" : change.key().name1();
			RowMetadata metadata = new RowMetadata(null, null, null, null, null, List.of(name), 1,
					change.key().name0(), change.key().name1(), null, false, false, "currency");
			rows.add(withVariance(GridRow.of(0, "Change in " + name, RowType.CATEGORY, RowStyle.NORMAL, 1,
					change.amounts(), metadata), layout));
		}
		return rows;
	}

	private List<AggregatedRow> rollup(MovementTable table, ColumnLayout layout, double sign, GroupingLevel grouping) {
		return rollupExecutor.rollup(table, RollupSpecBuilder.buildColumnSpec(layout, sign, grouping, false));
	}

	private List<GridRow> tree(List<AggregatedRow> accounts, ColumnLayout layout, int detailLevel) {
		List<HierarchyNode> nodes = treeBuilder.buildTree(accounts, layout.keys(), detailLevel);
		return treeBuilder.toGridRows(nodes, layout);
	}

	private GridRow withVariance(GridRow row, ColumnLayout layout) {
		if (!layout.hasVariance()) {
			return row;
		}
		Double a = row.amount(layout.baseline().key());
		Double b = row.amount(layout.comparison().key());
		return row.withVariance(VarianceCalculator.amount(a, b), VarianceCalculator.percent(a, b));
	}

	private List<GridRow> format(List<GridRow> rows, ColumnLayout layout) {
		ValueFormatter formatter = new ValueFormatter(null);
		List<GridRow> formatted = new ArrayList<>(rows.size());
		for (GridRow row : rows) {
			if (row.isSpacer()) {
				formatted.add(row);
				continue;
			}
			Map<String, String> texts = new LinkedHashMap<>();
			row.amounts().forEach((column, value) -> texts.put(column, formatter.format(value, FormatType.CURRENCY, null)));
			String varianceAmount = layout.hasVariance() ? formatter.format(row.varianceAmount(), FormatType.CURRENCY, null) : null;
			String variancePercent = layout.hasVariance()
					? (row.variancePercent() == null ? "N/A" : formatter.format(row.variancePercent(), FormatType.PERCENT, null))
					: null;
			formatted.add(row.withFormatting(texts, varianceAmount, variancePercent));
		}
		return formatted;
	}

	private List<LtmAvailabilityWarning> warnings(ColumnPlan plan) {
		List<LtmAvailabilityWarning> warnings = new ArrayList<>();
		ltmCalculator.toWarning(plan.ltmInfo()).ifPresent(warnings::add);
		return warnings;
	}

	private static List<String> columnLabels(ColumnLayout layout) {
		List<String> labels = new ArrayList<>();
		layout.columns().forEach(column -> labels.add(column.label()));
		return labels;
	}

	private static void requireData(MovementTable table) {
		if (table == null) {
			throw new DataException("Movements data is required");
		}
		if (table.isEmpty()) {
			throw new DataException("Movements data is empty");
		}
	}
}
