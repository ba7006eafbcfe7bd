package my.finstatements.app.statement;

import my.finstatements.app.category.CategoryClassifier;
import my.finstatements.app.category.IncomeCategory;
import my.finstatements.app.columns.ColumnLayout;
import my.finstatements.app.dto.StatementMetrics;
import my.finstatements.app.rollup.AggregatedRow;
import my.finstatements.app.sign.AccountSignHandler;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Statement figures derived from category totals, keyed per column.
 */
public class StatementMetricsCalculator {
	public static final String REVENUE = "revenue";
	public static final String COST_OF_SALES = "costOfSales";
	public static final String GROSS_MARGIN = "grossMargin";
	public static final String OPERATING_EXPENSES = "operatingExpenses";
	public static final String OPERATING_RESULT = "operatingResult";
	public static final String OTHER_RESULTS = "otherResults";
	public static final String RESULT_BEFORE_TAX = "resultBeforeTax";
	public static final String TAX = "tax";
	public static final String NET_INCOME = "netIncome";
	public static final String TOTAL_ASSETS = "totalAssets";
	public static final String TOTAL_LIABILITIES_EQUITY = "totalLiabilitiesEquity";
	public static final String RESULT_FOR_THE_YEAR = "resultForTheYear";
	public static final String IMBALANCE = "imbalance";

	private final CategoryClassifier classifier;
	private final AccountSignHandler signHandler;
	private final double tolerance;

	public StatementMetricsCalculator(CategoryClassifier classifier, double tolerance) {
		this.classifier = classifier;
		this.signHandler = AccountSignHandler.forClassifier(classifier);
		this.tolerance = tolerance;
	}

	/**
	 * @param categories income category totals, already multiplied by the income sign
	 */
	public Map<String, Map<String, Double>> income(List<AggregatedRow> categories, ColumnLayout layout) {
		Map<String, Map<String, Double>> metrics = new LinkedHashMap<>();
		for (String column : layout.keys()) {
			Map<IncomeCategory, Double> totals = new LinkedHashMap<>();
			double netIncome = 0.0;
			for (AggregatedRow row : categories) {
				double value = row.amountOrZero(column);
				totals.merge(classifier.classifyIncomeCategory(row.key().name1()), value, Double::sum);
				netIncome += value;
			}
			double revenue = totals.getOrDefault(IncomeCategory.REVENUE, 0.0);
			double cogs = totals.getOrDefault(IncomeCategory.COGS, 0.0);
			double opex = totals.getOrDefault(IncomeCategory.OPERATING_EXPENSE, 0.0);
			double other = totals.getOrDefault(IncomeCategory.OTHER_RESULT, 0.0);
			double tax = totals.getOrDefault(IncomeCategory.TAX, 0.0);
			double grossMargin = revenue + cogs;
			double operatingResult = grossMargin + opex;
			put(metrics, REVENUE, column, revenue);
			put(metrics, COST_OF_SALES, column, cogs);
			put(metrics, GROSS_MARGIN, column, grossMargin);
			put(metrics, OPERATING_EXPENSES, column, opex);
			put(metrics, OPERATING_RESULT, column, operatingResult);
			put(metrics, OTHER_RESULTS, column, other);
			put(metrics, RESULT_BEFORE_TAX, column, operatingResult + other);
			put(metrics, TAX, column, tax);
			put(metrics, NET_INCOME, column, netIncome);
		}
		return metrics;
	}

	/**
	 * @param categories balance category totals with raw signs; liabilities and equity are flipped here
	 * @param netIncome  income statement result per column, added to liabilities and equity
	 */
	public StatementMetrics balance(List<AggregatedRow> categories, Map<String, Double> netIncome, ColumnLayout layout) {
		Map<String, Map<String, Double>> metrics = new LinkedHashMap<>();
		boolean balanced = true;
		double worst = 0.0;
		for (String column : layout.keys()) {
			double assets = 0.0;
			double liabilitiesEquity = 0.0;
			for (AggregatedRow row : categories) {
				if (signHandler.isPassiva(row.key())) {
					liabilitiesEquity -= row.amountOrZero(column);
				} else {
					assets += row.amountOrZero(column);
				}
			}
			double result = netIncome == null ? 0.0 : netIncome.getOrDefault(column, 0.0);
			double totalLiabilitiesEquity = liabilitiesEquity + result;
			double imbalance = round(assets - totalLiabilitiesEquity);
			put(metrics, TOTAL_ASSETS, column, assets);
			put(metrics, RESULT_FOR_THE_YEAR, column, result);
			put(metrics, TOTAL_LIABILITIES_EQUITY, column, totalLiabilitiesEquity);
			put(metrics, IMBALANCE, column, imbalance);
			if (Math.abs(imbalance) > tolerance) {
				balanced = false;
			}
			if (Math.abs(imbalance) > Math.abs(worst)) {
				worst = imbalance;
			}
		}
		return new StatementMetrics(metrics, balanced, worst);
	}

	static void put(Map<String, Map<String, Double>> metrics, String name, String column, double value) {
		metrics.computeIfAbsent(name, k -> new LinkedHashMap<>()).put(column, value + 0.0);
	}

	private static double round(double value) {
		return Math.round(value * 100.0) / 100.0 + 0.0;
	}
}
