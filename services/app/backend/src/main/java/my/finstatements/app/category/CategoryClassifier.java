package my.finstatements.app.category;

import my.finstatements.app.domain.MovementRecord;

import java.util.List;
import java.util.Locale;

/**
 * Classifies category names by substring patterns, case-insensitively.
 */
public class CategoryClassifier {
	private final CategoryPatterns patterns;

	public CategoryClassifier() {
		this(CategoryPatterns.defaults());
	}

	public CategoryClassifier(CategoryPatterns patterns) {
		this.patterns = patterns == null ? CategoryPatterns.defaults() : patterns;
	}

	public boolean isAsset(String name) {
		return !isLiabilityOrEquity(name) && matches(name, patterns.assets());
	}

	public boolean isLiability(String name) {
		return matches(name, patterns.liabilities());
	}

	public boolean isEquity(String name) {
		return matches(name, patterns.equity());
	}

	public boolean isLiabilityOrEquity(String name) {
		return isLiability(name) || isEquity(name);
	}

	public boolean isCash(String name) {
		return matches(name, patterns.cash());
	}

	public boolean isRevenue(String name) {
		return matches(name, patterns.revenue()) && !matches(name, patterns.revenueExclusions());
	}

	public boolean isCogs(String name) {
		return matches(name, patterns.cogs());
	}

	public boolean isOperatingExpense(String name) {
		return matches(name, patterns.operatingExpenses());
	}

	public boolean isOtherResult(String name) {
		return matches(name, patterns.otherResults());
	}

	public boolean isTax(String name) {
		return matches(name, patterns.tax());
	}

	/**
	 * First match wins, in the order revenue, cost of sales, tax, other results, operating expenses.
	 */
	public IncomeCategory classifyIncomeCategory(String name) {
		if (isRevenue(name)) {
			return IncomeCategory.REVENUE;
		}
		if (isCogs(name)) {
			return IncomeCategory.COGS;
		}
		if (isTax(name)) {
			return IncomeCategory.TAX;
		}
		if (isOtherResult(name)) {
			return IncomeCategory.OTHER_RESULT;
		}
		if (isOperatingExpense(name)) {
			return IncomeCategory.OPERATING_EXPENSE;
		}
		return IncomeCategory.UNCLASSIFIED;
	}

	/**
	 * A balance row is liability/equity when its top-level name says so; when the top level
	 * is blank or neutral the first category level decides.
	 */
	public boolean isLiabilityOrEquityRow(String name0, String name1) {
		if (isLiabilityOrEquity(name0)) {
			return true;
		}
		if (isAsset(name0)) {
			return false;
		}
		return isLiabilityOrEquity(name1);
	}

	public boolean isLiabilityOrEquityRow(MovementRecord row) {
		return isLiabilityOrEquityRow(row.name0(), row.name1());
	}

	public boolean isCashRow(String name1, String name2) {
		return isCash(name1) || isCash(name2);
	}

	private boolean matches(String name, List<String> candidates) {
		if (name == null || name.isBlank()) {
			return false;
		}
		String normalized = name.toLowerCase(Locale.ROOT);
		for (String candidate : candidates) {
			if (normalized.contains(candidate.toLowerCase(Locale.ROOT))) {
				return true;
			}
		}
		return false;
	}
}
