package my.finstatements.app.sign;

import my.finstatements.app.category.CategoryClassifier;
import my.finstatements.app.rollup.AccountKey;
import my.finstatements.app.rollup.AggregatedRow;
import my.finstatements.app.rollup.RollupSpecBuilder;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Predicate;

/**
 * Presentation sign flips applied after aggregation. Liabilities and equity are stored as
 * credits (negative) and shown as positive figures.
 */
public class AccountSignHandler {
	private final Predicate<AccountKey> isPassiva;

	public AccountSignHandler(Predicate<AccountKey> isPassiva) {
		this.isPassiva = isPassiva;
	}

	public static AccountSignHandler forClassifier(CategoryClassifier classifier) {
		return new AccountSignHandler(key -> classifier.isLiabilityOrEquityRow(key.name0(), key.name1()));
	}

	public boolean isPassiva(AccountKey key) {
		return isPassiva.test(key);
	}

	public List<AggregatedRow> flipSignForPassiva(List<AggregatedRow> rows, String column1, String column2) {
		return flipSignForPassiva(rows, List.of(column1, column2));
	}

	public List<AggregatedRow> flipSignForPassiva(List<AggregatedRow> rows, List<String> columns) {
		List<AggregatedRow> result = new ArrayList<>(rows.size());
		for (AggregatedRow row : rows) {
			result.add(isPassiva.test(row.key()) ? negate(row, columns) : row);
		}
		return result;
	}

	/**
	 * Negates the given columns. Variance derived from two columns is negated with them, which holds
	 * when {@code columns} contains both compared columns: (-b) - (-a) = -(b - a), and |-a| = |a|.
	 */
	public static AggregatedRow negate(AggregatedRow row, List<String> columns) {
		Map<String, Double> amounts = new LinkedHashMap<>(row.amounts());
		for (String column : columns) {
			negateEntry(amounts, column);
		}
		for (String derived : List.of(RollupSpecBuilder.VARIANCE_AMOUNT, RollupSpecBuilder.VARIANCE_PERCENT)) {
			if (!columns.contains(derived)) {
				negateEntry(amounts, derived);
			}
		}
		return row.withAmounts(amounts);
	}

	private static void negateEntry(Map<String, Double> amounts, String column) {
		Double value = amounts.get(column);
		if (value != null) {
			amounts.put(column, value == 0.0 ? 0.0 : -value);
		}
	}
}
