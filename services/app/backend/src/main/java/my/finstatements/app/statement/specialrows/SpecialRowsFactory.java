package my.finstatements.app.statement.specialrows;

import my.finstatements.app.category.CategoryClassifier;
import my.finstatements.app.domain.StatementType;

public final class SpecialRowsFactory {
	private SpecialRowsFactory() {
	}

	public static SpecialRowsInjector forType(StatementType type, CategoryClassifier classifier) {
		return switch (type) {
			case BALANCE -> new BalanceSheetSpecialRows(classifier);
			case INCOME -> new IncomeStatementSpecialRows(classifier);
			case CASH_FLOW -> new CashFlowSpecialRows();
		};
	}
}
