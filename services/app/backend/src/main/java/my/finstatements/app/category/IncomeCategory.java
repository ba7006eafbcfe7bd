package my.finstatements.app.category;

public enum IncomeCategory {
	REVENUE,
	COGS,
	OPERATING_EXPENSE,
	OTHER_RESULT,
	TAX,
	UNCLASSIFIED
}
