package my.finstatements.app.rollup;

public enum GroupingLevel {
	ACCOUNT,
	CATEGORY
}
