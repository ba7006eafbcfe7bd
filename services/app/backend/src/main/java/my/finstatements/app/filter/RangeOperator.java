package my.finstatements.app.filter;

public enum RangeOperator {
	GTE("gte"),
	LTE("lte"),
	GT("gt"),
	LT("lt");

	private final String id;

	RangeOperator(String id) {
		this.id = id;
	}

	public String id() {
		return id;
	}

	public boolean accepts(int comparison) {
		return switch (this) {
			case GTE -> comparison >= 0;
			case LTE -> comparison <= 0;
			case GT -> comparison > 0;
			case LT -> comparison < 0;
		};
	}

	public static RangeOperator from(String raw) {
		for (RangeOperator operator : values()) {
			if (operator.id.equals(raw)) {
				return operator;
			}
		}
		return null;
	}
}
