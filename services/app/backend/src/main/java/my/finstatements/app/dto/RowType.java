package my.finstatements.app.dto;

public enum RowType {
	VARIABLE("variable"),
	CALCULATED("calculated"),
	CATEGORY("category"),
	ACCOUNT("account"),
	SUBTOTAL("subtotal"),
	TOTAL("total"),
	METRIC("metric"),
	SPACER("spacer");

	private final String id;

	RowType(String id) {
		this.id = id;
	}

	public String id() {
		return id;
	}
}
