package my.finstatements.app.domain;

import java.util.Locale;

public enum StatementType {
	BALANCE("balance", "BS", "Balance Sheet"),
	INCOME("income", "IS", "Income Statement"),
	CASH_FLOW("cashflow", "CF", "Cash Flow Statement");

	private final String id;
	private final String code;
	private final String title;

	StatementType(String id, String code, String title) {
		this.id = id;
		this.code = code;
		this.title = title;
	}

	/**
	 * Identifier used in report definitions.
	 */
	public String id() {
		return id;
	}

	/**
	 * Default {@code statement_type} value on movement rows.
	 */
	public String code() {
		return code;
	}

	public String title() {
		return title;
	}

	/**
	 * Presentation multiplier applied at aggregation time. Income statement credits render positive.
	 */
	public double signMultiplier() {
		return this == INCOME ? -1.0 : 1.0;
	}

	public static StatementType from(String raw) {
		if (raw == null || raw.isBlank()) {
			return null;
		}
		String normalized = raw.trim().toLowerCase(Locale.ROOT);
		switch (normalized) {
			case "balance", "bs", "balance_sheet", "balans":
				return BALANCE;
			case "income", "is", "income_statement", "pl", "profit_loss", "winst_verlies":
				return INCOME;
			case "cashflow", "cf", "cash_flow", "kasstroom":
				return CASH_FLOW;
			default:
				return null;
		}
	}
}
