package my.finstatements.app.report;

import java.text.DecimalFormat;
import java.text.DecimalFormatSymbols;
import java.util.Locale;

/**
 * Renders amounts for display: {@code € 1,000}, {@code 12.5%}, {@code 1,000}, {@code 1,000.00}.
 * Null renders as an empty string.
 */
public class ValueFormatter {
	private final FormattingRules rules;

	public ValueFormatter(FormattingRules rules) {
		this.rules = rules == null ? new FormattingRules() : rules;
	}

	public String format(Double value, FormatType type, Integer decimals) {
		if (value == null || value.isNaN() || value.isInfinite()) {
			return "";
		}
		FormatType effective = type == null ? FormatType.CURRENCY : type;
		return switch (effective) {
			case CURRENCY -> currency(value, decimals == null ? rules.getCurrencyDecimals() : decimals);
			case PERCENT -> percent(value, decimals == null ? rules.getPercentDecimals() : decimals);
			case INTEGER -> signed(value, 0);
			case DECIMAL -> signed(value, decimals == null ? rules.getDecimalDecimals() : decimals);
		};
	}

	public String currency(double value, int decimals) {
		String symbol = rules.getCurrencySymbol() == null ? "" : rules.getCurrencySymbol();
		String number = signed(value, decimals);
		return symbol.isEmpty() ? number : symbol + " " + number;
	}

	public String percent(double value, int decimals) {
		return number(value, decimals) + "%";
	}

	private String signed(double value, int decimals) {
		if (Boolean.TRUE.equals(rules.getNegativeParentheses()) && value < 0 && round(value, decimals) != 0.0) {
			return "(" + number(-value, decimals) + ")";
		}
		return number(value, decimals);
	}

	private String number(double value, int decimals) {
		StringBuilder pattern = new StringBuilder(Boolean.FALSE.equals(rules.getThousandsSeparator()) ? "0" : "#,##0");
		if (decimals > 0) {
			pattern.append('.');
			pattern.append("0".repeat(decimals));
		}
		DecimalFormat format = new DecimalFormat(pattern.toString(), DecimalFormatSymbols.getInstance(Locale.US));
		String text = format.format(value);
		// DecimalFormat keeps the sign of values that round to zero
		if (text.startsWith("-") && round(value, decimals) == 0.0) {
			return text.substring(1);
		}
		return text;
	}

	private static double round(double value, int decimals) {
		double scale = Math.pow(10, decimals);
		return Math.round(value * scale) / scale;
	}
}
