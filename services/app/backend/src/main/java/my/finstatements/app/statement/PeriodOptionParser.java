package my.finstatements.app.statement;

import my.finstatements.app.errors.ValidationException;

import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses {@code <year>-all}, {@code <year>-<n>}, {@code <year>-P<n>}, {@code <year>-Q<n>},
 * {@code <year>-ltm} and {@code ltm}.
 */
public class PeriodOptionParser {
	private static final Pattern OPTION = Pattern.compile("^(\\d{4})-(ALL|LTM|Q[1-4]|P?\\d{1,2})$");

	public PeriodOption parse(String raw) {
		if (raw == null || raw.isBlank()) {
			throw new ValidationException("Period option is required");
		}
		String normalized = raw.trim().toUpperCase(Locale.ROOT);
		if (normalized.equals("LTM")) {
			return new PeriodOption(0, PeriodOption.Kind.LTM, 12);
		}
		Matcher matcher = OPTION.matcher(normalized);
		if (!matcher.matches()) {
			throw new ValidationException("Invalid period option: " + raw);
		}
		int year = Integer.parseInt(matcher.group(1));
		String part = matcher.group(2);
		if (part.equals("ALL")) {
			return new PeriodOption(year, PeriodOption.Kind.ALL, 12);
		}
		if (part.equals("LTM")) {
			return new PeriodOption(year, PeriodOption.Kind.LTM, 12);
		}
		if (part.startsWith("Q")) {
			return new PeriodOption(year, PeriodOption.Kind.QUARTER, Integer.parseInt(part.substring(1)));
		}
		int period = Integer.parseInt(part.startsWith("P") ? part.substring(1) : part);
		if (period < 1 || period > 12) {
			throw new ValidationException("Invalid period in option " + raw + ": must be between 1 and 12");
		}
		return new PeriodOption(year, PeriodOption.Kind.PERIOD, period);
	}
}
