package my.finstatements.app.util;

import java.nio.charset.Charset;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.ByteBuffer;
import java.util.Locale;

public final class CsvParsing {
	private CsvParsing() {
	}

	public static String stripBom(String value) {
		if (value == null || value.isEmpty()) {
			return value;
		}
		if (value.charAt(0) == '\uFEFF') {
			return value.substring(1);
		}
		return value;
	}

	/**
	 * Looks at the header line only, so decimal commas in the data do not vote.
	 */
	public static char sniffDelimiter(String sample) {
		if (sample == null || sample.isEmpty()) {
			return ',';
		}
		int newline = sample.indexOf('\n');
		String header = newline < 0 ? sample : sample.substring(0, newline);
		if (header.indexOf(';') >= 0) {
			return ';';
		}
		if (header.indexOf('\t') >= 0) {
			return '\t';
		}
		return ',';
	}

	/**
	 * Strict UTF-8 first, Latin-1 for legacy accounting exports.
	 */
	public static String decode(byte[] payload) {
		if (payload == null || payload.length == 0) {
			return "";
		}
		try {
			String decoded = StandardCharsets.UTF_8.newDecoder()
					.onMalformedInput(CodingErrorAction.REPORT)
					.onUnmappableCharacter(CodingErrorAction.REPORT)
					.decode(ByteBuffer.wrap(payload))
					.toString();
			return stripBom(decoded);
		} catch (CharacterCodingException ex) {
			return stripBom(new String(payload, Charset.forName("ISO-8859-1")));
		}
	}

	/**
	 * Parses "1.234,56", "1,234.56", "-1234.5" and "(1.234,56)". Blank input is null.
	 */
	public static Double parseAmount(String raw) {
		if (raw == null) {
			return null;
		}
		String value = raw.trim().replace(" ", "").replace("\u00A0", "");
		if (value.isEmpty()) {
			return null;
		}
		boolean negative = false;
		if (value.startsWith("(") && value.endsWith(")")) {
			negative = true;
			value = value.substring(1, value.length() - 1);
		}
		int lastComma = value.lastIndexOf(',');
		int lastDot = value.lastIndexOf('.');
		if (lastComma > lastDot) {
			value = value.replace(".", "").replace(',', '.');
		} else if (lastDot > lastComma && lastComma >= 0) {
			value = value.replace(",", "");
		}
		double parsed = Double.parseDouble(value);
		return negative ? -parsed : parsed;
	}

	/**
	 * Accepts "P06", "6", "06" and "all". Returns null for anything else.
	 */
	public static Integer parsePeriod(String raw) {
		if (raw == null || raw.isBlank()) {
			return null;
		}
		String value = raw.trim().toUpperCase(Locale.ROOT);
		if (value.equals("ALL")) {
			return 999;
		}
		if (value.startsWith("P")) {
			value = value.substring(1);
		}
		try {
			return Integer.parseInt(value);
		} catch (NumberFormatException ex) {
			return null;
		}
	}
}
