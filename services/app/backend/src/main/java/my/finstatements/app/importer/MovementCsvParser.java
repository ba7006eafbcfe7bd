package my.finstatements.app.importer;

import my.finstatements.app.domain.MovementRecord;
import my.finstatements.app.domain.MovementTable;
import my.finstatements.app.util.CsvParsing;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.StringReader;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Reads a normalized movements export. Headers are matched case-insensitively.
 * Either {@code movement_amount} or a {@code debit}/{@code credit} pair must be present.
 */
public class MovementCsvParser implements MovementParser {
	private static final Logger logger = LoggerFactory.getLogger(MovementCsvParser.class);

	@Override
	public MovementTable parse(byte[] payload, String filename) {
		String content = CsvParsing.decode(payload);
		if (content.isBlank()) {
			return MovementTable.empty();
		}
		char delimiter = CsvParsing.sniffDelimiter(content);

		List<MovementRecord> rows = new ArrayList<>();
		int skipped = 0;
		CSVFormat format = CSVFormat.DEFAULT.builder()
				.setDelimiter(delimiter)
				.setHeader()
				.setSkipHeaderRecord(true)
				.setIgnoreHeaderCase(true)
				.setTrim(true)
				.build();
		try (CSVParser parser = CSVParser.parse(new StringReader(content), format)) {
			Map<String, Integer> header = parser.getHeaderMap();
			for (CSVRecord record : parser) {
				MovementRecord row = toRecord(record, header);
				if (row == null) {
					skipped++;
					continue;
				}
				rows.add(row);
			}
		} catch (IOException exc) {
			throw new IllegalArgumentException("Failed to read movements CSV " + filename + ": " + exc.getMessage(), exc);
		}
		if (skipped > 0) {
			logger.warn("Skipped {} movement rows without a valid year/period in {}", skipped, filename);
		}
		logger.info("Parsed {} movement rows from {}", rows.size(), filename);
		return MovementTable.of(rows);
	}

	private MovementRecord toRecord(CSVRecord record, Map<String, Integer> header) {
		Integer year = parseYear(value(record, header, "year"));
		Integer period = CsvParsing.parsePeriod(value(record, header, "period"));
		if (year == null || period == null) {
			return null;
		}
		Double amount;
		if (has(header, "movement_amount")) {
			amount = CsvParsing.parseAmount(value(record, header, "movement_amount"));
		} else {
			Double debit = CsvParsing.parseAmount(value(record, header, "debit"));
			Double credit = CsvParsing.parseAmount(value(record, header, "credit"));
			amount = (debit == null && credit == null) ? null
					: (debit == null ? 0.0 : debit) - (credit == null ? 0.0 : credit);
		}
		return new MovementRecord(
				year,
				period,
				value(record, header, "account_code"),
				value(record, header, "account_description"),
				value(record, header, "code0"),
				value(record, header, "name0"),
				value(record, header, "code1"),
				value(record, header, "name1"),
				value(record, header, "code2"),
				value(record, header, "name2"),
				value(record, header, "code3"),
				value(record, header, "name3"),
				value(record, header, "statement_type"),
				amount
		);
	}

	private boolean has(Map<String, Integer> header, String column) {
		return header.keySet().stream().anyMatch(h -> h.equalsIgnoreCase(column));
	}

	private String value(CSVRecord record, Map<String, Integer> header, String column) {
		for (Map.Entry<String, Integer> entry : header.entrySet()) {
			if (entry.getKey().toLowerCase(Locale.ROOT).equals(column)) {
				int index = entry.getValue();
				return index < record.size() ? record.get(index) : "";
			}
		}
		return "";
	}

	private Integer parseYear(String raw) {
		if (raw == null || raw.isBlank()) {
			return null;
		}
		try {
			return Integer.parseInt(raw.trim());
		} catch (NumberFormatException ex) {
			return null;
		}
	}
}
