package my.finstatements.app.filter;

import my.finstatements.app.domain.MovementRecord;

import java.util.Arrays;
import java.util.Locale;
import java.util.function.Function;
import java.util.stream.Collectors;

public enum FilterField {
	CODE0("code0", MovementRecord::code0),
	NAME0("name0", MovementRecord::name0),
	CODE1("code1", MovementRecord::code1),
	CODE2("code2", MovementRecord::code2),
	CODE3("code3", MovementRecord::code3),
	NAME1("name1", MovementRecord::name1),
	NAME2("name2", MovementRecord::name2),
	NAME3("name3", MovementRecord::name3),
	STATEMENT_TYPE("statement_type", MovementRecord::statementType),
	ACCOUNT_CODE("account_code", MovementRecord::accountCode),
	ACCOUNT_DESCRIPTION("account_description", MovementRecord::accountDescription);

	private final String id;
	private final Function<MovementRecord, String> extractor;

	FilterField(String id, Function<MovementRecord, String> extractor) {
		this.id = id;
		this.extractor = extractor;
	}

	public String id() {
		return id;
	}

	public String valueOf(MovementRecord row) {
		return extractor.apply(row);
	}

	public static FilterField from(String raw) {
		if (raw == null) {
			return null;
		}
		String normalized = raw.trim().toLowerCase(Locale.ROOT);
		for (FilterField field : values()) {
			if (field.id.equals(normalized)) {
				return field;
			}
		}
		return null;
	}

	public static String validFieldList() {
		return Arrays.stream(values()).map(FilterField::id).collect(Collectors.joining(", "));
	}
}
