package my.finstatements.app.report;

import java.util.Locale;

public enum FormatType {
	CURRENCY("currency"),
	PERCENT("percent"),
	INTEGER("integer"),
	DECIMAL("decimal");

	private final String id;

	FormatType(String id) {
		this.id = id;
	}

	public String id() {
		return id;
	}

	public static FormatType from(String raw) {
		if (raw == null || raw.isBlank()) {
			return null;
		}
		String normalized = raw.trim().toLowerCase(Locale.ROOT);
		for (FormatType type : values()) {
			if (type.id.equals(normalized)) {
				return type;
			}
		}
		return null;
	}
}
