package my.finstatements.app.report;

import java.util.Locale;

public enum LayoutType {
	VARIABLE("variable"),
	CALCULATED("calculated"),
	CATEGORY("category"),
	SUBTOTAL("subtotal"),
	SPACER("spacer");

	private final String id;

	LayoutType(String id) {
		this.id = id;
	}

	public String id() {
		return id;
	}

	public static LayoutType from(String raw) {
		if (raw == null) {
			return null;
		}
		String normalized = raw.trim().toLowerCase(Locale.ROOT);
		for (LayoutType type : values()) {
			if (type.id.equals(normalized)) {
				return type;
			}
		}
		return null;
	}
}
