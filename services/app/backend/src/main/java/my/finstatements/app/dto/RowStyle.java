package my.finstatements.app.dto;

import java.util.Locale;

public enum RowStyle {
	NORMAL("normal"),
	METRIC("metric"),
	SUBTOTAL("subtotal"),
	TOTAL("total"),
	SPACER("spacer");

	private final String id;

	RowStyle(String id) {
		this.id = id;
	}

	public String id() {
		return id;
	}

	public static RowStyle from(String raw) {
		if (raw == null || raw.isBlank()) {
			return null;
		}
		String normalized = raw.trim().toLowerCase(Locale.ROOT);
		for (RowStyle style : values()) {
			if (style.id.equals(normalized)) {
				return style;
			}
		}
		return null;
	}
}
