package my.finstatements.app.util;

import java.util.List;

public record ValidationResult(boolean valid, List<String> errors) {
	public ValidationResult {
		errors = errors == null ? List.of() : List.copyOf(errors);
	}

	public static ValidationResult of(List<String> errors) {
		return new ValidationResult(errors == null || errors.isEmpty(), errors);
	}
}
