package my.finstatements.app.errors;

import java.util.List;

/**
 * A filter, variable or report definition is malformed.
 */
public class ValidationException extends StatementException {
	private final List<String> errors;

	public ValidationException(String message) {
		this(message, List.of(message));
	}

	public ValidationException(String message, List<String> errors) {
		super(ErrorCode.VALIDATION, message);
		this.errors = errors == null ? List.of() : List.copyOf(errors);
	}

	public static ValidationException of(String prefix, List<String> errors) {
		return new ValidationException(prefix + ": " + String.join(", ", errors), errors);
	}

	public List<String> getErrors() {
		return errors;
	}
}
