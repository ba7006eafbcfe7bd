package my.finstatements.app.errors;

public class StatementException extends RuntimeException {
	private final ErrorCode code;

	public StatementException(ErrorCode code, String message) {
		this(code, message, null);
	}

	public StatementException(ErrorCode code, String message, Throwable cause) {
		super(message, cause);
		this.code = code;
	}

	public ErrorCode getCode() {
		return code;
	}
}
