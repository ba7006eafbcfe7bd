package my.finstatements.app.errors;

public enum ErrorCode {
	VALIDATION,
	RESOLUTION,
	DATA
}
