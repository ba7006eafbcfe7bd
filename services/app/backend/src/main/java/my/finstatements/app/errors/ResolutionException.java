package my.finstatements.app.errors;

/**
 * A variable or reference could not be resolved while a report was being evaluated.
 */
public class ResolutionException extends StatementException {
	private final String variableName;
	private final String reportId;

	public ResolutionException(String message, String variableName, String reportId, Throwable cause) {
		super(ErrorCode.RESOLUTION, message, cause);
		this.variableName = variableName;
		this.reportId = reportId;
	}

	public ResolutionException(String message, String variableName) {
		this(message, variableName, null, null);
	}

	public static ResolutionException variableNotFound(String variableName, String reportId) {
		return new ResolutionException("Variable '" + variableName + "' not found in report '" + reportId + "'",
				variableName, reportId, null);
	}

	public String getVariableName() {
		return variableName;
	}

	public String getReportId() {
		return reportId;
	}
}
