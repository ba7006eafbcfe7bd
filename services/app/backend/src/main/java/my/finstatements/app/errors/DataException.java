package my.finstatements.app.errors;

public class DataException extends StatementException {
	public DataException(String message) {
		super(ErrorCode.DATA, message);
	}
}
