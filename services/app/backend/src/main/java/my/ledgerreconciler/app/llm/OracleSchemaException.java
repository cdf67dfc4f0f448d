package my.ledgerreconciler.app.llm;

public class OracleSchemaException extends RuntimeException {
	public static final String INVALID_OUTPUT = "invalid_output";
	public static final String EMPTY_OUTPUT = "empty_output";
	public static final String UNKNOWN_REFERENCE = "unknown_reference";

	private final String errorCode;

	public OracleSchemaException(String message, String errorCode) {
		super(message);
		this.errorCode = errorCode;
	}

	public OracleSchemaException(String message, String errorCode, Throwable cause) {
		super(message, cause);
		this.errorCode = errorCode;
	}

	public String getErrorCode() {
		return errorCode;
	}
}
