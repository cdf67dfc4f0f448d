package my.ledgerreconciler.app.llm;

public class OracleTransportException extends RuntimeException {
	private final Integer statusCode;

	public OracleTransportException(String message, Integer statusCode, Throwable cause) {
		super(message, cause);
		this.statusCode = statusCode;
	}

	public Integer getStatusCode() {
		return statusCode;
	}
}
