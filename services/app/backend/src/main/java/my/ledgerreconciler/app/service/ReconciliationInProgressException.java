package my.ledgerreconciler.app.service;

public class ReconciliationInProgressException extends RuntimeException {
	public ReconciliationInProgressException(String message) {
		super(message);
	}
}
