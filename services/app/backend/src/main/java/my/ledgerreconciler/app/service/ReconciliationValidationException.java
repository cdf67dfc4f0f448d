package my.ledgerreconciler.app.service;

/**
 * Malformed or missing input that makes reconciliation impossible, e.g. a ledger without a name column or an
 * empty candidate list. Aborts the current run; work already committed stays in place.
 */
public class ReconciliationValidationException extends RuntimeException {
	public ReconciliationValidationException(String message) {
		super(message);
	}

	public ReconciliationValidationException(String message, Throwable cause) {
		super(message, cause);
	}
}
