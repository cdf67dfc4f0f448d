package my.ledgerreconciler.app.ledger;

/**
 * Header labels of the invoice ledger.
 */
public record TransactionColumns(String name, String amount, String status, String reference) {
	public static final TransactionColumns DEFAULTS = new TransactionColumns("Client", "Suma", "Match Status", "Matched Reference");

	public TransactionColumns {
		name = orDefault(name, "Client");
		amount = orDefault(amount, "Suma");
		status = orDefault(status, "Match Status");
		reference = orDefault(reference, "Matched Reference");
	}

	private static String orDefault(String value, String fallback) {
		return value == null || value.isBlank() ? fallback : value.trim();
	}
}
