package my.ledgerreconciler.app.ledger;

public class AggregationException extends RuntimeException {
	private final String reference;
	private final String rawValue;

	public AggregationException(String reference, String rawValue) {
		super("Aggregate target of " + reference + " is not numeric: '" + rawValue + "'");
		this.reference = reference;
		this.rawValue = rawValue;
	}

	public String getReference() {
		return reference;
	}

	public String getRawValue() {
		return rawValue;
	}
}
