package my.ledgerreconciler.app.domain;

public enum RunMode {
	/** Processes only the first few eligible entries. */
	TEST,
	FULL
}
