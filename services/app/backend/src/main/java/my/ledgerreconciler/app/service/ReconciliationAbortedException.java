package my.ledgerreconciler.app.service;

import my.ledgerreconciler.app.domain.RunSummary;

public class ReconciliationAbortedException extends RuntimeException {
	private final transient RunSummary summary;

	public ReconciliationAbortedException(RunSummary summary) {
		super(buildMessage(summary));
		this.summary = summary;
	}

	public RunSummary getSummary() {
		return summary;
	}

	private static String buildMessage(RunSummary summary) {
		String cause = summary.errors().isEmpty() ? "unknown error" : summary.errors().get(0);
		return "Reconciliation aborted after " + summary.processed() + " processed ("
				+ summary.matched() + " matched, " + summary.skipped() + " skipped): " + cause;
	}
}
