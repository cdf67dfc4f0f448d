package my.ledgerreconciler.app.domain;

import java.util.List;

public record RunSummary(String runId, int processed, int matched, int skipped, long elapsedMs, List<String> errors) {
	public RunSummary {
		errors = errors == null ? List.of() : List.copyOf(errors);
	}

	public boolean aborted() {
		return !errors.isEmpty();
	}
}
