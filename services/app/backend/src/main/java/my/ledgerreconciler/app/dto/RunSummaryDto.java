package my.ledgerreconciler.app.dto;

import my.ledgerreconciler.app.domain.RunSummary;

import java.util.List;

public record RunSummaryDto(
		String runId,
		int processed,
		int matched,
		int skipped,
		long elapsedMs,
		List<String> errors
) {
	public static RunSummaryDto from(RunSummary summary) {
		return new RunSummaryDto(summary.runId(), summary.processed(), summary.matched(), summary.skipped(),
				summary.elapsedMs(), summary.errors());
	}
}
