package my.ledgerreconciler.app.domain;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * One line of the audit trail. Written once per decided entry, matched or not.
 * Aggregate values are null when nothing was aggregated.
 */
public record AuditRecord(
		Instant timestamp,
		String runId,
		String period,
		String entryId,
		String entityName,
		MatchStatus outcome,
		String matchedReference,
		String matchedText,
		BigDecimal contribution,
		BigDecimal previousValue,
		BigDecimal newValue,
		double confidence,
		long latencyMs,
		String explanation,
		String warning
) {
}
