package my.ledgerreconciler.app.service;

import my.ledgerreconciler.app.domain.AuditRecord;
import my.ledgerreconciler.app.domain.CandidateRecord;
import my.ledgerreconciler.app.domain.MatchDecision;
import my.ledgerreconciler.app.domain.MatchPolicy;
import my.ledgerreconciler.app.domain.MatchStatus;
import my.ledgerreconciler.app.domain.Outcome;
import my.ledgerreconciler.app.domain.RunContext;
import my.ledgerreconciler.app.domain.SourceEntry;
import my.ledgerreconciler.app.ledger.AggregateStore;
import my.ledgerreconciler.app.ledger.AggregationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.time.Clock;
import java.util.List;
import java.util.Locale;

/**
 * Decides a single source entry: asks the oracle, applies the policy threshold, adds the amount to the matched
 * aggregate and records the outcome.
 * <p>
 * Matched entries are never decided again. Entries left at {@code NO_MATCH} are retried on every run.
 */
public class ReconciliationEngine {
	private static final Logger logger = LoggerFactory.getLogger(ReconciliationEngine.class);

	private final MatchOracleClient oracle;
	private final AggregateStore aggregates;
	private final AuditLog auditLog;
	private final Clock clock;

	public ReconciliationEngine(MatchOracleClient oracle, AggregateStore aggregates, AuditLog auditLog, Clock clock) {
		this.oracle = oracle;
		this.aggregates = aggregates;
		this.auditLog = auditLog;
		this.clock = clock;
	}

	public Outcome process(RunContext context, SourceEntry entry, List<CandidateRecord> candidates, MatchPolicy policy) {
		if (entry.isMatched()) {
			logger.debug("Skipping {}: already matched to {}", entry.getId(), entry.getMatchedReference());
			return Outcome.skipped(entry);
		}
		validate(entry, candidates);

		long started = clock.millis();
		MatchDecision decision = oracle.findBestMatch(entry.getName(), candidates);
		long latencyMs = Math.max(0L, clock.millis() - started);

		if (!policy.accepts(decision)) {
			entry.markNoMatch();
			String warning = null;
			if (decision.matched()) {
				warning = String.format(Locale.ROOT, "confidence %.2f not above threshold %.2f for %s",
						decision.confidence(), policy.threshold(), decision.reference());
			}
			logger.info("No match for {} '{}' (confidence {})", entry.getId(), entry.getName(), decision.confidence());
			audit(context, entry, MatchStatus.NO_MATCH, null, null, null, null, decision, latencyMs, warning);
			return Outcome.rejected(entry, decision);
		}

		String reference = decision.reference();
		CandidateRecord candidate = candidates.stream()
				.filter(c -> c.reference().equals(reference))
				.findFirst()
				.orElseThrow(() -> new IllegalStateException("Accepted decision points outside the candidate list: " + reference));
		String warning = null;
		BigDecimal previous;
		try {
			previous = aggregates.get(reference);
		} catch (AggregationException ex) {
			logger.warn("{}; treating it as 0", ex.getMessage());
			warning = ex.getMessage() + "; treated as 0";
			previous = BigDecimal.ZERO;
		}
		if (previous == null) {
			previous = BigDecimal.ZERO;
		}
		BigDecimal updated = previous.add(entry.getAmount());
		aggregates.set(reference, updated);
		entry.markMatched(reference);
		logger.info("Matched {} '{}' to '{}' ({}): {} -> {}", entry.getId(), entry.getName(), candidate.text(),
				reference, previous.toPlainString(), updated.toPlainString());
		audit(context, entry, MatchStatus.MATCHED, reference, candidate.text(), previous, updated, decision, latencyMs, warning);
		return Outcome.accepted(entry, decision, previous, updated);
	}

	private void validate(SourceEntry entry, List<CandidateRecord> candidates) {
		if (candidates == null || candidates.isEmpty()) {
			throw new ReconciliationValidationException("Candidate list is empty");
		}
		if (entry.getName() == null || entry.getName().isBlank()) {
			throw new ReconciliationValidationException("Entry " + entry.getId() + " has no name");
		}
		if (entry.getAmount() == null) {
			throw new ReconciliationValidationException("Entry " + entry.getId() + " has no numeric amount");
		}
	}

	private void audit(RunContext context,
					   SourceEntry entry,
					   MatchStatus outcome,
					   String reference,
					   String matchedText,
					   BigDecimal previous,
					   BigDecimal updated,
					   MatchDecision decision,
					   long latencyMs,
					   String warning) {
		auditLog.append(new AuditRecord(
				auditLog.nextTimestamp(),
				context.runId(),
				context.period(),
				entry.getId(),
				entry.getName(),
				outcome,
				reference,
				matchedText,
				entry.getAmount(),
				previous,
				updated,
				decision.confidence(),
				latencyMs,
				decision.explanation(),
				warning
		));
	}
}
