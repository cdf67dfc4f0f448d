package my.ledgerreconciler.app.service;

import my.ledgerreconciler.app.domain.CandidateRecord;
import my.ledgerreconciler.app.domain.MatchPolicy;
import my.ledgerreconciler.app.domain.RunContext;

import java.util.List;

/**
 * What a scheduled run works against.
 *
 * @param checkpoint persists committed work; called after every completed batch
 */
public record ReconciliationJob(RunContext context, List<CandidateRecord> candidates, MatchPolicy policy, Runnable checkpoint) {
	public ReconciliationJob {
		candidates = List.copyOf(candidates);
		checkpoint = checkpoint == null ? () -> { } : checkpoint;
	}
}
