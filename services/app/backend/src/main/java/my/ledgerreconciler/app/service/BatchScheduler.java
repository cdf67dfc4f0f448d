package my.ledgerreconciler.app.service;

import my.ledgerreconciler.app.domain.BatchSettings;
import my.ledgerreconciler.app.domain.Outcome;
import my.ledgerreconciler.app.domain.ProgressStats;
import my.ledgerreconciler.app.domain.RunSummary;
import my.ledgerreconciler.app.domain.SourceEntry;
import my.ledgerreconciler.app.ledger.ProgressSink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Runs entries through the engine in fixed-size batches, one at a time.
 * <p>
 * Oracle calls are paced: {@code perCallDelay} between two calls of the same batch and {@code perBatchDelay}
 * when a batch boundary lies between them. Skipped entries make no call and are not paced.
 * The first fatal error stops the run; everything decided before it stays committed.
 */
public class BatchScheduler {
	private static final Logger logger = LoggerFactory.getLogger(BatchScheduler.class);

	private final ReconciliationEngine engine;
	private final BatchPlanner planner;
	private final Sleeper sleeper;
	private final Clock clock;

	public BatchScheduler(ReconciliationEngine engine, BatchPlanner planner, Sleeper sleeper, Clock clock) {
		this.engine = engine;
		this.planner = planner;
		this.sleeper = sleeper;
		this.clock = clock;
	}

	public RunSummary run(List<SourceEntry> entries, ReconciliationJob job, BatchSettings settings, ProgressSink onProgress) {
		ProgressSink progress = onProgress == null ? ProgressSink.NONE : onProgress;
		long started = clock.millis();
		List<List<SourceEntry>> batches = planner.buildBatches(entries, settings.batchSize());
		List<String> errors = new ArrayList<>();
		int processed = 0;
		int matched = 0;
		int skipped = 0;
		Duration pendingPause = null;

		logger.info("Run {} ({}, policy {}): {} entries in {} batches", job.context().runId(), job.context().period(),
				job.policy().name(), entries == null ? 0 : entries.size(), batches.size());
		batchLoop:
		for (int batchIndex = 0; batchIndex < batches.size(); batchIndex++) {
			List<SourceEntry> batch = batches.get(batchIndex);
			if (batchIndex > 0 && pendingPause != null) {
				pendingPause = settings.perBatchDelay();
			}
			for (SourceEntry entry : batch) {
				try {
					if (Thread.interrupted()) {
						throw new InterruptedException();
					}
					if (!entry.isMatched() && pendingPause != null) {
						sleeper.sleep(pendingPause);
						pendingPause = null;
					}
					Outcome outcome = engine.process(job.context(), entry, job.candidates(), job.policy());
					switch (outcome.kind()) {
						case SKIPPED -> skipped++;
						case ACCEPTED -> {
							processed++;
							matched++;
						}
						case REJECTED -> processed++;
					}
					if (outcome.kind() != Outcome.Kind.SKIPPED) {
						pendingPause = settings.perCallDelay();
					}
				} catch (InterruptedException ex) {
					Thread.currentThread().interrupt();
					logger.warn("Run {} interrupted before {}", job.context().runId(), entry.getId());
					errors.add("interrupted");
					break batchLoop;
				} catch (ReconciliationValidationException ex) {
					logger.error("Run {} stopped at {}: {}", job.context().runId(), entry.getId(), ex.getMessage());
					errors.add(entry.getId() + ": " + ex.getMessage());
					break batchLoop;
				} catch (RuntimeException ex) {
					logger.error("Run {} failed at {}", job.context().runId(), entry.getId(), ex);
					errors.add(entry.getId() + ": " + ex.getMessage());
					break batchLoop;
				}
				report(progress, new ProgressStats(processed, matched, skipped, clock.millis() - started));
			}
			try {
				job.checkpoint().run();
			} catch (RuntimeException ex) {
				logger.error("Run {} could not save batch {}", job.context().runId(), batchIndex + 1, ex);
				errors.add("checkpoint after batch " + (batchIndex + 1) + ": " + ex.getMessage());
				break;
			}
			logger.debug("Batch {}/{} done", batchIndex + 1, batches.size());
		}

		RunSummary summary = new RunSummary(job.context().runId(), processed, matched, skipped,
				clock.millis() - started, errors);
		logger.info("Run {} finished: {} processed, {} matched, {} skipped in {} ms{}", summary.runId(),
				summary.processed(), summary.matched(), summary.skipped(), summary.elapsedMs(),
				summary.aborted() ? " (aborted)" : "");
		return summary;
	}

	private void report(ProgressSink progress, ProgressStats stats) {
		try {
			progress.onProgress(stats);
		} catch (RuntimeException ex) {
			logger.warn("Progress sink failed: {}", ex.getMessage());
		}
	}
}
