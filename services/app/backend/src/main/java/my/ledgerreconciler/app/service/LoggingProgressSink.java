package my.ledgerreconciler.app.service;

import my.ledgerreconciler.app.domain.ProgressStats;
import my.ledgerreconciler.app.ledger.ProgressSink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class LoggingProgressSink implements ProgressSink {
	private static final Logger logger = LoggerFactory.getLogger(LoggingProgressSink.class);

	@Override
	public void onProgress(ProgressStats stats) {
		logger.info("Progress: {} processed, {} matched, {} skipped, {} ms elapsed",
				stats.processed(), stats.matched(), stats.skipped(), stats.elapsedMs());
	}
}
