package my.ledgerreconciler.app.domain;

import java.time.Duration;

public record BatchSettings(int batchSize, Duration perCallDelay, Duration perBatchDelay) {
	public static final int DEFAULT_BATCH_SIZE = 10;

	public BatchSettings {
		batchSize = batchSize < 1 ? DEFAULT_BATCH_SIZE : batchSize;
		perCallDelay = perCallDelay == null || perCallDelay.isNegative() ? Duration.ZERO : perCallDelay;
		perBatchDelay = perBatchDelay == null || perBatchDelay.isNegative() ? Duration.ZERO : perBatchDelay;
	}
}
