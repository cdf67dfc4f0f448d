package my.ledgerreconciler.app.service;

import my.ledgerreconciler.app.domain.BatchSettings;
import my.ledgerreconciler.app.domain.MatchPolicy;
import my.ledgerreconciler.app.ledger.CollectionLayout;
import my.ledgerreconciler.app.ledger.TransactionColumns;

import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Resolved run configuration: where the ledgers live, how they are laid out, and how runs are paced.
 */
public record ReconciliationSettings(
		Path transactionsPath,
		TransactionColumns transactionColumns,
		Path referencePath,
		List<CollectionLayout> collections,
		Path auditPath,
		BatchSettings batch,
		int testModeLimit,
		Map<String, MatchPolicy> policies
) {
	public static final int DEFAULT_TEST_MODE_LIMIT = 10;

	public ReconciliationSettings {
		transactionColumns = transactionColumns == null ? TransactionColumns.DEFAULTS : transactionColumns;
		collections = collections == null ? List.of() : List.copyOf(collections);
		batch = batch == null ? new BatchSettings(BatchSettings.DEFAULT_BATCH_SIZE, null, null) : batch;
		testModeLimit = testModeLimit < 1 ? DEFAULT_TEST_MODE_LIMIT : testModeLimit;
		policies = policies == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(policies));
	}
}
