package my.ledgerreconciler.app.ledger;

import my.ledgerreconciler.app.domain.ProgressStats;

@FunctionalInterface
public interface ProgressSink {
	ProgressSink NONE = stats -> {
	};

	void onProgress(ProgressStats stats);
}
