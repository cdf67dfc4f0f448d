package my.ledgerreconciler.app.domain;

/**
 * Running counters of a reconciliation run. {@code processed} counts entries that reached the oracle;
 * already matched entries are counted as {@code skipped} only.
 */
public record ProgressStats(int processed, int matched, int skipped, long elapsedMs) {
}
