package my.ledgerreconciler.app.domain;

/**
 * A reference-ledger row eligible for matching.
 *
 * @param reference  stable address of the row, unique within one candidate list
 * @param text       the raw entity name in the row
 * @param collection the reference collection the row belongs to
 */
public record CandidateRecord(String reference, String text, String collection) {
}
