package my.ledgerreconciler.app.service;

import my.ledgerreconciler.app.domain.CandidateRecord;
import my.ledgerreconciler.app.ledger.LedgerRow;
import my.ledgerreconciler.app.ledger.NamedCollection;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Flattens reference collections into one addressable candidate list.
 * Blank rows are dropped first; every kept row is addressed by its own location, never by its list position.
 */
public class CandidateIndexer {
	public static final String SEPARATOR = ":";

	public List<CandidateRecord> build(List<? extends NamedCollection> collections) {
		if (collections == null || collections.isEmpty()) {
			return List.of();
		}
		List<CandidateRecord> candidates = new ArrayList<>();
		Set<String> seen = new HashSet<>();
		for (NamedCollection collection : collections) {
			for (LedgerRow row : collection.rows()) {
				if (row.text() == null || row.text().isBlank()) {
					continue;
				}
				String reference = collection.name() + SEPARATOR + row.address();
				if (!seen.add(reference)) {
					throw new ReconciliationValidationException("Duplicate candidate reference " + reference);
				}
				candidates.add(new CandidateRecord(reference, row.text().trim(), collection.name()));
			}
		}
		return List.copyOf(candidates);
	}
}
