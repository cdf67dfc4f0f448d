package my.ledgerreconciler.app.domain;

import java.util.List;

/**
 * Acceptance policy for one target category.
 *
 * @param name        category name, e.g. {@code clients}
 * @param threshold   a decision is accepted only when its confidence is strictly above this value
 * @param collections reference collections searched for this category, in search order
 */
public record MatchPolicy(String name, double threshold, List<String> collections) {
	public MatchPolicy {
		if (name == null || name.isBlank()) {
			throw new IllegalArgumentException("policy name is required");
		}
		if (Double.isNaN(threshold) || threshold < 0.0 || threshold > 1.0) {
			throw new IllegalArgumentException("threshold must be within [0,1]: " + threshold);
		}
		if (collections == null || collections.isEmpty()) {
			throw new IllegalArgumentException("policy " + name + " needs at least one collection");
		}
		collections = List.copyOf(collections);
	}

	public boolean accepts(MatchDecision decision) {
		return decision != null && decision.matched() && decision.confidence() > threshold;
	}
}
