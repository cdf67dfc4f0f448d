package my.ledgerreconciler.app.domain;

public record MatchDecision(boolean matched, String reference, double confidence, String explanation) {
	public MatchDecision {
		if (Double.isNaN(confidence) || confidence < 0.0 || confidence > 1.0) {
			throw new IllegalArgumentException("confidence must be within [0,1]: " + confidence);
		}
		if (!matched) {
			reference = null;
		}
	}

	public static MatchDecision noMatch(double confidence, String explanation) {
		return new MatchDecision(false, null, confidence, explanation);
	}

	/**
	 * Decision used when the oracle could not be reached or answered garbage on every attempt.
	 */
	public static MatchDecision degraded(String reason) {
		return new MatchDecision(false, null, 0.0, reason == null ? "oracle unavailable" : "oracle unavailable: " + reason);
	}
}
