package my.ledgerreconciler.app.domain;

import java.math.BigDecimal;

public record Outcome(SourceEntry entry, Kind kind, MatchDecision decision, BigDecimal previousValue, BigDecimal newValue) {
	public enum Kind {
		ACCEPTED,
		REJECTED,
		SKIPPED
	}

	public static Outcome skipped(SourceEntry entry) {
		return new Outcome(entry, Kind.SKIPPED, null, null, null);
	}

	public static Outcome rejected(SourceEntry entry, MatchDecision decision) {
		return new Outcome(entry, Kind.REJECTED, decision, null, null);
	}

	public static Outcome accepted(SourceEntry entry, MatchDecision decision, BigDecimal previousValue, BigDecimal newValue) {
		return new Outcome(entry, Kind.ACCEPTED, decision, previousValue, newValue);
	}
}
