package my.ledgerreconciler.app.domain;

import java.util.Locale;

public enum MatchStatus {
	UNPROCESSED,
	MATCHED,
	NO_MATCH;

	/**
	 * Reads a status persisted in a ledger cell. Blank or unknown values count as never processed.
	 */
	public static MatchStatus fromCell(String raw) {
		if (raw == null || raw.isBlank()) {
			return UNPROCESSED;
		}
		String normalized = raw.trim().toUpperCase(Locale.ROOT).replace(' ', '_').replace('-', '_');
		if ("NOMATCH".equals(normalized)) {
			return NO_MATCH;
		}
		for (MatchStatus status : values()) {
			if (status.name().equals(normalized)) {
				return status;
			}
		}
		return UNPROCESSED;
	}

	public String toCell() {
		return this == UNPROCESSED ? "" : name();
	}
}
