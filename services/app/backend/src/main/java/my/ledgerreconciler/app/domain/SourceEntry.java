package my.ledgerreconciler.app.domain;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * One transaction line of the invoice ledger.
 * Status and matched reference are persisted back to the ledger so that later runs skip matched lines.
 */
public class SourceEntry {
	private final String id;
	private final String name;
	private final BigDecimal amount;
	private MatchStatus matchStatus;
	private String matchedReference;

	public SourceEntry(String id, String name, BigDecimal amount) {
		this(id, name, amount, MatchStatus.UNPROCESSED, null);
	}

	public SourceEntry(String id, String name, BigDecimal amount, MatchStatus matchStatus, String matchedReference) {
		this.id = Objects.requireNonNull(id, "id");
		this.name = name;
		this.amount = amount;
		this.matchStatus = matchStatus == null ? MatchStatus.UNPROCESSED : matchStatus;
		this.matchedReference = this.matchStatus == MatchStatus.MATCHED ? matchedReference : null;
	}

	public String getId() {
		return id;
	}

	public String getName() {
		return name;
	}

	public BigDecimal getAmount() {
		return amount;
	}

	public MatchStatus getMatchStatus() {
		return matchStatus;
	}

	public String getMatchedReference() {
		return matchedReference;
	}

	public boolean isMatched() {
		return matchStatus == MatchStatus.MATCHED;
	}

	public void markMatched(String reference) {
		if (reference == null || reference.isBlank()) {
			throw new IllegalArgumentException("Matched entry requires a reference");
		}
		this.matchStatus = MatchStatus.MATCHED;
		this.matchedReference = reference;
	}

	public void markNoMatch() {
		this.matchStatus = MatchStatus.NO_MATCH;
		this.matchedReference = null;
	}

	@Override
	public String toString() {
		return "SourceEntry{" + id + ", '" + name + "', " + amount + ", " + matchStatus + "}";
	}
}
