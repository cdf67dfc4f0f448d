package my.ledgerreconciler.app.ledger;

import my.ledgerreconciler.app.util.CsvParsing;

import java.math.BigDecimal;

/**
 * Aggregates into one period column of the reference worksheet. The target of a candidate reference is the
 * period cell on the candidate's row.
 */
public class WorksheetAggregateStore implements AggregateStore {
	private final Worksheet worksheet;
	private final String periodColumn;

	public WorksheetAggregateStore(Worksheet worksheet, String periodColumn) {
		this.worksheet = worksheet;
		this.periodColumn = periodColumn;
	}

	@Override
	public BigDecimal get(String reference) {
		CellAddress target = target(reference);
		String raw = worksheet.get(target);
		if (raw == null || raw.isBlank()) {
			return BigDecimal.ZERO;
		}
		BigDecimal value = CsvParsing.parseDecimal(raw);
		if (value == null) {
			throw new AggregationException(reference, raw);
		}
		return value;
	}

	@Override
	public void set(String reference, BigDecimal value) {
		worksheet.set(target(reference), value.toPlainString());
	}

	public String periodColumn() {
		return periodColumn;
	}

	private CellAddress target(String reference) {
		CellAddress candidate = CellAddress.fromReference(reference);
		return new CellAddress(candidate.sheet(), periodColumn, candidate.row());
	}
}
