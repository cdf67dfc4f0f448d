package my.ledgerreconciler.app.ledger;

import my.ledgerreconciler.app.domain.MatchStatus;
import my.ledgerreconciler.app.domain.SourceEntry;
import my.ledgerreconciler.app.service.ReconciliationValidationException;
import my.ledgerreconciler.app.util.CsvParsing;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * The invoice worksheet. Entries are read once per run; their match status is written back on {@link #save()}.
 */
public class TransactionLedger {
	private static final Logger logger = LoggerFactory.getLogger(TransactionLedger.class);
	static final int HEADER_ROW = 1;

	private final Worksheet worksheet;
	private final String statusColumn;
	private final String referenceColumn;
	private final List<SourceEntry> entries;
	private final Map<String, Integer> rowsById;

	private TransactionLedger(Worksheet worksheet,
							  String statusColumn,
							  String referenceColumn,
							  List<SourceEntry> entries,
							  Map<String, Integer> rowsById) {
		this.worksheet = worksheet;
		this.statusColumn = statusColumn;
		this.referenceColumn = referenceColumn;
		this.entries = entries;
		this.rowsById = rowsById;
	}

	public static TransactionLedger load(Path path, TransactionColumns columns) {
		if (path == null || !Files.isRegularFile(path)) {
			throw new ReconciliationValidationException("Transaction ledger not found: " + path);
		}
		TransactionColumns labels = columns == null ? TransactionColumns.DEFAULTS : columns;
		Worksheet worksheet = Worksheet.load(path);
		String nameColumn = worksheet.findColumn(HEADER_ROW, labels.name())
				.orElseThrow(() -> new ReconciliationValidationException("Transaction ledger " + worksheet.name()
						+ " has no '" + labels.name() + "' column"));
		String amountColumn = worksheet.findColumn(HEADER_ROW, labels.amount())
				.orElseThrow(() -> new ReconciliationValidationException("Transaction ledger " + worksheet.name()
						+ " has no '" + labels.amount() + "' column"));
		String statusColumn = worksheet.findColumn(HEADER_ROW, labels.status())
				.orElseGet(() -> worksheet.appendColumn(HEADER_ROW, labels.status()));
		String referenceColumn = worksheet.findColumn(HEADER_ROW, labels.reference())
				.orElseGet(() -> worksheet.appendColumn(HEADER_ROW, labels.reference()));

		List<SourceEntry> entries = new ArrayList<>();
		Map<String, Integer> rowsById = new HashMap<>();
		for (int row = HEADER_ROW + 1; row <= worksheet.rowCount(); row++) {
			String name = worksheet.get(nameColumn, row);
			String rawAmount = worksheet.get(amountColumn, row);
			if (name.isBlank() && rawAmount.isBlank()) {
				continue;
			}
			BigDecimal amount = CsvParsing.parseDecimal(rawAmount);
			if (amount == null && !rawAmount.isBlank()) {
				logger.debug("Unparseable amount '{}' in {} row {}", rawAmount, worksheet.name(), row);
			}
			MatchStatus status = MatchStatus.fromCell(worksheet.get(statusColumn, row));
			String reference = worksheet.get(referenceColumn, row);
			String id = worksheet.name() + ":" + row;
			entries.add(new SourceEntry(id, name.trim(), amount, status, reference.isBlank() ? null : reference.trim()));
			rowsById.put(id, row);
		}
		logger.info("Loaded {} transaction entries from {}", entries.size(), path);
		return new TransactionLedger(worksheet, statusColumn, referenceColumn, List.copyOf(entries), rowsById);
	}

	public List<SourceEntry> entries() {
		return entries;
	}

	public Worksheet worksheet() {
		return worksheet;
	}

	/**
	 * Copies the in-memory status of every entry into the worksheet and writes it to disk.
	 */
	public void save() {
		flush();
		worksheet.save();
	}

	/**
	 * Copies the in-memory status of every entry into the worksheet without writing it.
	 */
	public void flush() {
		for (SourceEntry entry : entries) {
			int row = rowsById.get(entry.getId());
			String status = entry.getMatchStatus().toCell();
			String reference = entry.getMatchedReference() == null ? "" : entry.getMatchedReference();
			if (!status.equals(worksheet.get(statusColumn, row))) {
				worksheet.set(statusColumn, row, status);
			}
			if (!reference.equals(worksheet.get(referenceColumn, row))) {
				worksheet.set(referenceColumn, row, reference);
			}
		}
	}
}
