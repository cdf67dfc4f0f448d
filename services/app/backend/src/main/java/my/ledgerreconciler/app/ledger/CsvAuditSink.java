package my.ledgerreconciler.app.ledger;

import my.ledgerreconciler.app.domain.AuditRecord;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.Locale;

/**
 * Append-only CSV audit trail. The file and its header line are created by the first append;
 * an existing empty file also gets the header.
 */
public class CsvAuditSink implements AuditSink {
	private static final Logger logger = LoggerFactory.getLogger(CsvAuditSink.class);
	static final String[] HEADER = {
			"timestamp", "run_id", "period", "entry_id", "entity_name", "outcome", "matched_reference",
			"matched_text", "contribution", "previous_value", "new_value", "confidence", "latency_ms",
			"explanation", "warning"
	};

	private final Path path;

	public CsvAuditSink(Path path) {
		this.path = path;
	}

	public Path path() {
		return path;
	}

	@Override
	public synchronized void append(AuditRecord record) {
		try {
			boolean create = Files.notExists(path);
			boolean writeHeader = create || Files.size(path) == 0;
			if (create) {
				Path parent = path.toAbsolutePath().getParent();
				if (parent != null) {
					Files.createDirectories(parent);
				}
				logger.info("Creating audit log {}", path);
			}
			try (Writer writer = Files.newBufferedWriter(path, StandardCharsets.UTF_8,
					StandardOpenOption.CREATE, StandardOpenOption.APPEND);
				 CSVPrinter printer = new CSVPrinter(writer, CSVFormat.DEFAULT)) {
				if (writeHeader) {
					printer.printRecord((Object[]) HEADER);
				}
				printer.printRecord(
						record.timestamp(),
						record.runId(),
						record.period(),
						record.entryId(),
						record.entityName(),
						record.outcome(),
						nullToEmpty(record.matchedReference()),
						nullToEmpty(record.matchedText()),
						plain(record.contribution()),
						plain(record.previousValue()),
						plain(record.newValue()),
						String.format(Locale.ROOT, "%.4f", record.confidence()),
						record.latencyMs(),
						nullToEmpty(record.explanation()),
						nullToEmpty(record.warning())
				);
			}
		} catch (IOException ex) {
			throw new UncheckedIOException("Failed to append to audit log " + path, ex);
		}
	}

	private String plain(BigDecimal value) {
		return value == null ? "" : value.toPlainString();
	}

	private String nullToEmpty(String value) {
		return value == null ? "" : value;
	}
}
