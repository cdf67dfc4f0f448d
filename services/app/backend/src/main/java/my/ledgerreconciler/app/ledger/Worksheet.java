package my.ledgerreconciler.app.ledger;

import my.ledgerreconciler.app.util.CsvParsing;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVPrinter;
import org.apache.commons.csv.CSVRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.StringReader;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * In-memory grid of one CSV file, addressed like a spreadsheet: column letters and 1-based rows.
 * Changes stay in memory until {@link #save()}.
 */
public class Worksheet {
	private static final Logger logger = LoggerFactory.getLogger(Worksheet.class);

	private final String name;
	private final Path path;
	private final char delimiter;
	private final List<List<String>> rows;
	private boolean dirty;

	Worksheet(String name, Path path, char delimiter, List<List<String>> rows) {
		this.name = name;
		this.path = path;
		this.delimiter = delimiter;
		this.rows = rows;
	}

	public static Worksheet load(Path path) {
		byte[] payload;
		try {
			payload = Files.readAllBytes(path);
		} catch (IOException ex) {
			throw new UncheckedIOException("Failed to read worksheet " + path, ex);
		}
		String content = CsvParsing.decodeUtf8(payload);
		char delimiter = CsvParsing.sniffDelimiter(content);
		List<List<String>> rows = new ArrayList<>();
		CSVFormat format = CSVFormat.DEFAULT.builder().setDelimiter(delimiter).setIgnoreEmptyLines(false).build();
		try (CSVParser parser = CSVParser.parse(new StringReader(content), format)) {
			for (CSVRecord record : parser) {
				List<String> cells = new ArrayList<>(record.size());
				for (String value : record) {
					cells.add(value == null ? "" : value);
				}
				rows.add(cells);
			}
		} catch (IOException ex) {
			throw new UncheckedIOException("Failed to parse worksheet " + path, ex);
		}
		Worksheet worksheet = new Worksheet(sheetName(path), path, delimiter, rows);
		logger.debug("Loaded worksheet {} from {} ({} rows, delimiter '{}')", worksheet.name, path, rows.size(), delimiter);
		return worksheet;
	}

	public String name() {
		return name;
	}

	public Path path() {
		return path;
	}

	public int rowCount() {
		return rows.size();
	}

	public boolean isDirty() {
		return dirty;
	}

	public String get(String column, int row) {
		int columnIndex = CellAddress.columnIndex(column);
		if (row < 1 || row > rows.size()) {
			return "";
		}
		List<String> cells = rows.get(row - 1);
		return columnIndex < cells.size() ? cells.get(columnIndex) : "";
	}

	public String get(CellAddress address) {
		requireOwnSheet(address);
		return get(address.column(), address.row());
	}

	public void set(String column, int row, String value) {
		if (row < 1) {
			throw new IllegalArgumentException("Rows are 1-based: " + row);
		}
		int columnIndex = CellAddress.columnIndex(column);
		while (rows.size() < row) {
			rows.add(new ArrayList<>());
		}
		List<String> cells = rows.get(row - 1);
		while (cells.size() <= columnIndex) {
			cells.add("");
		}
		cells.set(columnIndex, value == null ? "" : value);
		dirty = true;
	}

	public void set(CellAddress address, String value) {
		requireOwnSheet(address);
		set(address.column(), address.row(), value);
	}

	public CellAddress address(String column, int row) {
		return new CellAddress(name, column, row);
	}

	/**
	 * Finds the column whose header cell equals {@code label}, ignoring case and surrounding blanks.
	 */
	public Optional<String> findColumn(int headerRow, String label) {
		if (label == null || label.isBlank() || headerRow < 1 || headerRow > rows.size()) {
			return Optional.empty();
		}
		String wanted = label.trim().toLowerCase(Locale.ROOT);
		List<String> header = rows.get(headerRow - 1);
		for (int i = 0; i < header.size(); i++) {
			String cell = header.get(i);
			if (cell != null && cell.trim().toLowerCase(Locale.ROOT).equals(wanted)) {
				return Optional.of(CellAddress.columnLetter(i));
			}
		}
		return Optional.empty();
	}

	/**
	 * Adds a header cell right after the last used column of the header row.
	 *
	 * @return the letter of the new column
	 */
	public String appendColumn(int headerRow, String label) {
		int next = 0;
		if (headerRow >= 1 && headerRow <= rows.size()) {
			List<String> header = rows.get(headerRow - 1);
			for (int i = header.size() - 1; i >= 0; i--) {
				if (header.get(i) != null && !header.get(i).isBlank()) {
					next = i + 1;
					break;
				}
			}
		}
		String column = CellAddress.columnLetter(next);
		set(column, headerRow, label);
		return column;
	}

	public void save() {
		saveAll(List.of(this));
	}

	/**
	 * Writes every dirty worksheet to a temp file first and replaces the originals only once all of them
	 * were written. A failed write leaves every original untouched.
	 */
	public static void saveAll(List<Worksheet> worksheets) {
		List<Worksheet> pending = new ArrayList<>();
		for (Worksheet worksheet : worksheets) {
			if (worksheet.dirty) {
				pending.add(worksheet);
			}
		}
		List<Path> staged = new ArrayList<>();
		try {
			for (Worksheet worksheet : pending) {
				staged.add(worksheet.writeTemp());
			}
		} catch (UncheckedIOException ex) {
			discard(staged, ex);
			throw ex;
		}
		for (int i = 0; i < pending.size(); i++) {
			pending.get(i).replaceWith(staged.get(i));
		}
	}

	private Path writeTemp() {
		Path target = path.toAbsolutePath();
		Path temp = target.resolveSibling(target.getFileName() + ".tmp");
		CSVFormat format = CSVFormat.DEFAULT.builder().setDelimiter(delimiter).build();
		try (Writer writer = Files.newBufferedWriter(temp, StandardCharsets.UTF_8);
			 CSVPrinter printer = new CSVPrinter(writer, format)) {
			for (List<String> cells : rows) {
				printer.printRecord(cells);
			}
		} catch (IOException ex) {
			throw new UncheckedIOException("Failed to write worksheet " + path, ex);
		}
		return temp;
	}

	private void replaceWith(Path temp) {
		try {
			Files.move(temp, path.toAbsolutePath(), StandardCopyOption.REPLACE_EXISTING);
		} catch (IOException ex) {
			throw new UncheckedIOException("Failed to replace worksheet " + path, ex);
		}
		dirty = false;
		logger.debug("Saved worksheet {} to {}", name, path);
	}

	private static void discard(List<Path> staged, UncheckedIOException failure) {
		for (Path temp : staged) {
			try {
				Files.deleteIfExists(temp);
			} catch (IOException ex) {
				logger.warn("Could not remove staged worksheet {}: {}", temp, ex.getMessage());
				failure.addSuppressed(ex);
			}
		}
	}

	private void requireOwnSheet(CellAddress address) {
		if (!name.equals(address.sheet())) {
			throw new IllegalArgumentException("Address " + address + " does not belong to sheet " + name);
		}
	}

	static String sheetName(Path path) {
		String fileName = path.getFileName().toString();
		int dot = fileName.lastIndexOf('.');
		String stem = dot > 0 ? fileName.substring(0, dot) : fileName;
		String sanitized = stem.replace(':', '_').trim();
		return sanitized.isEmpty() ? "Sheet" : sanitized;
	}
}
