package my.ledgerreconciler.app.ledger;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Spreadsheet style cell address rendered as {@code sheet:column:row}, e.g. {@code PL:B:12}.
 */
public record CellAddress(String sheet, String column, int row) {
	private static final Pattern COLUMN_RE = Pattern.compile("^[A-Z]{1,3}$");
	private static final String SEPARATOR = ":";

	public CellAddress {
		if (sheet == null || sheet.isBlank() || sheet.contains(SEPARATOR)) {
			throw new IllegalArgumentException("Invalid sheet name: " + sheet);
		}
		column = column == null ? "" : column.trim().toUpperCase(Locale.ROOT);
		if (!COLUMN_RE.matcher(column).matches()) {
			throw new IllegalArgumentException("Invalid column: " + column);
		}
		if (row < 1) {
			throw new IllegalArgumentException("Rows are 1-based: " + row);
		}
	}

	public static CellAddress parse(String value) {
		if (value == null) {
			throw new IllegalArgumentException("Address is required");
		}
		String[] parts = value.split(SEPARATOR, -1);
		if (parts.length != 3) {
			throw new IllegalArgumentException("Expected sheet:column:row but got " + value);
		}
		return new CellAddress(parts[0], parts[1], parseRow(parts[2], value));
	}

	/**
	 * Reads the address at the end of a reference such as {@code Clients:PL:B:12}.
	 */
	public static CellAddress fromReference(String reference) {
		if (reference == null) {
			throw new IllegalArgumentException("Reference is required");
		}
		String[] parts = reference.split(SEPARATOR, -1);
		if (parts.length < 3) {
			throw new IllegalArgumentException("Reference does not end with a cell address: " + reference);
		}
		int n = parts.length;
		return new CellAddress(parts[n - 3], parts[n - 2], parseRow(parts[n - 1], reference));
	}

	public static int columnIndex(String column) {
		String normalized = column == null ? "" : column.trim().toUpperCase(Locale.ROOT);
		if (!COLUMN_RE.matcher(normalized).matches()) {
			throw new IllegalArgumentException("Invalid column: " + column);
		}
		int index = 0;
		for (int i = 0; i < normalized.length(); i++) {
			index = index * 26 + (normalized.charAt(i) - 'A' + 1);
		}
		return index - 1;
	}

	public static String columnLetter(int index) {
		if (index < 0) {
			throw new IllegalArgumentException("Column index must not be negative: " + index);
		}
		StringBuilder letters = new StringBuilder();
		int remaining = index + 1;
		while (remaining > 0) {
			int digit = (remaining - 1) % 26;
			letters.insert(0, (char) ('A' + digit));
			remaining = (remaining - 1) / 26;
		}
		return letters.toString();
	}

	public int columnIndex() {
		return columnIndex(column);
	}

	@Override
	public String toString() {
		return sheet + SEPARATOR + column + SEPARATOR + row;
	}

	private static int parseRow(String raw, String source) {
		try {
			return Integer.parseInt(raw.trim());
		} catch (NumberFormatException ex) {
			throw new IllegalArgumentException("Invalid row in " + source, ex);
		}
	}
}
