package my.ledgerreconciler.app.util;

import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;

public final class CsvParsing {
	private CsvParsing() {
	}

	public static String stripBom(String value) {
		if (value == null || value.isEmpty()) {
			return value;
		}
		if (value.charAt(0) == '\uFEFF') {
			return value.substring(1);
		}
		return value;
	}

	/**
	 * Guesses the delimiter from the header line only, so that commas inside quoted amounts further down
	 * do not skew the result.
	 */
	public static char sniffDelimiter(String sample) {
		if (sample == null || sample.isEmpty()) {
			return ',';
		}
		int lineEnd = sample.indexOf('\n');
		String header = lineEnd < 0 ? sample : sample.substring(0, lineEnd);
		long semicolons = header.chars().filter(ch -> ch == ';').count();
		long commas = header.chars().filter(ch -> ch == ',').count();
		return semicolons > 0 && semicolons >= commas ? ';' : ',';
	}

	public static String decodeUtf8(byte[] payload) {
		String raw = new String(payload, StandardCharsets.UTF_8);
		return stripBom(raw);
	}

	/**
	 * Parses an already normalised decimal cell ({@code 1234.50}). Returns null for blank or malformed input.
	 */
	public static BigDecimal parseDecimal(String raw) {
		if (raw == null) {
			return null;
		}
		String value = raw.trim().replace(" ", "").replace("\u00A0", "");
		if (value.isEmpty()) {
			return null;
		}
		try {
			return new BigDecimal(value);
		} catch (NumberFormatException ex) {
			return null;
		}
	}
}
