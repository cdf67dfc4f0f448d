package my.ledgerreconciler.app.ledger;

/**
 * Where a named collection lives inside the reference worksheet.
 *
 * @param lastRow inclusive; null means "until the last row of the sheet"
 */
public record CollectionLayout(String name, String nameColumn, int firstRow, Integer lastRow) {
	public CollectionLayout {
		if (name == null || name.isBlank() || name.contains(":")) {
			throw new IllegalArgumentException("Collection name must be non-blank and must not contain ':' (" + name + ")");
		}
		CellAddress.columnIndex(nameColumn);
		if (firstRow < 1) {
			throw new IllegalArgumentException("firstRow must be >= 1 for collection " + name);
		}
		if (lastRow != null && lastRow < firstRow) {
			throw new IllegalArgumentException("lastRow must not precede firstRow for collection " + name);
		}
	}
}
