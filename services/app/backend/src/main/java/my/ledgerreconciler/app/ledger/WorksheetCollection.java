package my.ledgerreconciler.app.ledger;

import java.util.ArrayList;
import java.util.List;

public class WorksheetCollection implements NamedCollection {
	private final Worksheet worksheet;
	private final CollectionLayout layout;

	public WorksheetCollection(Worksheet worksheet, CollectionLayout layout) {
		this.worksheet = worksheet;
		this.layout = layout;
	}

	@Override
	public String name() {
		return layout.name();
	}

	@Override
	public List<LedgerRow> rows() {
		int last = layout.lastRow() == null ? worksheet.rowCount() : Math.min(layout.lastRow(), worksheet.rowCount());
		List<LedgerRow> rows = new ArrayList<>();
		for (int row = layout.firstRow(); row <= last; row++) {
			CellAddress address = worksheet.address(layout.nameColumn(), row);
			rows.add(new LedgerRow(address.toString(), worksheet.get(address)));
		}
		return rows;
	}
}
