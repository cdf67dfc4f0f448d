package my.ledgerreconciler.app.ledger;

import java.util.List;

/**
 * A named list of reference rows, e.g. the "Clients" block of a profit-and-loss sheet.
 */
public interface NamedCollection {
	String name();

	/**
	 * Rows in sheet order, blank ones included.
	 */
	List<LedgerRow> rows();
}
