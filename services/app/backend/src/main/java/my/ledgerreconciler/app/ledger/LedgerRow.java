package my.ledgerreconciler.app.ledger;

/**
 * @param address stable, human readable address of the row ({@code sheet:column:row})
 * @param text    raw cell text, may be blank
 */
public record LedgerRow(String address, String text) {
}
