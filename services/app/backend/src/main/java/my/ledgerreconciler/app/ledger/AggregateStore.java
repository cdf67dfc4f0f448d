package my.ledgerreconciler.app.ledger;

import java.math.BigDecimal;

public interface AggregateStore {
	/**
	 * @return the current value at the target of {@code reference}; zero when the target is empty
	 * @throws AggregationException when the target holds something that is not a number
	 */
	BigDecimal get(String reference);

	void set(String reference, BigDecimal value);
}
