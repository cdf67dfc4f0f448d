package my.ledgerreconciler.app.ledger;

import my.ledgerreconciler.app.domain.AuditRecord;

public interface AuditSink {
	void append(AuditRecord record);
}
