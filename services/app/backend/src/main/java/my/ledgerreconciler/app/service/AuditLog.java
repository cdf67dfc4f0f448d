package my.ledgerreconciler.app.service;

import my.ledgerreconciler.app.domain.AuditRecord;
import my.ledgerreconciler.app.ledger.AuditSink;

import java.time.Clock;
import java.time.Instant;

/**
 * Append-only decision trail of one run. Records must arrive in processing order, so timestamps never go
 * backwards even when the wall clock does.
 */
public class AuditLog {
	private final AuditSink sink;
	private final Clock clock;
	private Instant last;
	private int size;

	public AuditLog(AuditSink sink, Clock clock) {
		this.sink = sink;
		this.clock = clock;
	}

	public synchronized Instant nextTimestamp() {
		Instant now = clock.instant();
		return last != null && now.isBefore(last) ? last : now;
	}

	public synchronized void append(AuditRecord record) {
		if (record == null || record.timestamp() == null) {
			throw new IllegalArgumentException("Audit record requires a timestamp");
		}
		if (last != null && record.timestamp().isBefore(last)) {
			throw new IllegalStateException("Audit record at " + record.timestamp() + " precedes " + last);
		}
		sink.append(record);
		last = record.timestamp();
		size++;
	}

	public synchronized int size() {
		return size;
	}
}
