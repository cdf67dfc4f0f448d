package my.ledgerreconciler.app.service;

import my.ledgerreconciler.app.domain.AuditRecord;
import my.ledgerreconciler.app.domain.MatchStatus;
import my.ledgerreconciler.app.support.MutableClock;
import my.ledgerreconciler.app.support.RecordingAuditSink;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AuditLogTest {
	private static final Instant START = Instant.parse("2026-02-01T09:00:00Z");

	@Test
	void timestampsNeverGoBackwards() {
		MutableClock clock = new MutableClock(START);
		RecordingAuditSink sink = new RecordingAuditSink();
		AuditLog log = new AuditLog(sink, clock);

		log.append(record(log.nextTimestamp()));
		clock.set(START.minus(Duration.ofMinutes(5)));
		Instant next = log.nextTimestamp();
		log.append(record(next));

		assertThat(next).isEqualTo(START);
		assertThat(log.size()).isEqualTo(2);
		assertThat(sink.records()).extracting(AuditRecord::timestamp).containsExactly(START, START);
	}

	@Test
	void rejectsOutOfOrderRecords() {
		RecordingAuditSink sink = new RecordingAuditSink();
		AuditLog log = new AuditLog(sink, new MutableClock(START));
		log.append(record(START));

		assertThatThrownBy(() -> log.append(record(START.minusSeconds(1))))
				.isInstanceOf(IllegalStateException.class);
		assertThat(sink.records()).hasSize(1);
	}

	private AuditRecord record(Instant timestamp) {
		return new AuditRecord(timestamp, "run", "Ianuarie", "invoices:2", "Acme", MatchStatus.NO_MATCH, null, null,
				BigDecimal.ONE, null, null, 0.0, 0L, null, null);
	}
}
