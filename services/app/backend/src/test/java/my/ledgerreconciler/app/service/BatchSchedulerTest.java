package my.ledgerreconciler.app.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import my.ledgerreconciler.app.domain.BatchSettings;
import my.ledgerreconciler.app.domain.CandidateRecord;
import my.ledgerreconciler.app.domain.MatchPolicy;
import my.ledgerreconciler.app.domain.MatchStatus;
import my.ledgerreconciler.app.domain.ProgressStats;
import my.ledgerreconciler.app.domain.RunContext;
import my.ledgerreconciler.app.domain.RunSummary;
import my.ledgerreconciler.app.domain.SourceEntry;
import my.ledgerreconciler.app.ledger.ProgressSink;
import my.ledgerreconciler.app.support.MapAggregateStore;
import my.ledgerreconciler.app.support.MutableClock;
import my.ledgerreconciler.app.support.RecordingAuditSink;
import my.ledgerreconciler.app.support.ScriptedLlmProvider;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static my.ledgerreconciler.app.support.ScriptedLlmProvider.match;
import static my.ledgerreconciler.app.support.ScriptedLlmProvider.noMatch;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
class BatchSchedulerTest {
	private static final List<CandidateRecord> CANDIDATES = List.of(new CandidateRecord("ref1", "Acme SRL", "Clients"));
	private static final MatchPolicy CLIENTS = new MatchPolicy("clients", 0.8, List.of("Clients"));
	private static final BatchSettings PACED = new BatchSettings(2, Duration.ofSeconds(1), Duration.ofSeconds(5));

	@Mock
	private ProgressSink progressSink;

	private final MutableClock clock = new MutableClock(Instant.parse("2026-02-01T09:00:00Z"));
	private final List<Duration> pauses = new ArrayList<>();
	private final AtomicInteger checkpoints = new AtomicInteger();

	@Test
	void pacesCallsWithinAndBetweenBatches() {
		RunSummary summary = scheduler(ScriptedLlmProvider.answering(prompt -> noMatch(0.1)))
				.run(entries(5), job(), PACED, ProgressSink.NONE);

		assertThat(pauses).containsExactly(
				Duration.ofSeconds(1), Duration.ofSeconds(5), Duration.ofSeconds(1), Duration.ofSeconds(5));
		assertThat(summary.processed()).isEqualTo(5);
		assertThat(summary.aborted()).isFalse();
		assertThat(checkpoints).hasValue(3);
	}

	@Test
	void skippedEntriesNeitherCallNorPause() {
		List<SourceEntry> entries = List.of(
				new SourceEntry("invoices:2", "Acme", BigDecimal.ONE),
				new SourceEntry("invoices:3", "Acme", BigDecimal.ONE, MatchStatus.MATCHED, "ref1"),
				new SourceEntry("invoices:4", "Acme", BigDecimal.ONE));
		ScriptedLlmProvider oracle = ScriptedLlmProvider.answering(prompt -> match("ref1", 0.9));

		RunSummary summary = scheduler(oracle)
				.run(entries, job(), new BatchSettings(10, Duration.ofSeconds(1), Duration.ofSeconds(5)), ProgressSink.NONE);

		assertThat(pauses).containsExactly(Duration.ofSeconds(1));
		assertThat(oracle.prompts()).hasSize(2);
		assertThat(summary.processed()).isEqualTo(2);
		assertThat(summary.matched()).isEqualTo(2);
		assertThat(summary.skipped()).isEqualTo(1);
	}

	@Test
	void reportsProgressAfterEveryEntry() {
		ScriptedLlmProvider oracle = new ScriptedLlmProvider()
				.thenReturn(match("ref1", 0.9))
				.thenReturn(noMatch(0.2));
		List<SourceEntry> entries = List.of(
				new SourceEntry("invoices:2", "Acme", BigDecimal.ONE),
				new SourceEntry("invoices:3", "Acme", BigDecimal.ONE, MatchStatus.MATCHED, "ref1"),
				new SourceEntry("invoices:4", "Initech", BigDecimal.ONE));

		scheduler(oracle).run(entries, job(), PACED, progressSink);

		ArgumentCaptor<ProgressStats> captor = ArgumentCaptor.forClass(ProgressStats.class);
		verify(progressSink, times(3)).onProgress(captor.capture());
		List<ProgressStats> stats = captor.getAllValues();
		assertThat(stats.get(0)).isEqualTo(new ProgressStats(1, 1, 0, 0));
		assertThat(stats.get(1)).isEqualTo(new ProgressStats(1, 1, 1, 0));
		assertThat(stats.get(2)).isEqualTo(new ProgressStats(2, 1, 1, 0));
	}

	@Test
	void failingProgressSinkDoesNotAbortRun() {
		doThrow(new IllegalStateException("ui gone")).when(progressSink).onProgress(any());

		RunSummary summary = scheduler(ScriptedLlmProvider.answering(prompt -> noMatch(0.1)))
				.run(entries(3), job(), PACED, progressSink);

		assertThat(summary.processed()).isEqualTo(3);
		assertThat(summary.aborted()).isFalse();
	}

	@Test
	void validationErrorStopsRunButKeepsProgress() {
		List<SourceEntry> entries = new ArrayList<>(entries(4));
		entries.set(2, new SourceEntry("invoices:4", "Broken", null));
		ScriptedLlmProvider oracle = ScriptedLlmProvider.answering(prompt -> match("ref1", 0.9));

		RunSummary summary = scheduler(oracle).run(entries, job(), PACED, ProgressSink.NONE);

		assertThat(summary.aborted()).isTrue();
		assertThat(summary.errors()).hasSize(1);
		assertThat(summary.errors().get(0)).startsWith("invoices:4:").contains("amount");
		assertThat(summary.processed()).isEqualTo(2);
		assertThat(summary.matched()).isEqualTo(2);
		assertThat(entries.get(0).isMatched()).isTrue();
		assertThat(entries.get(1).isMatched()).isTrue();
		assertThat(entries.get(3).getMatchStatus()).isEqualTo(MatchStatus.UNPROCESSED);
		assertThat(checkpoints).hasValue(1);
	}

	@Test
	void checkpointFailureStopsRun() {
		ReconciliationJob failingJob = new ReconciliationJob(context(), CANDIDATES, CLIENTS, () -> {
			throw new IllegalStateException("disk full");
		});

		RunSummary summary = scheduler(ScriptedLlmProvider.answering(prompt -> noMatch(0.1)))
				.run(entries(4), failingJob, PACED, ProgressSink.NONE);

		assertThat(summary.processed()).isEqualTo(2);
		assertThat(summary.errors()).hasSize(1);
		assertThat(summary.errors().get(0)).contains("disk full");
	}

	@Test
	void interruptedPauseStopsRun() {
		BatchScheduler scheduler = new BatchScheduler(engine(ScriptedLlmProvider.answering(prompt -> noMatch(0.1))),
				new BatchPlanner(), duration -> {
					throw new InterruptedException("stop");
				}, clock);

		RunSummary summary = scheduler.run(entries(3), job(), PACED, ProgressSink.NONE);

		assertThat(summary.processed()).isEqualTo(1);
		assertThat(summary.errors()).containsExactly("interrupted");
		assertThat(Thread.interrupted()).isTrue();
	}

	@Test
	void emptyRunCompletesImmediately() {
		RunSummary summary = scheduler(new ScriptedLlmProvider()).run(List.of(), job(), PACED, progressSink);

		assertThat(summary.processed()).isZero();
		assertThat(summary.runId()).isEqualTo("run-1");
		assertThat(checkpoints).hasValue(0);
	}

	private List<SourceEntry> entries(int count) {
		List<SourceEntry> entries = new ArrayList<>();
		for (int i = 0; i < count; i++) {
			entries.add(new SourceEntry("invoices:" + (i + 2), "Entity " + i, BigDecimal.TEN));
		}
		return entries;
	}

	private RunContext context() {
		return new RunContext("run-1", "Ianuarie", "clients", clock.instant());
	}

	private ReconciliationJob job() {
		return new ReconciliationJob(context(), CANDIDATES, CLIENTS, checkpoints::incrementAndGet);
	}

	private BatchScheduler scheduler(ScriptedLlmProvider oracle) {
		return new BatchScheduler(engine(oracle), new BatchPlanner(), pauses::add, clock);
	}

	private ReconciliationEngine engine(ScriptedLlmProvider oracle) {
		MatchOracleClient client = new MatchOracleClient(oracle, new ObjectMapper(),
				RetryPolicy.fixed(2, Duration.ZERO, duration -> {
				}));
		return new ReconciliationEngine(client, new MapAggregateStore(), new AuditLog(new RecordingAuditSink(), clock), clock);
	}
}
