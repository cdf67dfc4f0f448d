package my.ledgerreconciler.app.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import my.ledgerreconciler.app.domain.AuditRecord;
import my.ledgerreconciler.app.domain.CandidateRecord;
import my.ledgerreconciler.app.domain.MatchPolicy;
import my.ledgerreconciler.app.domain.MatchStatus;
import my.ledgerreconciler.app.domain.Outcome;
import my.ledgerreconciler.app.domain.RunContext;
import my.ledgerreconciler.app.domain.SourceEntry;
import my.ledgerreconciler.app.llm.OracleTransportException;
import my.ledgerreconciler.app.support.ListCollection;
import my.ledgerreconciler.app.support.MapAggregateStore;
import my.ledgerreconciler.app.support.MutableClock;
import my.ledgerreconciler.app.support.RecordingAuditSink;
import my.ledgerreconciler.app.support.ScriptedLlmProvider;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static my.ledgerreconciler.app.support.ScriptedLlmProvider.match;
import static my.ledgerreconciler.app.support.ScriptedLlmProvider.noMatch;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ReconciliationEngineTest {
	private static final List<CandidateRecord> CANDIDATES = List.of(
			new CandidateRecord("ref1", "Acme SRL", "Clients"),
			new CandidateRecord("ref2", "Globex SA", "Clients"));
	private static final MatchPolicy CLIENTS = new MatchPolicy("clients", 0.8, List.of("Clients"));

	private final MutableClock clock = new MutableClock(Instant.parse("2026-02-01T09:00:00Z"));
	private final RunContext context = new RunContext("run-1", "Ianuarie", "clients", clock.instant());
	private final MapAggregateStore aggregates = new MapAggregateStore();
	private final RecordingAuditSink auditSink = new RecordingAuditSink();

	@Test
	void acceptedMatchAddsAmountAndMarksEntry() {
		ScriptedLlmProvider oracle = new ScriptedLlmProvider().thenReturn(match("ref1", 0.92));
		SourceEntry entry = new SourceEntry("invoices:2", "ACME S.R.L.", new BigDecimal("120.50"));

		Outcome outcome = engine(oracle).process(context, entry, CANDIDATES, CLIENTS);

		assertThat(outcome.kind()).isEqualTo(Outcome.Kind.ACCEPTED);
		assertThat(aggregates.get("ref1")).isEqualByComparingTo(new BigDecimal("120.50"));
		assertThat(entry.getMatchStatus()).isEqualTo(MatchStatus.MATCHED);
		assertThat(entry.getMatchedReference()).isEqualTo("ref1");
		assertThat(auditSink.records()).hasSize(1);
		AuditRecord record = auditSink.records().get(0);
		assertThat(record.confidence()).isEqualTo(0.92);
		assertThat(record.outcome()).isEqualTo(MatchStatus.MATCHED);
		assertThat(record.matchedText()).isEqualTo("Acme SRL");
		assertThat(record.previousValue()).isEqualByComparingTo(BigDecimal.ZERO);
		assertThat(record.newValue()).isEqualByComparingTo(new BigDecimal("120.50"));
		assertThat(record.contribution()).isEqualByComparingTo(new BigDecimal("120.50"));
		assertThat(record.runId()).isEqualTo("run-1");
		assertThat(record.period()).isEqualTo("Ianuarie");
		assertThat(record.warning()).isNull();
	}

	@Test
	void confidenceAtOrBelowThresholdIsNoMatch() {
		ScriptedLlmProvider oracle = new ScriptedLlmProvider()
				.thenReturn(match("ref1", 0.8))
				.thenReturn(match("ref1", 0.35));
		SourceEntry atThreshold = new SourceEntry("invoices:2", "ACME", new BigDecimal("10"));
		SourceEntry below = new SourceEntry("invoices:3", "ACME", new BigDecimal("10"));
		ReconciliationEngine engine = engine(oracle);

		engine.process(context, atThreshold, CANDIDATES, CLIENTS);
		Outcome outcome = engine.process(context, below, CANDIDATES, CLIENTS);

		assertThat(outcome.kind()).isEqualTo(Outcome.Kind.REJECTED);
		assertThat(atThreshold.getMatchStatus()).isEqualTo(MatchStatus.NO_MATCH);
		assertThat(below.getMatchStatus()).isEqualTo(MatchStatus.NO_MATCH);
		assertThat(atThreshold.getMatchedReference()).isNull();
		assertThat(aggregates.writes()).isZero();
		assertThat(auditSink.records()).hasSize(2);
		assertThat(auditSink.records().get(0).outcome()).isEqualTo(MatchStatus.NO_MATCH);
		assertThat(auditSink.records().get(0).warning()).contains("threshold").contains("ref1");
		assertThat(auditSink.records().get(0).matchedReference()).isNull();
	}

	@Test
	void sameDecisionPassesLowerThreshold() {
		ScriptedLlmProvider oracle = new ScriptedLlmProvider().thenReturn(match("ref2", 0.6));
		MatchPolicy expenses = new MatchPolicy("expenses", 0.5, List.of("Expenses", "Staffing"));
		SourceEntry entry = new SourceEntry("invoices:2", "Globex", new BigDecimal("3"));

		engine(oracle).process(context, entry, CANDIDATES, expenses);

		assertThat(entry.isMatched()).isTrue();
		assertThat(aggregates.get("ref2")).isEqualByComparingTo("3");
	}

	@Test
	void matchedEntriesAreSkippedWithoutOracleCall() {
		ScriptedLlmProvider oracle = new ScriptedLlmProvider();
		SourceEntry entry = new SourceEntry("invoices:2", "ACME", new BigDecimal("10"), MatchStatus.MATCHED, "ref1");

		Outcome outcome = engine(oracle).process(context, entry, CANDIDATES, CLIENTS);

		assertThat(outcome.kind()).isEqualTo(Outcome.Kind.SKIPPED);
		assertThat(oracle.prompts()).isEmpty();
		assertThat(aggregates.writes()).isZero();
		assertThat(auditSink.records()).isEmpty();
	}

	@Test
	void secondPassOverSameEntriesAddsNothing() {
		ScriptedLlmProvider oracle = ScriptedLlmProvider.answering(prompt -> match("ref1", 0.95));
		List<SourceEntry> entries = List.of(
				new SourceEntry("invoices:2", "ACME", new BigDecimal("10")),
				new SourceEntry("invoices:3", "Acme S.R.L", new BigDecimal("5")));
		ReconciliationEngine engine = engine(oracle);

		entries.forEach(entry -> engine.process(context, entry, CANDIDATES, CLIENTS));
		String afterFirstPass = aggregates.raw("ref1");
		entries.forEach(entry -> engine.process(context, entry, CANDIDATES, CLIENTS));

		assertThat(afterFirstPass).isEqualTo("15");
		assertThat(aggregates.raw("ref1")).isEqualTo("15");
		assertThat(oracle.prompts()).hasSize(2);
		assertThat(auditSink.records()).hasSize(2);
	}

	@Test
	void noMatchEntriesAreRetriedAndCanBecomeMatched() {
		ScriptedLlmProvider oracle = new ScriptedLlmProvider()
				.thenReturn(noMatch(0.2))
				.thenReturn(match("ref2", 0.9));
		SourceEntry entry = new SourceEntry("invoices:2", "Globex", new BigDecimal("7"));
		ReconciliationEngine engine = engine(oracle);

		engine.process(context, entry, CANDIDATES, CLIENTS);
		assertThat(entry.getMatchStatus()).isEqualTo(MatchStatus.NO_MATCH);
		engine.process(context, entry, CANDIDATES, CLIENTS);

		assertThat(entry.getMatchStatus()).isEqualTo(MatchStatus.MATCHED);
		assertThat(aggregates.get("ref2")).isEqualByComparingTo("7");
	}

	@Test
	void aggregationIsAdditiveInEitherOrder() {
		BigDecimal a = new BigDecimal("10.10");
		BigDecimal b = new BigDecimal("5.25");

		assertThat(aggregateInOrder(a, b)).isEqualByComparingTo("115.35");
		assertThat(aggregateInOrder(b, a)).isEqualByComparingTo("115.35");
	}

	@Test
	void nonNumericAggregateCountsAsZeroWithWarning() {
		aggregates.put("ref1", "see note");
		ScriptedLlmProvider oracle = new ScriptedLlmProvider().thenReturn(match("ref1", 0.9));
		SourceEntry entry = new SourceEntry("invoices:2", "ACME", new BigDecimal("42"));

		Outcome outcome = engine(oracle).process(context, entry, CANDIDATES, CLIENTS);

		assertThat(outcome.kind()).isEqualTo(Outcome.Kind.ACCEPTED);
		assertThat(aggregates.raw("ref1")).isEqualTo("42");
		assertThat(auditSink.records().get(0).warning()).contains("not numeric");
		assertThat(auditSink.records().get(0).previousValue()).isEqualByComparingTo(BigDecimal.ZERO);
	}

	@Test
	void referenceSurvivesBlankFiltering() {
		List<CandidateRecord> candidates = new CandidateIndexer().build(List.of(
				ListCollection.of("Clients", "B", "Acme SRL", "", "Globex SA")));
		ScriptedLlmProvider oracle = new ScriptedLlmProvider().thenReturn(match(candidates.get(1).reference(), 0.9));
		SourceEntry entry = new SourceEntry("invoices:2", "GLOBEX S.A.", new BigDecimal("1"));

		engine(oracle).process(context, entry, candidates, CLIENTS);

		assertThat(candidates).hasSize(2);
		assertThat(entry.getMatchedReference()).isEqualTo("Clients:pl:B:4");
		assertThat(auditSink.records().get(0).matchedText()).isEqualTo("Globex SA");
	}

	@Test
	void oracleRetryRecoversAndDoubleFailureEndsNoMatch() {
		ScriptedLlmProvider oracle = new ScriptedLlmProvider()
				.thenFail(new OracleTransportException("timeout", null, null))
				.thenReturn(match("ref1", 0.9))
				.thenFail(new OracleTransportException("timeout", null, null))
				.thenFail(new OracleTransportException("timeout", null, null));
		SourceEntry recovered = new SourceEntry("invoices:2", "ACME", new BigDecimal("1"));
		SourceEntry failed = new SourceEntry("invoices:3", "ACME", new BigDecimal("1"));
		ReconciliationEngine engine = engine(oracle);

		engine.process(context, recovered, CANDIDATES, CLIENTS);
		Outcome outcome = engine.process(context, failed, CANDIDATES, CLIENTS);

		assertThat(recovered.getMatchStatus()).isEqualTo(MatchStatus.MATCHED);
		assertThat(failed.getMatchStatus()).isEqualTo(MatchStatus.NO_MATCH);
		assertThat(outcome.decision().explanation()).contains("oracle unavailable");
		assertThat(auditSink.records()).hasSize(2);
	}

	@Test
	void recordsOracleLatency() {
		ScriptedLlmProvider oracle = ScriptedLlmProvider.answering(prompt -> {
			clock.advance(Duration.ofMillis(250));
			return noMatch(0.1);
		});

		engine(oracle).process(context, new SourceEntry("invoices:2", "ACME", BigDecimal.ONE), CANDIDATES, CLIENTS);

		assertThat(auditSink.records().get(0).latencyMs()).isEqualTo(250L);
	}

	@Test
	void structuralProblemsFailFast() {
		ScriptedLlmProvider oracle = new ScriptedLlmProvider();
		ReconciliationEngine engine = engine(oracle);

		assertThatThrownBy(() -> engine.process(context, new SourceEntry("invoices:2", "ACME", BigDecimal.ONE), List.of(), CLIENTS))
				.isInstanceOf(ReconciliationValidationException.class);
		assertThatThrownBy(() -> engine.process(context, new SourceEntry("invoices:3", " ", BigDecimal.ONE), CANDIDATES, CLIENTS))
				.isInstanceOf(ReconciliationValidationException.class)
				.hasMessageContaining("invoices:3");
		assertThatThrownBy(() -> engine.process(context, new SourceEntry("invoices:4", "ACME", null), CANDIDATES, CLIENTS))
				.isInstanceOf(ReconciliationValidationException.class)
				.hasMessageContaining("amount");
		assertThat(oracle.prompts()).isEmpty();
		assertThat(auditSink.records()).isEmpty();
	}

	private BigDecimal aggregateInOrder(BigDecimal first, BigDecimal second) {
		MapAggregateStore store = new MapAggregateStore().put("ref1", "100");
		ScriptedLlmProvider oracle = ScriptedLlmProvider.answering(prompt -> match("ref1", 0.99));
		ReconciliationEngine engine = new ReconciliationEngine(oracleClient(oracle), store,
				new AuditLog(new RecordingAuditSink(), clock), clock);
		engine.process(context, new SourceEntry("invoices:2", "ACME", first), CANDIDATES, CLIENTS);
		engine.process(context, new SourceEntry("invoices:3", "ACME", second), CANDIDATES, CLIENTS);
		return store.get("ref1");
	}

	private ReconciliationEngine engine(ScriptedLlmProvider oracle) {
		return new ReconciliationEngine(oracleClient(oracle), aggregates, new AuditLog(auditSink, clock), clock);
	}

	private MatchOracleClient oracleClient(ScriptedLlmProvider oracle) {
		return new MatchOracleClient(oracle, new ObjectMapper(), RetryPolicy.fixed(2, Duration.ofSeconds(2), duration -> {
		}));
	}
}
