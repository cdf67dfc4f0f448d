package my.ledgerreconciler.app.service;

import my.ledgerreconciler.app.domain.CandidateRecord;
import my.ledgerreconciler.app.domain.MatchPolicy;
import my.ledgerreconciler.app.domain.RunContext;
import my.ledgerreconciler.app.domain.RunMode;
import my.ledgerreconciler.app.domain.RunSummary;
import my.ledgerreconciler.app.domain.SourceEntry;
import my.ledgerreconciler.app.ledger.AggregateStore;
import my.ledgerreconciler.app.ledger.CsvAuditSink;
import my.ledgerreconciler.app.ledger.ProgressSink;
import my.ledgerreconciler.app.ledger.ReferenceLedger;
import my.ledgerreconciler.app.ledger.TransactionLedger;
import my.ledgerreconciler.app.ledger.Worksheet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.locks.ReentrantLock;

@Service
public class ReconciliationService {
	private static final Logger logger = LoggerFactory.getLogger(ReconciliationService.class);

	private final ReconciliationSettings settings;
	private final MatchOracleClient oracle;
	private final CandidateIndexer indexer;
	private final BatchPlanner planner;
	private final Sleeper sleeper;
	private final Clock clock;
	private final ProgressSink progressSink;
	private final ReentrantLock runLock = new ReentrantLock();

	public ReconciliationService(ReconciliationSettings settings,
								 MatchOracleClient oracle,
								 CandidateIndexer indexer,
								 BatchPlanner planner,
								 Sleeper sleeper,
								 Clock clock,
								 ProgressSink progressSink) {
		this.settings = settings;
		this.oracle = oracle;
		this.indexer = indexer;
		this.planner = planner;
		this.sleeper = sleeper;
		this.clock = clock;
		this.progressSink = progressSink;
	}

	public List<MatchPolicy> policies() {
		return List.copyOf(settings.policies().values());
	}

	public MatchPolicy resolvePolicy(String name) {
		if (name == null || name.isBlank()) {
			throw new ReconciliationValidationException("Policy is required");
		}
		MatchPolicy policy = settings.policies().get(name.trim().toLowerCase(Locale.ROOT));
		if (policy == null) {
			throw new ReconciliationValidationException("Unknown policy " + name.trim()
					+ " (configured: " + settings.policies().keySet() + ")");
		}
		return policy;
	}

	public RunSummary startReconciliation(String period, String policyName, RunMode mode) {
		return startReconciliation(period, resolvePolicy(policyName), mode);
	}

	/**
	 * Reconciles the transaction ledger into the given period column of the reference ledger.
	 * Only one run may be active at a time.
	 *
	 * @throws ReconciliationValidationException when the ledgers or the candidate set are unusable
	 * @throws ReconciliationAbortedException    when the run stopped early; committed work is kept
	 * @throws ReconciliationInProgressException when another run is active
	 */
	public RunSummary startReconciliation(String period, MatchPolicy policy, RunMode mode) {
		String trimmedPeriod = period == null ? "" : period.trim();
		if (trimmedPeriod.isEmpty()) {
			throw new ReconciliationValidationException("Period is required");
		}
		if (policy == null) {
			throw new ReconciliationValidationException("Policy is required");
		}
		RunMode runMode = mode == null ? RunMode.TEST : mode;
		if (!runLock.tryLock()) {
			throw new ReconciliationInProgressException("A reconciliation run is already in progress");
		}
		try {
			return run(trimmedPeriod, policy, runMode);
		} finally {
			runLock.unlock();
		}
	}

	private RunSummary run(String period, MatchPolicy policy, RunMode mode) {
		RunContext context = RunContext.start(period, policy.name(), clock);
		logger.info("Starting reconciliation run {} for {} (policy {}, threshold {}, mode {})",
				context.runId(), period, policy.name(), policy.threshold(), mode);

		TransactionLedger transactions = TransactionLedger.load(settings.transactionsPath(), settings.transactionColumns());
		ReferenceLedger reference = ReferenceLedger.load(settings.referencePath(), settings.collections());
		AggregateStore aggregates = reference.aggregateStore(period);
		List<CandidateRecord> candidates = indexer.build(reference.collections(policy.collections()));
		if (candidates.isEmpty()) {
			throw new ReconciliationValidationException("No candidates found in " + policy.collections());
		}
		List<SourceEntry> selected = select(transactions.entries(), mode);
		logger.info("Run {}: {} candidates, {} of {} entries selected", context.runId(), candidates.size(),
				selected.size(), transactions.entries().size());

		AuditLog auditLog = new AuditLog(new CsvAuditSink(settings.auditPath()), clock);
		ReconciliationEngine engine = new ReconciliationEngine(oracle, aggregates, auditLog, clock);
		BatchScheduler scheduler = new BatchScheduler(engine, planner, sleeper, clock);
		Runnable checkpoint = () -> {
			transactions.flush();
			Worksheet.saveAll(List.of(reference.worksheet(), transactions.worksheet()));
		};

		RunSummary summary;
		try {
			summary = scheduler.run(selected, new ReconciliationJob(context, candidates, policy, checkpoint),
					settings.batch(), progressSink);
		} catch (RuntimeException ex) {
			try {
				checkpoint.run();
			} catch (RuntimeException saveFailure) {
				ex.addSuppressed(saveFailure);
			}
			throw ex;
		}
		summary = finalCheckpoint(context, summary, checkpoint);
		if (summary.aborted()) {
			throw new ReconciliationAbortedException(summary);
		}
		return summary;
	}

	private RunSummary finalCheckpoint(RunContext context, RunSummary summary, Runnable checkpoint) {
		try {
			checkpoint.run();
			return summary;
		} catch (RuntimeException ex) {
			logger.error("Run {}: saving the ledgers failed: {}", context.runId(), ex.getMessage(), ex);
			List<String> errors = new ArrayList<>(summary.errors());
			errors.add("final checkpoint: " + ex.getMessage());
			return new RunSummary(summary.runId(), summary.processed(), summary.matched(), summary.skipped(),
					summary.elapsedMs(), errors);
		}
	}

	List<SourceEntry> select(List<SourceEntry> entries, RunMode mode) {
		if (mode == RunMode.FULL) {
			return entries;
		}
		List<SourceEntry> selected = new ArrayList<>();
		int eligible = 0;
		for (SourceEntry entry : entries) {
			if (eligible >= settings.testModeLimit()) {
				break;
			}
			selected.add(entry);
			if (!entry.isMatched()) {
				eligible++;
			}
		}
		return selected;
	}
}
