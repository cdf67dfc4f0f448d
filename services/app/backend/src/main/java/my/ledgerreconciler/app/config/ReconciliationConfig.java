package my.ledgerreconciler.app.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import my.ledgerreconciler.app.domain.BatchSettings;
import my.ledgerreconciler.app.domain.MatchPolicy;
import my.ledgerreconciler.app.ledger.CollectionLayout;
import my.ledgerreconciler.app.ledger.ProgressSink;
import my.ledgerreconciler.app.ledger.TransactionColumns;
import my.ledgerreconciler.app.llm.LlmProvider;
import my.ledgerreconciler.app.service.BatchPlanner;
import my.ledgerreconciler.app.service.CandidateIndexer;
import my.ledgerreconciler.app.service.LoggingProgressSink;
import my.ledgerreconciler.app.service.MatchOracleClient;
import my.ledgerreconciler.app.service.ReconciliationSettings;
import my.ledgerreconciler.app.service.RetryPolicy;
import my.ledgerreconciler.app.service.Sleeper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

@Configuration
public class ReconciliationConfig {
	private static final Logger logger = LoggerFactory.getLogger(ReconciliationConfig.class);

	@Bean
	@ConditionalOnMissingBean(Clock.class)
	public Clock clock() {
		return Clock.systemUTC();
	}

	@Bean
	@ConditionalOnMissingBean(Sleeper.class)
	public Sleeper sleeper() {
		return Sleeper.SYSTEM;
	}

	@Bean
	public RetryPolicy oracleRetryPolicy(AppProperties properties, Sleeper sleeper) {
		AppProperties.Reconciliation.Retry retry = reconciliation(properties).retry();
		int maxAttempts = retry == null || retry.maxAttempts() == null ? 2 : retry.maxAttempts();
		Duration delay = retry == null || retry.delay() == null ? Duration.ofSeconds(2) : retry.delay();
		double multiplier = retry == null || retry.backoffMultiplier() == null ? 1.0 : retry.backoffMultiplier();
		return new RetryPolicy(maxAttempts, delay, multiplier, sleeper);
	}

	@Bean
	public MatchOracleClient matchOracleClient(LlmProvider llmProvider, ObjectMapper objectMapper, RetryPolicy oracleRetryPolicy) {
		return new MatchOracleClient(llmProvider, objectMapper, oracleRetryPolicy);
	}

	@Bean
	public CandidateIndexer candidateIndexer() {
		return new CandidateIndexer();
	}

	@Bean
	public BatchPlanner batchPlanner() {
		return new BatchPlanner();
	}

	@Bean
	@ConditionalOnMissingBean(ProgressSink.class)
	public ProgressSink progressSink() {
		return new LoggingProgressSink();
	}

	@Bean
	public ReconciliationSettings reconciliationSettings(AppProperties properties) {
		AppProperties.Reconciliation reconciliation = reconciliation(properties);
		AppProperties.Ledgers ledgers = properties.ledgers();
		if (ledgers == null || ledgers.transactions() == null || ledgers.reference() == null) {
			throw new IllegalStateException("app.ledgers.transactions and app.ledgers.reference are required");
		}
		AppProperties.Ledgers.Transactions transactions = ledgers.transactions();
		TransactionColumns columns = new TransactionColumns(transactions.nameColumn(), transactions.amountColumn(),
				transactions.statusColumn(), transactions.referenceColumn());

		List<CollectionLayout> layouts = new ArrayList<>();
		if (ledgers.reference().collections() != null) {
			for (AppProperties.Ledgers.Reference.Collection collection : ledgers.reference().collections()) {
				layouts.add(new CollectionLayout(collection.name(), orDefault(collection.nameColumn(), "A"),
						collection.firstRow() == null ? 2 : collection.firstRow(), collection.lastRow()));
			}
		}

		Map<String, MatchPolicy> policies = new LinkedHashMap<>();
		if (reconciliation.policies() != null) {
			reconciliation.policies().forEach((name, policy) -> {
				String key = name.toLowerCase(Locale.ROOT);
				double threshold = policy.threshold() == null ? 0.8 : policy.threshold();
				policies.put(key, new MatchPolicy(key, threshold, policy.collections()));
			});
		}
		if (policies.isEmpty()) {
			logger.warn("No match policies configured (app.reconciliation.policies); every run will be rejected.");
		}

		BatchSettings batch = new BatchSettings(
				reconciliation.batchSize() == null ? BatchSettings.DEFAULT_BATCH_SIZE : reconciliation.batchSize(),
				reconciliation.perCallDelay() == null ? Duration.ofSeconds(1) : reconciliation.perCallDelay(),
				reconciliation.perBatchDelay() == null ? Duration.ofSeconds(5) : reconciliation.perBatchDelay());
		String auditPath = ledgers.audit() == null ? null : ledgers.audit().path();
		ReconciliationSettings settings = new ReconciliationSettings(
				Path.of(requirePath(transactions.path(), "app.ledgers.transactions.path")),
				columns,
				Path.of(requirePath(ledgers.reference().path(), "app.ledgers.reference.path")),
				layouts,
				Path.of(orDefault(auditPath, "data/audit.csv")),
				batch,
				reconciliation.testModeLimit() == null ? ReconciliationSettings.DEFAULT_TEST_MODE_LIMIT : reconciliation.testModeLimit(),
				policies);
		logger.info("Reconciliation configured: transactions={}, reference={}, policies={}, batch={}",
				settings.transactionsPath(), settings.referencePath(), policies.keySet(), batch);
		return settings;
	}

	private static AppProperties.Reconciliation reconciliation(AppProperties properties) {
		AppProperties.Reconciliation reconciliation = properties.reconciliation();
		return reconciliation == null ? new AppProperties.Reconciliation(null, null, null, null, null, null) : reconciliation;
	}

	private static String requirePath(String value, String property) {
		if (value == null || value.isBlank()) {
			throw new IllegalStateException(property + " is required");
		}
		return value.trim();
	}

	private static String orDefault(String value, String fallback) {
		return value == null || value.isBlank() ? fallback : value.trim();
	}
}
