package my.ledgerreconciler.app.config;

import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.List;
import java.util.Map;

@Validated
@ConfigurationProperties(prefix = "app")
public record AppProperties(
		Llm llm,
		Reconciliation reconciliation,
		Ledgers ledgers
) {
	public record Llm(
			@NotBlank String provider,
			OpenAi openai,
			Anthropic anthropic
	) {
		public record OpenAi(
				String apiKey,
				String baseUrl,
				String model,
				Integer connectTimeoutSeconds,
				Integer readTimeoutSeconds
		) {
		}

		public record Anthropic(
				String apiKey,
				String baseUrl,
				String model,
				Integer maxTokens,
				Integer connectTimeoutSeconds,
				Integer readTimeoutSeconds
		) {
		}
	}

	public record Reconciliation(
			Integer batchSize,
			Duration perCallDelay,
			Duration perBatchDelay,
			Integer testModeLimit,
			Retry retry,
			Map<String, Policy> policies
	) {
		public record Retry(
				Integer maxAttempts,
				Duration delay,
				Double backoffMultiplier
		) {
		}

		public record Policy(
				Double threshold,
				List<String> collections
		) {
		}
	}

	public record Ledgers(
			Transactions transactions,
			Reference reference,
			Audit audit
	) {
		public record Transactions(
				String path,
				String nameColumn,
				String amountColumn,
				String statusColumn,
				String referenceColumn
		) {
		}

		public record Reference(
				String path,
				List<Collection> collections
		) {
			public record Collection(
					String name,
					String nameColumn,
					Integer firstRow,
					Integer lastRow
			) {
			}
		}

		public record Audit(
				String path
		) {
		}
	}
}
