package my.ledgerreconciler.app.service;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.networknt.schema.JsonSchema;
import com.networknt.schema.JsonSchemaFactory;
import com.networknt.schema.SpecVersion;
import com.networknt.schema.ValidationMessage;
import my.ledgerreconciler.app.domain.CandidateRecord;
import my.ledgerreconciler.app.domain.MatchDecision;
import my.ledgerreconciler.app.llm.LlmProvider;
import my.ledgerreconciler.app.llm.LlmResponse;
import my.ledgerreconciler.app.llm.OracleSchemaException;
import my.ledgerreconciler.app.llm.OracleTransportException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Asks the matching oracle which candidate, if any, names the same entity as a query.
 * Transport and schema failures are retried by the {@link RetryPolicy}; once attempts run out a degraded
 * no-match decision is returned instead of an exception.
 */
public class MatchOracleClient {
	private static final Logger logger = LoggerFactory.getLogger(MatchOracleClient.class);
	static final String SCHEMA_NAME = "reconciliation_match";
	private static final String RESPONSE_SCHEMA_JSON = """
			{
			  "type": "object",
			  "additionalProperties": false,
			  "required": ["matched","reference","confidence","explanation"],
			  "properties": {
			    "matched": { "type": "boolean" },
			    "reference": { "type": ["string","null"] },
			    "confidence": { "type": "number" },
			    "explanation": { "type": ["string","null"] }
			  }
			}
			""";
	private static final String DECISION_SCHEMA_JSON = """
			{
			  "$schema": "https://json-schema.org/draft/2020-12/schema",
			  "type": "object",
			  "required": ["matched","confidence"],
			  "properties": {
			    "matched": { "type": "boolean" },
			    "reference": { "type": ["string","null"] },
			    "confidence": { "type": "number", "minimum": 0, "maximum": 1 },
			    "explanation": { "type": ["string","null"] }
			  }
			}
			""";

	private final LlmProvider llmProvider;
	private final ObjectMapper objectMapper;
	private final RetryPolicy retryPolicy;
	private final JsonSchema decisionSchema;
	private final Map<String, Object> responseSchema;

	public MatchOracleClient(LlmProvider llmProvider, ObjectMapper objectMapper, RetryPolicy retryPolicy) {
		this.llmProvider = llmProvider;
		this.objectMapper = objectMapper;
		this.retryPolicy = retryPolicy;
		this.decisionSchema = buildDecisionSchema(objectMapper);
		this.responseSchema = buildResponseSchema(objectMapper);
	}

	public MatchDecision findBestMatch(String query, List<CandidateRecord> candidates) {
		if (candidates == null || candidates.isEmpty()) {
			throw new ReconciliationValidationException("No candidates to match '" + query + "' against");
		}
		Set<String> references = candidates.stream().map(CandidateRecord::reference).collect(Collectors.toSet());
		String prompt = buildPrompt(query, candidates);
		logger.debug("Asking oracle about '{}' against {} candidates", query, candidates.size());
		try {
			return retryPolicy.execute(() -> requestDecision(prompt, references), MatchOracleClient::isRetryable);
		} catch (OracleTransportException ex) {
			logger.warn("Oracle unreachable for '{}' (status {}): {}", query, ex.getStatusCode(), ex.getMessage());
			return MatchDecision.degraded(ex.getMessage());
		} catch (OracleSchemaException ex) {
			logger.warn("Oracle answered out of contract for '{}' ({}): {}", query, ex.getErrorCode(), ex.getMessage());
			return MatchDecision.degraded(ex.getMessage());
		} catch (InterruptedException ex) {
			Thread.currentThread().interrupt();
			return MatchDecision.degraded("interrupted");
		}
	}

	private static boolean isRetryable(RuntimeException ex) {
		return ex instanceof OracleTransportException || ex instanceof OracleSchemaException;
	}

	private MatchDecision requestDecision(String prompt, Set<String> references) {
		LlmResponse response = llmProvider.runJsonPrompt(prompt, SCHEMA_NAME, responseSchema);
		logger.debug("Oracle ({}) answered: {}", response == null ? null : response.model(),
				response == null ? null : response.output());
		JsonNode root = parseJson(response == null ? null : response.output());
		Set<ValidationMessage> errors = decisionSchema.validate(root);
		if (!errors.isEmpty()) {
			String summary = errors.stream().map(ValidationMessage::getMessage).sorted().collect(Collectors.joining("; "));
			throw new OracleSchemaException("Match JSON did not match schema: " + summary, OracleSchemaException.INVALID_OUTPUT);
		}
		boolean matched = root.get("matched").booleanValue();
		double confidence = root.get("confidence").doubleValue();
		String reference = textOrNull(root, "reference");
		String explanation = textOrNull(root, "explanation");
		if (matched && (reference == null || !references.contains(reference))) {
			throw new OracleSchemaException("Oracle matched unknown reference " + reference,
					OracleSchemaException.UNKNOWN_REFERENCE);
		}
		return new MatchDecision(matched, reference, confidence, explanation);
	}

	String buildPrompt(String query, List<CandidateRecord> candidates) {
		ObjectNode payload = objectMapper.createObjectNode();
		payload.put("query", query);
		ArrayNode list = payload.putArray("candidates");
		for (CandidateRecord candidate : candidates) {
			list.addObject().put("reference", candidate.reference()).put("text", candidate.text());
		}
		String json;
		try {
			json = objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(payload);
		} catch (Exception ex) {
			throw new IllegalStateException("Failed to serialize match request", ex);
		}
		return """
				Decide whether the query names the same company or person as one of the candidates.
				Names come from invoices and a profit-and-loss sheet and are written inconsistently.

				Rules:
				- Ignore case, spacing, punctuation and diacritics.
				- Treat legal-form variants as equal (SRL, S.R.L., SA, S.A., LLC, GmbH, Ltd and similar).
				- Names may be written in Romanian, English or another language; translations and abbreviations count.
				- Pick the single closest candidate. If none plausibly names the same entity, answer matched=false.
				- Copy the chosen reference exactly as given. Never answer with a position or line number.
				- confidence is a number between 0 and 1.

				Reply only with a JSON object:
				{"matched": true|false, "reference": "<reference>"|null, "confidence": 0.0-1.0, "explanation": "<short reason>"}

				---BEGIN REQUEST---
				%s
				---END REQUEST---
				""".formatted(json);
	}

	private JsonNode parseJson(String raw) {
		if (raw == null || raw.isBlank()) {
			throw new OracleSchemaException("Empty oracle output", OracleSchemaException.EMPTY_OUTPUT);
		}
		try {
			return objectMapper.readTree(stripCodeFence(raw));
		} catch (Exception ex) {
			logger.debug("Could not parse raw oracle response {}", raw, ex);
			throw new OracleSchemaException("Oracle output is not valid JSON", OracleSchemaException.INVALID_OUTPUT, ex);
		}
	}

	static String stripCodeFence(String raw) {
		String text = raw.trim();
		if (!text.startsWith("```")) {
			return text;
		}
		int firstLineEnd = text.indexOf('\n');
		if (firstLineEnd < 0) {
			return text;
		}
		text = text.substring(firstLineEnd + 1);
		int fenceEnd = text.lastIndexOf("```");
		if (fenceEnd >= 0) {
			text = text.substring(0, fenceEnd);
		}
		return text.trim();
	}

	private String textOrNull(JsonNode node, String field) {
		JsonNode value = node.get(field);
		if (value == null || value.isNull() || !value.isTextual()) {
			return null;
		}
		String text = value.asText().trim();
		return text.isEmpty() ? null : text;
	}

	private JsonSchema buildDecisionSchema(ObjectMapper mapper) {
		try {
			JsonNode schemaNode = mapper.readTree(DECISION_SCHEMA_JSON);
			return JsonSchemaFactory.getInstance(SpecVersion.VersionFlag.V202012).getSchema(schemaNode);
		} catch (Exception ex) {
			logger.error("Failed to load match decision JSON schema", ex);
			throw new IllegalStateException("Failed to load match decision schema");
		}
	}

	private Map<String, Object> buildResponseSchema(ObjectMapper mapper) {
		try {
			return mapper.readValue(RESPONSE_SCHEMA_JSON, new TypeReference<Map<String, Object>>() {});
		} catch (Exception ex) {
			logger.error("Failed to load match response JSON schema", ex);
			throw new IllegalStateException("Failed to load match response schema");
		}
	}
}
