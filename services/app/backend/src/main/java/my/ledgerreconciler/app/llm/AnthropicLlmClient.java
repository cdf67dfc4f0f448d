package my.ledgerreconciler.app.llm;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientResponseException;

import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Anthropic Messages API client. The API has no structured output switch, so the schema travels in the
 * system prompt.
 */
public class AnthropicLlmClient implements LlmProvider {
	static final String API_VERSION = "2023-06-01";
	private static final Duration DEFAULT_CONNECT_TIMEOUT = Duration.ofSeconds(30);
	private static final Duration DEFAULT_READ_TIMEOUT = Duration.ofMinutes(2);
	private static final int DEFAULT_MAX_TOKENS = 512;

	private final RestClient restClient;
	private final ObjectMapper objectMapper;
	private final String model;
	private final int maxTokens;

	public AnthropicLlmClient(String baseUrl, String apiKey, String model, ObjectMapper objectMapper) {
		this(baseUrl, apiKey, model, DEFAULT_MAX_TOKENS, DEFAULT_CONNECT_TIMEOUT, DEFAULT_READ_TIMEOUT, objectMapper);
	}

	public AnthropicLlmClient(String baseUrl,
							  String apiKey,
							  String model,
							  Integer maxTokens,
							  Duration connectTimeout,
							  Duration readTimeout,
							  ObjectMapper objectMapper) {
		SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
		requestFactory.setConnectTimeout(connectTimeout == null ? DEFAULT_CONNECT_TIMEOUT : connectTimeout);
		requestFactory.setReadTimeout(readTimeout == null ? DEFAULT_READ_TIMEOUT : readTimeout);
		this.restClient = RestClient.builder()
				.baseUrl(baseUrl)
				.requestFactory(requestFactory)
				.defaultHeader("x-api-key", apiKey)
				.defaultHeader("anthropic-version", API_VERSION)
				.defaultHeader(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
				.build();
		this.objectMapper = objectMapper;
		this.model = model;
		this.maxTokens = maxTokens == null || maxTokens < 1 ? DEFAULT_MAX_TOKENS : maxTokens;
	}

	@Override
	public LlmResponse runJsonPrompt(String prompt, String schemaName, Map<String, Object> schema) {
		Map<String, Object> request = new HashMap<>();
		request.put("model", model);
		request.put("max_tokens", maxTokens);
		request.put("temperature", 0);
		request.put("system", buildSystemPrompt(schema));
		request.put("messages", List.of(Map.of("role", "user", "content", prompt)));
		Map<?, ?> response;
		try {
			response = restClient.post().uri("/v1/messages").body(request).retrieve().body(Map.class);
		} catch (RestClientResponseException ex) {
			throw new OracleTransportException(OpenAiLlmClient.safeMessage(ex), ex.getStatusCode().value(), ex);
		} catch (ResourceAccessException ex) {
			throw new OracleTransportException(OpenAiLlmClient.safeMessage(ex), null, ex);
		} catch (Exception ex) {
			throw new OracleTransportException(OpenAiLlmClient.safeMessage(ex), null, ex);
		}
		String text = extractText(response);
		if (text == null || text.isBlank()) {
			throw new OracleSchemaException("No text content in Anthropic response", OracleSchemaException.EMPTY_OUTPUT);
		}
		return new LlmResponse(text, model);
	}

	private String buildSystemPrompt(Map<String, Object> schema) {
		StringBuilder system = new StringBuilder("Reply only with a single JSON object. No Markdown, no prose.");
		if (schema != null) {
			try {
				system.append("\nThe object must conform to this JSON schema:\n").append(objectMapper.writeValueAsString(schema));
			} catch (JsonProcessingException ex) {
				throw new IllegalStateException("Failed to serialize response schema", ex);
			}
		}
		return system.toString();
	}

	private String extractText(Map<?, ?> response) {
		if (response == null || !(response.get("content") instanceof List<?> content)) {
			return null;
		}
		StringBuilder combined = new StringBuilder();
		for (Object block : content) {
			if (!(block instanceof Map<?, ?> blockMap) || !"text".equals(String.valueOf(blockMap.get("type")))) {
				continue;
			}
			Object text = blockMap.get("text");
			if (text != null) {
				combined.append(text);
			}
		}
		return combined.toString();
	}
}
