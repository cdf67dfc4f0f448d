package my.ledgerreconciler.app.llm;

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
 * OpenAI Responses API client with JSON schema structured output.
 */
public class OpenAiLlmClient implements LlmProvider {
    private static final Duration DEFAULT_CONNECT_TIMEOUT = Duration.ofSeconds(30);
    private static final Duration DEFAULT_READ_TIMEOUT = Duration.ofMinutes(2);
    private static final String SYSTEM_PROMPT = "Respond in JSON only. Do not wrap in Markdown code fences.";
    private final RestClient restClient;
    private final String model;

    public OpenAiLlmClient(String baseUrl, String apiKey, String model) {
        this(baseUrl, apiKey, model, DEFAULT_CONNECT_TIMEOUT, DEFAULT_READ_TIMEOUT);
    }

    public OpenAiLlmClient(String baseUrl, String apiKey, String model, Duration connectTimeout, Duration readTimeout) {
        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout(connectTimeout == null ? DEFAULT_CONNECT_TIMEOUT : connectTimeout);
        requestFactory.setReadTimeout(readTimeout == null ? DEFAULT_READ_TIMEOUT : readTimeout);
        this.restClient = RestClient.builder()
                .baseUrl(baseUrl)
                .requestFactory(requestFactory)
                .defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + apiKey)
                .defaultHeader(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                .build();
        this.model = model;
    }

    @Override
    public LlmResponse runJsonPrompt(String prompt, String schemaName, Map<String, Object> schema) {
        Map<String, Object> request = new HashMap<>();
        request.put("model", model);
        request.put("input", List.of(
                Map.of("role", "system", "content", SYSTEM_PROMPT),
                Map.of("role", "user", "content", prompt)
        ));
        request.put("reasoning", Map.of("effort", "low"));
        if (schemaName != null && schema != null) {
            request.put("text", Map.of("format", Map.of(
                    "type", "json_schema",
                    "name", schemaName,
                    "schema", schema,
                    "strict", true
            )));
        }
        return callResponsesApi(request);
    }

    private LlmResponse callResponsesApi(Map<String, Object> request) {
        Map<?, ?> response;
        try {
            response = restClient.post().uri("/responses").body(request).retrieve().body(Map.class);
        } catch (RestClientResponseException ex) {
            throw new OracleTransportException(safeMessage(ex), ex.getStatusCode().value(), ex);
        } catch (ResourceAccessException ex) {
            throw new OracleTransportException(safeMessage(ex), null, ex);
        } catch (Exception ex) {
            throw new OracleTransportException(safeMessage(ex), null, ex);
        }
        String text = extractOutputText(response);
        if (text == null || text.isBlank()) {
            throw new OracleSchemaException("No output_text in OpenAI response", OracleSchemaException.EMPTY_OUTPUT);
        }
        return new LlmResponse(text, model);
    }

    private String extractOutputText(Map<?, ?> response) {
        if (response == null) {
            return null;
        }
        Object outputText = response.get("output_text");
        if (outputText instanceof String text && !text.isBlank()) {
            return text;
        }
        if (!(response.get("output") instanceof List<?> outputList)) {
            return null;
        }
        StringBuilder combined = new StringBuilder();
        for (Object outputItem : outputList) {
            if (!(outputItem instanceof Map<?, ?> outputMap) || !(outputMap.get("content") instanceof List<?> contentList)) {
                continue;
            }
            for (Object contentItem : contentList) {
                if (!(contentItem instanceof Map<?, ?> contentMap)) {
                    continue;
                }
                Object type = contentMap.get("type");
                Object text = contentMap.get("text");
                if (text == null || (type != null && !"output_text".equals(type.toString()))) {
                    continue;
                }
                if (combined.length() > 0) {
                    combined.append("\n");
                }
                combined.append(text);
            }
        }
        return combined.toString();
    }

    static String safeMessage(Exception ex) {
        if (ex == null) {
            return "Unknown error";
        }
        String message = ex.getMessage();
        if (message == null || message.isBlank()) {
            message = ex.getClass().getSimpleName();
        }
        return message;
    }
}
