package my.ledgerreconciler.app.llm;

import java.util.Map;

public class NoopLlmClient implements LlmProvider {
	@Override
	public LlmResponse runJsonPrompt(String prompt, String schemaName, Map<String, Object> schema) {
		throw new OracleTransportException("LLM disabled", null, null);
	}
}
