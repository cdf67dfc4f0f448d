package my.ledgerreconciler.app.llm;

import java.util.Map;

public interface LlmProvider {
	/**
	 * Sends one prompt and asks for a single JSON object back.
	 *
	 * @param schemaName name of the structured output format, if the provider supports one
	 * @param schema     JSON schema of the expected object; may be ignored by providers without structured output
	 * @throws OracleTransportException when the call cannot complete
	 * @throws OracleSchemaException    when the provider answered without any usable text
	 */
	LlmResponse runJsonPrompt(String prompt, String schemaName, Map<String, Object> schema);
}
