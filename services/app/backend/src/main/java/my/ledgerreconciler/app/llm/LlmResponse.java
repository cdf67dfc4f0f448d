package my.ledgerreconciler.app.llm;

public record LlmResponse(String output, String model) {
}
