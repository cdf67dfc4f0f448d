package my.ledgerreconciler.app.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import my.ledgerreconciler.app.llm.AnthropicLlmClient;
import my.ledgerreconciler.app.llm.LlmProvider;
import my.ledgerreconciler.app.llm.NoopLlmClient;
import my.ledgerreconciler.app.llm.OpenAiLlmClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

@Configuration
public class LlmConfig {
	private static final Logger logger = LoggerFactory.getLogger(LlmConfig.class);

	@Bean
	@ConditionalOnProperty(name = "app.llm.provider", havingValue = "openai")
	public OpenAiLlmClient openAiLlmClient(AppProperties properties) {
		AppProperties.Llm.OpenAi openai = properties.llm().openai();
		if (openai == null || isBlank(openai.apiKey())) {
			throw new IllegalStateException("app.llm.openai.api-key is required for provider openai");
		}
		String baseUrl = isBlank(openai.baseUrl()) ? "https://api.openai.com/v1" : openai.baseUrl();
		String model = isBlank(openai.model()) ? "gpt-5-mini" : openai.model();
		logger.info("LLM client enabled (provider=openai, model={}).", model);
		return new OpenAiLlmClient(baseUrl, openai.apiKey(), model,
				seconds(openai.connectTimeoutSeconds(), 30),
				seconds(openai.readTimeoutSeconds(), 120));
	}

	@Bean
	@ConditionalOnProperty(name = "app.llm.provider", havingValue = "anthropic")
	public AnthropicLlmClient anthropicLlmClient(AppProperties properties, ObjectMapper objectMapper) {
		AppProperties.Llm.Anthropic anthropic = properties.llm().anthropic();
		if (anthropic == null || isBlank(anthropic.apiKey())) {
			throw new IllegalStateException("app.llm.anthropic.api-key is required for provider anthropic");
		}
		String baseUrl = isBlank(anthropic.baseUrl()) ? "https://api.anthropic.com" : anthropic.baseUrl();
		String model = isBlank(anthropic.model()) ? "claude-3-5-haiku-latest" : anthropic.model();
		logger.info("LLM client enabled (provider=anthropic, model={}).", model);
		return new AnthropicLlmClient(baseUrl, anthropic.apiKey(), model, anthropic.maxTokens(),
				seconds(anthropic.connectTimeoutSeconds(), 30),
				seconds(anthropic.readTimeoutSeconds(), 120),
				objectMapper);
	}

	@Bean
	@ConditionalOnMissingBean(LlmProvider.class)
	public NoopLlmClient noopLlmClient() {
		logger.info("LLM client disabled (provider=noop). Every entry will end as no match.");
		return new NoopLlmClient();
	}

	private static Duration seconds(Integer value, int fallback) {
		return Duration.ofSeconds(value == null || value < 1 ? fallback : value);
	}

	private static boolean isBlank(String value) {
		return value == null || value.isBlank();
	}
}
