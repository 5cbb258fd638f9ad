package dev.semanticcut.query;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Chat model used for query understanding, bound from {@code semanticcut.llm.*}.
 *
 * @param apiKey bearer token; when blank no chat model is created and every query falls back to
 *     its raw text
 * @param baseUrl OpenAI-compatible API root
 * @param model chat model id
 * @param temperature sampling temperature
 * @param maxTokens completion token cap
 * @param timeout request timeout
 */
@ConfigurationProperties(prefix = "semanticcut.llm")
public record LlmProperties(
    String apiKey,
    String baseUrl,
    String model,
    double temperature,
    int maxTokens,
    Duration timeout) {}
