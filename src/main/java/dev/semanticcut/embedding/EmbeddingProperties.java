package dev.semanticcut.embedding;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Settings for the OpenAI-compatible embeddings endpoint, bound from {@code
 * semanticcut.embedding.*}.
 *
 * @param apiKey bearer token; blank disables embedding (searches and indexing then fail)
 * @param baseUrl endpoint root, e.g. {@code https://openrouter.ai/api/v1}
 * @param model embedding model id
 * @param dimension vector size produced by the model
 * @param timeout read timeout per request
 */
@ConfigurationProperties(prefix = "semanticcut.embedding")
public record EmbeddingProperties(
    String apiKey, String baseUrl, String model, int dimension, Duration timeout) {

  public boolean hasApiKey() {
    return apiKey != null && !apiKey.isBlank();
  }
}
