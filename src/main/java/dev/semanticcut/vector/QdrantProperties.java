package dev.semanticcut.vector;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Qdrant connection settings, bound from {@code semanticcut.qdrant.*}.
 *
 * @param url REST endpoint, e.g. {@code http://localhost:6333}
 * @param apiKey optional API key sent as the {@code api-key} header
 * @param collection collection holding one point per clip
 * @param timeout connect and read timeout
 */
@ConfigurationProperties(prefix = "semanticcut.qdrant")
public record QdrantProperties(String url, String apiKey, String collection, Duration timeout) {

  public boolean hasApiKey() {
    return apiKey != null && !apiKey.isBlank();
  }
}
