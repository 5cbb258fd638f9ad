package dev.semanticcut.search;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Remote reranking API settings, bound from {@code semanticcut.reranker.*}.
 *
 * @param apiKey bearer token; blank means results keep their vector order
 * @param baseUrl API root exposing {@code /rerank}
 * @param model reranker model id
 * @param timeout read timeout
 */
@ConfigurationProperties(prefix = "semanticcut.reranker")
public record RerankerProperties(String apiKey, String baseUrl, String model, Duration timeout) {

  public boolean hasApiKey() {
    return apiKey != null && !apiKey.isBlank();
  }
}
