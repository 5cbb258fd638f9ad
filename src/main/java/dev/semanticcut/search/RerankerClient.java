package dev.semanticcut.search;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Comparator;
import java.util.List;
import java.util.stream.IntStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;

/**
 * HTTP client for a cross-encoder reranking API ({@code POST /rerank}, SiliconFlow-compatible).
 *
 * <p>Never fails. Without an API key, or on any transport or provider error, it returns the
 * identity ranking {@code 0..min(n, topN)-1} with score 0.0 so the caller keeps vector order.
 */
@Component
public class RerankerClient {

  private static final Logger log = LoggerFactory.getLogger(RerankerClient.class);

  static final String RERANK_PATH = "/rerank";

  private final RestClient restClient;
  private final RerankerProperties properties;

  public RerankerClient(
      @Qualifier("rerankerRestClient") RestClient restClient, RerankerProperties properties) {
    this.restClient = restClient;
    this.properties = properties;
  }

  /**
   * Scores documents against a query.
   *
   * @param query the rerank query
   * @param documents candidate texts, in candidate order
   * @param topN maximum number of items to return
   * @return items sorted by score descending; indices refer to {@code documents}
   */
  public List<RerankedItem> rerank(String query, List<String> documents, int topN) {
    if (documents.isEmpty()) {
      return List.of();
    }
    if (!properties.hasApiKey()) {
      log.warn("Reranker API key not set; keeping vector order");
      return identity(documents.size(), topN);
    }

    try {
      RerankResponse response =
          restClient
              .post()
              .uri(RERANK_PATH)
              .body(new RerankRequest(properties.model(), query, documents, false, topN))
              .retrieve()
              .body(RerankResponse.class);
      if (response == null || response.results() == null) {
        log.warn("Reranker returned no results; keeping vector order");
        return identity(documents.size(), topN);
      }
      List<RerankedItem> items =
          response.results().stream()
              .map(r -> new RerankedItem(r.index(), r.relevanceScore()))
              .sorted(Comparator.comparingDouble(RerankedItem::score).reversed())
              .toList();
      log.debug("Reranked {} documents, {} scored", documents.size(), items.size());
      return items;
    } catch (RuntimeException e) {
      log.warn("Rerank failed: {}; keeping vector order", e.getMessage());
      return identity(documents.size(), topN);
    }
  }

  static List<RerankedItem> identity(int documentCount, int topN) {
    return IntStream.range(0, Math.min(documentCount, Math.max(topN, 0)))
        .mapToObj(i -> new RerankedItem(i, 0.0))
        .toList();
  }

  record RerankRequest(
      String model,
      String query,
      List<String> documents,
      @JsonProperty("return_documents") boolean returnDocuments,
      @JsonProperty("top_n") int topN) {}

  @JsonIgnoreProperties(ignoreUnknown = true)
  record RerankResponse(List<Result> results) {}

  @JsonIgnoreProperties(ignoreUnknown = true)
  record Result(int index, @JsonProperty("relevance_score") double relevanceScore) {}
}
