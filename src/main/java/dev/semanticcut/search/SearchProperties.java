package dev.semanticcut.search;

import jakarta.annotation.PostConstruct;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Externalised configuration for the search pipeline.
 *
 * <p>Properties are bound from {@code semanticcut.search.*} in application.yml.
 *
 * <ul>
 *   <li>{@code use-query-llm} - parse queries with the chat model (default true); when off the raw
 *       query is the intent and no filters are inferred
 *   <li>{@code hybrid-query} - also search with the raw query and fuse both runs (default true)
 *   <li>{@code initial-k} - candidates fetched per vector search (default 20, bounded [5, 100])
 *   <li>{@code return-top} - results returned when a request names no limit (default 5, bounded
 *       [1, 20])
 *   <li>{@code filter-fallback-min} - a filtered search returning fewer candidates than this is
 *       broadened with an unfiltered search (default 5)
 *   <li>{@code rerank-min-score} - reranker scores below this are dropped (default 0.0)
 *   <li>{@code rrf-k} - Reciprocal Rank Fusion constant (default 60)
 * </ul>
 *
 * <p>Validated at startup via {@link #validate()}; the application fails to start if values are out
 * of range.
 */
@Configuration
@ConfigurationProperties(prefix = "semanticcut.search")
public class SearchProperties {

  private boolean useQueryLlm = true;
  private boolean hybridQuery = true;
  private int initialK = 20;
  private int returnTop = 5;
  private int filterFallbackMin = 5;
  private double rerankMinScore = 0.0;
  private int rrfK = 60;

  /** Validates configuration at startup. Throws if values are out of allowed range. */
  @PostConstruct
  void validate() {
    if (initialK < 5 || initialK > 100) {
      throw new IllegalStateException(
          "semanticcut.search.initial-k must be in [5, 100], got: " + initialK);
    }
    if (returnTop < 1 || returnTop > SearchRequest.MAX_LIMIT) {
      throw new IllegalStateException(
          "semanticcut.search.return-top must be in [1, 20], got: " + returnTop);
    }
    if (filterFallbackMin < 0) {
      throw new IllegalStateException(
          "semanticcut.search.filter-fallback-min must be >= 0, got: " + filterFallbackMin);
    }
    if (rrfK < 1) {
      throw new IllegalStateException("semanticcut.search.rrf-k must be >= 1, got: " + rrfK);
    }
  }

  public boolean isUseQueryLlm() {
    return useQueryLlm;
  }

  public void setUseQueryLlm(boolean useQueryLlm) {
    this.useQueryLlm = useQueryLlm;
  }

  public boolean isHybridQuery() {
    return hybridQuery;
  }

  public void setHybridQuery(boolean hybridQuery) {
    this.hybridQuery = hybridQuery;
  }

  public int getInitialK() {
    return initialK;
  }

  public void setInitialK(int initialK) {
    this.initialK = initialK;
  }

  public int getReturnTop() {
    return returnTop;
  }

  public void setReturnTop(int returnTop) {
    this.returnTop = returnTop;
  }

  public int getFilterFallbackMin() {
    return filterFallbackMin;
  }

  public void setFilterFallbackMin(int filterFallbackMin) {
    this.filterFallbackMin = filterFallbackMin;
  }

  public double getRerankMinScore() {
    return rerankMinScore;
  }

  public void setRerankMinScore(double rerankMinScore) {
    this.rerankMinScore = rerankMinScore;
  }

  public int getRrfK() {
    return rrfK;
  }

  public void setRrfK(int rrfK) {
    this.rrfK = rrfK;
  }
}
