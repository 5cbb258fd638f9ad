package dev.semanticcut.search;

import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.semanticcut.filter.ClipPredicate;
import dev.semanticcut.vector.ClipHit;
import dev.semanticcut.vector.ClipVectorStore;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Builds the candidate pool for a parsed query.
 *
 * <p>Pipeline: embed {@value #QUERY_PREFIX} + intent -> filtered vector search -> broaden with an
 * unfiltered search when the filter leaves fewer than {@code filter-fallback-min} candidates ->
 * when hybrid search is on and the intent differs from the raw query, search again with the raw
 * query and merge both runs with {@link ReciprocalRankFusion}.
 *
 * <p>Embedding and vector-store failures propagate; there is no substitute relevance source.
 */
@Service
public class RetrievalService {

  private static final Logger log = LoggerFactory.getLogger(RetrievalService.class);

  /** Instruction prefix prepended to every query text before embedding. */
  static final String QUERY_PREFIX = "Find footage that shows: ";

  private final EmbeddingModel embeddingModel;
  private final ClipVectorStore vectorStore;
  private final SearchProperties searchProperties;

  public RetrievalService(
      EmbeddingModel embeddingModel,
      ClipVectorStore vectorStore,
      SearchProperties searchProperties) {
    this.embeddingModel = embeddingModel;
    this.vectorStore = vectorStore;
    this.searchProperties = searchProperties;
  }

  /**
   * Retrieves candidates without progress reporting.
   *
   * @see #retrieve(String, String, int, ClipPredicate, SearchProgressListener)
   */
  public List<Candidate> retrieve(
      String intent, String rawQuery, int limit, @Nullable ClipPredicate predicate) {
    return retrieve(intent, rawQuery, limit, predicate, SearchProgressListener.NONE);
  }

  /**
   * Retrieves up to {@code limit} distinct candidates.
   *
   * @param intent parsed intent, embedded for the primary search
   * @param rawQuery the user's query, embedded for the hybrid search
   * @param limit pool size
   * @param predicate payload filter, or null for none
   * @param listener receives embedding, vector_search and hybrid stage events
   * @return candidates in rank order, deduplicated by clip id
   */
  public List<Candidate> retrieve(
      String intent,
      String rawQuery,
      int limit,
      @Nullable ClipPredicate predicate,
      SearchProgressListener listener) {
    listener.throwIfCancelled();
    listener.onProgress(SearchProgressEvent.loading(SearchStage.EMBEDDING, "Embedding query"));
    float[] vector = embed(intent);
    listener.onProgress(
        SearchProgressEvent.done(
            SearchStage.EMBEDDING, "Query embedded", Map.of("dimension", vector.length)));

    listener.throwIfCancelled();
    listener.onProgress(
        SearchProgressEvent.loading(SearchStage.VECTOR_SEARCH, "Searching clip index"));
    List<Candidate> candidates = toCandidates(vectorStore.search(vector, limit, predicate));
    log.info("Vector search: {} candidates (filtered={})", candidates.size(), predicate != null);

    boolean broadened = false;
    if (predicate != null && candidates.size() < searchProperties.getFilterFallbackMin()) {
      log.info(
          "Filtered search returned {} < {}; broadening with an unfiltered search",
          candidates.size(),
          searchProperties.getFilterFallbackMin());
      List<Candidate> unfiltered = toCandidates(vectorStore.search(vector, limit, null));
      candidates = appendUnseen(candidates, unfiltered, limit);
      broadened = true;
      log.info("After fallback: {} candidates", candidates.size());
    }
    listener.onProgress(
        SearchProgressEvent.done(
            SearchStage.VECTOR_SEARCH,
            "Found %d candidates".formatted(candidates.size()),
            Map.of("count", candidates.size(), "fallback", broadened)));

    if (searchProperties.isHybridQuery() && differs(intent, rawQuery)) {
      listener.throwIfCancelled();
      listener.onProgress(
          SearchProgressEvent.loading(SearchStage.HYBRID, "Searching with the original query"));
      List<Candidate> rawCandidates =
          toCandidates(vectorStore.search(embed(rawQuery), limit, predicate));
      List<Candidate> fused =
          ReciprocalRankFusion.fuse(List.of(candidates, rawCandidates), searchProperties.getRrfK());
      candidates = fused.subList(0, Math.min(limit, fused.size()));
      log.info("Hybrid: {} candidates after RRF merge", candidates.size());
      listener.onProgress(
          SearchProgressEvent.done(
              SearchStage.HYBRID,
              "Merged %d candidates".formatted(candidates.size()),
              Map.of("count", candidates.size())));
    }
    return candidates;
  }

  private float[] embed(String text) {
    Embedding embedding = embeddingModel.embed(QUERY_PREFIX + text).content();
    return embedding.vector();
  }

  /** Trimmed, case-insensitive inequality. */
  static boolean differs(String intent, String rawQuery) {
    return !intent.strip().toLowerCase(Locale.ROOT).equals(rawQuery.strip().toLowerCase(Locale.ROOT));
  }

  private static List<Candidate> toCandidates(List<ClipHit> hits) {
    List<Candidate> candidates = new ArrayList<>(hits.size());
    Set<String> seen = new HashSet<>();
    for (ClipHit hit : hits) {
      Candidate candidate = Candidate.from(hit);
      if (seen.add(candidate.clipId())) {
        candidates.add(candidate);
      }
    }
    return candidates;
  }

  /** Keeps {@code first} in order, then appends unseen {@code extra} items until {@code limit}. */
  static List<Candidate> appendUnseen(List<Candidate> first, List<Candidate> extra, int limit) {
    List<Candidate> merged = new ArrayList<>(first);
    Set<String> seen = new HashSet<>();
    first.forEach(c -> seen.add(c.clipId()));
    for (Candidate candidate : extra) {
      if (merged.size() >= limit) {
        break;
      }
      if (seen.add(candidate.clipId())) {
        merged.add(candidate);
      }
    }
    return merged;
  }
}
