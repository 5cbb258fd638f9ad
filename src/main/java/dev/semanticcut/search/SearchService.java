package dev.semanticcut.search;

import dev.semanticcut.filter.ClipPredicate;
import dev.semanticcut.filter.FilterClause;
import dev.semanticcut.filter.FilterClauseParser;
import dev.semanticcut.filter.FilterClauseSet;
import dev.semanticcut.filter.FilterCompiler;
import dev.semanticcut.query.ParsedIntent;
import dev.semanticcut.query.QueryUnderstandingService;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CancellationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Search orchestration: query understanding, filter compilation, retrieval, reranking and result
 * assembly.
 *
 * <p>Pipeline: parse query (or take it verbatim when {@code use-query-llm} is off) -> overlay the
 * caller's filters onto the parsed {@code must} clause -> compile to a {@link ClipPredicate} ->
 * {@link RetrievalService} builds a pool of {@code max(initial-k, returnTop)} candidates -> {@link
 * RerankerClient} scores the pool against the intent -> {@link ResultAssembler} returns at most
 * {@code returnTop} results.
 *
 * <p>Runs on the calling thread. A listener that reports cancellation stops the pipeline before
 * the next stage with a {@link CancellationException}.
 */
@Service
public class SearchService {

  private static final Logger log = LoggerFactory.getLogger(SearchService.class);

  private final QueryUnderstandingService queryUnderstanding;
  private final FilterCompiler filterCompiler;
  private final RetrievalService retrievalService;
  private final RerankerClient rerankerClient;
  private final SearchProperties searchProperties;

  public SearchService(
      QueryUnderstandingService queryUnderstanding,
      FilterCompiler filterCompiler,
      RetrievalService retrievalService,
      RerankerClient rerankerClient,
      SearchProperties searchProperties) {
    this.queryUnderstanding = queryUnderstanding;
    this.filterCompiler = filterCompiler;
    this.retrievalService = retrievalService;
    this.rerankerClient = rerankerClient;
    this.searchProperties = searchProperties;
  }

  public List<RankedResult> search(SearchRequest request) {
    return search(request, SearchProgressListener.NONE);
  }

  /**
   * Runs the search, reporting each stage to {@code listener}.
   *
   * @param request the query, optional limit and caller filters
   * @param listener stage observer and cancellation source
   * @return ranked results, empty for a blank query or an empty pool
   * @throws CancellationException if the listener reports cancellation between stages
   */
  public List<RankedResult> search(SearchRequest request, SearchProgressListener listener) {
    String rawQuery = request.query() == null ? "" : request.query().strip();
    if (rawQuery.isEmpty()) {
      log.debug("Blank query; returning no results");
      return List.of();
    }
    int returnTop = request.limit() != null ? request.limit() : searchProperties.getReturnTop();
    int initialK = Math.max(searchProperties.getInitialK(), returnTop);
    log.info(
        "Search started: query={}, returnTop={}, initialK={}",
        preview(rawQuery),
        returnTop,
        initialK);

    listener.throwIfCancelled();
    listener.onProgress(
        SearchProgressEvent.loading(SearchStage.QUERY_UNDERSTANDING, "Understanding query"));
    ParsedIntent parsed =
        searchProperties.isUseQueryLlm()
            ? queryUnderstanding.parse(rawQuery)
            : ParsedIntent.fallback(rawQuery);
    FilterClauseSet clauses = withCallerFilters(parsed.filters(), request);
    ClipPredicate predicate = filterCompiler.compile(clauses);
    listener.onProgress(
        SearchProgressEvent.done(
            SearchStage.QUERY_UNDERSTANDING,
            "Query understood",
            understandingDetails(parsed, clauses)));

    List<Candidate> candidates =
        retrievalService.retrieve(parsed.intent(), rawQuery, initialK, predicate, listener);
    if (candidates.isEmpty()) {
      log.info("Search: no candidates");
      return List.of();
    }

    listener.throwIfCancelled();
    listener.onProgress(
        SearchProgressEvent.loading(
            SearchStage.RERANK, "Reranking %d candidates".formatted(candidates.size())));
    List<String> documents = candidates.stream().map(Candidate::rerankDocument).toList();
    List<RerankedItem> reranked = rerankerClient.rerank(parsed.intent(), documents, returnTop);
    List<RankedResult> results =
        ResultAssembler.assemble(
            candidates, reranked, returnTop, searchProperties.getRerankMinScore());
    listener.onProgress(
        SearchProgressEvent.done(
            SearchStage.RERANK,
            "Ranked %d results".formatted(results.size()),
            Map.of("count", results.size(), "reranked", reranked.size())));

    log.info(
        "Search completed: {} results, clip_ids={}",
        results.size(),
        results.stream().map(RankedResult::clipId).toList());
    return results;
  }

  private static FilterClauseSet withCallerFilters(FilterClauseSet parsed, SearchRequest request) {
    FilterClause callerMust = FilterClauseParser.parseLegacy(request.filters()).must();
    return parsed.withMust(callerMust);
  }

  private static Map<String, Object> understandingDetails(
      ParsedIntent parsed, FilterClauseSet clauses) {
    Map<String, Object> details = new LinkedHashMap<>();
    details.put("intent", parsed.intent());
    details.put("keywords", parsed.keywords());
    details.put("filters", clauses.toWire());
    return details;
  }

  private static String preview(String query) {
    return query.length() > 120 ? query.substring(0, 120) + "..." : query;
  }
}
