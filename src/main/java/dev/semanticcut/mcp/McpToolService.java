package dev.semanticcut.mcp;

import dev.semanticcut.ingest.ClipIndexingService;
import dev.semanticcut.ingest.IndexReport;
import dev.semanticcut.search.RankedResult;
import dev.semanticcut.search.SearchRequest;
import dev.semanticcut.search.SearchService;
import java.util.List;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.tool.annotation.Tool;
import org.springframework.ai.tool.annotation.ToolParam;
import org.springframework.stereotype.Service;

/**
 * MCP adapter exposing footage search and catalog indexing as tools.
 *
 * <p>Tool methods follow the structured error pattern: all exceptions are caught and returned as
 * descriptive error strings, never thrown.
 *
 * @see SearchResultFormatter
 * @see McpToolConfig
 */
@Service
public class McpToolService {

  private static final Logger log = LoggerFactory.getLogger(McpToolService.class);

  private final SearchService searchService;
  private final ClipIndexingService indexingService;
  private final SearchResultFormatter formatter;

  public McpToolService(
      SearchService searchService,
      ClipIndexingService indexingService,
      SearchResultFormatter formatter) {
    this.searchService = searchService;
    this.indexingService = indexingService;
    this.formatter = formatter;
  }

  @Tool(
      name = "search_footage",
      description =
          "Find film clips matching a natural-language description, e.g. 'someone refusing a "
              + "request firmly'. Returns ranked clips with timecodes, location and a match score. "
              + "Optional filters restrict results to a scene, location, time of day, INT/EXT or "
              + "actors.")
  public String searchFootage(
      @ToolParam(description = "What the footage should show") @Nullable String query,
      @ToolParam(description = "Maximum number of clips (1-20, default 5)", required = false)
          @Nullable Integer limit,
      @ToolParam(description = "Restrict to a scene id, e.g. 'scene_1'", required = false)
          @Nullable String sceneId,
      @ToolParam(description = "Restrict to a location, e.g. \"DON'S OFFICE\"", required = false)
          @Nullable String location,
      @ToolParam(description = "Restrict to DAY or NIGHT", required = false)
          @Nullable String timeOfDay,
      @ToolParam(description = "Restrict to INT or EXT", required = false) @Nullable String intExt,
      @ToolParam(description = "Clips featuring at least one of these actors", required = false)
          @Nullable List<String> actors) {
    try {
      if (query == null || query.isBlank()) {
        return "Error: Query must not be empty. Describe the footage you are looking for.";
      }
      List<RankedResult> results =
          searchService.search(
              new SearchRequest(query, limit, sceneId, location, timeOfDay, intExt, actors));
      if (results.isEmpty()) {
        return "No clips found for '%s'. Try a broader description or fewer filters."
            .formatted(query);
      }
      return formatter.format(results);
    } catch (Exception e) {
      log.warn("search_footage failed: {}", e.getMessage());
      return "Error searching footage: " + e.getMessage();
    }
  }

  @Tool(
      name = "index_catalog",
      description =
          "Index every clip of the configured scene catalog into the vector store. "
              + "Set recreate to drop the existing collection first.")
  public String indexCatalog(
      @ToolParam(description = "Drop and recreate the collection first", required = false)
          @Nullable Boolean recreate) {
    try {
      IndexReport report = indexingService.indexCatalog(Boolean.TRUE.equals(recreate));
      return report.message();
    } catch (Exception e) {
      log.warn("index_catalog failed: {}", e.getMessage());
      return "Error indexing catalog: " + e.getMessage();
    }
  }
}
