package dev.semanticcut.api;

import com.fasterxml.jackson.databind.ObjectMapper;
import dev.semanticcut.ingest.ClipIndexingService;
import dev.semanticcut.ingest.IndexReport;
import dev.semanticcut.ingest.IndexRequest;
import dev.semanticcut.search.RankedResult;
import dev.semanticcut.search.SearchRequest;
import dev.semanticcut.search.SearchService;
import java.io.UncheckedIOException;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

/** REST surface: footage search (plain and streamed) and clip indexing. */
@RestController
@RequestMapping("/api/v1")
public class SearchController {

    private static final Logger log = LoggerFactory.getLogger(SearchController.class);

    static final long STREAM_TIMEOUT_MS = 300_000L;

    private final SearchService searchService;
    private final ClipIndexingService indexingService;
    private final ObjectMapper objectMapper;

    public SearchController(SearchService searchService,
                            ClipIndexingService indexingService,
                            ObjectMapper objectMapper) {
        this.searchService = searchService;
        this.indexingService = indexingService;
        this.objectMapper = objectMapper;
    }

    @PostMapping("/search")
    public List<RankedResult> search(@RequestBody SearchRequest request) {
        return searchService.search(request);
    }

    /**
     * Streams stage events while the search runs on a worker thread, then the results.
     * Closing the connection cancels the search before its next stage.
     */
    @PostMapping(value = "/search/stream", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public ResponseEntity<SseEmitter> searchStream(@RequestBody SearchRequest request) {
        SseEmitter emitter = new SseEmitter(STREAM_TIMEOUT_MS);
        SseSearchProgressListener listener = new SseSearchProgressListener(emitter, objectMapper);
        CompletableFuture.runAsync(() -> streamSearch(request, emitter, listener));
        return ResponseEntity.ok()
                .header("x-vercel-ai-ui-message-stream", "v1")
                .header("Cache-Control", "no-cache, no-transform")
                .header("X-Accel-Buffering", "no")
                .contentType(MediaType.TEXT_EVENT_STREAM)
                .body(emitter);
    }

    @PostMapping("/index")
    public IndexReport index(@RequestBody IndexRequest request) {
        return indexingService.index(request);
    }

    @PostMapping("/index/catalog")
    public IndexReport indexCatalog(@RequestParam(defaultValue = "false") boolean recreate) {
        return indexingService.indexCatalog(recreate);
    }

    void streamSearch(SearchRequest request, SseEmitter emitter, SseSearchProgressListener listener) {
        try {
            List<RankedResult> results = searchService.search(request, listener);
            listener.sendResults(results);
            emitter.complete();
        } catch (CancellationException | UncheckedIOException e) {
            log.info("Search stream closed by client: {}", e.getMessage());
            emitter.complete();
        } catch (Exception e) {
            log.error("Search stream failed", e);
            try {
                String message = e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
                listener.sendError(message);
                emitter.complete();
            } catch (CancellationException | UncheckedIOException sendFailure) {
                emitter.completeWithError(e);
            }
        }
    }
}
