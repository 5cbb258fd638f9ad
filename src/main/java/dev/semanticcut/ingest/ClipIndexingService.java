package dev.semanticcut.ingest;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.semanticcut.vector.ClipPoint;
import dev.semanticcut.vector.ClipVectorStore;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Turns scenes into clip points and writes them to the vector store.
 *
 * <p>Every clip becomes one point whose vector embeds the scene slug line, the clip description
 * and its dialogue. The payload carries the filterable fields ({@code scene_id}, {@code
 * location}, {@code time_of_day}, {@code int_ext}, {@code actors}) plus everything search results
 * display.
 *
 * <p>Validation is all-or-nothing, and all embeddings are computed before the collection is
 * touched: a failing embedding provider leaves the existing index intact.
 */
@Service
public class ClipIndexingService {

    private static final Logger log = LoggerFactory.getLogger(ClipIndexingService.class);

    static final int EMBED_BATCH_SIZE = 64;
    static final int SNIPPET_MAX_CHARS = 120;

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

    private final ClipVectorStore vectorStore;
    private final EmbeddingModel embeddingModel;
    private final Validator validator;
    private final ObjectMapper objectMapper;
    private final SceneCatalogLoader catalogLoader;

    public ClipIndexingService(ClipVectorStore vectorStore,
                               EmbeddingModel embeddingModel,
                               Validator validator,
                               ObjectMapper objectMapper,
                               SceneCatalogLoader catalogLoader) {
        this.vectorStore = vectorStore;
        this.embeddingModel = embeddingModel;
        this.validator = validator;
        this.objectMapper = objectMapper;
        this.catalogLoader = catalogLoader;
    }

    /**
     * Indexes every clip of the request.
     *
     * @param request scenes plus the recreate flag
     * @return number of clips indexed and the elapsed time
     * @throws IllegalArgumentException if any scene fails validation
     */
    public IndexReport index(IndexRequest request) {
        Set<ConstraintViolation<IndexRequest>> violations = validator.validate(request);
        if (!violations.isEmpty()) {
            String messages = violations.stream()
                    .map(v -> v.getPropertyPath() + ": " + v.getMessage())
                    .collect(Collectors.joining(", "));
            throw new IllegalArgumentException("Validation failed: " + messages);
        }

        long started = System.nanoTime();
        log.info("Index request: {} scenes, recreateCollection={}",
                request.scenes().size(), request.recreateCollection());

        List<ClipDocument> documents = new ArrayList<>();
        for (Scene scene : request.scenes()) {
            for (Clip clip : scene.clips()) {
                documents.add(toDocument(scene, clip));
            }
        }
        if (documents.isEmpty()) {
            log.warn("Index request produced no clips to index");
            return new IndexReport(0, elapsedSeconds(started), "No clips to index.");
        }

        List<Embedding> embeddings = embedAll(documents.stream()
                .map(d -> TextSegment.from(d.text()))
                .toList());

        vectorStore.ensureCollection(embeddings.get(0).dimension(), request.recreateCollection());

        List<ClipPoint> points = new ArrayList<>(documents.size());
        for (int i = 0; i < documents.size(); i++) {
            ClipDocument document = documents.get(i);
            points.add(new ClipPoint(
                    document.pointId(), embeddings.get(i).vectorAsList(), document.payload()));
        }
        vectorStore.upsert(points);

        double duration = elapsedSeconds(started);
        log.info("Indexed {} clips in {}s", points.size(), "%.2f".formatted(duration));
        return new IndexReport(points.size(), duration,
                "Successfully indexed %d clips in %.2f seconds.".formatted(points.size(), duration));
    }

    /**
     * Indexes the configured scene catalog file.
     *
     * @throws IllegalArgumentException if no catalog is configured or it cannot be read
     */
    public IndexReport indexCatalog(boolean recreateCollection) {
        Path path = catalogLoader.configuredPath();
        if (path == null || !Files.isRegularFile(path)) {
            throw new IllegalArgumentException(
                    "No scene catalog found (semanticcut.catalog.scenes-path=" + path + ")");
        }
        List<Scene> scenes;
        try {
            scenes = catalogLoader.load(path);
        } catch (IOException e) {
            throw new IllegalArgumentException(
                    "Cannot read scene catalog " + path + ": " + e.getMessage(), e);
        }
        return index(new IndexRequest(scenes, recreateCollection));
    }

    ClipDocument toDocument(Scene scene, Clip clip) {
        String text = embedText(scene, clip);
        double start;
        double end;
        if (!clip.dialogue().isEmpty()) {
            start = clip.dialogue().stream().mapToDouble(Dialogue::timestampStartSec).min().orElse(0.0);
            end = clip.dialogue().stream().mapToDouble(Dialogue::timestampEndSec).max().orElse(0.0);
        } else {
            start = clip.estimatedClipStart() == null ? 0.0 : clip.estimatedClipStart();
            end = clip.estimatedClipEnd() == null ? 0.0 : clip.estimatedClipEnd();
        }

        SceneDescription description = scene.sceneDescription();
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("clip_id", clip.clipId());
        payload.put("scene_id", scene.sceneId());
        payload.put("location", description.location());
        payload.put("int_ext", description.intExt());
        payload.put("time_of_day", description.timeOfDay());
        payload.put("actors", clip.actorsInvolved());
        payload.put("clip_description", clip.clipDescription());
        payload.put("dialogue", clip.dialogue().stream()
                .map(d -> objectMapper.convertValue(d, MAP_TYPE))
                .toList());
        payload.put("start", start);
        payload.put("end", end);
        payload.put("start_display", Timestamps.toDisplay(start));
        payload.put("end_display", Timestamps.toDisplay(end));
        payload.put("snippet", snippet(clip));
        payload.put("text", text);
        return new ClipDocument(ClipIds.pointId(clip.clipId()), text, payload);
    }

    static String embedText(Scene scene, Clip clip) {
        SceneDescription description = scene.sceneDescription();
        List<String> parts = new ArrayList<>();
        parts.add(description.location());
        parts.add(description.timeOfDay());
        parts.add(String.join(" ", description.actorsInvolved()));
        parts.add(String.join(" ", clip.clipDescription()));
        for (Dialogue line : clip.dialogue()) {
            StringBuilder sb = new StringBuilder().append(line.actor()).append(": ").append(line.text());
            if (line.actualDialogs() != null && !line.actualDialogs().isEmpty()) {
                sb.append(' ').append(String.join(" ", line.actualDialogs()).replace('\n', ' '));
            }
            parts.add(sb.toString());
        }
        return parts.stream()
                .filter(p -> !p.isEmpty())
                .collect(Collectors.joining(" "))
                .strip();
    }

    /** First dialogue line, else the clip description, cut to {@value #SNIPPET_MAX_CHARS} chars. */
    static String snippet(Clip clip) {
        String source = "";
        if (!clip.dialogue().isEmpty() && !clip.dialogue().get(0).text().isEmpty()) {
            source = clip.dialogue().get(0).text();
        } else if (!clip.clipDescription().isEmpty()) {
            source = String.join(" ", clip.clipDescription());
        }
        return source.length() > SNIPPET_MAX_CHARS ? source.substring(0, SNIPPET_MAX_CHARS) : source;
    }

    private List<Embedding> embedAll(List<TextSegment> segments) {
        log.info("Embedding {} clips", segments.size());
        List<Embedding> all = new ArrayList<>(segments.size());
        for (int i = 0; i < segments.size(); i += EMBED_BATCH_SIZE) {
            int end = Math.min(i + EMBED_BATCH_SIZE, segments.size());
            List<TextSegment> batch = segments.subList(i, end);
            all.addAll(embeddingModel.embedAll(batch).content());
        }
        return all;
    }

    private static double elapsedSeconds(long startedNanos) {
        return (System.nanoTime() - startedNanos) / 1_000_000_000.0;
    }

    record ClipDocument(String pointId, String text, Map<String, Object> payload) {}
}
