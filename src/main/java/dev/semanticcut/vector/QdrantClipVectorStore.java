package dev.semanticcut.vector;

import dev.semanticcut.filter.ClipPredicate;
import dev.semanticcut.filter.FilterField;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

/**
 * {@link ClipVectorStore} over the Qdrant REST API.
 *
 * <p>Uses the universal query endpoint ({@code POST /collections/{c}/points/query}) with payloads
 * returned and vectors omitted. Every filterable payload field gets a keyword index when the
 * collection is created.
 */
public class QdrantClipVectorStore implements ClipVectorStore {

  private static final Logger log = LoggerFactory.getLogger(QdrantClipVectorStore.class);

  static final int UPSERT_BATCH_SIZE = 15;

  private final RestClient restClient;
  private final String collection;

  public QdrantClipVectorStore(RestClient restClient, QdrantProperties properties) {
    this.restClient = restClient;
    this.collection = properties.collection();
  }

  @Override
  public List<ClipHit> search(float[] vector, int limit, @Nullable ClipPredicate predicate) {
    Map<String, Object> body = new LinkedHashMap<>();
    body.put("query", toList(vector));
    body.put("limit", limit);
    body.put("with_payload", true);
    body.put("with_vector", false);
    if (predicate != null && !predicate.isEmpty()) {
      body.put("filter", QdrantFilterMapper.toFilter(predicate));
    }

    QdrantResponses.Query response;
    try {
      response =
          restClient
              .post()
              .uri(collectionPath() + "/points/query")
              .body(body)
              .retrieve()
              .body(QdrantResponses.Query.class);
    } catch (RestClientException e) {
      throw new VectorStoreException("Qdrant query failed: " + e.getMessage(), e);
    }

    List<ClipHit> hits =
        response == null
            ? List.of()
            : response.points().stream()
                .map(p -> new ClipHit(String.valueOf(p.id()), p.score(), p.payload()))
                .toList();
    log.debug("Qdrant query limit={} filtered={} hits={}", limit, predicate != null, hits.size());
    return hits;
  }

  @Override
  public void ensureCollection(int dimension, boolean recreate) {
    try {
      boolean exists = collectionExists();
      if (exists && recreate) {
        log.info("Dropping collection {}", collection);
        restClient.delete().uri(collectionPath()).retrieve().toBodilessEntity();
        exists = false;
      }
      if (exists) {
        return;
      }
      log.info("Creating collection {} (dim={}, distance=Cosine)", collection, dimension);
      restClient
          .put()
          .uri(collectionPath())
          .body(Map.of("vectors", Map.of("size", dimension, "distance", "Cosine")))
          .retrieve()
          .toBodilessEntity();
      for (FilterField field : FilterField.values()) {
        restClient
            .put()
            .uri(collectionPath() + "/index")
            .body(Map.of("field_name", field.key(), "field_schema", "keyword"))
            .retrieve()
            .toBodilessEntity();
      }
    } catch (RestClientException e) {
      throw new VectorStoreException(
          "Failed to prepare collection %s: %s".formatted(collection, e.getMessage()), e);
    }
  }

  @Override
  public void upsert(List<ClipPoint> points) {
    for (int start = 0; start < points.size(); start += UPSERT_BATCH_SIZE) {
      List<ClipPoint> batch =
          points.subList(start, Math.min(start + UPSERT_BATCH_SIZE, points.size()));
      List<Map<String, Object>> wire =
          batch.stream()
              .map(
                  p ->
                      Map.<String, Object>of(
                          "id", p.id(), "vector", p.vector(), "payload", p.payload()))
              .toList();
      try {
        restClient
            .put()
            .uri(collectionPath() + "/points?wait=true")
            .body(Map.of("points", wire))
            .retrieve()
            .toBodilessEntity();
      } catch (RestClientException e) {
        throw new VectorStoreException(
            "Upsert of %d points into %s failed: %s"
                .formatted(batch.size(), collection, e.getMessage()),
            e);
      }
      log.debug("Upserted batch {}..{} into {}", start, start + batch.size() - 1, collection);
    }
  }

  boolean collectionExists() {
    QdrantResponses.Exists response =
        restClient
            .get()
            .uri(collectionPath() + "/exists")
            .retrieve()
            .body(QdrantResponses.Exists.class);
    return response != null && response.exists();
  }

  private String collectionPath() {
    return "/collections/" + collection;
  }

  private static List<Float> toList(float[] vector) {
    Float[] boxed = new Float[vector.length];
    for (int i = 0; i < vector.length; i++) {
      boxed[i] = vector[i];
    }
    return Arrays.asList(boxed);
  }
}
