package dev.semanticcut.vector;

import dev.semanticcut.filter.ClipPredicate;
import java.util.List;
import org.jspecify.annotations.Nullable;

/** Nearest-neighbour store of clip vectors with filterable payloads. */
public interface ClipVectorStore {

  /**
   * Returns up to {@code limit} hits ordered by decreasing similarity.
   *
   * @param vector the query embedding
   * @param limit maximum number of hits
   * @param predicate payload filter, or null for an unfiltered search
   * @throws VectorStoreException on transport or store errors
   */
  List<ClipHit> search(float[] vector, int limit, @Nullable ClipPredicate predicate);

  /**
   * Creates the collection if it is missing, dropping it first when {@code recreate} is set.
   * Payload indexes are created on the filterable clip fields.
   */
  void ensureCollection(int dimension, boolean recreate);

  /** Inserts or replaces points by id. */
  void upsert(List<ClipPoint> points);
}
