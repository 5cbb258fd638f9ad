package dev.semanticcut.embedding;

import java.util.List;

/**
 * Response body of the {@code /embeddings} endpoint. Items carry an explicit {@code index} and
 * are not guaranteed to arrive in request order.
 */
record EmbeddingApiResponse(List<Item> data) {

  record Item(int index, List<Float> embedding) {}
}
