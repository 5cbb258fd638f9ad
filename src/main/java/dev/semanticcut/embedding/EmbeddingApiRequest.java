package dev.semanticcut.embedding;

import java.util.List;

/** Request body of the OpenAI-compatible {@code /embeddings} endpoint. */
record EmbeddingApiRequest(String model, List<String> input) {}
