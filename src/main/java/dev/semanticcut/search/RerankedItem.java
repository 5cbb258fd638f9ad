package dev.semanticcut.search;

/**
 * One reranker verdict.
 *
 * @param index position of the document in the list that was sent
 * @param score relevance score; 0.0 when the identity fallback was used
 */
public record RerankedItem(int index, double score) {}
