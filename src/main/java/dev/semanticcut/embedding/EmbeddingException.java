package dev.semanticcut.embedding;

/**
 * Thrown when a text cannot be embedded: missing credentials, transport failure or an unusable
 * provider response. There is no local substitute for an embedding, so callers let it propagate.
 */
public class EmbeddingException extends RuntimeException {

  public EmbeddingException(String message) {
    super(message);
  }

  public EmbeddingException(String message, Throwable cause) {
    super(message, cause);
  }
}
