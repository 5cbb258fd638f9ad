package dev.semanticcut.vector;

/** Thrown when the vector store cannot be reached or rejects a request. */
public class VectorStoreException extends RuntimeException {

  public VectorStoreException(String message) {
    super(message);
  }

  public VectorStoreException(String message, Throwable cause) {
    super(message, cause);
  }
}
