package dev.semanticcut.search;

import java.util.concurrent.CancellationException;

/**
 * Receives stage events from a running search and tells it whether to stop.
 *
 * <p>The pipeline checks {@link #isCancelled()} before every stage; once it reports true no
 * further provider call is made and the search ends with a {@link CancellationException}.
 */
public interface SearchProgressListener {

  /** Listener that ignores events and never cancels. */
  SearchProgressListener NONE = event -> {};

  void onProgress(SearchProgressEvent event);

  default boolean isCancelled() {
    return false;
  }

  /** Throws if the consumer has gone away. */
  default void throwIfCancelled() {
    if (isCancelled()) {
      throw new CancellationException("Search cancelled by client");
    }
  }
}
