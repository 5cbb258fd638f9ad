package dev.semanticcut.search;

import java.util.Map;

/**
 * Progress of one pipeline stage.
 *
 * @param stage the stage
 * @param status whether the stage just started or just finished
 * @param message short human-readable status line
 * @param details stage-specific values (counts, parsed intent), possibly empty
 */
public record SearchProgressEvent(
    SearchStage stage, Status status, String message, Map<String, Object> details) {

  public SearchProgressEvent {
    details = details == null ? Map.of() : Map.copyOf(details);
  }

  public static SearchProgressEvent loading(SearchStage stage, String message) {
    return new SearchProgressEvent(stage, Status.LOADING, message, Map.of());
  }

  public static SearchProgressEvent done(
      SearchStage stage, String message, Map<String, Object> details) {
    return new SearchProgressEvent(stage, Status.DONE, message, details);
  }

  public enum Status {
    LOADING("loading"),
    DONE("done");

    private final String id;

    Status(String id) {
      this.id = id;
    }

    public String id() {
      return id;
    }
  }
}
