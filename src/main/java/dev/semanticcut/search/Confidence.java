package dev.semanticcut.search;

import com.fasterxml.jackson.annotation.JsonValue;

/** Coarse confidence label derived from a raw reranker score. */
public enum Confidence {
  HIGH("High"),
  MEDIUM("Medium"),
  LOW("Low");

  static final double HIGH_THRESHOLD = 0.5;
  static final double MEDIUM_THRESHOLD = 0.35;

  private final String label;

  Confidence(String label) {
    this.label = label;
  }

  @JsonValue
  public String label() {
    return label;
  }

  public static Confidence forScore(double score) {
    if (score >= HIGH_THRESHOLD) {
      return HIGH;
    }
    if (score >= MEDIUM_THRESHOLD) {
      return MEDIUM;
    }
    return LOW;
  }
}
