package dev.semanticcut.ingest;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Outcome of an indexing run.
 *
 * @param clipsIndexed number of clips upserted
 * @param durationSeconds wall-clock duration
 * @param message human-readable summary
 */
public record IndexReport(
    @JsonProperty("clips_indexed") int clipsIndexed,
    @JsonProperty("duration_seconds") double durationSeconds,
    String message) {}
