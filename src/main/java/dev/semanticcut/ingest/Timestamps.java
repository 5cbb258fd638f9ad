package dev.semanticcut.ingest;

import org.jspecify.annotations.Nullable;

/** Conversions between subtitle-style timestamps, seconds and display strings. */
public final class Timestamps {

  private Timestamps() {}

  /**
   * Converts a timestamp to seconds.
   *
   * <p>Accepts {@code HH:MM:SS,mmm}, {@code HH:MM:SS.mmm} and numbers. Null and anything
   * unparseable yield {@code 0.0}.
   */
  public static double toSeconds(@Nullable Object timestamp) {
    if (timestamp == null) {
      return 0.0;
    }
    if (timestamp instanceof Number number) {
      return number.doubleValue();
    }
    String[] parts = timestamp.toString().strip().replace(',', '.').split(":");
    if (parts.length != 3) {
      return 0.0;
    }
    try {
      int hours = Integer.parseInt(parts[0]);
      int minutes = Integer.parseInt(parts[1]);
      double seconds = Double.parseDouble(parts[2]);
      return hours * 3600 + minutes * 60 + seconds;
    } catch (NumberFormatException e) {
      return 0.0;
    }
  }

  /** Formats seconds as {@code M:SS}, or {@code H:MM:SS} from one hour on. Negatives clamp to 0. */
  public static String toDisplay(double seconds) {
    long total = (long) Math.max(0, seconds);
    long hours = total / 3600;
    long minutes = (total % 3600) / 60;
    long secs = total % 60;
    if (hours > 0) {
      return "%d:%02d:%02d".formatted(hours, minutes, secs);
    }
    return "%d:%02d".formatted(minutes, secs);
  }
}
