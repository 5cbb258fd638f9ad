package dev.semanticcut.ingest;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class TimestampsTest {

  @ParameterizedTest
  @CsvSource({
    "'00:00:12,500', 12.5",
    "'00:01:05.250', 65.25",
    "'01:02:03,000', 3723.0",
    "' 00:00:07,000 ', 7.0",
    "'12:34', 0.0",
    "'aa:bb:cc', 0.0",
    "'', 0.0"
  })
  void toSecondsParsesSubtitleTimestamps(String timestamp, double expected) {
    assertThat(Timestamps.toSeconds(timestamp)).isEqualTo(expected);
  }

  @Test
  void toSecondsAcceptsNumbersAndNull() {
    assertThat(Timestamps.toSeconds(42)).isEqualTo(42.0);
    assertThat(Timestamps.toSeconds(3.75)).isEqualTo(3.75);
    assertThat(Timestamps.toSeconds(null)).isZero();
  }

  @ParameterizedTest
  @CsvSource({"0, 0:00", "7.9, 0:07", "65, 1:05", "3599, 59:59", "3600, 1:00:00", "3725, 1:02:05"})
  void toDisplayUsesHoursOnlyWhenNeeded(double seconds, String expected) {
    assertThat(Timestamps.toDisplay(seconds)).isEqualTo(expected);
  }

  @Test
  void toDisplayClampsNegativeValues() {
    assertThat(Timestamps.toDisplay(-5)).isEqualTo("0:00");
  }
}
