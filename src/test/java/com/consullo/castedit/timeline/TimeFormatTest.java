package com.consullo.castedit.timeline;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for status-message time formatting.
 *
 * @since 1.0
 */
public class TimeFormatTest {

  @Test
  @DisplayName("Should format seconds as minutes, seconds and milliseconds")
  void format_Seconds_MinutesSecondsMillis() {
    assertThat(TimeFormat.format(0)).isEqualTo("00:00.000");
    assertThat(TimeFormat.format(75.5)).isEqualTo("01:15.500");
  }
}
