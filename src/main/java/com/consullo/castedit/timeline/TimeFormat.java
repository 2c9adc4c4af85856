package com.consullo.castedit.timeline;

/**
 * Formats seconds as {@code mm:ss.mmm} for status messages and CLI output.
 *
 * @since 1.0
 */
public final class TimeFormat {

  private TimeFormat() {
  }

  public static String format(double seconds) {
    long totalMs = Double.isFinite(seconds) ? Math.round(seconds * 1000) : 0;
    if (totalMs < 0) {
      totalMs = 0;
    }
    long ms = totalMs % 1000;
    long totalSec = totalMs / 1000;
    long sec = totalSec % 60;
    long min = totalSec / 60;
    return String.format("%02d:%02d.%03d", min, sec, ms);
  }
}
