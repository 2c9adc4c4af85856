package com.consullo.castedit.recording;

/**
 * Output-kind event reduced to what the replay engine needs.
 *
 * @param time absolute source time in seconds
 * @param text terminal output text
 * @since 1.0
 */
public record OutputEvent(double time, String text) {

  public OutputEvent {
    if (text == null) {
      throw new IllegalArgumentException("text must not be null.");
    }
  }
}
