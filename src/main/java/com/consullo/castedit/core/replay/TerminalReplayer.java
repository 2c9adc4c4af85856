package com.consullo.castedit.core.replay;

import com.consullo.castedit.core.TerminalCore;
import com.consullo.castedit.core.TerminalSnapshot;
import com.consullo.castedit.core.Theme;
import com.consullo.castedit.recording.OutputEvent;
import com.consullo.castedit.recording.Recording;
import java.util.List;
import org.apache.commons.lang3.Validate;

/**
 * Pure replay entry points: output event prefix in, screen snapshot out.
 *
 * <p>Every call builds a fresh {@link ReplayTerminalCore}; style and cursor state depend on the whole
 * history, so replay is never incremental.</p>
 *
 * @since 1.0
 */
public final class TerminalReplayer {

  private TerminalReplayer() {
  }

  /**
   * Replays events in order.
   *
   * @param events output events, already cut at the desired point
   * @param rows screen rows
   * @param cols screen columns
   * @param theme theme for palette lookups
   * @return screen after the last event
   */
  public static TerminalSnapshot replay(List<OutputEvent> events, int rows, int cols, Theme theme) {
    Validate.notNull(events, "events must not be null");
    TerminalCore core = new ReplayTerminalCore(cols, rows, theme);
    for (OutputEvent e : events) {
      core.feed(e.text());
    }
    return core.snapshot();
  }

  /**
   * Replays a recording's output events with source time at or before {@code cutoff}.
   *
   * @param recording source recording
   * @param cutoff source time in seconds, inclusive
   * @return screen at the cutoff
   */
  public static TerminalSnapshot replay(Recording recording, double cutoff) {
    Validate.notNull(recording, "recording must not be null");
    TerminalCore core = new ReplayTerminalCore(recording.cols(), recording.rows(), recording.theme());
    for (OutputEvent e : recording.outputEvents()) {
      if (e.time() > cutoff) {
        break;
      }
      core.feed(e.text());
    }
    return core.snapshot();
  }
}
