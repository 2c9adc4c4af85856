package com.consullo.castedit.timeline;

import com.consullo.castedit.recording.OutputEvent;
import java.util.List;

/**
 * Output events contributed by one segment to a preview, in source order.
 *
 * @param segment contributing segment
 * @param events output events with source time inside the segment's played range
 * @since 1.0
 */
public record PreviewSlice(Segment segment, List<OutputEvent> events) {

  public PreviewSlice {
    events = List.copyOf(events);
  }
}
