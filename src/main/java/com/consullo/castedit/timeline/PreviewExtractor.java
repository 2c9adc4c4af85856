package com.consullo.castedit.timeline;

import com.consullo.castedit.recording.OutputEvent;
import com.consullo.castedit.recording.Recording;
import com.consullo.castedit.recording.SourceRegistry;
import java.util.ArrayList;
import java.util.List;
import org.apache.commons.lang3.Validate;

/**
 * Collects the output events that are visible at a timeline time.
 *
 * <p>
 * Segments are walked in play order. A segment that ends at or before {@code t} contributes every output
 * event with source time in {@code [start, end]}; the segment containing {@code t} contributes events up to
 * the source cutoff given by the time mapping; later segments contribute nothing.
 * </p>
 *
 * @since 1.0
 */
public final class PreviewExtractor {

  private PreviewExtractor() {
  }

  /**
   * Returns per-segment slices of the events visible at {@code t}.
   *
   * @param timeline timeline
   * @param sources registry holding every referenced source
   * @param t timeline time; a non-finite value is read as 0
   * @return slices in play order
   */
  public static List<PreviewSlice> slicesUpTo(Timeline timeline, SourceRegistry sources, double t) {
    Validate.notNull(timeline, "timeline must not be null");
    Validate.notNull(sources, "sources must not be null");
    if (!Double.isFinite(t)) {
      t = 0;
    }
    List<PreviewSlice> slices = new ArrayList<>();
    double acc = 0;
    for (Segment seg : timeline.segments()) {
      double len = seg.timelineDuration();
      double remaining = t - acc;
      double offset = remaining >= len ? len : Math.max(0, Math.min(len, remaining));
      double cutoff = seg.sourceTime(offset);

      Recording source = sources.require(seg.sourceId());
      List<OutputEvent> picked = new ArrayList<>();
      for (OutputEvent ev : source.outputEvents()) {
        if (ev.time() > cutoff) {
          break;
        }
        if (ev.time() >= seg.start()) {
          picked.add(ev);
        }
      }
      slices.add(new PreviewSlice(seg, picked));

      if (remaining < len) {
        break;
      }
      acc += len;
    }
    return slices;
  }

  /**
   * Returns the visible events as one continuous stream.
   *
   * @param timeline timeline
   * @param sources registry holding every referenced source
   * @param t timeline time
   * @return events in replay order, possibly spanning several sources
   */
  public static List<OutputEvent> eventsUpTo(Timeline timeline, SourceRegistry sources, double t) {
    List<OutputEvent> out = new ArrayList<>();
    for (PreviewSlice slice : slicesUpTo(timeline, sources, t)) {
      out.addAll(slice.events());
    }
    return out;
  }
}
