package com.consullo.castedit.export;

import com.consullo.castedit.recording.CastEvent;
import com.consullo.castedit.recording.Recording;
import com.consullo.castedit.recording.SourceRegistry;
import com.consullo.castedit.timeline.Segment;
import com.consullo.castedit.timeline.Timeline;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.IntNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.ArrayList;
import java.util.List;
import org.apache.commons.lang3.Validate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Flattens a timeline into one re-timed event stream and wraps it as a version 2 cast.
 *
 * <p>
 * Segments are walked in play order with a running timeline cursor. Each segment contributes every raw event
 * of its source (all kinds, not only output) with source time in {@code [start, end]}, mapped to
 * {@code cursor + ((t - start) / (end - start)) * timelineDuration} and rounded to 6 decimals; the cursor
 * then advances by the segment's timeline duration. Mapped offsets never exceed the segment's duration, so
 * the result is non-decreasing in time.
 * </p>
 *
 * <p>The screen buffer is never involved; export works on raw events only.</p>
 */
public final class ExportBuilder {

  private static final Logger LOGGER = LoggerFactory.getLogger(ExportBuilder.class);

  /** Version every export declares: absolute event times. */
  public static final int EXPORT_VERSION = 2;

  private static final double ROUNDING = 1_000_000d;

  private final ObjectMapper mapper;

  public ExportBuilder() {
    this(new ObjectMapper());
  }

  public ExportBuilder(ObjectMapper mapper) {
    Validate.notNull(mapper, "mapper must not be null");
    this.mapper = mapper;
  }

  /**
   * Produces the flattened, re-timed event stream.
   *
   * @param timeline timeline to flatten
   * @param sources registry holding every referenced source
   * @return events with timeline times
   */
  public List<CastEvent> flatten(Timeline timeline, SourceRegistry sources) {
    Validate.notNull(timeline, "timeline must not be null");
    Validate.notNull(sources, "sources must not be null");
    List<CastEvent> out = new ArrayList<>();
    double timelineCursor = 0;
    for (Segment seg : timeline.segments()) {
      Recording source = sources.require(seg.sourceId());
      double srcLen = seg.sourceLength();
      for (CastEvent ev : source.events()) {
        double t = ev.time();
        if (t < seg.start() || t > seg.end()) {
          continue;
        }
        double ratio = (t - seg.start()) / srcLen;
        double mapped = timelineCursor + ratio * seg.timelineDuration();
        out.add(ev.withTime(round6(mapped)));
      }
      timelineCursor += seg.timelineDuration();
    }
    LOGGER.debug("flatten: {} segments -> {} events", timeline.size(), out.size());
    return out;
  }

  /**
   * Builds the export document: the first registered recording's header with {@code version} forced to 2
   * and {@code events} replaced by the flattened stream. Other header fields pass through.
   *
   * @param timeline timeline to export
   * @param sources registry holding every referenced source
   * @return cast document
   */
  public ObjectNode build(Timeline timeline, SourceRegistry sources) {
    Recording primary = sources.first()
        .orElseThrow(() -> new IllegalStateException("No recording loaded."));
    ObjectNode doc = primary.header();
    doc.set("version", IntNode.valueOf(EXPORT_VERSION));
    ArrayNode events = mapper.createArrayNode();
    for (CastEvent ev : flatten(timeline, sources)) {
      events.add(CastWriter.toArray(mapper, ev));
    }
    doc.set("events", events);
    return doc;
  }

  static double round6(double v) {
    return Math.round(v * ROUNDING) / ROUNDING;
  }
}
