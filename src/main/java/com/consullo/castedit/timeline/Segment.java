package com.consullo.castedit.timeline;

import org.apache.commons.lang3.Validate;

/**
 * A clip on the timeline: a sub-interval of one source recording plus the length it occupies on the edited
 * timeline.
 *
 * <p>
 * {@code timelineDuration} is independent of {@code end - start}; their ratio is the playback speed of the
 * clip. Segments hold the source id only, never the source events.
 * </p>
 *
 * @param id unique segment id
 * @param label display label
 * @param sourceId id of the source recording
 * @param start source start time in seconds
 * @param end source end time in seconds
 * @param timelineDuration length on the edited timeline in seconds
 * @since 1.0
 */
public record Segment(
    String id,
    String label,
    String sourceId,
    double start,
    double end,
    double timelineDuration) {

  public Segment {
    Validate.notBlank(id, "id must not be blank");
    Validate.notNull(label, "label must not be null");
    Validate.notBlank(sourceId, "sourceId must not be blank");
    Validate.isTrue(Double.isFinite(start) && Double.isFinite(end), "start/end must be finite");
    Validate.isTrue(start >= 0, "start must not be negative: %s", start);
    Validate.isTrue(start < end, "start must be before end: %s >= %s", start, end);
    Validate.isTrue(Double.isFinite(timelineDuration) && timelineDuration > 0,
        "timelineDuration must be positive: %s", timelineDuration);
  }

  /**
   * Source span covered by this segment.
   *
   * @return {@code end - start}
   */
  public double sourceLength() {
    return end - start;
  }

  /**
   * Maps an offset from the segment's timeline start to source time. The offset is clamped to
   * {@code [0, timelineDuration]}; the two bounds map exactly to {@code start} and {@code end}.
   *
   * @param timelineOffset offset in seconds from the segment's start on the timeline
   * @return source time
   */
  public double sourceTime(double timelineOffset) {
    if (timelineOffset <= 0) {
      return start;
    }
    if (timelineOffset >= timelineDuration) {
      return end;
    }
    return start + (timelineOffset / timelineDuration) * (end - start);
  }

  /**
   * Inverse of {@link #sourceTime(double)}: maps a source time inside the segment to the offset from the
   * segment's timeline start. The source time is clamped to {@code [start, end]}.
   *
   * @param sourceTime source time in seconds
   * @return timeline offset
   */
  public double timelineOffset(double sourceTime) {
    if (sourceTime <= start) {
      return 0;
    }
    if (sourceTime >= end) {
      return timelineDuration;
    }
    return ((sourceTime - start) / (end - start)) * timelineDuration;
  }

  /**
   * Playback speed relative to the source.
   *
   * @return source seconds per timeline second
   */
  public double speed() {
    return (end - start) / timelineDuration;
  }

  public Segment withId(String newId) {
    return new Segment(newId, label, sourceId, start, end, timelineDuration);
  }

  public Segment withLabel(String newLabel) {
    return new Segment(id, newLabel, sourceId, start, end, timelineDuration);
  }

  public Segment withTimelineDuration(double newDuration) {
    return new Segment(id, label, sourceId, start, end, newDuration);
  }

  /**
   * Replaces the source range and re-times the segment 1:1.
   */
  public Segment withSourceRange(double newStart, double newEnd) {
    return new Segment(id, label, sourceId, newStart, newEnd, newEnd - newStart);
  }
}
