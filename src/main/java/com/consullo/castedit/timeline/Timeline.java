package com.consullo.castedit.timeline;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.apache.commons.lang3.Validate;

/**
 * Immutable, never-empty ordered list of segments plus the playhead.
 *
 * <p>
 * Play order is list order. The composed duration is the sum of the segments' timeline durations and the
 * playhead always lies in {@code [0, composedDuration]}. Every edit produces a new instance, so instances
 * can be kept as undo snapshots and compared with {@link #equals(Object)}.
 * </p>
 */
public final class Timeline {

  private final List<Segment> segments;
  private final double playheadTime;
  private final double composedDuration;

  private Timeline(List<Segment> segments, double playheadTime) {
    Validate.notEmpty(segments, "timeline must contain at least one segment");
    List<Segment> copy = new ArrayList<>(segments);
    for (Segment s : copy) {
      Validate.notNull(s, "segments must not contain null");
    }
    this.segments = Collections.unmodifiableList(copy);
    double total = 0;
    for (Segment s : copy) {
      total += s.timelineDuration();
    }
    this.composedDuration = total;
    double p = Double.isFinite(playheadTime) ? playheadTime : 0;
    this.playheadTime = Math.max(0, Math.min(total, p));
  }

  /**
   * Creates a timeline; the playhead is clamped to the composed duration.
   *
   * @param segments segments in play order, not empty
   * @param playheadTime playhead in timeline seconds
   * @return timeline
   */
  public static Timeline of(List<Segment> segments, double playheadTime) {
    Validate.notNull(segments, "segments must not be null");
    return new Timeline(segments, playheadTime);
  }

  public static Timeline of(Segment first) {
    return new Timeline(List.of(first), 0);
  }

  public List<Segment> segments() {
    return segments;
  }

  public int size() {
    return segments.size();
  }

  public Segment get(int index) {
    return segments.get(index);
  }

  public double playheadTime() {
    return playheadTime;
  }

  public double composedDuration() {
    return composedDuration;
  }

  public int indexOf(String segmentId) {
    for (int i = 0; i < segments.size(); i++) {
      if (segments.get(i).id().equals(segmentId)) {
        return i;
      }
    }
    return -1;
  }

  public Optional<Segment> find(String segmentId) {
    int i = indexOf(segmentId);
    return i < 0 ? Optional.empty() : Optional.of(segments.get(i));
  }

  /**
   * Cumulative timeline time at which the segment at {@code index} begins.
   *
   * @param index segment index, {@code size()} gives the composed duration
   * @return start time on the timeline
   */
  public double segmentStart(int index) {
    if (index < 0 || index > segments.size()) {
      throw new IndexOutOfBoundsException("index out of range: " + index);
    }
    double start = 0;
    for (int i = 0; i < index; i++) {
      start += segments.get(i).timelineDuration();
    }
    return start;
  }

  /**
   * Finds the segment whose cumulative range strictly contains {@code t}. Boundaries, 0 and the composed
   * duration belong to no segment.
   *
   * @param t timeline time
   * @return position, or empty when {@code t} is outside every open segment range
   */
  public Optional<SegmentPosition> locateStrict(double t) {
    double cursor = 0;
    for (int i = 0; i < segments.size(); i++) {
      Segment s = segments.get(i);
      double next = cursor + s.timelineDuration();
      if (t > cursor && t < next) {
        return Optional.of(new SegmentPosition(i, s, cursor, t - cursor));
      }
      cursor = next;
    }
    return Optional.empty();
  }

  /**
   * Finds the segment covering {@code t}, preferring the earlier segment on a boundary. Times past the end
   * resolve to the end of the last segment; negative times to the start of the first.
   *
   * @param t timeline time
   * @return position, never empty
   */
  public SegmentPosition locate(double t) {
    double cursor = 0;
    int last = segments.size() - 1;
    for (int i = 0; i < segments.size(); i++) {
      Segment s = segments.get(i);
      double len = s.timelineDuration();
      if (t <= cursor + len || i == last) {
        double offset = Math.max(0, Math.min(len, t - cursor));
        return new SegmentPosition(i, s, cursor, offset);
      }
      cursor += len;
    }
    throw new IllegalStateException("unreachable: timeline is never empty");
  }

  /**
   * Maps a timeline time to the source time of the segment that covers it.
   *
   * @param t timeline time
   * @return source time
   */
  public double timelineToSourceTime(double t) {
    return locate(t).sourceTime();
  }

  public Timeline withSegments(List<Segment> newSegments) {
    return new Timeline(newSegments, playheadTime);
  }

  public Timeline withSegments(List<Segment> newSegments, double newPlayhead) {
    return new Timeline(newSegments, newPlayhead);
  }

  public Timeline withPlayhead(double newPlayhead) {
    return new Timeline(segments, newPlayhead);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof Timeline)) {
      return false;
    }
    Timeline other = (Timeline) o;
    return Double.compare(playheadTime, other.playheadTime) == 0 && segments.equals(other.segments);
  }

  @Override
  public int hashCode() {
    return Objects.hash(segments, playheadTime);
  }

  @Override
  public String toString() {
    return "Timeline{segments=" + segments.size() + ", composed=" + TimeFormat.format(composedDuration)
        + ", playhead=" + TimeFormat.format(playheadTime) + "}";
  }
}
