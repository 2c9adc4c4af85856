package com.consullo.castedit.timeline;

/**
 * Where a timeline time falls: the segment, its index and cumulative start, and the offset into it.
 *
 * @param index segment index in play order
 * @param segment the segment
 * @param timelineStart cumulative timeline time at which the segment begins
 * @param offset offset of the queried time from {@code timelineStart}, clamped to the segment
 * @since 1.0
 */
public record SegmentPosition(int index, Segment segment, double timelineStart, double offset) {

  public double sourceTime() {
    return segment.sourceTime(offset);
  }
}
