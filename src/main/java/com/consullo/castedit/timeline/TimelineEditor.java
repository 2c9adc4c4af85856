package com.consullo.castedit.timeline;

import com.consullo.castedit.recording.Recording;
import com.consullo.castedit.recording.SourceRegistry;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.function.Supplier;
import org.apache.commons.lang3.Validate;

/**
 * Edit operations over {@link Timeline} values.
 *
 * <p>
 * Every operation is a pure function of its arguments: it returns a new timeline wrapped in an accepted
 * {@link EditResult}, or a declined result when the edit would break a timeline invariant. Policy violations
 * never throw; only programming errors (null arguments) do.
 * </p>
 *
 * <p>
 * Invariants kept by every operation: at least one segment; {@code 0 <= start < end <= source duration};
 * {@code timelineDuration > 0}; playhead within {@code [0, composedDuration]}.
 * </p>
 */
public final class TimelineEditor {

  /** Smallest source span a split or trim may leave behind. */
  public static final double MIN_SOURCE_SPAN = 0.01;

  /** Largest source gap two segments may have and still be healed. */
  public static final double HEAL_TOLERANCE = 0.02;

  /** Floor applied to scaled timeline durations. */
  public static final double MIN_TIMELINE_DURATION = 0.01;

  private static final String COPY_SUFFIX = " Copy";

  private final Supplier<String> idGenerator;

  public TimelineEditor() {
    this(() -> UUID.randomUUID().toString());
  }

  /**
   * Creates an editor with a custom segment id source.
   *
   * @param idGenerator supplies a fresh unique id per call
   */
  public TimelineEditor(Supplier<String> idGenerator) {
    Validate.notNull(idGenerator, "idGenerator must not be null");
    this.idGenerator = idGenerator;
  }

  /**
   * Creates a timeline holding one segment that spans the whole recording.
   *
   * @param recording loaded recording
   * @return accepted result with the new timeline, or declined when the recording has no playable span
   */
  public EditResult create(Recording recording) {
    Validate.notNull(recording, "recording must not be null");
    if (recording.duration() < MIN_SOURCE_SPAN) {
      return EditResult.declined("Recording " + recording.name() + " has no playable output.");
    }
    Segment first = new Segment(idGenerator.get(), labelFor(recording.name()), recording.id(),
        0, recording.duration(), recording.duration());
    return EditResult.accepted(Timeline.of(first), "Created timeline from " + recording.name() + ".");
  }

  /**
   * Adds a clip of {@code [in, out]} from a recording. The range is clamped into the recording. With
   * {@code atTime} the clip goes to the segment boundary nearest to it (comparing against each segment's
   * half-point), otherwise it is appended. The playhead moves to the new clip's start.
   *
   * @param timeline current timeline
   * @param recording source of the clip
   * @param in requested source in-point
   * @param out requested source out-point
   * @param atTime timeline time to insert near, or null to append
   * @return edit result
   */
  public EditResult insert(Timeline timeline, Recording recording, double in, double out, Double atTime) {
    Validate.notNull(timeline, "timeline must not be null");
    Validate.notNull(recording, "recording must not be null");
    if (!Double.isFinite(in) || !Double.isFinite(out)) {
      return EditResult.declined("Clip range must be finite.");
    }
    double duration = recording.duration();
    if (duration < MIN_SOURCE_SPAN) {
      return EditResult.declined("Recording " + recording.name() + " has no playable output.");
    }
    double start = clamp(in, 0, duration - MIN_SOURCE_SPAN);
    double end = clamp(out, start + MIN_SOURCE_SPAN, duration);
    Segment clip = new Segment(idGenerator.get(), labelFor(recording.name()), recording.id(),
        start, end, end - start);

    List<Segment> segments = new ArrayList<>(timeline.segments());
    int insertIndex = segments.size();
    if (atTime != null && Double.isFinite(atTime)) {
      double target = clamp(atTime, 0, timeline.composedDuration());
      double cursor = 0;
      for (int i = 0; i < segments.size(); i++) {
        double len = segments.get(i).timelineDuration();
        if (target <= cursor + len * 0.5) {
          insertIndex = i;
          break;
        }
        if (target <= cursor + len) {
          insertIndex = i + 1;
          break;
        }
        cursor += len;
      }
    }
    segments.add(insertIndex, clip);
    Timeline base = timeline.withSegments(segments);
    Timeline next = base.withPlayhead(base.segmentStart(insertIndex));
    return EditResult.accepted(next, "Added clip from " + recording.name() + " ("
        + TimeFormat.format(start) + " - " + TimeFormat.format(end) + ").");
  }

  /**
   * Splits the segment strictly containing timeline time {@code t} into two contiguous segments.
   *
   * @param timeline current timeline
   * @param t timeline time
   * @return edit result
   */
  public EditResult split(Timeline timeline, double t) {
    Validate.notNull(timeline, "timeline must not be null");
    if (!Double.isFinite(t) || t <= 0 || t >= timeline.composedDuration()) {
      return EditResult.declined("Split point must lie strictly inside the timeline.");
    }
    Optional<SegmentPosition> found = timeline.locateStrict(t);
    if (found.isEmpty()) {
      return EditResult.declined("Split point lies on an existing clip boundary.");
    }
    SegmentPosition pos = found.get();
    Segment seg = pos.segment();
    double ratio = pos.offset() / seg.timelineDuration();
    double splitSource = seg.start() + ratio * (seg.end() - seg.start());
    if (splitSource - seg.start() < MIN_SOURCE_SPAN || seg.end() - splitSource < MIN_SOURCE_SPAN) {
      return EditResult.declined("Split point is too close to the clip edge.");
    }
    double leftDuration = seg.timelineDuration() * ratio;
    double rightDuration = seg.timelineDuration() - leftDuration;
    if (leftDuration <= 0 || rightDuration <= 0) {
      return EditResult.declined("Split point is too close to the clip edge.");
    }

    Segment left = new Segment(idGenerator.get(), seg.label() + " A", seg.sourceId(),
        seg.start(), splitSource, leftDuration);
    Segment right = new Segment(idGenerator.get(), seg.label() + " B", seg.sourceId(),
        splitSource, seg.end(), rightDuration);

    List<Segment> segments = new ArrayList<>(timeline.segments());
    segments.set(pos.index(), left);
    segments.add(pos.index() + 1, right);
    return EditResult.accepted(timeline.withSegments(segments),
        "Split " + seg.label() + " at " + TimeFormat.format(t) + ".");
  }

  /**
   * Moves one edge of a segment. The new boundary is clamped so that at least {@link #MIN_SOURCE_SPAN}
   * remains and the range stays inside the source. The segment is re-timed 1:1.
   *
   * @param timeline current timeline
   * @param sources registry holding the segment's source
   * @param segmentId segment to trim
   * @param edge edge to move
   * @param newBoundary requested source time for that edge
   * @return edit result
   */
  public EditResult trim(Timeline timeline, SourceRegistry sources, String segmentId, TrimEdge edge,
      double newBoundary) {
    Validate.notNull(timeline, "timeline must not be null");
    Validate.notNull(sources, "sources must not be null");
    Validate.notNull(edge, "edge must not be null");
    int index = timeline.indexOf(segmentId);
    if (index < 0) {
      return EditResult.declined("No clip with id " + segmentId + ".");
    }
    if (!Double.isFinite(newBoundary)) {
      return EditResult.declined("Trim boundary must be finite.");
    }
    Segment seg = timeline.get(index);
    Optional<Recording> source = sources.find(seg.sourceId());
    if (source.isEmpty()) {
      return EditResult.declined("Source of clip " + seg.label() + " is not loaded.");
    }

    Segment trimmed;
    if (edge == TrimEdge.LEFT) {
      double start = clamp(newBoundary, 0, seg.end() - MIN_SOURCE_SPAN);
      trimmed = seg.withSourceRange(start, seg.end());
    } else {
      double end = clamp(newBoundary, seg.start() + MIN_SOURCE_SPAN, source.get().duration());
      trimmed = seg.withSourceRange(seg.start(), end);
    }

    List<Segment> segments = new ArrayList<>(timeline.segments());
    segments.set(index, trimmed);
    return EditResult.accepted(timeline.withSegments(segments), "Trimmed " + seg.label() + " to "
        + TimeFormat.format(trimmed.start()) + " - " + TimeFormat.format(trimmed.end()) + ".");
  }

  /**
   * Relocates a segment next to another one.
   *
   * @param timeline current timeline
   * @param segmentId segment to move
   * @param targetId reference segment
   * @param placeAfter true to place after the reference, false for before
   * @return edit result
   */
  public EditResult move(Timeline timeline, String segmentId, String targetId, boolean placeAfter) {
    Validate.notNull(timeline, "timeline must not be null");
    int sourceIndex = timeline.indexOf(segmentId);
    int targetIndex = timeline.indexOf(targetId);
    if (sourceIndex < 0 || targetIndex < 0) {
      return EditResult.declined("Both clips must be on the timeline.");
    }
    if (sourceIndex == targetIndex) {
      return EditResult.declined("A clip cannot be moved relative to itself.");
    }
    List<Segment> segments = new ArrayList<>(timeline.segments());
    Segment moved = segments.remove(sourceIndex);
    int insertion = targetIndex;
    if (sourceIndex < targetIndex) {
      insertion--;
    }
    if (placeAfter) {
      insertion++;
    }
    insertion = Math.max(0, Math.min(segments.size(), insertion));
    segments.add(insertion, moved);
    return EditResult.accepted(timeline.withSegments(segments), "Moved " + moved.label() + ".");
  }

  /**
   * Clones a segment under a fresh id, for the clipboard.
   *
   * @param timeline current timeline
   * @param segmentId segment to copy
   * @return clone, empty when no such segment exists
   */
  public Optional<Segment> copy(Timeline timeline, String segmentId) {
    Validate.notNull(timeline, "timeline must not be null");
    return timeline.find(segmentId).map(s -> s.withId(idGenerator.get()));
  }

  /**
   * Removes a segment. Declined when it is the last one.
   *
   * @param timeline current timeline
   * @param segmentId segment to remove
   * @return edit result
   */
  public EditResult delete(Timeline timeline, String segmentId) {
    Validate.notNull(timeline, "timeline must not be null");
    int index = timeline.indexOf(segmentId);
    if (index < 0) {
      return EditResult.declined("No clip with id " + segmentId + ".");
    }
    if (timeline.size() <= 1) {
      return EditResult.declined("The last remaining clip cannot be removed.");
    }
    List<Segment> segments = new ArrayList<>(timeline.segments());
    Segment removed = segments.remove(index);
    return EditResult.accepted(timeline.withSegments(segments), "Removed " + removed.label() + ".");
  }

  /**
   * Inserts a fresh-id clone of {@code clip} next to a reference segment. The clone's label gains a
   * " Copy" suffix once.
   *
   * @param timeline current timeline
   * @param sources registry that must hold the clip's source
   * @param clip clipboard content
   * @param referenceId segment to paste next to
   * @param placeAfter true to paste after the reference, false for before
   * @return edit result
   */
  public EditResult paste(Timeline timeline, SourceRegistry sources, Segment clip, String referenceId,
      boolean placeAfter) {
    Validate.notNull(timeline, "timeline must not be null");
    Validate.notNull(sources, "sources must not be null");
    if (clip == null) {
      return EditResult.declined("Clipboard is empty.");
    }
    int index = timeline.indexOf(referenceId);
    if (index < 0) {
      return EditResult.declined("No clip with id " + referenceId + ".");
    }
    Optional<Recording> source = sources.find(clip.sourceId());
    if (source.isEmpty() || clip.end() > source.get().duration()) {
      return EditResult.declined("Clipboard clip refers to a source that is not loaded.");
    }
    String label = clip.label().endsWith(COPY_SUFFIX) ? clip.label() : clip.label() + COPY_SUFFIX;
    Segment pasted = clip.withId(idGenerator.get()).withLabel(label);
    List<Segment> segments = new ArrayList<>(timeline.segments());
    segments.add(placeAfter ? index + 1 : index, pasted);
    return EditResult.accepted(timeline.withSegments(segments), "Pasted " + label + ".");
  }

  /**
   * Merges two timeline-adjacent segments of the same source whose source ranges meet within
   * {@link #HEAL_TOLERANCE}. The ids may be given in either order.
   *
   * @param timeline current timeline
   * @param firstId one of the two segments
   * @param secondId the other segment
   * @return edit result
   */
  public EditResult heal(Timeline timeline, String firstId, String secondId) {
    Validate.notNull(timeline, "timeline must not be null");
    int i1 = timeline.indexOf(firstId);
    int i2 = timeline.indexOf(secondId);
    if (i1 < 0 || i2 < 0) {
      return EditResult.declined("Both clips must be on the timeline.");
    }
    int leftIndex = Math.min(i1, i2);
    int rightIndex = Math.max(i1, i2);
    if (rightIndex != leftIndex + 1) {
      return EditResult.declined("Only adjacent clips can be healed.");
    }
    Segment left = timeline.get(leftIndex);
    Segment right = timeline.get(rightIndex);
    if (!left.sourceId().equals(right.sourceId())) {
      return EditResult.declined("Clips come from different sources.");
    }
    if (Math.abs(left.end() - right.start()) > HEAL_TOLERANCE || right.end() <= left.start()) {
      return EditResult.declined("Clips are not contiguous in the source.");
    }

    Segment merged = new Segment(idGenerator.get(), healedLabel(left.label()), left.sourceId(),
        left.start(), right.end(), left.timelineDuration() + right.timelineDuration());
    List<Segment> segments = new ArrayList<>(timeline.segments());
    segments.set(leftIndex, merged);
    segments.remove(rightIndex);
    return EditResult.accepted(timeline.withSegments(segments), "Healed clips into "
        + TimeFormat.format(merged.start()) + " - " + TimeFormat.format(merged.end()) + ".");
  }

  /**
   * Sets one segment's timeline duration, changing its playback speed.
   *
   * @param timeline current timeline
   * @param segmentId segment to scale
   * @param targetSeconds new timeline duration
   * @return edit result
   */
  public EditResult scaleSegment(Timeline timeline, String segmentId, double targetSeconds) {
    Validate.notNull(timeline, "timeline must not be null");
    if (!Double.isFinite(targetSeconds) || targetSeconds <= 0) {
      return EditResult.declined("Target duration must be a positive number.");
    }
    int index = timeline.indexOf(segmentId);
    if (index < 0) {
      return EditResult.declined("Select a clip to scale.");
    }
    Segment seg = timeline.get(index);
    Segment scaled = seg.withTimelineDuration(Math.max(MIN_TIMELINE_DURATION, targetSeconds));
    List<Segment> segments = new ArrayList<>(timeline.segments());
    segments.set(index, scaled);
    return EditResult.accepted(timeline.withSegments(segments),
        "Scaled clip to " + TimeFormat.format(scaled.timelineDuration()) + ".");
  }

  /**
   * Rescales a selection of at least two segments so their timeline durations sum to
   * {@code targetTotalSeconds}, keeping each member's share. Unknown ids are ignored.
   *
   * @param timeline current timeline
   * @param segmentIds selected segments
   * @param targetTotalSeconds new total duration of the selection
   * @return edit result
   */
  public EditResult scaleSelection(Timeline timeline, Collection<String> segmentIds, double targetTotalSeconds) {
    Validate.notNull(timeline, "timeline must not be null");
    Validate.notNull(segmentIds, "segmentIds must not be null");
    if (!Double.isFinite(targetTotalSeconds) || targetTotalSeconds <= 0) {
      return EditResult.declined("Target duration must be a positive number.");
    }
    Set<String> selected = new LinkedHashSet<>(segmentIds);
    double total = 0;
    int count = 0;
    for (Segment s : timeline.segments()) {
      if (selected.contains(s.id())) {
        total += s.timelineDuration();
        count++;
      }
    }
    if (count < 2) {
      return EditResult.declined("Select at least two clips before scaling selected total.");
    }
    if (total <= 0) {
      return EditResult.declined("Selected clips have no duration.");
    }
    double factor = targetTotalSeconds / total;
    List<Segment> segments = new ArrayList<>(timeline.size());
    for (Segment s : timeline.segments()) {
      if (selected.contains(s.id())) {
        segments.add(s.withTimelineDuration(Math.max(MIN_TIMELINE_DURATION, s.timelineDuration() * factor)));
      } else {
        segments.add(s);
      }
    }
    return EditResult.accepted(timeline.withSegments(segments),
        "Scaled " + count + " clips to " + TimeFormat.format(targetTotalSeconds) + " total.");
  }

  /**
   * Clip label derived from a file name: the name without a .cast/.asciicast/.json extension.
   *
   * @param name file or display name
   * @return label, "Clip 1" when nothing is left
   */
  public static String labelFor(String name) {
    String label = name == null ? "" : name.replaceFirst("(?i)\\.(cast|asciicast|json)$", "");
    return label.isEmpty() ? "Clip 1" : label;
  }

  private static String healedLabel(String label) {
    String stripped = label.replaceFirst("(?i)\\s+[AB]$", "");
    return stripped.isEmpty() ? label : stripped;
  }

  private static double clamp(double v, double min, double max) {
    return Math.max(min, Math.min(max, v));
  }
}
