package com.consullo.castedit.session;

import com.consullo.castedit.core.TerminalSnapshot;
import com.consullo.castedit.export.ExportBuilder;
import com.consullo.castedit.recording.CastEvent;
import com.consullo.castedit.recording.CastFormatException;
import com.consullo.castedit.recording.CastParser;
import com.consullo.castedit.recording.OutputEvent;
import com.consullo.castedit.recording.Recording;
import com.consullo.castedit.recording.SourceRegistry;
import com.consullo.castedit.timeline.EditResult;
import com.consullo.castedit.timeline.PreviewRenderer;
import com.consullo.castedit.timeline.Segment;
import com.consullo.castedit.timeline.Timeline;
import com.consullo.castedit.timeline.TimelineEditor;
import com.consullo.castedit.timeline.TrimEdge;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import org.apache.commons.lang3.Validate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Represents a single editing session over one or more loaded recordings.
 *
 * <p>
 * Owns:
 * <ul>
 * <li>the source registry of loaded recordings</li>
 * <li>the current timeline and its undo history</li>
 * <li>a single-slot clipboard</li>
 * <li>the playback clock</li>
 * </ul>
 * </p>
 *
 * <p>
 * Edits are delegated to {@link TimelineEditor}. An accepted edit replaces the timeline and is recorded in
 * the history; a declined edit leaves everything as it was. Playhead moves (seek, playback) are not
 * recorded. The session is not thread-safe; callers serialize mutations.
 * </p>
 */
public final class EditorSession {

  private static final Logger LOGGER = LoggerFactory.getLogger(EditorSession.class);

  private final EditorSessionConfig config;
  private final CastParser parser;
  private final TimelineEditor editor;
  private final PreviewRenderer previewRenderer;
  private final ExportBuilder exportBuilder;

  private final SourceRegistry sources = new SourceRegistry();
  private final EditHistory history;
  private final PlaybackClock clock = new PlaybackClock();

  private Timeline timeline;
  private Segment clipboard;

  private EditorSession(EditorSessionConfig config, CastParser parser, TimelineEditor editor,
      PreviewRenderer previewRenderer, ExportBuilder exportBuilder) {
    this.config = config;
    this.parser = parser;
    this.editor = editor;
    this.previewRenderer = previewRenderer;
    this.exportBuilder = exportBuilder;
    this.history = new EditHistory(config.historyDepth());
  }

  public static EditorSession create(EditorSessionConfig config, CastParser parser, TimelineEditor editor,
      PreviewRenderer previewRenderer, ExportBuilder exportBuilder) {
    if (config == null || parser == null || editor == null || previewRenderer == null
        || exportBuilder == null) {
      throw new IllegalArgumentException("config/parser/editor/previewRenderer/exportBuilder must not be null.");
    }
    return new EditorSession(config, parser, editor, previewRenderer, exportBuilder);
  }

  public EditorSessionConfig config() {
    return config;
  }

  public SourceRegistry sources() {
    return sources;
  }

  public PlaybackClock clock() {
    return clock;
  }

  public boolean hasTimeline() {
    return timeline != null;
  }

  /**
   * Current timeline.
   *
   * @return timeline
   * @throws IllegalStateException if nothing has been loaded yet
   */
  public Timeline timeline() {
    if (timeline == null) {
      throw new IllegalStateException("No recording loaded.");
    }
    return timeline;
  }

  public Optional<Segment> clipboard() {
    return Optional.ofNullable(clipboard);
  }

  // ---------------------------------------------------------------------------
  // loading
  // ---------------------------------------------------------------------------

  /**
   * Parses and registers a recording.
   *
   * <p>
   * With {@code replace}, or when nothing is loaded yet, the registry is cleared, a new timeline spanning
   * the whole recording is created, the playhead is placed shortly after the first output, and the history
   * is reset. Otherwise the recording only joins the registry as a clip source.
   * </p>
   *
   * @param name display name, usually the file name
   * @param text cast file content
   * @param replace true to start over with this recording
   * @return registered recording (an existing one when the same name and duration were loaded before)
   * @throws CastFormatException if the content is not a cast or has no playable output
   */
  public Recording load(String name, String text, boolean replace) throws CastFormatException {
    Validate.notNull(text, "text must not be null");
    Recording parsed = parser.parse(name == null ? "" : name, text);
    if (!replace && timeline != null) {
      Recording registered = sources.register(parsed);
      LOGGER.info("Added source {} ({}s, {} events).", registered.name(), registered.duration(),
          registered.events().size());
      return registered;
    }

    EditResult created = editor.create(parsed);
    if (created.isDeclined()) {
      throw new CastFormatException(created.message());
    }
    sources.clear();
    Recording registered = sources.register(parsed);
    clock.pause();
    clipboard = null;
    Timeline fresh = created.requireTimeline();
    timeline = fresh.withPlayhead(initialPlayhead(registered));
    history.reset(timeline);
    LOGGER.info("Loaded {} ({}x{}, {}s, {} events).", registered.name(), registered.cols(),
        registered.rows(), registered.duration(), registered.events().size());
    return registered;
  }

  /**
   * Loads several files. Files that cannot be read or parsed are skipped with a warning. The first file
   * that loads uses {@code replace}; the rest are appended as sources.
   *
   * @param files cast files
   * @param replace true to start over with the first loadable file
   * @return recordings that were loaded
   */
  public List<Recording> loadFiles(List<Path> files, boolean replace) {
    Validate.notNull(files, "files must not be null");
    List<Recording> loaded = new ArrayList<>();
    boolean replaceNext = replace;
    for (Path file : files) {
      try {
        String text = Files.readString(file, StandardCharsets.UTF_8);
        loaded.add(load(String.valueOf(file.getFileName()), text, replaceNext));
        replaceNext = false;
      } catch (IOException | CastFormatException e) {
        LOGGER.warn("Skipping {}: {}", file, e.getMessage());
      }
    }
    return loaded;
  }

  private double initialPlayhead(Recording recording) {
    List<OutputEvent> outputs = recording.outputEvents();
    double firstOutput = outputs.isEmpty() ? 0 : outputs.get(0).time();
    return Math.min(firstOutput + config.previewLeadIn(), recording.duration());
  }

  // ---------------------------------------------------------------------------
  // edits
  // ---------------------------------------------------------------------------

  public EditResult insert(String sourceId, double in, double out, Double atTime) {
    Optional<Recording> source = sources.find(sourceId);
    if (source.isEmpty()) {
      return declined("insert", "Unknown source " + sourceId + ".");
    }
    return apply("insert", editor.insert(timeline(), source.get(), in, out, atTime));
  }

  public EditResult split(double t) {
    return apply("split", editor.split(timeline(), t));
  }

  public EditResult splitAtPlayhead() {
    return split(timeline().playheadTime());
  }

  public EditResult trim(String segmentId, TrimEdge edge, double newBoundary) {
    return apply("trim", editor.trim(timeline(), sources, segmentId, edge, newBoundary));
  }

  public EditResult move(String segmentId, String targetId, boolean placeAfter) {
    return apply("move", editor.move(timeline(), segmentId, targetId, placeAfter));
  }

  /**
   * Puts a fresh-id clone of a segment on the clipboard. The timeline is unchanged.
   *
   * @param segmentId segment to copy
   * @return true if the clipboard now holds the segment
   */
  public boolean copy(String segmentId) {
    Optional<Segment> copied = editor.copy(timeline(), segmentId);
    copied.ifPresent(s -> clipboard = s);
    LOGGER.debug("copy {}: {}", segmentId, copied.isPresent() ? "ok" : "no such clip");
    return copied.isPresent();
  }

  /**
   * Copies then deletes a segment. The clipboard only changes when the delete is accepted.
   *
   * @param segmentId segment to cut
   * @return delete result
   */
  public EditResult cut(String segmentId) {
    Optional<Segment> copied = editor.copy(timeline(), segmentId);
    EditResult result = apply("cut", editor.delete(timeline(), segmentId));
    if (result.isAccepted()) {
      clipboard = copied.orElse(null);
    }
    return result;
  }

  public EditResult delete(String segmentId) {
    return apply("delete", editor.delete(timeline(), segmentId));
  }

  public EditResult paste(String referenceId, boolean placeAfter) {
    return apply("paste", editor.paste(timeline(), sources, clipboard, referenceId, placeAfter));
  }

  public EditResult heal(String firstId, String secondId) {
    return apply("heal", editor.heal(timeline(), firstId, secondId));
  }

  public EditResult scaleSegment(String segmentId, double targetSeconds) {
    return apply("scale", editor.scaleSegment(timeline(), segmentId, targetSeconds));
  }

  public EditResult scaleSelection(Collection<String> segmentIds, double targetTotalSeconds) {
    return apply("scale selection", editor.scaleSelection(timeline(), segmentIds, targetTotalSeconds));
  }

  public boolean undo() {
    Optional<Timeline> previous = history.undo();
    previous.ifPresent(this::restore);
    return previous.isPresent();
  }

  public boolean redo() {
    Optional<Timeline> next = history.redo();
    next.ifPresent(this::restore);
    return next.isPresent();
  }

  public boolean canUndo() {
    return history.canUndo();
  }

  public boolean canRedo() {
    return history.canRedo();
  }

  private void restore(Timeline snapshot) {
    clock.pause();
    timeline = snapshot;
    LOGGER.info("Restored {}", snapshot);
  }

  private EditResult apply(String operation, EditResult result) {
    if (result.isDeclined()) {
      return declined(operation, result.message());
    }
    timeline = result.requireTimeline();
    history.record(timeline);
    LOGGER.info("{}: {}", operation, result.message());
    return result;
  }

  private EditResult declined(String operation, String reason) {
    LOGGER.debug("{} declined: {}", operation, reason);
    return EditResult.declined(reason);
  }

  // ---------------------------------------------------------------------------
  // playhead, playback, preview, export
  // ---------------------------------------------------------------------------

  public void seek(double t) {
    timeline = timeline().withPlayhead(t);
  }

  public void rewind() {
    clock.pause();
    seek(0);
  }

  public void play() {
    clock.play();
  }

  public void pause() {
    clock.pause();
  }

  /**
   * Advances the playhead by one playback tick.
   *
   * @param elapsedSeconds real time since the previous tick
   * @return new playhead
   */
  public double tick(double elapsedSeconds) {
    Timeline current = timeline();
    double next = clock.tick(elapsedSeconds, current.playheadTime(), current.composedDuration());
    timeline = current.withPlayhead(next);
    return next;
  }

  public TerminalSnapshot preview() {
    return preview(timeline().playheadTime());
  }

  public TerminalSnapshot preview(double t) {
    return previewRenderer.render(timeline(), sources, t);
  }

  public TerminalSnapshot preview(double t, int rows, int cols) {
    return previewRenderer.render(timeline(), sources, t, rows, cols);
  }

  /**
   * Flattened, re-timed event stream of the current timeline.
   *
   * @return events in timeline time
   */
  public List<CastEvent> flatten() {
    return exportBuilder.flatten(timeline(), sources);
  }

  public ObjectNode export() {
    return exportBuilder.build(timeline(), sources);
  }
}
