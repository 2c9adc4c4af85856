package com.consullo.castedit.session;

import com.consullo.castedit.export.ExportBuilder;
import com.consullo.castedit.recording.CastParser;
import com.consullo.castedit.timeline.PreviewRenderer;
import com.consullo.castedit.timeline.TimelineEditor;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Factory for creating editing sessions with sensible defaults.
 *
 * <p>
 * Centralizes the wiring of parser, editor, preview renderer and export builder around one shared
 * {@link ObjectMapper}.
 * </p>
 */
public final class EditorSessionFactory {

  private EditorSessionFactory() {
  }

  public static EditorSession createDefaultSession() {
    return createSession(EditorSessionConfig.defaults());
  }

  /**
   * Create an editing session.
   *
   * @param config session configuration
   * @return session
   */
  public static EditorSession createSession(EditorSessionConfig config) {
    if (config == null) {
      throw new IllegalArgumentException("config must not be null.");
    }
    ObjectMapper mapper = new ObjectMapper();
    return EditorSession.create(
        config,
        new CastParser(mapper),
        new TimelineEditor(),
        new PreviewRenderer(config.boundaryStylePolicy()),
        new ExportBuilder(mapper));
  }
}
