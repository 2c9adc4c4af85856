package com.consullo.castedit.cli;

import com.consullo.castedit.core.TerminalSnapshot;
import com.consullo.castedit.core.render.RunRenderer;
import com.consullo.castedit.core.render.ScreenFormat;
import com.consullo.castedit.recording.CastFormatException;
import com.consullo.castedit.recording.CastParser;
import com.consullo.castedit.session.EditorSession;
import com.consullo.castedit.timeline.PreviewRenderer;
import com.consullo.castedit.timeline.Timeline;
import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.concurrent.Callable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

/**
 * Prints the screen of a recording at a point in time.
 */
@Command(name = "render", header = "Render the screen at a point in time", mixinStandardHelpOptions = true)
public class RenderCommand implements Callable<Integer> {

  private static final Logger LOGGER = LoggerFactory.getLogger(RenderCommand.class);

  @Spec
  CommandSpec spec;

  @Parameters(index = "0", paramLabel = "FILE", description = "Cast file")
  Path file;

  @Option(names = "--at", paramLabel = "SECONDS", description = "Time to render; defaults to the end")
  Double at;

  @Option(names = "--format", defaultValue = "TEXT",
      description = "Output format: ${COMPLETION-CANDIDATES} (default: ${DEFAULT-VALUE})")
  ScreenFormat format;

  @Option(names = "--rows", description = "Override screen rows")
  Integer rows;

  @Option(names = "--cols", description = "Override screen columns")
  Integer cols;

  @Override
  public Integer call() {
    EditorSession session;
    try {
      session = SessionLoader.open(file);
    } catch (IOException | CastFormatException e) {
      LOGGER.error("Cannot load {}: {}", file, e.getMessage());
      return CastEditCommand.EXIT_FAILURE;
    }
    Timeline timeline = session.timeline();
    double t = at != null ? at : timeline.composedDuration();
    TerminalSnapshot snapshot;
    if (rows != null || cols != null) {
      int r = rows != null ? rows : session.sources().first().orElseThrow().rows();
      int c = cols != null ? cols : session.sources().first().orElseThrow().cols();
      if (r <= 0 || c <= 0 || r > CastParser.MAX_DIMENSION || c > CastParser.MAX_DIMENSION) {
        LOGGER.error("rows/cols must be between 1 and {}.", CastParser.MAX_DIMENSION);
        return CastEditCommand.EXIT_FAILURE;
      }
      snapshot = session.preview(t, r, c);
    } else {
      snapshot = session.preview(t);
    }
    RunRenderer renderer = new RunRenderer(PreviewRenderer.previewTheme(session.sources()));
    PrintWriter out = spec.commandLine().getOut();
    out.println(renderer.render(snapshot, format));
    out.flush();
    return CastEditCommand.EXIT_OK;
  }
}
