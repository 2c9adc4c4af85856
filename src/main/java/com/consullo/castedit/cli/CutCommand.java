package com.consullo.castedit.cli;

import com.consullo.castedit.export.CastWriter;
import com.consullo.castedit.recording.CastFormatException;
import com.consullo.castedit.recording.Recording;
import com.consullo.castedit.session.EditorSession;
import com.consullo.castedit.timeline.Segment;
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
 * Exports the {@code [from, to]} slice of a recording as a new cast.
 */
@Command(name = "cut", header = "Export a time slice of a recording", mixinStandardHelpOptions = true)
public class CutCommand implements Callable<Integer> {

  private static final Logger LOGGER = LoggerFactory.getLogger(CutCommand.class);

  @Spec
  CommandSpec spec;

  @Parameters(index = "0", paramLabel = "FILE", description = "Cast file")
  Path file;

  @Option(names = "--from", required = true, paramLabel = "SECONDS", description = "Slice start")
  double from;

  @Option(names = "--to", required = true, paramLabel = "SECONDS", description = "Slice end")
  double to;

  @Option(names = {"-o", "--output"}, paramLabel = "OUT", description = "Output file; stdout when absent")
  Path output;

  @Override
  public Integer call() {
    if (!(to > from)) {
      LOGGER.error("--to must be greater than --from.");
      return CastEditCommand.EXIT_FAILURE;
    }
    try {
      EditorSession session = SessionLoader.open(file);
      Recording recording = session.sources().first().orElseThrow();
      Segment whole = session.timeline().get(0);
      SessionLoader.require(session.insert(recording.id(), from, to, null));
      SessionLoader.require(session.delete(whole.id()));
      String json = new CastWriter().toJson(session.export());
      if (output != null) {
        SessionLoader.write(output, json);
        LOGGER.info("Wrote {} ({} - {}) to {}", file, from, to, output);
      } else {
        PrintWriter out = spec.commandLine().getOut();
        out.println(json);
        out.flush();
      }
      return CastEditCommand.EXIT_OK;
    } catch (IOException | CastFormatException | SessionLoader.EditDeclinedException e) {
      LOGGER.error("Cannot cut {}: {}", file, e.getMessage());
      return CastEditCommand.EXIT_FAILURE;
    }
  }
}
