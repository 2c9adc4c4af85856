package com.consullo.castedit.cli;

import com.consullo.castedit.recording.CastEvent;
import com.consullo.castedit.recording.CastFormatException;
import com.consullo.castedit.recording.Recording;
import com.consullo.castedit.session.EditorSession;
import com.consullo.castedit.timeline.TimeFormat;
import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.Callable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

/**
 * Prints header size, version, event counts and duration of a recording.
 */
@Command(name = "info", header = "Describe a recording", mixinStandardHelpOptions = true)
public class InfoCommand implements Callable<Integer> {

  private static final Logger LOGGER = LoggerFactory.getLogger(InfoCommand.class);

  @Spec
  CommandSpec spec;

  @Parameters(index = "0", paramLabel = "FILE", description = "Cast file")
  Path file;

  @Override
  public Integer call() {
    EditorSession session;
    try {
      session = SessionLoader.open(file);
    } catch (IOException | CastFormatException e) {
      LOGGER.error("Cannot load {}: {}", file, e.getMessage());
      return CastEditCommand.EXIT_FAILURE;
    }
    Recording recording = session.sources().first().orElseThrow();
    Map<String, Integer> kinds = new TreeMap<>();
    for (CastEvent ev : recording.events()) {
      String kind = ev.kind().isTextual() ? ev.kind().asText() : ev.kind().toString();
      kinds.merge(kind, 1, Integer::sum);
    }
    PrintWriter out = spec.commandLine().getOut();
    out.printf("file:     %s%n", file);
    out.printf("version:  %s%n", formatVersion(recording.version()));
    out.printf("size:     %dx%d%n", recording.cols(), recording.rows());
    out.printf("duration: %s%n", TimeFormat.format(recording.duration()));
    out.printf("events:   %d (%d output)%n", recording.events().size(), recording.outputEvents().size());
    for (Map.Entry<String, Integer> e : kinds.entrySet()) {
      out.printf("  %s: %d%n", e.getKey(), e.getValue());
    }
    out.flush();
    return CastEditCommand.EXIT_OK;
  }

  private static String formatVersion(double version) {
    return version == Math.rint(version) ? String.valueOf((long) version) : String.valueOf(version);
  }
}
