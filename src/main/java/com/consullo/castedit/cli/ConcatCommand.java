package com.consullo.castedit.cli;

import com.consullo.castedit.export.CastWriter;
import com.consullo.castedit.recording.Recording;
import com.consullo.castedit.session.EditorSession;
import com.consullo.castedit.session.EditorSessionFactory;
import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

/**
 * Appends recordings one after another and exports the result. Files that fail to load are skipped.
 */
@Command(name = "concat", header = "Join recordings end to end", mixinStandardHelpOptions = true)
public class ConcatCommand implements Callable<Integer> {

  private static final Logger LOGGER = LoggerFactory.getLogger(ConcatCommand.class);

  @Spec
  CommandSpec spec;

  @Parameters(arity = "1..*", paramLabel = "FILE", description = "Cast files in play order")
  List<Path> files;

  @Option(names = {"-o", "--output"}, paramLabel = "OUT", description = "Output file; stdout when absent")
  Path output;

  @Override
  public Integer call() {
    EditorSession session = EditorSessionFactory.createDefaultSession();
    List<Recording> loaded = session.loadFiles(files, true);
    if (loaded.isEmpty()) {
      LOGGER.error("None of the {} files could be loaded.", files.size());
      return CastEditCommand.EXIT_FAILURE;
    }
    try {
      for (Recording recording : loaded.subList(1, loaded.size())) {
        SessionLoader.require(session.insert(recording.id(), 0, recording.duration(), null));
      }
      String json = new CastWriter().toJson(session.export());
      if (output != null) {
        SessionLoader.write(output, json);
        LOGGER.info("Joined {} recordings into {}", loaded.size(), output);
      } else {
        PrintWriter out = spec.commandLine().getOut();
        out.println(json);
        out.flush();
      }
      return CastEditCommand.EXIT_OK;
    } catch (IOException | SessionLoader.EditDeclinedException e) {
      LOGGER.error("Cannot concatenate: {}", e.getMessage());
      return CastEditCommand.EXIT_FAILURE;
    }
  }
}
