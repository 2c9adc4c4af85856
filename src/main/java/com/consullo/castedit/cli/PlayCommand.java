package com.consullo.castedit.cli;

import com.consullo.castedit.recording.CastEvent;
import com.consullo.castedit.recording.CastFormatException;
import com.consullo.castedit.session.EditorSession;
import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

/**
 * Writes a recording's output to stdout at its recorded pace, driven by the session's playback clock.
 */
@Command(name = "play", header = "Play a recording in this terminal", mixinStandardHelpOptions = true)
public class PlayCommand implements Callable<Integer> {

  private static final Logger LOGGER = LoggerFactory.getLogger(PlayCommand.class);

  @Spec
  CommandSpec spec;

  @Parameters(index = "0", paramLabel = "FILE", description = "Cast file")
  Path file;

  @Option(names = "--speed", defaultValue = "1", description = "Speed multiplier (default: ${DEFAULT-VALUE})")
  double speed;

  @Option(names = "--fps", defaultValue = "30", description = "Clock ticks per second (default: ${DEFAULT-VALUE})")
  int fps;

  @Option(names = "--no-wait", description = "Advance the clock without sleeping")
  boolean noWait;

  @Override
  public Integer call() {
    if (fps <= 0) {
      LOGGER.error("fps must be positive.");
      return CastEditCommand.EXIT_FAILURE;
    }
    EditorSession session;
    try {
      session = SessionLoader.open(file);
    } catch (IOException | CastFormatException e) {
      LOGGER.error("Cannot load {}: {}", file, e.getMessage());
      return CastEditCommand.EXIT_FAILURE;
    }
    List<CastEvent> events = session.flatten();
    PrintWriter out = spec.commandLine().getOut();
    double frame = 1.0 / fps;
    session.rewind();
    session.clock().setSpeed(speed);
    session.play();
    int next = 0;
    int frames = 0;
    while (true) {
      double playhead = session.tick(frame);
      while (next < events.size() && events.get(next).time() <= playhead) {
        CastEvent ev = events.get(next++);
        if (ev.isOutput()) {
          out.print(ev.dataText());
        }
      }
      out.flush();
      frames++;
      if (!session.clock().isPlaying()) {
        break;
      }
      if (!noWait) {
        try {
          TimeUnit.MILLISECONDS.sleep(Math.max(1, Math.round(frame * 1000)));
        } catch (InterruptedException e) {
          Thread.currentThread().interrupt();
          LOGGER.warn("Playback interrupted at {}s", playhead);
          return CastEditCommand.EXIT_FAILURE;
        }
      }
    }
    LOGGER.debug("play: {} frames, {} events", frames, next);
    return CastEditCommand.EXIT_OK;
  }
}
