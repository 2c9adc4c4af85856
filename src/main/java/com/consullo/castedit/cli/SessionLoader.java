package com.consullo.castedit.cli;

import com.consullo.castedit.recording.CastFormatException;
import com.consullo.castedit.session.EditorSession;
import com.consullo.castedit.session.EditorSessionFactory;
import com.consullo.castedit.timeline.EditResult;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Shared file handling for the subcommands.
 */
final class SessionLoader {

  private SessionLoader() {
  }

  static EditorSession open(Path file) throws IOException, CastFormatException {
    EditorSession session = EditorSessionFactory.createDefaultSession();
    String text = Files.readString(file, StandardCharsets.UTF_8);
    session.load(String.valueOf(file.getFileName()), text, true);
    return session;
  }

  static void write(Path output, String content) throws IOException {
    Path parent = output.toAbsolutePath().getParent();
    if (parent != null) {
      Files.createDirectories(parent);
    }
    Files.writeString(output, content, StandardCharsets.UTF_8);
  }

  static EditResult require(EditResult result) throws EditDeclinedException {
    if (result.isDeclined()) {
      throw new EditDeclinedException(result.message());
    }
    return result;
  }

  /**
   * A subcommand's edit was refused by the timeline editor.
   */
  static final class EditDeclinedException extends Exception {

    private static final long serialVersionUID = 1L;

    EditDeclinedException(String message) {
      super(message);
    }
  }
}
