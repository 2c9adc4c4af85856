package com.consullo.castedit.core.replay;

import com.consullo.castedit.core.TerminalCore;
import com.consullo.castedit.core.TerminalSnapshot;
import com.consullo.castedit.core.Theme;
import org.apache.commons.lang3.Validate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link TerminalCore} implementation backed by the built-in interpreter.
 *
 * <p>
 * This integrates:
 * <ul>
 * <li>control/escape parsing: {@link EscapeSequenceInterpreter}</li>
 * <li>grid, cursor, scrolling and erase: {@link ScreenBuffer}</li>
 * <li>SGR color lookup: {@link ColorResolver} over the recording {@link Theme}</li>
 * </ul>
 * </p>
 *
 * <p>
 * A core starts from an empty grid, default style and the cursor at (0,0). It is meant for one replay and is
 * discarded afterwards; nothing is cached between replays.
 * </p>
 */
public final class ReplayTerminalCore implements TerminalCore {

  private static final Logger LOGGER = LoggerFactory.getLogger(ReplayTerminalCore.class);

  private final ScreenBuffer screen;
  private final EscapeSequenceInterpreter interpreter;
  private long fedChars;

  /**
   * Creates a terminal core with given screen size and theme.
   *
   * @param cols screen columns
   * @param rows screen rows
   * @param theme recording theme used for palette lookups
   */
  public ReplayTerminalCore(int cols, int rows, Theme theme) {
    if (cols <= 0 || rows <= 0) {
      throw new IllegalArgumentException("cols/rows must be positive.");
    }
    Validate.notNull(theme, "theme must not be null");
    this.screen = new ScreenBuffer(rows, cols);
    this.interpreter = new EscapeSequenceInterpreter(screen, theme);
  }

  @Override
  public void feed(CharSequence text) {
    if (text == null) {
      throw new IllegalArgumentException("text must not be null.");
    }
    if (text.length() == 0) {
      return;
    }
    interpreter.feed(text);
    fedChars += text.length();
  }

  @Override
  public void resetStyle() {
    interpreter.resetStyle();
  }

  @Override
  public TerminalSnapshot snapshot() {
    LOGGER.debug("snapshot: {} chars fed, {} sequences applied, {} ignored",
        fedChars, interpreter.dispatchedSequences(), interpreter.ignoredSequences());
    return screen.snapshot();
  }

  @Override
  public int cols() {
    return screen.cols();
  }

  @Override
  public int rows() {
    return screen.rows();
  }
}
