package com.consullo.castedit.core;

/**
 * Terminal core abstraction that converts recorded output text into a maintained screen state.
 *
 * <p>This interface exists to isolate preview and rendering code from a specific interpreter. The reference
 * implementation is {@link com.consullo.castedit.core.replay.ReplayTerminalCore}; a core is single-use and
 * always starts from an empty grid, default style and the cursor at the origin.
 *
 * @since 1.0
 */
public interface TerminalCore {

  /**
   * Feeds output text into the interpreter. Escape sequences may span several calls.
   *
   * <p>Callers must ensure that all invocations are serialized on a single thread.
   *
   * @param text output text of one recorded event
   */
  void feed(final CharSequence text);

  /**
   * Resets the current style to the default and drops any escape sequence still in progress. Grid content
   * and cursor position are kept.
   */
  void resetStyle();

  /**
   * Returns an immutable snapshot of the current screen.
   *
   * @return immutable terminal snapshot
   */
  TerminalSnapshot snapshot();

  /**
   * Returns the number of screen columns.
   *
   * @return columns
   */
  int cols();

  /**
   * Returns the number of screen rows.
   *
   * @return rows
   */
  int rows();
}
