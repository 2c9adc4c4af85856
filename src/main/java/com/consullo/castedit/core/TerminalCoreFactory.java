package com.consullo.castedit.core;

/**
 * Creates fresh {@link TerminalCore} instances, one per replay.
 *
 * @since 1.0
 */
@FunctionalInterface
public interface TerminalCoreFactory {

  /**
   * Creates a core with an empty grid.
   *
   * @param cols screen columns
   * @param rows screen rows
   * @param theme theme used for palette lookups
   * @return new core
   */
  TerminalCore create(final int cols, final int rows, final Theme theme);
}
