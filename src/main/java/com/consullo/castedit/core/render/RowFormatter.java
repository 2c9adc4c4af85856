package com.consullo.castedit.core.render;

import java.util.List;

/**
 * Turns the runs of one row into output text for a presentation format.
 *
 * <p>Implementations escape run text so that it is safe to embed in their format.
 *
 * @since 1.0
 */
public interface RowFormatter {

  /**
   * Formats one row.
   *
   * @param runs runs of the row, left to right
   * @return formatted row, without a trailing line separator
   */
  String formatRow(final List<StyledRun> runs);
}
