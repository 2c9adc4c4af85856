package com.consullo.castedit.core.render;

import java.util.List;

/**
 * Drops styling and right-trims the row.
 */
public final class PlainRowFormatter implements RowFormatter {

  @Override
  public String formatRow(List<StyledRun> runs) {
    StringBuilder sb = new StringBuilder();
    for (StyledRun run : runs) {
      sb.append(run.text());
    }
    int n = sb.length();
    while (n > 0 && sb.charAt(n - 1) == ' ') {
      n--;
    }
    sb.setLength(n);
    return sb.toString();
  }
}
