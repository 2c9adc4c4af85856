package com.consullo.castedit.core.render;

import com.consullo.castedit.core.TerminalColor;
import java.util.List;

/**
 * Re-encodes runs as SGR sequences for display on a truecolor terminal.
 *
 * <p>Every run starts from a full reset so runs never depend on each other; the row ends with a reset.
 * Control characters in run text are replaced by '?' so the output cannot move the host cursor.</p>
 */
public final class AnsiRowFormatter implements RowFormatter {

  private static final String CSI = "\u001b[";

  @Override
  public String formatRow(List<StyledRun> runs) {
    StringBuilder sb = new StringBuilder();
    for (StyledRun run : runs) {
      sb.append(sgr(run.style()));
      appendSafe(sb, run.text());
    }
    sb.append(CSI).append("0m");
    return sb.toString();
  }

  static String sgr(ResolvedStyle style) {
    StringBuilder sb = new StringBuilder(CSI).append('0');
    if (style.bold()) {
      sb.append(";1");
    }
    if (style.dimmed()) {
      sb.append(";2");
    }
    if (style.italic()) {
      sb.append(";3");
    }
    if (style.underline()) {
      sb.append(";4");
    }
    if (style.strike()) {
      sb.append(";9");
    }
    appendColor(sb, 38, style.foreground());
    appendColor(sb, 48, style.background());
    return sb.append('m').toString();
  }

  private static void appendColor(StringBuilder sb, int selector, TerminalColor color) {
    if (color == null) {
      return;
    }
    sb.append(';').append(selector).append(";2;")
        .append(color.red()).append(';')
        .append(color.green()).append(';')
        .append(color.blue());
  }

  private static void appendSafe(StringBuilder sb, String text) {
    for (int i = 0; i < text.length(); i++) {
      char c = text.charAt(i);
      sb.append(c < 0x20 || c == 0x7F ? '?' : c);
    }
  }
}
