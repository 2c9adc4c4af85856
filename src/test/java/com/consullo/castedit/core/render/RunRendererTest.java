package com.consullo.castedit.core.render;

import com.consullo.castedit.core.TerminalColor;
import com.consullo.castedit.core.TerminalSnapshot;
import com.consullo.castedit.core.Theme;
import com.consullo.castedit.core.replay.ReplayTerminalCore;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for run grouping and the row formatters.
 *
 * @since 1.0
 */
public class RunRendererTest {

  private final RunRenderer renderer = new RunRenderer(Theme.DEFAULT);

  private static TerminalSnapshot screen(int cols, int rows, String text) {
    ReplayTerminalCore core = new ReplayTerminalCore(cols, rows, Theme.DEFAULT);
    core.feed(text);
    return core.snapshot();
  }

  @Test
  @DisplayName("Should group adjacent cells with the same resolved style into one run")
  void runs_MixedStyles_GroupedLeftToRight() {
    TerminalSnapshot s = screen(4, 1, "ab\u001b[31mc");

    List<StyledRun> runs = renderer.runs(s.getLine(0));

    assertThat(runs).hasSize(3);
    assertThat(runs.get(0).text()).isEqualTo("ab");
    assertThat(runs.get(0).style().isPlain()).isTrue();
    assertThat(runs.get(1).text()).isEqualTo("c");
    assertThat(runs.get(1).style().foreground()).isEqualTo(Theme.DEFAULT_PALETTE.get(1));
    assertThat(runs.get(2).text()).isEqualTo(" ");
  }

  @Test
  @DisplayName("Should merge an inverse cell with a cell carrying the swapped colors explicitly")
  void runs_InverseMatchesExplicitSwap_SingleRun() {
    String fg = rgb(Theme.DEFAULT_BACKGROUND);
    String bg = rgb(Theme.DEFAULT_FOREGROUND);
    TerminalSnapshot s = screen(2, 1, "\u001b[7ma\u001b[0;38;2;" + fg + ";48;2;" + bg + "mb");

    List<StyledRun> runs = renderer.runs(s.getLine(0));

    assertThat(runs).hasSize(1);
    assertThat(runs.get(0).style().foreground()).isEqualTo(Theme.DEFAULT_BACKGROUND);
    assertThat(runs.get(0).style().background()).isEqualTo(Theme.DEFAULT_FOREGROUND);
  }

  @Test
  @DisplayName("Should render plain text rows right-trimmed")
  void render_TextFormat_PlainRows() {
    TerminalSnapshot s = screen(6, 2, "\u001b[1mhi\u001b[0m\r\nyo");

    assertThat(renderer.render(s, ScreenFormat.TEXT)).isEqualTo("hi\nyo");
  }

  @Test
  @DisplayName("Should emit escaped HTML with inline CSS for styled runs")
  void render_HtmlFormat_SpansWithCss() {
    TerminalSnapshot s = screen(6, 1, "<\u001b[1;2;4;9;31m&\u001b[0m>");

    String html = renderer.render(s, ScreenFormat.HTML);

    assertThat(html).isEqualTo("&lt;<span style=\"color:#cd0000;font-weight:700;"
        + "text-decoration:underline line-through;opacity:0.75\">&amp;</span>&gt;   ");
  }

  @Test
  @DisplayName("Should re-encode runs as truecolor SGR with a trailing reset")
  void render_AnsiFormat_SgrPerRun() {
    TerminalSnapshot s = screen(2, 1, "a\u001b[3;32mb");

    String ansi = renderer.render(s, ScreenFormat.ANSI);

    assertThat(ansi).isEqualTo("\u001b[0ma\u001b[0;3;38;2;0;205;0mb\u001b[0m");
  }

  @Test
  @DisplayName("Should resolve inverse on default colors against the theme")
  void resolvedStyle_InverseDefaults_UsesTheme() {
    Theme theme = new Theme(new TerminalColor(1, 1, 1), new TerminalColor(2, 2, 2), Theme.DEFAULT_PALETTE);
    TerminalSnapshot s = screen(1, 1, "\u001b[7mx");

    ResolvedStyle style = ResolvedStyle.of(s.cellAt(0, 0).style(), theme);

    assertThat(style.foreground()).isEqualTo(new TerminalColor(2, 2, 2));
    assertThat(style.background()).isEqualTo(new TerminalColor(1, 1, 1));
  }

  private static String rgb(TerminalColor c) {
    return c.red() + ";" + c.green() + ";" + c.blue();
  }
}
