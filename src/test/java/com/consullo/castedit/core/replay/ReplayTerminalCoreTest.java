package com.consullo.castedit.core.replay;

import com.consullo.castedit.core.Cell;
import com.consullo.castedit.core.Style;
import com.consullo.castedit.core.TerminalColor;
import com.consullo.castedit.core.TerminalSnapshot;
import com.consullo.castedit.core.Theme;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Behavioral tests for the escape sequence interpreter driven through the public core.
 *
 * @since 1.0
 */
public class ReplayTerminalCoreTest {

  private static final TerminalColor RED = Theme.DEFAULT_PALETTE.get(1);

  private static TerminalSnapshot replay(int cols, int rows, String... chunks) {
    ReplayTerminalCore core = new ReplayTerminalCore(cols, rows, Theme.DEFAULT);
    for (String chunk : chunks) {
      core.feed(chunk);
    }
    return core.snapshot();
  }

  @Test
  @DisplayName("Should color only the characters written after an SGR color")
  void feed_SgrForeground_StylesFollowingCells() {
    TerminalSnapshot s = replay(4, 2, "ab\u001b[31mc");

    assertThat(s.rowText(0)).isEqualTo("abc");
    assertThat(s.rowText(1)).isEmpty();
    assertThat(s.cellAt(0, 0).style()).isEqualTo(Style.DEFAULT);
    assertThat(s.cellAt(0, 2).style().foreground()).isEqualTo(RED);
    assertThat(s.getCursorRow()).isEqualTo(0);
    assertThat(s.getCursorCol()).isEqualTo(3);
  }

  @Test
  @DisplayName("Should return to default style after SGR 0 and after an empty SGR")
  void feed_SgrReset_RestoresDefaults() {
    TerminalSnapshot s = replay(8, 1, "\u001b[1;4;31ma\u001b[0mb\u001b[7mc\u001b[md");

    assertThat(s.cellAt(0, 0).style().bold()).isTrue();
    assertThat(s.cellAt(0, 0).style().underline()).isTrue();
    assertThat(s.cellAt(0, 1).style()).isEqualTo(Style.DEFAULT);
    assertThat(s.cellAt(0, 2).style().inverse()).isTrue();
    assertThat(s.cellAt(0, 3).style()).isEqualTo(Style.DEFAULT);
  }

  @Test
  @DisplayName("Should resolve bright, 256-color and truecolor selections")
  void feed_ExtendedColors_Resolved() {
    TerminalSnapshot s = replay(8, 1, "\u001b[91ma\u001b[38;5;196mb\u001b[48;2;1;2;3mc\u001b[39;49md");

    assertThat(s.cellAt(0, 0).style().foreground()).isEqualTo(Theme.DEFAULT_PALETTE.get(9));
    assertThat(s.cellAt(0, 1).style().foreground().toHex()).isEqualTo("#ff0000");
    assertThat(s.cellAt(0, 2).style().background()).isEqualTo(new TerminalColor(1, 2, 3));
    assertThat(s.cellAt(0, 3).style().foreground()).isNull();
    assertThat(s.cellAt(0, 3).style().background()).isNull();
  }

  @Test
  @DisplayName("Should wrap at the right edge and scroll when the bottom row overflows")
  void feed_PastLastColumn_WrapsAndScrolls() {
    TerminalSnapshot s = replay(3, 2, "abcdefg");

    assertThat(s.plainLines()).containsExactly("def", "g");
    assertThat(s.getCursorRow()).isEqualTo(1);
    assertThat(s.getCursorCol()).isEqualTo(1);
  }

  @Test
  @DisplayName("Should keep the column at the edge until the next printable character")
  void feed_FullRowThenCarriageReturn_NoWrap() {
    TerminalSnapshot s = replay(3, 2, "abc\rX");

    assertThat(s.plainLines()).containsExactly("Xbc", "");
  }

  @Test
  @DisplayName("Should skip OSC payloads terminated by BEL or ST")
  void feed_OscSequences_Skipped() {
    TerminalSnapshot s = replay(10, 1, "\u001b]0;title\u0007a\u001b]8;;http://x\u001b\\b");

    assertThat(s.rowText(0)).isEqualTo("ab");
  }

  @Test
  @DisplayName("Should skip DCS, SOS, PM and APC payloads terminated by BEL or ST")
  void feed_OtherStringSequences_Skipped() {
    TerminalSnapshot s = replay(10, 1,
        "\u001bPq#0\u001b\\a\u001bXsos\u0007b\u001b^pm\u001b\\c\u001b_apc\u001b\\d");

    assertThat(s.rowText(0)).isEqualTo("abcd");
  }

  @Test
  @DisplayName("Should discard everything after a string sequence that is never terminated")
  void feed_UnterminatedOsc_RemainderDiscarded() {
    TerminalSnapshot s = replay(10, 1, "a\u001b]0;title", "bcd");

    assertThat(s.rowText(0)).isEqualTo("a");
  }

  @Test
  @DisplayName("Should clear each attribute with its own SGR off code")
  void feed_SgrOffCodes_ClearAttributes() {
    TerminalSnapshot s = replay(8, 1,
        "\u001b[1;2;3;4;7;9ma\u001b[22;23;24;27;29mb\u001b[0;1;2;3m\u001b[22mc");

    Style all = s.cellAt(0, 0).style();
    assertThat(all.bold()).isTrue();
    assertThat(all.dim()).isTrue();
    assertThat(all.italic()).isTrue();
    assertThat(all.underline()).isTrue();
    assertThat(all.inverse()).isTrue();
    assertThat(all.strike()).isTrue();
    assertThat(s.cellAt(0, 1).style()).isEqualTo(Style.DEFAULT);

    Style normalIntensity = s.cellAt(0, 2).style();
    assertThat(normalIntensity.bold()).isFalse();
    assertThat(normalIntensity.dim()).isFalse();
    assertThat(normalIntensity.italic()).isTrue();
  }

  @Test
  @DisplayName("Should recognize a sequence split across two feeds")
  void feed_SplitSequence_AppliedOnce() {
    TerminalSnapshot s = replay(6, 2, "hello\u001b[", "2J", "x");

    assertThat(s.plainLines()).containsExactly("x", "");
  }

  @Test
  @DisplayName("Should position the cursor with CUP and clamp relative moves to the grid")
  void feed_CursorMoves_Clamped() {
    TerminalSnapshot s = replay(5, 3, "\u001b[2;3Ha\u001b[10Ab\u001b[99Cc\u001b[99Dd\u001b[99Be");

    assertThat(s.plainLines()).containsExactly("d  bc", "  a", " e");
  }

  @Test
  @DisplayName("Should erase with the current style for modes 0 and 1, and reset the screen for mode 2")
  void feed_EraseModes_ApplyStyle() {
    TerminalSnapshot s = replay(4, 2, "abcd\r\nefgh\u001b[1;3H\u001b[41m\u001b[1K");

    Cell erased = s.cellAt(0, 0);
    assertThat(erased.ch()).isEqualTo(' ');
    assertThat(erased.style().background()).isEqualTo(RED);
    assertThat(s.rowText(0)).isEqualTo("   d");
    assertThat(s.rowText(1)).isEqualTo("efgh");

    TerminalSnapshot cleared = replay(4, 2, "abcd\u001b[41m\u001b[2J");
    assertThat(cleared.cellAt(0, 0)).isEqualTo(Cell.BLANK);
    assertThat(cleared.getCursorCol()).isEqualTo(0);
  }

  @Test
  @DisplayName("Should erase from the cursor to the end of the screen with the current style")
  void feed_EraseDisplayMode0_ClearsCursorToEnd() {
    TerminalSnapshot s = replay(3, 3, "abc\r\ndef\r\nghi\u001b[2;2H\u001b[41m\u001b[0J");

    assertThat(s.plainLines()).containsExactly("abc", "d", "");
    assertThat(s.cellAt(0, 2).style()).isEqualTo(Style.DEFAULT);
    assertThat(s.cellAt(1, 0).style()).isEqualTo(Style.DEFAULT);
    assertThat(s.cellAt(1, 1).style().background()).isEqualTo(RED);
    assertThat(s.cellAt(2, 0).style().background()).isEqualTo(RED);
    assertThat(s.cellAt(2, 2).style().background()).isEqualTo(RED);
  }

  @Test
  @DisplayName("Should erase from the start of the screen through the cursor with the current style")
  void feed_EraseDisplayMode1_ClearsStartToCursor() {
    TerminalSnapshot s = replay(3, 3, "abc\r\ndef\r\nghi\u001b[2;2H\u001b[41m\u001b[1J");

    assertThat(s.plainLines()).containsExactly("", "  f", "ghi");
    assertThat(s.cellAt(0, 0).style().background()).isEqualTo(RED);
    assertThat(s.cellAt(0, 2).style().background()).isEqualTo(RED);
    assertThat(s.cellAt(1, 1).style().background()).isEqualTo(RED);
    assertThat(s.cellAt(1, 2).style()).isEqualTo(Style.DEFAULT);
    assertThat(s.cellAt(2, 0).style()).isEqualTo(Style.DEFAULT);
  }

  @Test
  @DisplayName("Should advance tabs to the next multiple of eight and ignore other controls")
  void feed_TabAndControls_Handled() {
    TerminalSnapshot s = replay(12, 1, "a\tb\u0001\u0007\u007fc\bd");

    assertThat(s.rowText(0)).isEqualTo("a       bd");
  }

  @Test
  @DisplayName("Should consume charset designators and unknown CSI finals without output")
  void feed_IgnoredSequences_ProduceNothing() {
    TerminalSnapshot s = replay(10, 1, "\u001b(Ba\u001b[?25lb\u001b[5nc\u001b[1$xd");

    assertThat(s.rowText(0)).isEqualTo("abcd");
  }

  @Test
  @DisplayName("Should drop the style but keep the screen on resetStyle")
  void resetStyle_AfterColor_DefaultStyleForNewText() {
    ReplayTerminalCore core = new ReplayTerminalCore(4, 1, Theme.DEFAULT);
    core.feed("\u001b[31ma");
    core.resetStyle();
    core.feed("b");

    TerminalSnapshot s = core.snapshot();
    assertThat(s.cellAt(0, 0).style().foreground()).isEqualTo(RED);
    assertThat(s.cellAt(0, 1).style()).isEqualTo(Style.DEFAULT);
  }

  @Test
  @DisplayName("Should reject non-positive sizes")
  void constructor_InvalidSize_Throws() {
    assertThatThrownBy(() -> new ReplayTerminalCore(0, 1, Theme.DEFAULT))
        .isInstanceOf(IllegalArgumentException.class);
  }
}
