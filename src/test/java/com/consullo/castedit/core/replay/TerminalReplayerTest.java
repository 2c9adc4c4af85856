package com.consullo.castedit.core.replay;

import com.consullo.castedit.core.Style;
import com.consullo.castedit.core.TerminalSnapshot;
import com.consullo.castedit.core.Theme;
import com.consullo.castedit.recording.CastParser;
import com.consullo.castedit.recording.Recording;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for replaying a recording up to a cutoff.
 *
 * @since 1.0
 */
public class TerminalReplayerTest {

  private static final String SMALL = "{\"version\":2,\"width\":4,\"height\":2,"
      + "\"events\":[[0,\"o\",\"ab\"],[0.1,\"o\",\"\\u001b[31mc\"]]}";

  @Test
  @DisplayName("Should replay every output event up to and including the cutoff")
  void replay_AtLastEvent_FullScreen() throws Exception {
    Recording recording = new CastParser().parse("small", "small.cast", SMALL);

    TerminalSnapshot s = TerminalReplayer.replay(recording, 0.1);

    assertThat(s.rowText(0)).isEqualTo("abc");
    assertThat(s.rowText(1)).isEmpty();
    assertThat(s.cellAt(0, 2).style().foreground()).isEqualTo(Theme.DEFAULT_PALETTE.get(1));
    assertThat(s.cellAt(0, 0).style()).isEqualTo(Style.DEFAULT);
  }

  @Test
  @DisplayName("Should leave later events out of the screen")
  void replay_BeforeSecondEvent_PrefixOnly() throws Exception {
    Recording recording = new CastParser().parse("small", "small.cast", SMALL);

    TerminalSnapshot s = TerminalReplayer.replay(recording, 0.05);
    TerminalSnapshot fromList = TerminalReplayer.replay(recording.outputEvents().subList(0, 1), 2, 4,
        recording.theme());

    assertThat(s.rowText(0)).isEqualTo("ab");
    assertThat(fromList.plainLines()).isEqualTo(s.plainLines());
  }
}
