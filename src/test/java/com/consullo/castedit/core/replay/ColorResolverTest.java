package com.consullo.castedit.core.replay;

import com.consullo.castedit.core.TerminalColor;
import com.consullo.castedit.core.Theme;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for 256-color and truecolor resolution.
 *
 * @since 1.0
 */
public class ColorResolverTest {

  @Test
  @DisplayName("Should take indices below 16 from the recording palette")
  void resolve256_BaseIndex_UsesPalette() {
    assertThat(ColorResolver.resolve256(1, Theme.DEFAULT_PALETTE)).isEqualTo(TerminalColor.parseHex("#cd0000"));
    assertThat(ColorResolver.resolve256(15, Theme.DEFAULT_PALETTE)).isEqualTo(new TerminalColor(255, 255, 255));
  }

  @Test
  @DisplayName("Should map cube indices onto the 6x6x6 step table")
  void resolve256_CubeIndex_UsesSteps() {
    assertThat(ColorResolver.resolve256(196, Theme.DEFAULT_PALETTE).toHex()).isEqualTo("#ff0000");
    assertThat(ColorResolver.resolve256(16, Theme.DEFAULT_PALETTE).toHex()).isEqualTo("#000000");
    assertThat(ColorResolver.resolve256(67, Theme.DEFAULT_PALETTE)).isEqualTo(new TerminalColor(95, 135, 175));
  }

  @Test
  @DisplayName("Should map 232..255 onto the grayscale ramp")
  void resolve256_GrayIndex_UsesRamp() {
    assertThat(ColorResolver.resolve256(232, Theme.DEFAULT_PALETTE).toHex()).isEqualTo("#080808");
    assertThat(ColorResolver.resolve256(255, Theme.DEFAULT_PALETTE).toHex()).isEqualTo("#eeeeee");
  }

  @Test
  @DisplayName("Should clamp out-of-range indices and channels")
  void resolve_OutOfRange_Clamps() {
    assertThat(ColorResolver.resolve256(999, Theme.DEFAULT_PALETTE).toHex()).isEqualTo("#eeeeee");
    assertThat(ColorResolver.resolve256(-4, Theme.DEFAULT_PALETTE).toHex()).isEqualTo("#000000");
    assertThat(ColorResolver.truecolor(300, -1, 128)).isEqualTo(new TerminalColor(255, 0, 128));
  }
}
