package com.consullo.castedit.core.replay;

import com.consullo.castedit.core.TerminalColor;
import java.util.List;
import org.apache.commons.lang3.Validate;

/**
 * Maps SGR color selections to concrete colors.
 *
 * <p>
 * 256-color indices: 0..15 come from the recording palette, 16..231 form the 6x6x6 cube, 232..255 are the
 * 24-step grayscale ramp. Truecolor values are used directly.
 * </p>
 *
 * @since 1.0
 */
public final class ColorResolver {

  private static final int[] CUBE_STEPS = {0, 95, 135, 175, 215, 255};

  private ColorResolver() {
  }

  /**
   * Resolves a 256-color index. Out-of-range indices are clamped to 0..255.
   *
   * @param index color index
   * @param palette 16-entry base palette
   * @return resolved color
   */
  public static TerminalColor resolve256(int index, List<TerminalColor> palette) {
    Validate.notNull(palette, "palette must not be null");
    int value = Math.max(0, Math.min(255, index));
    if (value < 16) {
      return palette.get(value);
    }
    if (value >= 232) {
      int level = 8 + 10 * (value - 232);
      return new TerminalColor(level, level, level);
    }
    int cube = value - 16;
    int r = cube / 36;
    int g = (cube % 36) / 6;
    int b = cube % 6;
    return new TerminalColor(CUBE_STEPS[r], CUBE_STEPS[g], CUBE_STEPS[b]);
  }

  /**
   * Resolves a direct RGB selection, clamping each channel.
   */
  public static TerminalColor truecolor(int red, int green, int blue) {
    return TerminalColor.clamped(red, green, blue);
  }
}
