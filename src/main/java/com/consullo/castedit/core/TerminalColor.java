package com.consullo.castedit.core;

/**
 * Concrete 24-bit color used for terminal cells and theme entries.
 *
 * @param red red channel 0..255
 * @param green green channel 0..255
 * @param blue blue channel 0..255
 * @since 1.0
 */
public record TerminalColor(int red, int green, int blue) {

  public TerminalColor {
    if (red < 0 || red > 255 || green < 0 || green > 255 || blue < 0 || blue > 255) {
      throw new IllegalArgumentException("color channels must be in 0..255.");
    }
  }

  /**
   * Creates a color, clamping each channel into 0..255.
   *
   * @param red red channel
   * @param green green channel
   * @param blue blue channel
   * @return clamped color
   */
  public static TerminalColor clamped(int red, int green, int blue) {
    return new TerminalColor(clampChannel(red), clampChannel(green), clampChannel(blue));
  }

  /**
   * Parses {@code #rrggbb} or {@code #rgb}. The leading '#' is optional.
   *
   * @param text hex text
   * @return parsed color, or null when the text is not a hex color
   */
  public static TerminalColor parseHex(String text) {
    if (text == null) {
      return null;
    }
    String s = text.trim();
    if (s.startsWith("#")) {
      s = s.substring(1);
    }
    if (s.length() == 3) {
      StringBuilder expanded = new StringBuilder(6);
      for (int i = 0; i < 3; i++) {
        expanded.append(s.charAt(i)).append(s.charAt(i));
      }
      s = expanded.toString();
    }
    if (s.length() != 6) {
      return null;
    }
    for (int i = 0; i < 6; i++) {
      if (Character.digit(s.charAt(i), 16) < 0) {
        return null;
      }
    }
    int rgb = Integer.parseInt(s, 16);
    return new TerminalColor((rgb >> 16) & 0xFF, (rgb >> 8) & 0xFF, rgb & 0xFF);
  }

  /**
   * Returns the lower-case {@code #rrggbb} form.
   *
   * @return hex string
   */
  public String toHex() {
    return String.format("#%02x%02x%02x", red, green, blue);
  }

  private static int clampChannel(int v) {
    return Math.max(0, Math.min(255, v));
  }
}
