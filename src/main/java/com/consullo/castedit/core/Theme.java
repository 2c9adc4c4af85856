package com.consullo.castedit.core;

import java.util.List;
import org.apache.commons.lang3.Validate;

/**
 * Color theme of a recording: default foreground/background and the 16-entry base palette.
 *
 * @param foreground default foreground
 * @param background default background
 * @param palette exactly 16 base colors (indices 0..7 normal, 8..15 bright)
 * @since 1.0
 */
public record Theme(TerminalColor foreground, TerminalColor background, List<TerminalColor> palette) {

  public static final int PALETTE_SIZE = 16;

  /** xterm default 16-color palette. */
  public static final List<TerminalColor> DEFAULT_PALETTE = List.of(
      new TerminalColor(0x00, 0x00, 0x00),
      new TerminalColor(0xcd, 0x00, 0x00),
      new TerminalColor(0x00, 0xcd, 0x00),
      new TerminalColor(0xcd, 0xcd, 0x00),
      new TerminalColor(0x00, 0x00, 0xee),
      new TerminalColor(0xcd, 0x00, 0xcd),
      new TerminalColor(0x00, 0xcd, 0xcd),
      new TerminalColor(0xe5, 0xe5, 0xe5),
      new TerminalColor(0x7f, 0x7f, 0x7f),
      new TerminalColor(0xff, 0x00, 0x00),
      new TerminalColor(0x00, 0xff, 0x00),
      new TerminalColor(0xff, 0xff, 0x00),
      new TerminalColor(0x5c, 0x5c, 0xff),
      new TerminalColor(0xff, 0x00, 0xff),
      new TerminalColor(0x00, 0xff, 0xff),
      new TerminalColor(0xff, 0xff, 0xff));

  public static final TerminalColor DEFAULT_FOREGROUND = new TerminalColor(0xf5, 0xf5, 0xf5);
  public static final TerminalColor DEFAULT_BACKGROUND = new TerminalColor(0x11, 0x10, 0x15);

  public static final Theme DEFAULT = new Theme(DEFAULT_FOREGROUND, DEFAULT_BACKGROUND, DEFAULT_PALETTE);

  public Theme {
    Validate.notNull(foreground, "foreground must not be null");
    Validate.notNull(background, "background must not be null");
    Validate.notNull(palette, "palette must not be null");
    Validate.isTrue(palette.size() == PALETTE_SIZE, "palette must contain %d colors", PALETTE_SIZE);
    palette = List.copyOf(palette);
  }

  public TerminalColor paletteColor(int index) {
    return palette.get(index);
  }
}
