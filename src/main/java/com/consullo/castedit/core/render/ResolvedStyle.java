package com.consullo.castedit.core.render;

import com.consullo.castedit.core.Style;
import com.consullo.castedit.core.TerminalColor;
import com.consullo.castedit.core.Theme;

/**
 * Display-ready style of a run: inverse already applied, colors null only when they are the theme default.
 *
 * @param foreground effective foreground, or null for the theme default
 * @param background effective background, or null for the theme default
 * @param bold bold text
 * @param dimmed reduced emphasis
 * @param italic italic text
 * @param underline underline decoration
 * @param strike line-through decoration
 * @since 1.0
 */
public record ResolvedStyle(
    TerminalColor foreground,
    TerminalColor background,
    boolean bold,
    boolean dimmed,
    boolean italic,
    boolean underline,
    boolean strike) {

  public static final ResolvedStyle PLAIN = new ResolvedStyle(null, null, false, false, false, false, false);

  /**
   * Resolves a cell style. Inverse swaps the effective colors; a default color is substituted from the
   * theme before the swap so inverse text on default colors stays visible.
   *
   * @param style cell style
   * @param theme recording theme
   * @return resolved style
   */
  public static ResolvedStyle of(Style style, Theme theme) {
    TerminalColor fg = style.foreground();
    TerminalColor bg = style.background();
    if (style.inverse()) {
      TerminalColor swappedFg = bg != null ? bg : theme.background();
      TerminalColor swappedBg = fg != null ? fg : theme.foreground();
      fg = swappedFg;
      bg = swappedBg;
    }
    return new ResolvedStyle(fg, bg, style.bold(), style.dim(), style.italic(), style.underline(), style.strike());
  }

  public boolean isPlain() {
    return PLAIN.equals(this);
  }

  public boolean hasDecoration() {
    return underline || strike;
  }
}
