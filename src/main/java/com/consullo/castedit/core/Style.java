package com.consullo.castedit.core;

/**
 * Graphic rendition carried by the cursor and copied into every written cell.
 *
 * <p>A null color means "theme default". Instances are immutable; the interpreter replaces the current
 * style on every SGR change, so cells can share instances safely.</p>
 *
 * @param bold bold attribute
 * @param dim reduced intensity
 * @param italic italic attribute
 * @param underline underline attribute
 * @param inverse swap foreground and background when rendered
 * @param strike strike-through attribute
 * @param foreground explicit foreground, or null for the theme default
 * @param background explicit background, or null for the theme default
 * @since 1.0
 */
public record Style(
    boolean bold,
    boolean dim,
    boolean italic,
    boolean underline,
    boolean inverse,
    boolean strike,
    TerminalColor foreground,
    TerminalColor background) {

  /** All attributes off, both colors unset. */
  public static final Style DEFAULT = new Style(false, false, false, false, false, false, null, null);

  public Style withBold(boolean value) {
    return new Style(value, dim, italic, underline, inverse, strike, foreground, background);
  }

  public Style withDim(boolean value) {
    return new Style(bold, value, italic, underline, inverse, strike, foreground, background);
  }

  public Style withItalic(boolean value) {
    return new Style(bold, dim, value, underline, inverse, strike, foreground, background);
  }

  public Style withUnderline(boolean value) {
    return new Style(bold, dim, italic, value, inverse, strike, foreground, background);
  }

  public Style withInverse(boolean value) {
    return new Style(bold, dim, italic, underline, value, strike, foreground, background);
  }

  public Style withStrike(boolean value) {
    return new Style(bold, dim, italic, underline, inverse, value, foreground, background);
  }

  public Style withForeground(TerminalColor color) {
    return new Style(bold, dim, italic, underline, inverse, strike, color, background);
  }

  public Style withBackground(TerminalColor color) {
    return new Style(bold, dim, italic, underline, inverse, strike, foreground, color);
  }

  public boolean isDefault() {
    return DEFAULT.equals(this);
  }
}
