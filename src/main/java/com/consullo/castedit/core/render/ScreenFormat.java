package com.consullo.castedit.core.render;

/**
 * Output formats supported by {@link RunRenderer}.
 *
 * @since 1.0
 */
public enum ScreenFormat {
  TEXT,
  HTML,
  ANSI;

  public RowFormatter formatter() {
    switch (this) {
      case HTML:
        return new HtmlRowFormatter();
      case ANSI:
        return new AnsiRowFormatter();
      default:
        return new PlainRowFormatter();
    }
  }
}
