package com.consullo.castedit.core;

/**
 * One grid position: a character and the style it was written with.
 *
 * @param ch displayed character
 * @param style style snapshot
 * @since 1.0
 */
public record Cell(char ch, Style style) {

  public static final Cell BLANK = new Cell(' ', Style.DEFAULT);

  public static Cell blank(Style style) {
    return style == null || style.isDefault() ? BLANK : new Cell(' ', style);
  }
}
