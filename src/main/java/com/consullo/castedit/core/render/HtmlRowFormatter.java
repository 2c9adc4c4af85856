package com.consullo.castedit.core.render;

import java.util.ArrayList;
import java.util.List;

/**
 * Emits HTML: unstyled runs as escaped text, styled runs as {@code <span style="...">} with inline CSS.
 *
 * <p>Inline CSS uses color, background-color, font-weight, font-style, text-decoration (underline and
 * line-through combined) and opacity for dimmed text.</p>
 */
public final class HtmlRowFormatter implements RowFormatter {

  @Override
  public String formatRow(List<StyledRun> runs) {
    StringBuilder sb = new StringBuilder();
    for (StyledRun run : runs) {
      String text = escape(run.text());
      String css = css(run.style());
      if (css.isEmpty()) {
        sb.append(text);
      } else {
        sb.append("<span style=\"").append(css).append("\">").append(text).append("</span>");
      }
    }
    return sb.toString();
  }

  static String css(ResolvedStyle style) {
    List<String> parts = new ArrayList<>(6);
    if (style.foreground() != null) {
      parts.add("color:" + style.foreground().toHex());
    }
    if (style.background() != null) {
      parts.add("background-color:" + style.background().toHex());
    }
    if (style.bold()) {
      parts.add("font-weight:700");
    }
    if (style.italic()) {
      parts.add("font-style:italic");
    }
    if (style.hasDecoration()) {
      String decoration = style.underline() && style.strike()
          ? "underline line-through"
          : style.underline() ? "underline" : "line-through";
      parts.add("text-decoration:" + decoration);
    }
    if (style.dimmed()) {
      parts.add("opacity:0.75");
    }
    return String.join(";", parts);
  }

  static String escape(String text) {
    StringBuilder sb = new StringBuilder(text.length());
    for (int i = 0; i < text.length(); i++) {
      char c = text.charAt(i);
      if (c == '&') {
        sb.append("&amp;");
      } else if (c == '<') {
        sb.append("&lt;");
      } else if (c == '>') {
        sb.append("&gt;");
      } else if (c == '"') {
        sb.append("&quot;");
      } else {
        sb.append(c);
      }
    }
    return sb.toString();
  }
}
