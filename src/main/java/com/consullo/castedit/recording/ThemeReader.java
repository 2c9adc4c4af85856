package com.consullo.castedit.recording;

import com.consullo.castedit.core.TerminalColor;
import com.consullo.castedit.core.Theme;
import com.fasterxml.jackson.databind.JsonNode;
import java.util.ArrayList;
import java.util.List;

/**
 * Resolves a recording's {@link Theme} from its header.
 *
 * <p>{@code term.theme} takes precedence over a top-level {@code theme}. The palette is a colon-separated
 * list of hex colors; fewer than 16 usable entries fall back to the default palette.</p>
 *
 * @since 1.0
 */
public final class ThemeReader {

  private ThemeReader() {
  }

  public static Theme read(JsonNode header) {
    if (header == null) {
      return Theme.DEFAULT;
    }
    JsonNode theme = header.path("term").path("theme");
    if (!theme.isObject()) {
      theme = header.path("theme");
    }
    if (!theme.isObject()) {
      return Theme.DEFAULT;
    }

    TerminalColor fg = TerminalColor.parseHex(theme.path("fg").asText(null));
    TerminalColor bg = TerminalColor.parseHex(theme.path("bg").asText(null));
    return new Theme(
        fg != null ? fg : Theme.DEFAULT_FOREGROUND,
        bg != null ? bg : Theme.DEFAULT_BACKGROUND,
        parsePalette(theme.path("palette")));
  }

  static List<TerminalColor> parsePalette(JsonNode paletteNode) {
    if (!paletteNode.isTextual()) {
      return Theme.DEFAULT_PALETTE;
    }
    List<String> parts = new ArrayList<>();
    for (String part : paletteNode.asText().split(":")) {
      String p = part.trim();
      if (!p.isEmpty()) {
        parts.add(p);
      }
    }
    if (parts.size() < Theme.PALETTE_SIZE) {
      return Theme.DEFAULT_PALETTE;
    }
    List<TerminalColor> out = new ArrayList<>(Theme.PALETTE_SIZE);
    for (int i = 0; i < Theme.PALETTE_SIZE; i++) {
      TerminalColor c = TerminalColor.parseHex(parts.get(i));
      // Unparseable entries keep the default color for that slot.
      out.add(c != null ? c : Theme.DEFAULT_PALETTE.get(i));
    }
    return out;
  }
}
