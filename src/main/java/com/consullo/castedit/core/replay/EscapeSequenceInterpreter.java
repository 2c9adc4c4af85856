package com.consullo.castedit.core.replay;

import com.consullo.castedit.core.Style;
import com.consullo.castedit.core.TerminalColor;
import com.consullo.castedit.core.Theme;
import java.util.ArrayList;
import java.util.List;

/**
 * Character-at-a-time state machine over terminal output.
 *
 * <p>
 * Recognized:
 * <ul>
 * <li>C0 controls: LF (next row, column 0, scrolling at the bottom), CR, BS, HT. Other C0 controls and DEL
 * are ignored.</li>
 * <li>CSI {@code ESC [ params final}: H/f cursor position, A/B/C/D relative moves, J erase in display, K
 * erase in line, m SGR. Any other final byte is consumed without effect.</li>
 * <li>String sequences (OSC {@code ESC ]}, DCS {@code ESC P}, SOS {@code ESC X}, PM {@code ESC ^}, APC
 * {@code ESC _}) are skipped up to BEL or {@code ESC \}.</li>
 * <li>Other escapes: optional intermediate bytes followed by one final byte, consumed without effect.</li>
 * </ul>
 * </p>
 *
 * <p>
 * Parser state survives between {@link #feed(CharSequence)} calls, so a sequence split over two recorded
 * events is still recognized. A sequence still open when the input ends is simply never applied. Nothing in
 * the input stream can make this class throw.
 * </p>
 */
final class EscapeSequenceInterpreter {

  private static final char ESC = 0x1B;
  private static final char BEL = 0x07;
  private static final int MAX_PARAM = 65_535;

  private enum State {
    GROUND,
    ESCAPE,
    ESCAPE_INTERMEDIATE,
    CSI,
    STRING,
    STRING_ESCAPE
  }

  private final ScreenBuffer screen;
  private final Theme theme;
  private final StringBuilder csiBody = new StringBuilder();

  private State state = State.GROUND;
  private Style style = Style.DEFAULT;
  private long dispatchedSequences;
  private long ignoredSequences;

  EscapeSequenceInterpreter(ScreenBuffer screen, Theme theme) {
    if (screen == null || theme == null) {
      throw new IllegalArgumentException("screen/theme must not be null.");
    }
    this.screen = screen;
    this.theme = theme;
  }

  Style currentStyle() {
    return style;
  }

  long dispatchedSequences() {
    return dispatchedSequences;
  }

  long ignoredSequences() {
    return ignoredSequences;
  }

  void resetStyle() {
    style = Style.DEFAULT;
    state = State.GROUND;
    csiBody.setLength(0);
  }

  void feed(CharSequence text) {
    for (int i = 0; i < text.length(); i++) {
      step(text.charAt(i));
    }
  }

  private void step(char ch) {
    switch (state) {
      case GROUND:
        ground(ch);
        break;
      case ESCAPE:
        escape(ch);
        break;
      case ESCAPE_INTERMEDIATE:
        if (ch == ESC) {
          state = State.ESCAPE;
        } else if (!isIntermediate(ch)) {
          state = State.GROUND;
        }
        break;
      case CSI:
        csi(ch);
        break;
      case STRING:
        if (ch == BEL) {
          state = State.GROUND;
        } else if (ch == ESC) {
          state = State.STRING_ESCAPE;
        }
        break;
      case STRING_ESCAPE:
        if (ch == '\\') {
          state = State.GROUND;
        } else if (ch != ESC) {
          state = State.STRING;
        }
        break;
      default:
        state = State.GROUND;
        break;
    }
  }

  private void ground(char ch) {
    if (ch == ESC) {
      state = State.ESCAPE;
      return;
    }
    if (ch == '\n') {
      screen.lineFeed(style);
      return;
    }
    if (ch == '\r') {
      screen.carriageReturn();
      return;
    }
    if (ch == '\b') {
      screen.backspace();
      return;
    }
    if (ch == '\t') {
      screen.tab();
      return;
    }
    if (ch < 0x20 || ch == 0x7F) {
      return;
    }
    screen.put(ch, style);
  }

  private void escape(char ch) {
    if (ch == '[') {
      csiBody.setLength(0);
      state = State.CSI;
    } else if (ch == ']' || ch == 'P' || ch == 'X' || ch == '^' || ch == '_') {
      state = State.STRING;
    } else if (isIntermediate(ch)) {
      state = State.ESCAPE_INTERMEDIATE;
    } else if (ch != ESC) {
      state = State.GROUND;
    }
  }

  private void csi(char ch) {
    if (ch >= 0x40 && ch <= 0x7E) {
      state = State.GROUND;
      dispatchCsi(csiBody.toString(), ch);
      csiBody.setLength(0);
      return;
    }
    if (ch == ESC) {
      // Abandon the open sequence and start a new one.
      csiBody.setLength(0);
      state = State.ESCAPE;
      return;
    }
    csiBody.append(ch);
  }

  private void dispatchCsi(String body, char finalChar) {
    for (int i = 0; i < body.length(); i++) {
      char c = body.charAt(i);
      if (!(c >= '0' && c <= '?')) {
        ignoredSequences++;
        return;
      }
    }
    int start = 0;
    while (start < body.length() && body.charAt(start) >= '<') {
      start++;
    }
    int[] params = parseParams(body.substring(start));
    dispatchedSequences++;

    switch (finalChar) {
      case 'H':
      case 'f':
        screen.moveTo(orOne(param(params, 0)) - 1, orOne(param(params, 1)) - 1);
        break;
      case 'A':
        screen.moveBy(-orOne(params[0]), 0);
        break;
      case 'B':
        screen.moveBy(orOne(params[0]), 0);
        break;
      case 'C':
        screen.moveBy(0, orOne(params[0]));
        break;
      case 'D':
        screen.moveBy(0, -orOne(params[0]));
        break;
      case 'J':
        screen.eraseInDisplay(params[0], style);
        break;
      case 'K':
        screen.eraseInLine(params[0], style);
        break;
      case 'm':
        applySgr(params);
        break;
      default:
        break;
    }
  }

  /**
   * Applies an SGR parameter list. An empty list behaves as a single 0.
   */
  void applySgr(int[] values) {
    int[] codes = values.length == 0 ? new int[] {0} : values;
    for (int i = 0; i < codes.length; i++) {
      int code = codes[i];
      if (code == 0) {
        style = Style.DEFAULT;
      } else if (code == 1) {
        style = style.withBold(true);
      } else if (code == 2) {
        style = style.withDim(true);
      } else if (code == 3) {
        style = style.withItalic(true);
      } else if (code == 4) {
        style = style.withUnderline(true);
      } else if (code == 7) {
        style = style.withInverse(true);
      } else if (code == 9) {
        style = style.withStrike(true);
      } else if (code == 22) {
        style = style.withBold(false).withDim(false);
      } else if (code == 23) {
        style = style.withItalic(false);
      } else if (code == 24) {
        style = style.withUnderline(false);
      } else if (code == 27) {
        style = style.withInverse(false);
      } else if (code == 29) {
        style = style.withStrike(false);
      } else if (code >= 30 && code <= 37) {
        style = style.withForeground(theme.paletteColor(code - 30));
      } else if (code == 39) {
        style = style.withForeground(null);
      } else if (code >= 40 && code <= 47) {
        style = style.withBackground(theme.paletteColor(code - 40));
      } else if (code == 49) {
        style = style.withBackground(null);
      } else if (code >= 90 && code <= 97) {
        style = style.withForeground(theme.paletteColor(code - 90 + 8));
      } else if (code >= 100 && code <= 107) {
        style = style.withBackground(theme.paletteColor(code - 100 + 8));
      } else if (code == 38 || code == 48) {
        i = applyExtendedColor(codes, i, code == 38);
      }
    }
  }

  /**
   * Handles {@code 38/48;5;N} and {@code 38/48;2;R;G;B}. Returns the index of the last consumed parameter.
   */
  private int applyExtendedColor(int[] codes, int i, boolean foreground) {
    int mode = param(codes, i + 1);
    if (mode == 5 && i + 2 < codes.length) {
      setColor(foreground, ColorResolver.resolve256(codes[i + 2], theme.palette()));
      return i + 2;
    }
    if (mode == 2 && i + 4 < codes.length) {
      setColor(foreground, ColorResolver.truecolor(codes[i + 2], codes[i + 3], codes[i + 4]));
      return i + 4;
    }
    return i;
  }

  private void setColor(boolean foreground, TerminalColor color) {
    style = foreground ? style.withForeground(color) : style.withBackground(color);
  }

  static int[] parseParams(String text) {
    if (text.isEmpty()) {
      return new int[] {0};
    }
    List<Integer> out = new ArrayList<>();
    int from = 0;
    while (true) {
      int sep = text.indexOf(';', from);
      String part = sep < 0 ? text.substring(from) : text.substring(from, sep);
      out.add(parseParam(part));
      if (sep < 0) {
        break;
      }
      from = sep + 1;
    }
    int[] params = new int[out.size()];
    for (int i = 0; i < params.length; i++) {
      params[i] = out.get(i);
    }
    return params;
  }

  /**
   * Digits only; anything else (including colon sub-parameters) reads as 0.
   */
  private static int parseParam(String part) {
    if (part.isEmpty()) {
      return 0;
    }
    int v = 0;
    for (int i = 0; i < part.length(); i++) {
      char c = part.charAt(i);
      if (c < '0' || c > '9') {
        return 0;
      }
      v = Math.min(MAX_PARAM, v * 10 + (c - '0'));
    }
    return v;
  }

  private static int param(int[] params, int index) {
    return index < params.length ? params[index] : 0;
  }

  private static int orOne(int v) {
    return v == 0 ? 1 : v;
  }

  private static boolean isIntermediate(char ch) {
    return ch >= 0x20 && ch <= 0x2F;
  }
}
