package com.consullo.castedit.core;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Immutable snapshot of a replayed screen: the cell grid plus cursor position.
 *
 * <p>
 * Snapshots are throwaway values. They are rebuilt from the event prefix for every query and are never
 * part of timeline or history state.
 * </p>
 */
public final class TerminalSnapshot {

  private final int cols;
  private final int rows;
  private final int cursorRow;
  private final int cursorCol;
  private final List<List<Cell>> lines;

  private TerminalSnapshot(Builder b) {
    this.cols = b.cols;
    this.rows = b.rows;
    this.cursorRow = b.cursorRow;
    this.cursorCol = b.cursorCol;
    List<List<Cell>> copy = new ArrayList<>(b.lines.size());
    for (List<Cell> line : b.lines) {
      copy.add(Collections.unmodifiableList(new ArrayList<>(line)));
    }
    this.lines = Collections.unmodifiableList(copy);
  }

  public int getCols() {
    return cols;
  }

  public int getRows() {
    return rows;
  }

  public int getCursorRow() {
    return cursorRow;
  }

  /**
   * Cursor column. May equal {@link #getCols()} when the last write filled the row and the wrap is still
   * pending.
   */
  public int getCursorCol() {
    return cursorCol;
  }

  public List<Cell> getLine(int row) {
    return lines.get(row);
  }

  public List<List<Cell>> getLines() {
    return lines;
  }

  public Cell cellAt(int row, int col) {
    return lines.get(row).get(col);
  }

  /**
   * Returns the characters of a row, right-trimmed.
   *
   * @param row row index
   * @return plain text
   */
  public String rowText(int row) {
    List<Cell> line = lines.get(row);
    StringBuilder sb = new StringBuilder(line.size());
    for (Cell c : line) {
      sb.append(c.ch());
    }
    int n = sb.length();
    while (n > 0 && sb.charAt(n - 1) == ' ') {
      n--;
    }
    sb.setLength(n);
    return sb.toString();
  }

  /**
   * Returns every row as right-trimmed plain text.
   *
   * @return one string per row
   */
  public List<String> plainLines() {
    List<String> out = new ArrayList<>(rows);
    for (int r = 0; r < rows; r++) {
      out.add(rowText(r));
    }
    return out;
  }

  public static Builder builder() {
    return new Builder();
  }

  public static final class Builder {

    private int cols;
    private int rows;
    private int cursorRow;
    private int cursorCol;
    private List<List<Cell>> lines = List.of();

    private Builder() {
    }

    public Builder cols(int cols) {
      this.cols = cols;
      return this;
    }

    public Builder rows(int rows) {
      this.rows = rows;
      return this;
    }

    public Builder cursor(int row, int col) {
      this.cursorRow = row;
      this.cursorCol = col;
      return this;
    }

    public Builder lines(List<List<Cell>> lines) {
      this.lines = lines;
      return this;
    }

    public TerminalSnapshot build() {
      if (cols <= 0 || rows <= 0) {
        throw new IllegalArgumentException("cols/rows must be positive.");
      }
      if (lines == null || lines.size() != rows) {
        throw new IllegalArgumentException("lines must contain exactly one entry per row.");
      }
      for (List<Cell> line : lines) {
        if (line.size() != cols) {
          throw new IllegalArgumentException("every line must contain exactly cols cells.");
        }
      }
      return new TerminalSnapshot(this);
    }
  }
}
