package com.consullo.castedit.core.replay;

import com.consullo.castedit.core.Cell;
import com.consullo.castedit.core.Style;
import com.consullo.castedit.core.TerminalSnapshot;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Fixed-size mutable character grid with a cursor.
 *
 * <p>
 * Rows scroll off the top when the cursor advances past the last row; scrolled-off content is discarded.
 * The column may sit one past the last column after a write fills the row. The next printable character
 * then wraps to the following line before it is placed.
 * </p>
 *
 * <p>Not thread-safe. A buffer belongs to exactly one replay.</p>
 */
final class ScreenBuffer {

  private static final int TAB_WIDTH = 8;

  private final int rows;
  private final int cols;
  private Cell[][] grid;
  private int row;
  private int col;

  ScreenBuffer(int rows, int cols) {
    if (rows <= 0 || cols <= 0) {
      throw new IllegalArgumentException("rows/cols must be positive.");
    }
    this.rows = rows;
    this.cols = cols;
    this.grid = blankGrid();
  }

  int rows() {
    return rows;
  }

  int cols() {
    return cols;
  }

  int cursorRow() {
    return row;
  }

  int cursorCol() {
    return col;
  }

  void put(char ch, Style style) {
    if (col >= cols) {
      lineFeed(style);
    }
    grid[row][col] = new Cell(ch, style);
    col++;
  }

  /**
   * Moves to column 0 of the next row, scrolling when already on the last row. New rows are blanked with
   * the given style.
   */
  void lineFeed(Style style) {
    col = 0;
    row++;
    if (row >= rows) {
      System.arraycopy(grid, 1, grid, 0, rows - 1);
      grid[rows - 1] = blankRow(style);
      row = rows - 1;
    }
  }

  void carriageReturn() {
    col = 0;
  }

  void backspace() {
    col = Math.max(0, col - 1);
  }

  void tab() {
    if (col < cols) {
      col = Math.min(cols - 1, (col / TAB_WIDTH + 1) * TAB_WIDTH);
    }
  }

  /**
   * Absolute move, zero-based, clamped to the grid.
   */
  void moveTo(int newRow, int newCol) {
    row = clamp(newRow, 0, rows - 1);
    col = clamp(newCol, 0, cols - 1);
  }

  /**
   * Relative move, clamped to the grid.
   */
  void moveBy(int dRows, int dCols) {
    moveTo(row + dRows, col + dCols);
  }

  /**
   * Erase in display. Mode 0: cursor to end; 1: start to cursor; 2: whole screen and cursor home. Other
   * modes are ignored.
   */
  void eraseInDisplay(int mode, Style style) {
    if (mode == 2) {
      grid = blankGrid();
      row = 0;
      col = 0;
      return;
    }
    if (mode == 0) {
      eraseInLine(0, style);
      for (int r = row + 1; r < rows; r++) {
        grid[r] = blankRow(style);
      }
      return;
    }
    if (mode == 1) {
      eraseInLine(1, style);
      for (int r = 0; r < row; r++) {
        grid[r] = blankRow(style);
      }
    }
  }

  /**
   * Erase in line, restricted to the cursor row. Modes as in {@link #eraseInDisplay(int, Style)}, without
   * moving the cursor.
   */
  void eraseInLine(int mode, Style style) {
    int from;
    int to;
    if (mode == 0) {
      from = col;
      to = cols - 1;
    } else if (mode == 1) {
      from = 0;
      to = Math.min(col, cols - 1);
    } else if (mode == 2) {
      from = 0;
      to = cols - 1;
    } else {
      return;
    }
    Cell blank = Cell.blank(style);
    for (int c = from; c <= to; c++) {
      grid[row][c] = blank;
    }
  }

  TerminalSnapshot snapshot() {
    List<List<Cell>> lines = new ArrayList<>(rows);
    for (Cell[] line : grid) {
      lines.add(Arrays.asList(line));
    }
    return TerminalSnapshot.builder()
        .rows(rows)
        .cols(cols)
        .cursor(row, col)
        .lines(lines)
        .build();
  }

  private Cell[][] blankGrid() {
    Cell[][] g = new Cell[rows][];
    for (int r = 0; r < rows; r++) {
      g[r] = blankRow(Style.DEFAULT);
    }
    return g;
  }

  private Cell[] blankRow(Style style) {
    Cell[] line = new Cell[cols];
    Arrays.fill(line, Cell.blank(style));
    return line;
  }

  private static int clamp(int v, int min, int max) {
    return Math.max(min, Math.min(max, v));
  }
}
