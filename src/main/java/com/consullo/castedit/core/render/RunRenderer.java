package com.consullo.castedit.core.render;

import com.consullo.castedit.core.Cell;
import com.consullo.castedit.core.TerminalSnapshot;
import com.consullo.castedit.core.Theme;
import java.util.ArrayList;
import java.util.List;
import org.apache.commons.lang3.Validate;

/**
 * Compresses rendered rows into style-homogeneous runs and formats them.
 *
 * <p>Cells are grouped by {@link ResolvedStyle}, not by raw style, so two cells that look the same (for
 * example an inverse cell and a cell with the swapped colors set explicitly) share a run.</p>
 *
 * @since 1.0
 */
public final class RunRenderer {

  private final Theme theme;

  public RunRenderer(Theme theme) {
    Validate.notNull(theme, "theme must not be null");
    this.theme = theme;
  }

  /**
   * Splits one row into runs, left to right.
   *
   * @param line row cells
   * @return runs covering every cell of the row
   */
  public List<StyledRun> runs(List<Cell> line) {
    List<StyledRun> out = new ArrayList<>();
    StringBuilder text = new StringBuilder();
    ResolvedStyle current = null;
    for (Cell cell : line) {
      ResolvedStyle style = ResolvedStyle.of(cell.style(), theme);
      if (current != null && !current.equals(style)) {
        out.add(new StyledRun(text.toString(), current));
        text.setLength(0);
      }
      current = style;
      text.append(cell.ch());
    }
    if (current != null) {
      out.add(new StyledRun(text.toString(), current));
    }
    return out;
  }

  /**
   * Formats every row of a snapshot.
   *
   * @param snapshot screen
   * @param formatter output format
   * @return one formatted string per row
   */
  public List<String> renderRows(TerminalSnapshot snapshot, RowFormatter formatter) {
    Validate.notNull(snapshot, "snapshot must not be null");
    Validate.notNull(formatter, "formatter must not be null");
    List<String> rows = new ArrayList<>(snapshot.getRows());
    for (List<Cell> line : snapshot.getLines()) {
      rows.add(formatter.formatRow(runs(line)));
    }
    return rows;
  }

  /**
   * Formats a snapshot with rows joined by '\n'.
   */
  public String render(TerminalSnapshot snapshot, ScreenFormat format) {
    return String.join("\n", renderRows(snapshot, format.formatter()));
  }
}
