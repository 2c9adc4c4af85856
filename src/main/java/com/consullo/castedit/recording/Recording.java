package com.consullo.castedit.recording;

import com.consullo.castedit.core.Theme;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import org.apache.commons.lang3.Validate;

/**
 * A parsed terminal recording. Immutable once created.
 *
 * <p>
 * {@link #events()} holds every normalized event in source order; {@link #outputEvents()} holds only the
 * output-kind events, sorted by time. The duration is the time of the last output event.
 * </p>
 */
public final class Recording {

  private final String id;
  private final String name;
  private final ObjectNode header;
  private final int cols;
  private final int rows;
  private final Theme theme;
  private final List<CastEvent> events;
  private final List<OutputEvent> outputEvents;
  private final double duration;

  private Recording(Builder b) {
    this.id = b.id;
    this.name = b.name;
    this.header = b.header.deepCopy();
    this.cols = b.cols;
    this.rows = b.rows;
    this.theme = b.theme;
    this.events = Collections.unmodifiableList(new ArrayList<>(b.events));
    List<OutputEvent> out = new ArrayList<>();
    for (CastEvent e : b.events) {
      if (e.isOutput()) {
        out.add(new OutputEvent(e.time(), e.dataText()));
      }
    }
    out.sort((a, c) -> Double.compare(a.time(), c.time()));
    this.outputEvents = Collections.unmodifiableList(out);
    this.duration = out.isEmpty() ? 0.0 : out.get(out.size() - 1).time();
  }

  public String id() {
    return id;
  }

  public String name() {
    return name;
  }

  /**
   * Returns a copy of the normalized header.
   *
   * @return header JSON
   */
  public ObjectNode header() {
    return header.deepCopy();
  }

  public int cols() {
    return cols;
  }

  public int rows() {
    return rows;
  }

  public Theme theme() {
    return theme;
  }

  public List<CastEvent> events() {
    return events;
  }

  public List<OutputEvent> outputEvents() {
    return outputEvents;
  }

  public double duration() {
    return duration;
  }

  /**
   * Returns the header version as declared, or 0 when it is not numeric.
   *
   * @return version number
   */
  public double version() {
    return header.path("version").asDouble(0.0);
  }

  @Override
  public String toString() {
    return "Recording{id=" + id + ", name=" + name + ", " + cols + "x" + rows
        + ", events=" + events.size() + ", duration=" + duration + "}";
  }

  public static Builder builder() {
    return new Builder();
  }

  public static final class Builder {

    private String id;
    private String name;
    private ObjectNode header;
    private int cols;
    private int rows;
    private Theme theme = Theme.DEFAULT;
    private List<CastEvent> events = List.of();

    private Builder() {
    }

    public Builder id(String id) {
      this.id = id;
      return this;
    }

    public Builder name(String name) {
      this.name = name;
      return this;
    }

    public Builder header(ObjectNode header) {
      this.header = header;
      return this;
    }

    public Builder size(int cols, int rows) {
      this.cols = cols;
      this.rows = rows;
      return this;
    }

    public Builder theme(Theme theme) {
      this.theme = theme;
      return this;
    }

    public Builder events(List<CastEvent> events) {
      this.events = events;
      return this;
    }

    public Recording build() {
      Validate.notBlank(id, "id must not be blank");
      Validate.notNull(name, "name must not be null");
      Validate.notNull(header, "header must not be null");
      Validate.notNull(theme, "theme must not be null");
      Validate.notNull(events, "events must not be null");
      if (cols <= 0 || rows <= 0) {
        throw new IllegalArgumentException("cols/rows must be positive.");
      }
      return new Recording(this);
    }
  }
}
