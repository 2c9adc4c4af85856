package com.consullo.castedit.recording;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.IntNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import org.apache.commons.lang3.Validate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Parses asciicast-style recordings into {@link Recording} values.
 *
 * <p>
 * Two layouts are accepted:
 * <ul>
 * <li>a single JSON object carrying the header fields and an {@code events} array;</li>
 * <li>line-delimited: the first non-blank line is the header object, every following non-blank line is one
 * JSON-encoded event.</li>
 * </ul>
 * </p>
 *
 * <p>
 * Each event is an array {@code [time, kind, data, ...]}. Entries that are not arrays of at least three
 * elements, or whose time is not a finite number, are skipped. Times are delta-encoded when the header
 * version is 3 or above. For older versions a time that goes backwards is also treated as a delta.
 * </p>
 */
public final class CastParser {

  private static final Logger LOGGER = LoggerFactory.getLogger(CastParser.class);

  public static final int DEFAULT_WIDTH = 80;
  public static final int DEFAULT_HEIGHT = 24;
  public static final int MAX_DIMENSION = 2000;

  private final ObjectMapper mapper;

  public CastParser() {
    this(new ObjectMapper());
  }

  public CastParser(ObjectMapper mapper) {
    Validate.notNull(mapper, "mapper must not be null");
    this.mapper = mapper.copy().enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);
  }

  /**
   * Parses a recording under a generated id.
   *
   * @param name display name (usually the file name)
   * @param text full file content
   * @return parsed recording
   * @throws CastFormatException if the content cannot be loaded
   */
  public Recording parse(String name, String text) throws CastFormatException {
    return parse(UUID.randomUUID().toString(), name, text);
  }

  /**
   * Parses a recording.
   *
   * @param id source id to assign
   * @param name display name
   * @param text full file content
   * @return parsed recording
   * @throws CastFormatException if the content cannot be loaded
   */
  public Recording parse(String id, String name, String text) throws CastFormatException {
    Validate.notBlank(id, "id must not be blank");
    Validate.notNull(name, "name must not be null");
    String trimmed = text == null ? "" : text.trim();
    if (trimmed.isEmpty()) {
      throw new CastFormatException("Cast file is empty");
    }

    ObjectNode header;
    JsonNode rawEvents;

    JsonNode whole = tryReadWhole(trimmed);
    if (whole != null) {
      header = normalizeHeader(whole);
      rawEvents = whole.get("events");
      if (rawEvents == null || !rawEvents.isArray()) {
        throw new CastFormatException("Expected events in cast payload");
      }
      header.remove("events");
    } else {
      List<String> lines = nonBlankLines(text);
      if (lines.size() < 2) {
        throw new CastFormatException("Expected JSON cast or line-based cast format");
      }
      header = normalizeHeader(readLine(lines.get(0), 1));
      List<JsonNode> parsed = new ArrayList<>(lines.size() - 1);
      for (int i = 1; i < lines.size(); i++) {
        parsed.add(readLine(lines.get(i), i + 1));
      }
      rawEvents = mapper.createArrayNode().addAll(parsed);
    }

    double version = numberOf(header.get("version"));
    List<CastEvent> events = normalizeEvents(rawEvents, version);

    Recording recording = Recording.builder()
        .id(id)
        .name(name)
        .header(header)
        .size(header.get("width").asInt(), header.get("height").asInt())
        .theme(ThemeReader.read(header))
        .events(events)
        .build();
    LOGGER.debug("parse: {}", recording);
    return recording;
  }

  private JsonNode tryReadWhole(String trimmed) {
    try {
      return mapper.readTree(trimmed);
    } catch (JsonProcessingException e) {
      LOGGER.debug("parse: not a single JSON document ({}), trying line-delimited", e.getOriginalMessage());
      return null;
    }
  }

  private JsonNode readLine(String line, int lineNumber) throws CastFormatException {
    try {
      return mapper.readTree(line);
    } catch (JsonProcessingException e) {
      throw new CastFormatException("Invalid JSON on line " + lineNumber + ": " + e.getOriginalMessage(), e);
    }
  }

  static ObjectNode normalizeHeader(JsonNode raw) throws CastFormatException {
    if (raw == null || !raw.isObject()) {
      throw new CastFormatException("Invalid cast header");
    }
    if (!isTruthy(raw.get("version"))) {
      throw new CastFormatException("Missing cast version in header");
    }
    ObjectNode header = ((ObjectNode) raw).deepCopy();
    JsonNode term = raw.path("term");
    header.set("width", IntNode.valueOf(dimension(firstPresent(raw.get("width"), term.get("cols")), DEFAULT_WIDTH)));
    header.set("height", IntNode.valueOf(dimension(firstPresent(raw.get("height"), term.get("rows")), DEFAULT_HEIGHT)));
    return header;
  }

  static List<CastEvent> normalizeEvents(JsonNode rawEvents, double version) {
    List<CastEvent> out = new ArrayList<>(rawEvents.size());
    boolean useDelta = version >= 3;
    double cursor = 0;
    double prevRaw = Double.NEGATIVE_INFINITY;
    int skipped = 0;

    for (JsonNode event : rawEvents) {
      if (!event.isArray() || event.size() < 3) {
        skipped++;
        continue;
      }
      double rawTime = numberOf(event.get(0));
      if (!Double.isFinite(rawTime)) {
        skipped++;
        continue;
      }

      double absTime;
      if (useDelta || rawTime < prevRaw) {
        cursor += Math.max(0, rawTime);
        absTime = cursor;
      } else {
        cursor = rawTime;
        absTime = rawTime;
      }
      prevRaw = rawTime;
      out.add(new CastEvent(absTime, event.get(1), event.get(2)));
    }

    if (skipped > 0) {
      LOGGER.debug("normalizeEvents: skipped {} malformed entries", skipped);
    }
    return out;
  }

  private static List<String> nonBlankLines(String text) {
    List<String> out = new ArrayList<>();
    for (String line : text.split("\r?\n")) {
      String t = line.trim();
      if (!t.isEmpty()) {
        out.add(t);
      }
    }
    return out;
  }

  private static JsonNode firstPresent(JsonNode a, JsonNode b) {
    if (a != null && !a.isNull()) {
      return a;
    }
    return b;
  }

  private static int dimension(JsonNode node, int fallback) {
    double v = node == null || node.isNull() ? fallback : numberOf(node);
    if (!Double.isFinite(v)) {
      return fallback;
    }
    return (int) Math.floor(Math.max(1, Math.min(MAX_DIMENSION, v)));
  }

  /**
   * Reads a JSON number or numeric string; anything else is NaN.
   */
  static double numberOf(JsonNode node) {
    if (node == null) {
      return Double.NaN;
    }
    if (node.isNumber()) {
      return node.asDouble();
    }
    if (node.isTextual()) {
      try {
        return Double.parseDouble(node.asText().trim());
      } catch (NumberFormatException e) {
        return Double.NaN;
      }
    }
    return Double.NaN;
  }

  private static boolean isTruthy(JsonNode node) {
    if (node == null || node.isNull() || node.isMissingNode()) {
      return false;
    }
    if (node.isBoolean()) {
      return node.asBoolean();
    }
    if (node.isNumber()) {
      double d = node.asDouble();
      return d != 0 && !Double.isNaN(d);
    }
    if (node.isTextual()) {
      return !node.asText().isEmpty();
    }
    return true;
  }
}
