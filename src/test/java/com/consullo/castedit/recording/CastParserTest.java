package com.consullo.castedit.recording;

import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for cast parsing and header/time normalization.
 *
 * @since 1.0
 */
public class CastParserTest {

  private final CastParser parser = new CastParser();

  private Recording parse(String text) throws CastFormatException {
    return parser.parse("src-1", "demo.cast", text);
  }

  private static List<Double> times(Recording r) {
    return r.events().stream().map(CastEvent::time).toList();
  }

  @Test
  @DisplayName("Should parse line-delimited casts with absolute times")
  void parse_LineFormatVersion2_AbsoluteTimes() throws Exception {
    Recording r = parse("{\"version\": 2, \"width\": 100, \"height\": 30}\n"
        + "[0.5, \"o\", \"a\"]\n"
        + "\n"
        + "[1.25, \"i\", \"k\"]\n"
        + "[2.0, \"o\", \"b\"]\n");

    assertThat(r.id()).isEqualTo("src-1");
    assertThat(r.cols()).isEqualTo(100);
    assertThat(r.rows()).isEqualTo(30);
    assertThat(times(r)).containsExactly(0.5, 1.25, 2.0);
    assertThat(r.outputEvents()).hasSize(2);
    assertThat(r.duration()).isEqualTo(2.0);
  }

  @Test
  @DisplayName("Should accumulate delta times for version 3 and read the size from term")
  void parse_Version3_DeltaTimes() throws Exception {
    Recording r = parse("{\"version\": 3, \"term\": {\"cols\": 90, \"rows\": 20}}\n"
        + "[0.5, \"o\", \"a\"]\n"
        + "[0.25, \"o\", \"b\"]\n"
        + "[1, \"o\", \"c\"]\n");

    assertThat(r.cols()).isEqualTo(90);
    assertThat(r.rows()).isEqualTo(20);
    assertThat(times(r)).containsExactly(0.5, 0.75, 1.75);
  }

  @Test
  @DisplayName("Should switch to delta accumulation when an older cast goes backwards in time")
  void parse_Version2DecreasingTime_TreatedAsDelta() throws Exception {
    Recording r = parse("{\"version\": 2}\n[1.0, \"o\", \"a\"]\n[0.2, \"o\", \"b\"]\n");

    assertThat(times(r)).containsExactly(1.0, 1.2);
  }

  @Test
  @DisplayName("Should parse the single-document layout and strip events from the header")
  void parse_SingleJsonDocument_HeaderWithoutEvents() throws Exception {
    Recording r = parse("{\"version\": 2, \"width\": 40, \"height\": 10, \"title\": \"t\","
        + " \"events\": [[0.1, \"o\", \"x\"], [0.2, \"o\", \"y\"]]}");

    assertThat(times(r)).containsExactly(0.1, 0.2);
    assertThat(r.header().has("events")).isFalse();
    assertThat(r.header().path("title").asText()).isEqualTo("t");
  }

  @Test
  @DisplayName("Should skip malformed events and accept numeric strings as times")
  void parse_MalformedEvents_Skipped() throws Exception {
    Recording r = parse("{\"version\": 2}\n"
        + "[0.1, \"o\"]\n"
        + "[\"soon\", \"o\", \"x\"]\n"
        + "\"not an event\"\n"
        + "[null, \"o\", \"x\"]\n"
        + "[\"0.5\", \"o\", \"ok\"]\n");

    assertThat(r.events()).hasSize(1);
    assertThat(r.events().get(0).time()).isEqualTo(0.5);
    assertThat(r.events().get(0).dataText()).isEqualTo("ok");
  }

  @Test
  @DisplayName("Should default a missing size to 80x24 and clamp out-of-range sizes")
  void parse_SizeDefaultsAndClamps() throws Exception {
    Recording defaults = parse("{\"version\": 2}\n[0.1, \"o\", \"x\"]\n");
    Recording clamped = parse("{\"version\": 2, \"width\": 5000, \"height\": 0}\n[0.1, \"o\", \"x\"]\n");

    assertThat(defaults.cols()).isEqualTo(80);
    assertThat(defaults.rows()).isEqualTo(24);
    assertThat(clamped.cols()).isEqualTo(2000);
    assertThat(clamped.rows()).isEqualTo(1);
  }

  @Test
  @DisplayName("Should reject empty input")
  void parse_Empty_Throws() {
    assertThatThrownBy(() -> parse("  \n "))
        .isInstanceOf(CastFormatException.class)
        .hasMessage("Cast file is empty");
  }

  @Test
  @DisplayName("Should reject a header without a truthy version")
  void parse_MissingVersion_Throws() {
    assertThatThrownBy(() -> parse("{\"width\": 80}\n[0.1, \"o\", \"x\"]\n"))
        .isInstanceOf(CastFormatException.class)
        .hasMessage("Missing cast version in header");
    assertThatThrownBy(() -> parse("{\"version\": 0, \"events\": []}"))
        .isInstanceOf(CastFormatException.class)
        .hasMessage("Missing cast version in header");
  }

  @Test
  @DisplayName("Should reject a non-object header")
  void parse_ArrayHeader_Throws() {
    assertThatThrownBy(() -> parse("[1, 2]\n[0.1, \"o\", \"x\"]\n"))
        .isInstanceOf(CastFormatException.class)
        .hasMessage("Invalid cast header");
  }

  @Test
  @DisplayName("Should reject a single JSON document without an events array")
  void parse_DocumentWithoutEvents_Throws() {
    assertThatThrownBy(() -> parse("{\"version\": 2, \"events\": {}}"))
        .isInstanceOf(CastFormatException.class)
        .hasMessage("Expected events in cast payload");
  }

  @Test
  @DisplayName("Should reject input that is neither JSON nor line-delimited")
  void parse_SingleGarbageLine_Throws() {
    assertThatThrownBy(() -> parse("hello"))
        .isInstanceOf(CastFormatException.class)
        .hasMessage("Expected JSON cast or line-based cast format");
  }

  @Test
  @DisplayName("Should name the line holding invalid JSON")
  void parse_InvalidJsonLine_ThrowsWithLineNumber() {
    assertThatThrownBy(() -> parse("{\"version\": 2}\n[0.1, \"o\", \"x\"]\n[0.2, \"o\",\n"))
        .isInstanceOf(CastFormatException.class)
        .hasMessageStartingWith("Invalid JSON on line 3");
  }
}
