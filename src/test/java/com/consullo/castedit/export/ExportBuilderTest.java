package com.consullo.castedit.export;

import com.consullo.castedit.recording.CastEvent;
import com.consullo.castedit.recording.CastParser;
import com.consullo.castedit.recording.Recording;
import com.consullo.castedit.recording.SourceRegistry;
import com.consullo.castedit.timeline.Segment;
import com.consullo.castedit.timeline.Timeline;
import com.consullo.castedit.timeline.TimelineEditor;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.io.StringWriter;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for timeline flattening and cast export.
 *
 * @since 1.0
 */
public class ExportBuilderTest {

  private static final String DEMO = "{\"version\": 3, \"term\": {\"cols\": 30, \"rows\": 5}, \"title\": \"demo\"}\n"
      + "[0.5, \"o\", \"a\"]\n[0.5, \"o\", \"b\"]\n[1.0, \"o\", \"c\"]\n"
      + "[0.5, \"i\", \"k\"]\n[0.5, \"o\", \"d\"]\n[1.0, \"o\", \"e\"]\n";

  private final ExportBuilder builder = new ExportBuilder();
  private SourceRegistry sources;
  private Timeline timeline;

  @BeforeEach
  void setUp() throws Exception {
    sources = new SourceRegistry();
    sources.register(new CastParser().parse("src", "demo.cast", DEMO));
    timeline = Timeline.of(List.of(
        new Segment("s1", "head", "src", 0, 1, 1),
        new Segment("s2", "slow", "src", 1, 3, 4)), 0);
  }

  private static List<Double> times(List<CastEvent> events) {
    return events.stream().map(CastEvent::time).toList();
  }

  @Test
  @DisplayName("Should re-time every event kind by its segment's speed and keep boundary events on both sides")
  void flatten_HalfSpeedSegment_MappedTimes() {
    List<CastEvent> events = builder.flatten(timeline, sources);

    assertThat(times(events)).containsExactly(0.5, 1.0, 1.0, 3.0, 4.0, 5.0);
    assertThat(events).extracting(CastEvent::dataText).containsExactly("a", "b", "b", "c", "k", "d");
    assertThat(events.get(4).isOutput()).isFalse();
  }

  @Test
  @DisplayName("Should produce non-decreasing times for reordered segments")
  void flatten_ReorderedSegments_NonDecreasing() {
    Timeline reversed = Timeline.of(List.of(timeline.get(1), timeline.get(0)), 0);

    List<Double> times = times(builder.flatten(reversed, sources));

    assertThat(times).isSorted();
    assertThat(times.get(times.size() - 1)).isEqualTo(5.0);
  }

  @Test
  @DisplayName("Should round mapped times to six decimals")
  void flatten_ThirdSpeed_Rounded() {
    Timeline third = Timeline.of(List.of(new Segment("s", "x", "src", 0, 3, 1)), 0);

    List<Double> times = times(builder.flatten(third, sources));

    assertThat(times).contains(0.166667, 0.333333);
  }

  @Test
  @DisplayName("Should reproduce the original output events when nothing was edited")
  void build_UneditedTimeline_SameOutputEvents() throws Exception {
    Recording original = sources.require("src");
    Timeline unedited = new TimelineEditor().create(original).requireTimeline();

    String json = new CastWriter().toJson(builder.build(unedited, sources));
    Recording reparsed = new CastParser().parse("out", "out.cast", json);

    assertThat(reparsed.outputEvents()).isEqualTo(original.outputEvents());
  }

  @Test
  @DisplayName("Should write a version 2 document that parses back to the flattened stream")
  void build_RoundTrip_ParsesBack() throws Exception {
    ObjectNode doc = builder.build(timeline, sources);
    String json = new CastWriter().toJson(doc);
    StringWriter lines = new StringWriter();
    new CastWriter().writeLines(doc, lines);

    Recording fromJson = new CastParser().parse("out", "out.cast", json);
    Recording fromLines = new CastParser().parse("out", "out.cast", lines.toString());

    assertThat(doc.path("version").asInt()).isEqualTo(2);
    assertThat(doc.path("title").asText()).isEqualTo("demo");
    assertThat(fromJson.cols()).isEqualTo(30);
    assertThat(fromJson.events()).hasSize(6);
    assertThat(fromJson.duration()).isEqualTo(5.0);
    assertThat(fromLines.events()).extracting(CastEvent::time)
        .containsExactly(0.5, 1.0, 1.0, 3.0, 4.0, 5.0);
  }
}
