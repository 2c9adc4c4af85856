package com.consullo.castedit.recording;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.TextNode;
import org.apache.commons.lang3.Validate;

/**
 * One normalized recording event: absolute time in seconds, event kind and payload.
 *
 * <p>Kind and payload are kept as parsed JSON so that non-output events pass through export unmodified.</p>
 *
 * @param time absolute time in seconds
 * @param kind event kind ("o" for output)
 * @param data event payload
 * @since 1.0
 */
public record CastEvent(double time, JsonNode kind, JsonNode data) {

  public static final String OUTPUT_KIND = "o";

  public CastEvent {
    Validate.isTrue(Double.isFinite(time), "time must be finite");
    Validate.notNull(kind, "kind must not be null");
    Validate.notNull(data, "data must not be null");
  }

  public static CastEvent output(double time, String text) {
    return new CastEvent(time, TextNode.valueOf(OUTPUT_KIND), TextNode.valueOf(text));
  }

  public boolean isOutput() {
    return kind.isTextual() && OUTPUT_KIND.equals(kind.asText());
  }

  /**
   * Returns the payload as text. Non-textual payloads are rendered as their JSON form.
   *
   * @return payload text
   */
  public String dataText() {
    return data.isTextual() ? data.asText() : data.toString();
  }

  public CastEvent withTime(double newTime) {
    return new CastEvent(newTime, kind, data);
  }
}
