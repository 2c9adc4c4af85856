package com.consullo.castedit.export;

import com.consullo.castedit.recording.CastEvent;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.io.IOException;
import java.io.Writer;
import java.util.Iterator;
import java.util.Map;
import org.apache.commons.lang3.Validate;

/**
 * Serializes export documents.
 *
 * <p>Two layouts mirror what the parser reads: one JSON object with an {@code events} array, or
 * line-delimited output with the header on the first line and one event per line.</p>
 *
 * @since 1.0
 */
public final class CastWriter {

  private final ObjectMapper mapper;

  public CastWriter() {
    this(new ObjectMapper());
  }

  public CastWriter(ObjectMapper mapper) {
    Validate.notNull(mapper, "mapper must not be null");
    this.mapper = mapper;
  }

  /**
   * Renders the document as a single JSON object.
   *
   * @param document export document
   * @return JSON text
   * @throws JsonProcessingException if serialization fails
   */
  public String toJson(ObjectNode document) throws JsonProcessingException {
    return mapper.writeValueAsString(document);
  }

  /**
   * Writes the document in line-delimited layout.
   *
   * @param document export document holding an {@code events} array
   * @param out destination, not closed
   * @throws IOException if writing fails
   */
  public void writeLines(ObjectNode document, Writer out) throws IOException {
    Validate.notNull(document, "document must not be null");
    Validate.notNull(out, "out must not be null");
    ObjectNode header = mapper.createObjectNode();
    Iterator<Map.Entry<String, JsonNode>> fields = document.fields();
    while (fields.hasNext()) {
      Map.Entry<String, JsonNode> field = fields.next();
      if (!"events".equals(field.getKey())) {
        header.set(field.getKey(), field.getValue());
      }
    }
    out.write(mapper.writeValueAsString(header));
    out.write('\n');
    JsonNode events = document.path("events");
    for (JsonNode event : events) {
      out.write(mapper.writeValueAsString(event));
      out.write('\n');
    }
    out.flush();
  }

  static ArrayNode toArray(ObjectMapper mapper, CastEvent event) {
    ArrayNode node = mapper.createArrayNode();
    node.add(event.time());
    node.add(event.kind());
    node.add(event.data());
    return node;
  }
}
