package ca.gc.cra.guardian.infrastructure.persistence;

import ca.gc.cra.guardian.domain.pipeline.ActivityRecord;
import ca.gc.cra.guardian.domain.safety.IncidentAction;
import ca.gc.cra.guardian.domain.safety.SafetyCategory;
import ca.gc.cra.guardian.domain.safety.SafetyIncident;
import ca.gc.cra.guardian.domain.safety.SeverityLevel;
import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import java.io.IOException;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.HashMap;
import java.util.Map;

/**
 * Single-line JSON encoding of incidents and activity records using the Jackson streaming API.
 *
 * <p>Field names are snake_case; timestamps are ISO-8601 instants, categories and actions use their keys and
 * severities their numeric level.</p>
 *
 * @since 1.0.0
 */
final class RecordJsonCodec {
  private final JsonFactory factory = new JsonFactory();

  String encode(SafetyIncident incident) {
    StringWriter out = new StringWriter(256);
    try (JsonGenerator json = factory.createGenerator(out)) {
      json.writeStartObject();
      json.writeStringField("id", incident.id());
      json.writeStringField("timestamp", incident.timestamp().toString());
      json.writeStringField("child_id", incident.childId());
      json.writeNumberField("child_age", incident.childAge());
      json.writeStringField("session_id", incident.sessionId());
      json.writeStringField("input_excerpt", incident.inputExcerpt());
      json.writeStringField("category", incident.category().key());
      json.writeNumberField("severity", incident.severity().level());
      json.writeStringField("action", incident.action().key());
      json.writeBooleanField("parent_notified", incident.parentNotified());
      json.writeEndObject();
    } catch (IOException ex) {
      throw new UncheckedIOException("Failed to encode incident " + incident.id(), ex);
    }
    return out.toString();
  }

  String encode(ActivityRecord record) {
    StringWriter out = new StringWriter(256);
    try (JsonGenerator json = factory.createGenerator(out)) {
      json.writeStartObject();
      json.writeStringField("timestamp", record.timestamp().toString());
      json.writeStringField("session_id", record.sessionId());
      json.writeStringField("child_id", record.childId());
      json.writeStringField("age_band", record.ageBand());
      json.writeStringField("input_excerpt", record.inputExcerpt());
      json.writeNumberField("response_words", record.responseWords());
      json.writeBooleanField("off_topic", record.offTopic());
      json.writeArrayFieldStart("alerts");
      for (String alert : record.alerts()) {
        json.writeString(alert);
      }
      json.writeEndArray();
      json.writeEndObject();
    } catch (IOException ex) {
      throw new UncheckedIOException("Failed to encode activity record for session " + record.sessionId(), ex);
    }
    return out.toString();
  }

  /**
   * Decodes one incident line.
   *
   * @param line JSON object on a single line
   * @return decoded incident
   * @throws IllegalArgumentException when the line is not a valid incident
   */
  SafetyIncident decodeIncident(String line) {
    Map<String, Object> fields = readFlatObject(line);
    try {
      String categoryKey = requireString(fields, "category");
      return new SafetyIncident(
          requireString(fields, "id"),
          Instant.parse(requireString(fields, "timestamp")),
          requireString(fields, "child_id"),
          requireNumber(fields, "child_age").intValue(),
          requireString(fields, "session_id"),
          (String) fields.getOrDefault("input_excerpt", ""),
          SafetyCategory.fromKey(categoryKey)
              .orElseThrow(() -> new IllegalArgumentException("unknown category '" + categoryKey + "'")),
          SeverityLevel.of(requireNumber(fields, "severity").intValue()),
          IncidentAction.fromKey(requireString(fields, "action")),
          Boolean.TRUE.equals(fields.get("parent_notified")));
    } catch (DateTimeParseException | ClassCastException ex) {
      throw new IllegalArgumentException("malformed incident: " + ex.getMessage(), ex);
    }
  }

  private Map<String, Object> readFlatObject(String line) {
    Map<String, Object> fields = new HashMap<>();
    try (JsonParser parser = factory.createParser(line)) {
      if (parser.nextToken() != JsonToken.START_OBJECT) {
        throw new IllegalArgumentException("expected a JSON object");
      }
      JsonToken token;
      while ((token = parser.nextToken()) != JsonToken.END_OBJECT) {
        if (token != JsonToken.FIELD_NAME) {
          throw new IllegalArgumentException("expected field name but found " + token);
        }
        String name = parser.getCurrentName();
        JsonToken value = parser.nextToken();
        switch (value) {
          case VALUE_STRING -> fields.put(name, parser.getText());
          case VALUE_NUMBER_INT, VALUE_NUMBER_FLOAT -> fields.put(name, parser.getNumberValue());
          case VALUE_TRUE -> fields.put(name, Boolean.TRUE);
          case VALUE_FALSE -> fields.put(name, Boolean.FALSE);
          case VALUE_NULL -> fields.remove(name);
          default -> parser.skipChildren();
        }
      }
    } catch (IOException ex) {
      throw new IllegalArgumentException("invalid JSON: " + ex.getMessage(), ex);
    }
    return fields;
  }

  private static String requireString(Map<String, Object> fields, String name) {
    if (fields.get(name) instanceof String value) {
      return value;
    }
    throw new IllegalArgumentException("missing string field '" + name + "'");
  }

  private static Number requireNumber(Map<String, Object> fields, String name) {
    if (fields.get(name) instanceof Number value) {
      return value;
    }
    throw new IllegalArgumentException("missing numeric field '" + name + "'");
  }
}
