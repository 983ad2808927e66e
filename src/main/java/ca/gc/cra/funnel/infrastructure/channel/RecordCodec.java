package ca.gc.cra.funnel.infrastructure.channel;

import ca.gc.cra.funnel.domain.CapturedRecord;
import ca.gc.cra.funnel.domain.ChannelEndpoint;
import ca.gc.cra.funnel.domain.HandlerSnapshot;
import ca.gc.cra.funnel.domain.TaggedRecord;
import ch.qos.logback.classic.Level;
import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import java.io.IOException;
import java.io.StringWriter;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * JSON codec for everything that crosses a process boundary: tagged records on a bridge connection, the
 * connection handshake, and interception snapshots handed to worker processes.
 *
 * <p>Records are encoded as one JSON object per line:
 * {@code {"pid":..,"logger":..,"level":..,"message":..,"thread":..,"timestamp":..,"throwable":..,
 * "attributes":{..},"handled":..}}. Unknown fields are skipped so older workers stay readable.</p>
 *
 * <p>Thread-safe: the underlying {@link JsonFactory} is shared and every call allocates its own
 * generator or parser.</p>
 *
 * @since FUNNEL 0.1
 */
public final class RecordCodec {
  private final JsonFactory factory = new JsonFactory();

  /**
   * Encodes a record as a single JSON line without the trailing newline.
   *
   * @param tagged record to encode
   * @return JSON text
   */
  public String encode(TaggedRecord tagged) {
    Objects.requireNonNull(tagged, "tagged");
    CapturedRecord record = tagged.record();
    StringWriter out = new StringWriter(256);
    try (JsonGenerator gen = factory.createGenerator(out)) {
      gen.writeStartObject();
      gen.writeNumberField("pid", tagged.originPid());
      gen.writeStringField("logger", record.loggerName());
      gen.writeStringField("level", record.level().toString());
      gen.writeStringField("message", record.message());
      gen.writeStringField("thread", record.threadName());
      gen.writeNumberField("timestamp", record.timestamp());
      if (record.throwableText() != null) {
        gen.writeStringField("throwable", record.throwableText());
      }
      if (!record.attributes().isEmpty()) {
        gen.writeObjectFieldStart("attributes");
        for (Map.Entry<String, String> entry : record.attributes().entrySet()) {
          gen.writeStringField(entry.getKey(), entry.getValue());
        }
        gen.writeEndObject();
      }
      gen.writeBooleanField("handled", record.handled());
      gen.writeEndObject();
    } catch (IOException ex) {
      throw new IllegalStateException("Failed to encode record", ex);
    }
    return out.toString();
  }

  /**
   * Decodes a JSON line produced by {@link #encode(TaggedRecord)}.
   *
   * @param line JSON text
   * @return decoded record
   * @throws IllegalArgumentException when the line is not a valid record
   */
  public TaggedRecord decode(String line) {
    Objects.requireNonNull(line, "line");
    long pid = -1;
    String logger = null;
    String level = null;
    String message = "";
    String thread = "";
    long timestamp = 0L;
    String throwable = null;
    Map<String, String> attributes = Map.of();
    boolean handled = false;
    try (JsonParser parser = factory.createParser(line)) {
      expect(parser.nextToken(), JsonToken.START_OBJECT);
      while (parser.nextToken() == JsonToken.FIELD_NAME) {
        String field = parser.getCurrentName();
        JsonToken value = parser.nextToken();
        switch (field) {
          case "pid" -> pid = parser.getLongValue();
          case "logger" -> logger = parser.getText();
          case "level" -> level = parser.getText();
          case "message" -> message = parser.getText();
          case "thread" -> thread = parser.getText();
          case "timestamp" -> timestamp = parser.getLongValue();
          case "throwable" -> throwable = value == JsonToken.VALUE_NULL ? null : parser.getText();
          case "attributes" -> attributes = readStringMap(parser, value);
          case "handled" -> handled = parser.getBooleanValue();
          default -> parser.skipChildren();
        }
      }
    } catch (IOException ex) {
      throw new IllegalArgumentException("Invalid record line", ex);
    }
    if (pid <= 0 || logger == null || level == null) {
      throw new IllegalArgumentException("Record line is missing pid, logger or level");
    }
    CapturedRecord record = new CapturedRecord(
        logger, parseLevel(level), message, thread, timestamp, throwable, attributes, handled);
    return new TaggedRecord(pid, record);
  }

  /**
   * Encodes the first line of a bridge connection.
   *
   * @param token session token
   * @return JSON text
   */
  public String encodeHandshake(String token) {
    StringWriter out = new StringWriter(64);
    try (JsonGenerator gen = factory.createGenerator(out)) {
      gen.writeStartObject();
      gen.writeStringField("token", Objects.requireNonNull(token, "token"));
      gen.writeEndObject();
    } catch (IOException ex) {
      throw new IllegalStateException("Failed to encode handshake", ex);
    }
    return out.toString();
  }

  /**
   * Extracts the token from a handshake line.
   *
   * @param line JSON text
   * @return presented token
   * @throws IllegalArgumentException when the line is not a handshake
   */
  public String decodeHandshake(String line) {
    Objects.requireNonNull(line, "line");
    try (JsonParser parser = factory.createParser(line)) {
      expect(parser.nextToken(), JsonToken.START_OBJECT);
      String token = null;
      while (parser.nextToken() == JsonToken.FIELD_NAME) {
        String field = parser.getCurrentName();
        parser.nextToken();
        if ("token".equals(field)) {
          token = parser.getText();
        } else {
          parser.skipChildren();
        }
      }
      if (token == null) {
        throw new IllegalArgumentException("Handshake carries no token");
      }
      return token;
    } catch (IOException ex) {
      throw new IllegalArgumentException("Invalid handshake line", ex);
    }
  }

  /**
   * Encodes interception snapshots as a JSON array.
   *
   * @param snapshots snapshots in installation order
   * @return JSON text
   */
  public String encodeSnapshots(List<HandlerSnapshot> snapshots) {
    Objects.requireNonNull(snapshots, "snapshots");
    StringWriter out = new StringWriter(128);
    try (JsonGenerator gen = factory.createGenerator(out)) {
      gen.writeStartArray();
      for (HandlerSnapshot snapshot : snapshots) {
        gen.writeStartObject();
        gen.writeStringField("level", snapshot.level().toString());
        gen.writeStringField("host", snapshot.endpoint().host());
        gen.writeNumberField("port", snapshot.endpoint().port());
        gen.writeStringField("token", snapshot.endpoint().token());
        gen.writeEndObject();
      }
      gen.writeEndArray();
    } catch (IOException ex) {
      throw new IllegalStateException("Failed to encode snapshots", ex);
    }
    return out.toString();
  }

  /**
   * Decodes snapshots produced by {@link #encodeSnapshots(List)}.
   *
   * @param json JSON text; blank input yields an empty list
   * @return snapshots in their original order
   * @throws IllegalArgumentException when the text is malformed
   */
  public List<HandlerSnapshot> decodeSnapshots(String json) {
    if (json == null || json.isBlank()) {
      return List.of();
    }
    List<HandlerSnapshot> snapshots = new ArrayList<>();
    try (JsonParser parser = factory.createParser(json)) {
      expect(parser.nextToken(), JsonToken.START_ARRAY);
      while (parser.nextToken() == JsonToken.START_OBJECT) {
        String level = null;
        String host = null;
        int port = 0;
        String token = null;
        while (parser.nextToken() == JsonToken.FIELD_NAME) {
          String field = parser.getCurrentName();
          parser.nextToken();
          switch (field) {
            case "level" -> level = parser.getText();
            case "host" -> host = parser.getText();
            case "port" -> port = parser.getIntValue();
            case "token" -> token = parser.getText();
            default -> parser.skipChildren();
          }
        }
        if (level == null || host == null || token == null) {
          throw new IllegalArgumentException("Snapshot is missing level, host or token");
        }
        snapshots.add(new HandlerSnapshot(
            parseLevel(level), new ChannelEndpoint(host, port, token)));
      }
    } catch (IOException ex) {
      throw new IllegalArgumentException("Invalid snapshot list", ex);
    }
    return List.copyOf(snapshots);
  }

  private static Map<String, String> readStringMap(JsonParser parser, JsonToken start) throws IOException {
    if (start == JsonToken.VALUE_NULL) {
      return Map.of();
    }
    expect(start, JsonToken.START_OBJECT);
    Map<String, String> map = new LinkedHashMap<>();
    while (parser.nextToken() == JsonToken.FIELD_NAME) {
      String key = parser.getCurrentName();
      JsonToken value = parser.nextToken();
      if (value == JsonToken.VALUE_NULL) {
        continue;
      }
      if (value.isStructStart()) {
        parser.skipChildren();
        continue;
      }
      map.put(key, parser.getText());
    }
    return map;
  }

  private static Level parseLevel(String name) {
    Level level = Level.toLevel(name, null);
    if (level == null) {
      throw new IllegalArgumentException("Unknown level: " + name);
    }
    return level;
  }

  private static void expect(JsonToken actual, JsonToken expected) {
    if (actual != expected) {
      throw new IllegalArgumentException("Expected " + expected + " but found " + actual);
    }
  }
}
