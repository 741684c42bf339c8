package ca.gc.cra.sift.infrastructure.load;

import ca.gc.cra.sift.domain.record.RawRecord;
import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonParseException;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import java.io.IOException;
import java.io.InputStream;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Streams a JSON document into records.
 * <p>A top-level array yields one record per element, a top-level object yields one {@code "key: value"}
 * record per entry, and any other value yields a single record. Strings keep their text, numbers and
 * literals keep their JSON spelling, and nested containers are rendered as compact JSON.</p>
 *
 * @since 0.1.0
 */
public final class JsonRecordReader {
  private final JsonFactory factory = new JsonFactory();

  /**
   * Reads the JSON document at {@code source}.
   *
   * @param source JSON file
   * @return records in document order
   * @throws IOException if the file cannot be read or is not a single well-formed JSON document
   */
  public List<RawRecord> read(Path source) throws IOException {
    Objects.requireNonNull(source, "source");
    try (InputStream in = Files.newInputStream(source);
         JsonParser parser = factory.createParser(in)) {
      JsonToken token = parser.nextToken();
      if (token == null) {
        throw new JsonParseException(parser, "empty JSON document");
      }
      List<RawRecord> records = new ArrayList<>();
      if (token == JsonToken.START_ARRAY) {
        JsonToken element;
        while ((element = parser.nextToken()) != JsonToken.END_ARRAY) {
          records.add(new RawRecord(render(parser, element)));
        }
      } else if (token == JsonToken.START_OBJECT) {
        JsonToken field;
        while ((field = parser.nextToken()) != JsonToken.END_OBJECT) {
          if (field != JsonToken.FIELD_NAME) {
            throw new JsonParseException(parser, "expected field name but found " + field);
          }
          String name = parser.currentName();
          JsonToken value = parser.nextToken();
          records.add(new RawRecord(name + ": " + render(parser, value)));
        }
      } else {
        records.add(new RawRecord(render(parser, token)));
      }
      if (parser.nextToken() != null) {
        throw new JsonParseException(parser, "JSON document contains trailing content");
      }
      return List.copyOf(records);
    }
  }

  private String render(JsonParser parser, JsonToken token) throws IOException {
    if (token == null) {
      throw new JsonParseException(parser, "unexpected end of JSON document");
    }
    return switch (token) {
      case START_OBJECT, START_ARRAY -> compact(parser);
      case VALUE_STRING, VALUE_NUMBER_INT, VALUE_NUMBER_FLOAT, VALUE_TRUE, VALUE_FALSE, VALUE_NULL ->
          parser.getText();
      default -> throw new JsonParseException(parser, "unsupported JSON token: " + token);
    };
  }

  private String compact(JsonParser parser) throws IOException {
    StringWriter out = new StringWriter();
    try (JsonGenerator generator = factory.createGenerator(out)) {
      generator.copyCurrentStructure(parser);
    }
    return out.toString();
  }
}
