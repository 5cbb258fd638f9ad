package dev.semanticcut.ingest;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import java.io.IOException;

/** Reads a timestamp given either as seconds or as an {@code HH:MM:SS,mmm} string. */
class TimestampDeserializer extends StdDeserializer<Double> {

  TimestampDeserializer() {
    super(Double.class);
  }

  @Override
  public Double deserialize(JsonParser parser, DeserializationContext ctxt) throws IOException {
    JsonToken token = parser.currentToken();
    if (token == JsonToken.VALUE_NUMBER_INT || token == JsonToken.VALUE_NUMBER_FLOAT) {
      return parser.getDoubleValue();
    }
    if (token == JsonToken.VALUE_STRING) {
      return Timestamps.toSeconds(parser.getText());
    }
    return (Double) ctxt.handleUnexpectedToken(Double.class, parser);
  }

  @Override
  public Double getNullValue(DeserializationContext ctxt) {
    return 0.0;
  }
}
