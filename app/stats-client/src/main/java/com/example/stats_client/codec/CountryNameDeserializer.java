package com.example.stats_client.codec;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import java.io.IOException;

/**
 * country は {"code": "JP", "name": "Japan"} 形式でも名前文字列単体でも届く。
 * どちらも国名文字列へ正規化する。
 */
public class CountryNameDeserializer extends StdDeserializer<String> {

  public CountryNameDeserializer() {
    super(String.class);
  }

  @Override
  public String deserialize(JsonParser parser, DeserializationContext context) throws IOException {
    final JsonNode node = context.readTree(parser);
    if (node.isTextual()) {
      return node.textValue();
    }
    if (node.isObject() && node.hasNonNull("name")) {
      return node.get("name").asText();
    }
    return context.reportInputMismatch(
        this, "country must be a name or an object containing `name`");
  }
}
