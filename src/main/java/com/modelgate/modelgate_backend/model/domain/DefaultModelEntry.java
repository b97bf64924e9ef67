package com.modelgate.modelgate_backend.model.domain;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;

import java.io.IOException;

/**
 * A default model is declared either as a bare identifier or as an object with a
 * {@code name} field (extra fields such as a description are ignored).
 */
@JsonDeserialize(using = DefaultModelEntry.Deserializer.class)
public record DefaultModelEntry(String name) {

    public static class Deserializer extends StdDeserializer<DefaultModelEntry> {

        public Deserializer() {
            super(DefaultModelEntry.class);
        }

        @Override
        public DefaultModelEntry deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
            JsonNode node = p.readValueAsTree();
            if (node.isTextual()) {
                return new DefaultModelEntry(node.asText());
            }
            if (node.isObject() && node.hasNonNull("name")) {
                return new DefaultModelEntry(node.get("name").asText());
            }
            return new DefaultModelEntry(null);
        }
    }
}
