package com.bmsedge.hvi.util;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonDeserializer;

import java.io.IOException;

/**
 * Reads an instrument value that collaborators may send either as a JSON number
 * or as text such as "4,20". The text is kept untouched; empty objects, arrays,
 * booleans and blank strings become an absent reading.
 */
public class DecimalReadingDeserializer extends JsonDeserializer<String> {

    @Override
    public String deserialize(JsonParser parser, DeserializationContext context)
            throws IOException {

        JsonToken token = parser.getCurrentToken();

        if (token == JsonToken.VALUE_NULL) {
            return null;
        }

        // {} and [] show up from some spreadsheet exports
        if (token == JsonToken.START_OBJECT || token == JsonToken.START_ARRAY) {
            parser.skipChildren();
            return null;
        }

        if (token == JsonToken.VALUE_STRING) {
            String value = parser.getText();
            if (value == null || value.trim().isEmpty()) {
                return null;
            }
            return value.trim();
        }

        if (token == JsonToken.VALUE_NUMBER_INT || token == JsonToken.VALUE_NUMBER_FLOAT) {
            return parser.getDecimalValue().toPlainString();
        }

        return null;
    }

    @Override
    public String getNullValue(DeserializationContext context) {
        return null;
    }
}
