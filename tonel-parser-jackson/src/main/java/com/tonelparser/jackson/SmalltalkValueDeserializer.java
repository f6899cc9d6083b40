package com.tonelparser.jackson;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonDeserializer;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Reads literal values written by {@link SmalltalkNumberSerializer}.
 * Integers come back as Long, or BigInteger when they do not fit a long;
 * floats as Double; arrays as unmodifiable lists of the same values.
 */
public class SmalltalkValueDeserializer extends JsonDeserializer<Object> {
    @Override
    public Object deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
        JsonToken token = p.currentToken();
        if (token == null) {
            return ctxt.handleUnexpectedToken(Object.class, p);
        }
        switch (token) {
            case VALUE_NUMBER_INT:
                if (p.getNumberType() == JsonParser.NumberType.BIG_INTEGER) {
                    return p.getBigIntegerValue();
                }
                return p.getLongValue();
            case VALUE_NUMBER_FLOAT:
                return p.getDoubleValue();
            case VALUE_STRING:
                return p.getText();
            case VALUE_TRUE:
                return Boolean.TRUE;
            case VALUE_FALSE:
                return Boolean.FALSE;
            case VALUE_NULL:
                return null;
            case START_ARRAY:
                return readArray(p, ctxt);
            default:
                return ctxt.handleUnexpectedToken(Object.class, p);
        }
    }

    // Nested literal and byte arrays
    private List<Object> readArray(JsonParser p, DeserializationContext ctxt) throws IOException {
        List<Object> elements = new ArrayList<>();
        while (p.nextToken() != JsonToken.END_ARRAY) {
            elements.add(deserialize(p, ctxt));
        }
        return Collections.unmodifiableList(elements);
    }
}
