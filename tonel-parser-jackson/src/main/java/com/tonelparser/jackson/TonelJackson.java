package com.tonelparser.jackson;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.module.paramnames.ParameterNamesModule;

/**
 * Factory for ObjectMapper instances configured for the Smalltalk AST.
 *
 * Usage:
 * <pre>
 * ObjectMapper mapper = TonelJackson.createObjectMapper();
 * String json = mapper.writeValueAsString(Parser.parse("^ 3 + 4"));
 * Sequence body = mapper.readValue(json, Sequence.class);
 * </pre>
 */
public final class TonelJackson {

    private TonelJackson() {
        // Utility class
    }

    /**
     * The returned mapper:
     * - Writes every node with a "type" property and reads nodes back by it
     * - Writes the nullable fields (Block body, Sequence temporaries, Literal value) even when null
     * - Reads literal integers back as Long, or BigInteger when they do not fit a long
     *
     * @return A new configured ObjectMapper instance
     */
    public static ObjectMapper createObjectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new ParameterNamesModule());

        // Null fields are left out unless a mixin in AstModule asks for them
        mapper.setSerializationInclusion(JsonInclude.Include.NON_NULL);

        mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

        mapper.registerModule(new AstModule());

        return mapper;
    }
}
