package com.tonelparser.json;

import com.tonelparser.ast.Node;
import com.tonelparser.ast.Sequence;

/**
 * Reads AST nodes back from the JSON written by an {@link AstJsonSerializer}.
 */
public interface AstJsonDeserializer {

    /**
     * Reads a method body tree.
     *
     * @param json JSON produced for a {@link Sequence}
     * @return the rebuilt sequence
     * @throws AstJsonException if the JSON is malformed or describes another node kind
     */
    Sequence deserializeSequence(String json) throws AstJsonException;

    /**
     * Reads a node of the given kind, e.g. {@code Expression.class} for a
     * single expression.
     *
     * @throws AstJsonException if deserialization fails
     */
    <T extends Node> T deserialize(String json, Class<T> type) throws AstJsonException;
}
