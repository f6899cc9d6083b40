package com.tonelparser.json;

import com.tonelparser.Parser;
import com.tonelparser.ast.Node;

/**
 * Writes AST nodes as JSON. Every node object carries its kind in a
 * {@code "type"} property.
 */
public interface AstJsonSerializer {

    /**
     * @throws AstJsonException if serialization fails
     */
    String serialize(Node node) throws AstJsonException;

    /**
     * Same as {@link #serialize(Node)}, indented for reading.
     *
     * @throws AstJsonException if serialization fails
     */
    String serializePretty(Node node) throws AstJsonException;

    /**
     * Parses a method body and writes its tree.
     *
     * @throws com.tonelparser.ParseException if the body does not parse
     * @throws AstJsonException if serialization fails
     */
    default String serializeSource(String methodBody) throws AstJsonException {
        return serialize(Parser.parse(methodBody));
    }
}
