package com.tonelparser.ast;

/**
 * Base interface for all Smalltalk AST nodes.
 */
public sealed interface Node permits
    Sequence,
    TemporaryVariables,
    Statement {

    String type();
}
