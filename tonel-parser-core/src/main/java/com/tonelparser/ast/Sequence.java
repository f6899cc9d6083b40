package com.tonelparser.ast;

import java.util.List;

/**
 * A method or block body: an optional temporaries declaration followed by
 * statements. A {@link Return}, when present, is the last statement.
 */
public record Sequence(
    TemporaryVariables temporaries,
    List<Statement> statements
) implements Node {
    public Sequence {
        statements = List.copyOf(statements);
    }

    @Override
    public String type() {
        return "Sequence";
    }
}
