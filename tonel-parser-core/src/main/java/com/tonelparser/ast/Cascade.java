package com.tonelparser.ast;

import java.util.List;

/**
 * Several messages sent to one receiver, {@code stream nextPut: $a; cr}.
 * The first entry of {@code messages} is the message of the leading send.
 */
public record Cascade(Expression receiver, List<CascadeMessage> messages) implements Expression {
    public Cascade {
        messages = List.copyOf(messages);
    }

    @Override
    public String type() {
        return "Cascade";
    }
}
