package com.tonelparser.ast;

import java.util.List;

public record MessageSend(
    Expression receiver,
    String selector,
    List<Expression> arguments
) implements Expression {
    public MessageSend {
        arguments = List.copyOf(arguments);
    }

    public MessageSend(Expression receiver, String selector) {
        this(receiver, selector, List.of());
    }

    @Override
    public String type() {
        return "MessageSend";
    }
}
