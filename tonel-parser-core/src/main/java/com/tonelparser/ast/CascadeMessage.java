package com.tonelparser.ast;

import java.util.List;

public record CascadeMessage(String selector, List<Expression> arguments) {
    public CascadeMessage {
        arguments = List.copyOf(arguments);
    }
}
