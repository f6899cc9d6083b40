package com.tonelparser.ast;

import java.util.List;

public record DynamicArray(List<Expression> expressions) implements Expression {
    public DynamicArray {
        expressions = List.copyOf(expressions);
    }

    @Override
    public String type() {
        return "DynamicArray";
    }
}
