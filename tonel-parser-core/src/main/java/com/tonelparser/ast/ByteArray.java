package com.tonelparser.ast;

import java.util.List;

public record ByteArray(List<Integer> values) implements Expression {
    public ByteArray {
        values = List.copyOf(values);
    }

    @Override
    public String type() {
        return "ByteArray";
    }
}
