package com.tonelparser.ast;

import java.util.List;

/**
 * Block closure. {@code body} is null for an empty block such as {@code []}
 * or {@code [ :x | ]}.
 */
public record Block(List<String> parameters, Sequence body) implements Expression {
    public Block {
        parameters = List.copyOf(parameters);
    }

    @Override
    public String type() {
        return "Block";
    }
}
