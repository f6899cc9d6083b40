package com.tonelparser.ast;

import java.util.List;

public record TemporaryVariables(List<String> names) implements Node {
    public TemporaryVariables {
        names = List.copyOf(names);
    }

    @Override
    public String type() {
        return "TemporaryVariables";
    }
}
