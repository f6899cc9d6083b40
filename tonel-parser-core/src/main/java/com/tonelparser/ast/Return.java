package com.tonelparser.ast;

public record Return(Expression expression) implements Statement {
    @Override
    public String type() {
        return "Return";
    }
}
