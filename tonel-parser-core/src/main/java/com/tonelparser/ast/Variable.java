package com.tonelparser.ast;

public record Variable(String name) implements Expression {
    @Override
    public String type() {
        return "Variable";
    }
}
