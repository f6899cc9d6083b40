package com.tonelparser.ast;

public record Assignment(String name, Expression value) implements Expression {
    @Override
    public String type() {
        return "Assignment";
    }
}
