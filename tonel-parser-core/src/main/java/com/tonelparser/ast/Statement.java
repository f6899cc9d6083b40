package com.tonelparser.ast;

public sealed interface Statement extends Node permits Return, Expression {
}
