package com.tonelparser.ast;

public sealed interface Expression extends Statement permits
    Assignment,
    Block,
    MessageSend,
    Cascade,
    Literal,
    Variable,
    LiteralArray,
    DynamicArray,
    ByteArray {
}
