package com.tonelparser.jackson.mixins;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.tonelparser.ast.*;

/**
 * Polymorphic type handling for AST nodes: each node is written with a
 * {@code "type"} property naming its kind, and read back by that name.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "type")
@JsonSubTypes({
    @JsonSubTypes.Type(value = Sequence.class, name = "Sequence"),
    @JsonSubTypes.Type(value = TemporaryVariables.class, name = "TemporaryVariables"),
    @JsonSubTypes.Type(value = Return.class, name = "Return"),
    @JsonSubTypes.Type(value = Assignment.class, name = "Assignment"),
    @JsonSubTypes.Type(value = Block.class, name = "Block"),
    @JsonSubTypes.Type(value = MessageSend.class, name = "MessageSend"),
    @JsonSubTypes.Type(value = Cascade.class, name = "Cascade"),
    @JsonSubTypes.Type(value = Literal.class, name = "Literal"),
    @JsonSubTypes.Type(value = Variable.class, name = "Variable"),
    @JsonSubTypes.Type(value = LiteralArray.class, name = "LiteralArray"),
    @JsonSubTypes.Type(value = DynamicArray.class, name = "DynamicArray"),
    @JsonSubTypes.Type(value = ByteArray.class, name = "ByteArray")
})
public abstract class NodeMixin {
}
