package com.tonelparser.jackson;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.Version;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import com.fasterxml.jackson.databind.module.SimpleModule;
import com.tonelparser.ast.*;
import com.tonelparser.jackson.mixins.NodeMixin;

import java.util.List;

/**
 * Jackson module that configures serialization/deserialization for the AST records.
 *
 * This module handles:
 * - Polymorphic type handling via NodeMixin
 * - Null values for AST fields that are legitimately null
 * - Literal values written and read so that integers and floats stay apart
 */
public class AstModule extends SimpleModule {

    public AstModule() {
        super("AstModule", new Version(1, 0, 0, null, "com.tonelparser", "tonel-parser-jackson"));
    }

    @Override
    public void setupModule(SetupContext context) {
        super.setupModule(context);

        // Register polymorphic type handling
        context.setMixInAnnotations(Node.class, NodeMixin.class);
        context.setMixInAnnotations(Statement.class, NodeMixin.class);
        context.setMixInAnnotations(Expression.class, NodeMixin.class);
        // Sequence and TemporaryVariables are read directly as well as through Node
        context.setMixInAnnotations(TemporaryVariables.class, NodeMixin.class);

        context.setMixInAnnotations(Sequence.class, SequenceMixin.class);
        context.setMixInAnnotations(Block.class, BlockMixin.class);
        context.setMixInAnnotations(Literal.class, LiteralMixin.class);
        context.setMixInAnnotations(LiteralArray.class, LiteralArrayMixin.class);
    }

    // ==================== Serialization Mixins ====================

    // temporaries is null when the body declares none
    private abstract static class SequenceMixin extends NodeMixin {
        @JsonInclude(JsonInclude.Include.ALWAYS)
        abstract TemporaryVariables temporaries();
    }

    // body is null for an empty block
    private abstract static class BlockMixin extends NodeMixin {
        @JsonInclude(JsonInclude.Include.ALWAYS)
        abstract Sequence body();
    }

    // value is null for nil
    private abstract static class LiteralMixin extends NodeMixin {
        @JsonSerialize(using = SmalltalkNumberSerializer.class)
        @JsonDeserialize(using = SmalltalkValueDeserializer.class)
        @JsonInclude(JsonInclude.Include.ALWAYS)
        abstract Object value();
    }

    private abstract static class LiteralArrayMixin extends NodeMixin {
        @JsonSerialize(contentUsing = SmalltalkNumberSerializer.class)
        @JsonDeserialize(contentUsing = SmalltalkValueDeserializer.class)
        abstract List<Object> elements();
    }
}
