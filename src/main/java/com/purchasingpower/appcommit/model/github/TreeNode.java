package com.purchasingpower.appcommit.model.github;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;

import java.io.IOException;
import java.util.Objects;

/**
 * One entry of a create-a-tree request. Serialized with exactly one of {@code content} or {@code sha}.
 */
@JsonSerialize(using = TreeNode.Serializer.class)
public record TreeNode(String path, GitHubFileMode mode, GitHubNodeType type, TreeNodeSource source) {

    public TreeNode {
        Objects.requireNonNull(path, "path");
        Objects.requireNonNull(mode, "mode");
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(source, "source");
    }

    static class Serializer extends StdSerializer<TreeNode> {

        Serializer() {
            super(TreeNode.class);
        }

        @Override
        public void serialize(TreeNode node, JsonGenerator gen, SerializerProvider provider) throws IOException {
            gen.writeStartObject();
            gen.writeStringField("path", node.path());
            gen.writeStringField("mode", node.mode().getWireValue());
            gen.writeStringField("type", node.type().getWireValue());
            TreeNodeSource source = node.source();
            if (source.getKind() == TreeNodeSource.Kind.CONTENT) {
                gen.writeStringField("content", source.getValue());
            } else if (source.isDeletion()) {
                gen.writeNullField("sha");
            } else {
                gen.writeStringField("sha", source.getValue());
            }
            gen.writeEndObject();
        }
    }
}
