package com.goparser.jackson;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import com.goparser.generic.GenericNode;

import java.io.IOException;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

/**
 * Writes a {@link GenericNode} as {@code {name?, type, children?, value?, comments?}}.
 * Null or empty strings and empty lists are left out.
 */
public class GenericNodeSerializer extends StdSerializer<GenericNode> {

    public GenericNodeSerializer() {
        super(GenericNode.class);
    }

    @Override
    public void serialize(GenericNode root, JsonGenerator gen, SerializerProvider provider) throws IOException {
        Deque<Frame> stack = new ArrayDeque<>();
        stack.push(new Frame(root, false));

        while (!stack.isEmpty()) {
            Frame frame = stack.pop();
            GenericNode node = frame.node();
            if (!frame.closing()) {
                gen.writeStartObject(node);
                if (isPresent(node.name())) {
                    gen.writeStringField("name", node.name());
                }
                gen.writeStringField("type", node.type());
                stack.push(new Frame(node, true));
                List<GenericNode> children = node.children();
                if (!children.isEmpty()) {
                    gen.writeArrayFieldStart("children");
                    for (int i = children.size() - 1; i >= 0; i--) {
                        stack.push(new Frame(children.get(i), false));
                    }
                }
            } else {
                if (!node.children().isEmpty()) {
                    gen.writeEndArray();
                }
                if (isPresent(node.value())) {
                    gen.writeStringField("value", node.value());
                }
                if (!node.comments().isEmpty()) {
                    gen.writeArrayFieldStart("comments");
                    for (String comment : node.comments()) {
                        gen.writeString(comment);
                    }
                    gen.writeEndArray();
                }
                gen.writeEndObject();
            }
        }
    }

    private static boolean isPresent(String s) {
        return s != null && !s.isEmpty();
    }

    // closing: the children (if any) are written; finish the node
    private record Frame(GenericNode node, boolean closing) {}
}
