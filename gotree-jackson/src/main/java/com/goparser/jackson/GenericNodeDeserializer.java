package com.goparser.jackson;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import com.goparser.generic.GenericNode;

import java.io.IOException;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Reads a {@link GenericNode} tree from its JSON form. A node without a string
 * {@code type} is rejected.
 */
public class GenericNodeDeserializer extends StdDeserializer<GenericNode> {

    public GenericNodeDeserializer() {
        super(GenericNode.class);
    }

    @Override
    public GenericNode deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
        JsonNode root = ctxt.readTree(p);
        return fromTree(p, root);
    }

    static GenericNode fromTree(JsonParser p, JsonNode root) throws JsonMappingException {
        Deque<Frame> stack = new ArrayDeque<>();
        stack.push(new Frame(root, null, null));
        GenericNode result = null;

        while (!stack.isEmpty()) {
            Frame frame = stack.pop();
            if (frame.children() == null) {
                // First visit: schedule completion, then the children in order
                JsonNode json = frame.json();
                if (!json.isObject()) {
                    throw JsonMappingException.from(p, "Expected a generic node object, found " + json.getNodeType());
                }
                List<GenericNode> children = new ArrayList<>();
                stack.push(new Frame(json, children, frame.sink()));
                JsonNode childArray = json.get("children");
                if (childArray != null && !childArray.isNull()) {
                    if (!childArray.isArray()) {
                        throw JsonMappingException.from(p, "\"children\" must be an array");
                    }
                    for (int i = childArray.size() - 1; i >= 0; i--) {
                        stack.push(new Frame(childArray.get(i), null, children));
                    }
                }
            } else {
                GenericNode node = toNode(p, frame.json(), frame.children());
                if (frame.sink() != null) {
                    frame.sink().add(node);
                } else {
                    result = node;
                }
            }
        }
        return result;
    }

    private static GenericNode toNode(JsonParser p, JsonNode json, List<GenericNode> children) throws JsonMappingException {
        JsonNode type = json.get("type");
        if (type == null || !type.isTextual()) {
            throw JsonMappingException.from(p, "Generic node is missing its \"type\"");
        }
        List<String> comments = new ArrayList<>();
        JsonNode commentArray = json.get("comments");
        if (commentArray != null && !commentArray.isNull()) {
            if (!commentArray.isArray()) {
                throw JsonMappingException.from(p, "\"comments\" must be an array");
            }
            for (JsonNode comment : commentArray) {
                comments.add(comment.asText());
            }
        }
        return new GenericNode(type.asText(), text(json, "name"), text(json, "value"), children, comments);
    }

    private static String text(JsonNode json, String field) {
        JsonNode node = json.get(field);
        return node == null || node.isNull() ? null : node.asText();
    }

    // children is null until the node has been expanded
    private record Frame(JsonNode json, List<GenericNode> children, List<GenericNode> sink) {}
}
