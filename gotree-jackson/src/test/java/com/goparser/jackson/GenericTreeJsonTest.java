package com.goparser.jackson;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.goparser.Parser;
import com.goparser.generic.GenericNode;
import com.goparser.generic.NodeDispatcher;
import com.goparser.json.GenericJsonException;
import com.goparser.json.GenericTreeDeserializer;
import com.goparser.json.GenericTreeSerializer;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class GenericTreeJsonTest {

    private final JacksonGenericJsonProvider provider = new JacksonGenericJsonProvider();
    private final GenericTreeSerializer serializer = provider.getSerializer();
    private final GenericTreeDeserializer deserializer = provider.getDeserializer();

    private static GenericNode sampleTree() {
        GenericNode body = new GenericNode("block-stmt");
        GenericNode main = new GenericNode("func-decl", "main", null, List.of(body), List.of("// doc"));
        return new GenericNode("file", null, "p", List.of(main), List.of());
    }

    @Test
    @DisplayName("Rendered documents use two-space indentation and a trailing newline")
    void rendersDocumentFormat() {
        String expected = """
            {
              "type": "file",
              "children": [
                {
                  "name": "main",
                  "type": "func-decl",
                  "children": [
                    {
                      "type": "block-stmt"
                    }
                  ],
                  "comments": [
                    "// doc"
                  ]
                }
              ],
              "value": "p"
            }
            """;
        assertEquals(expected, serializer.render(sampleTree()));
    }

    @Test
    void serializesCompactly() {
        String json = serializer.serialize(sampleTree());
        assertEquals("{\"type\":\"file\",\"children\":[{\"name\":\"main\",\"type\":\"func-decl\","
            + "\"children\":[{\"type\":\"block-stmt\"}],\"comments\":[\"// doc\"]}],\"value\":\"p\"}", json);
    }

    @Test
    void omitsEmptyNameAndValue() {
        GenericNode node = new GenericNode("ident", "", "", List.of(), List.of());
        assertEquals("{\"type\":\"ident\"}", serializer.serialize(node));
    }

    @Test
    void escapesHtmlCharactersAndLineSeparators() {
        GenericNode lit = new GenericNode("basic-lit", null, "\"<a&b>\"", List.of(), List.of());
        assertEquals("{\"type\":\"basic-lit\",\"value\":\"\\\"\\u003ca\\u0026b\\u003e\\\"\"}", serializer.serialize(lit));

        GenericNode separators = new GenericNode("basic-lit", null, "a\u2028b\u2029c", List.of(), List.of());
        assertEquals("{\"type\":\"basic-lit\",\"value\":\"a\\u2028b\\u2029c\"}", serializer.serialize(separators));

        // Escaped output still reads back to the original text
        assertEquals(lit.value(), deserializer.deserialize(serializer.serialize(lit)).value());
    }

    @Test
    void writeMatchesRender() {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        serializer.write(sampleTree(), out);
        assertEquals(serializer.render(sampleTree()), out.toString(StandardCharsets.UTF_8));
    }

    @Test
    void readsRenderedDocumentBack() {
        GenericNode tree = NodeDispatcher.classify(Parser.parse("""
            package p

            // Sum adds.
            func Sum(xs []int) (total int) {
            	for _, x := range xs {
            		total += x
            	}
            	return
            }
            """));
        assertEquals(tree, deserializer.deserialize(serializer.render(tree)));
    }

    @Test
    void ignoresUnknownProperties() {
        GenericNode node = deserializer.deserialize("{\"type\":\"ident\",\"value\":\"x\",\"pos\":12}");
        assertEquals(new GenericNode("ident", null, "x", List.of(), List.of()), node);
    }

    @Test
    void rejectsNodeWithoutType() {
        GenericJsonException e = assertThrows(GenericJsonException.class,
            () -> deserializer.deserialize("{\"type\":\"file\",\"children\":[{\"value\":\"x\"}]}"));
        assertTrue(e.getCause().getMessage().contains("missing its \"type\""), e.getCause().getMessage());

        assertThrows(GenericJsonException.class, () -> deserializer.deserialize("{\"type\":42}"));
        assertThrows(GenericJsonException.class, () -> deserializer.deserialize("[]"));
        assertThrows(GenericJsonException.class, () -> deserializer.deserialize("{\"type\":\"file\",\"children\":{}}"));
    }

    @Test
    void writesPropertiesInSchemaOrder() throws Exception {
        GenericNode tree = NodeDispatcher.classify(Parser.parse("package p\n\n// F does nothing.\nfunc F() {}\n"));
        ObjectMapper mapper = provider.getObjectMapper();
        JsonNode file = mapper.readTree(serializer.render(tree));

        assertEquals(List.of("type", "children", "value"), fieldNames(file));
        JsonNode func = file.get("children").get(0);
        assertEquals(List.of("name", "type", "children", "comments"), fieldNames(func));
        assertEquals("F", func.get("name").asText());
        assertEquals("// F does nothing.", func.get("comments").get(0).asText());
    }

    @Test
    void handlesDeepNestingInBothDirections() {
        GenericNode node = new GenericNode("ident", null, "x", List.of(), List.of());
        for (int i = 0; i < 100_000; i++) {
            node = new GenericNode("paren-expr", null, null, List.of(node), List.of());
        }

        String json = serializer.serialize(node);
        assertTrue(json.startsWith("{\"type\":\"paren-expr\",\"children\":[{\"type\":\"paren-expr\""));

        GenericNode back = deserializer.deserialize(json);
        assertEquals(100_001, back.size());
    }

    private static List<String> fieldNames(JsonNode node) {
        List<String> names = new ArrayList<>();
        Iterator<String> it = node.fieldNames();
        it.forEachRemaining(names::add);
        return names;
    }
}
