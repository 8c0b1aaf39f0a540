package com.goparser.jackson;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.goparser.generic.GenericNode;
import com.goparser.json.*;

import java.io.IOException;
import java.io.OutputStream;

/**
 * Jackson-based implementation of GenericJsonProvider.
 */
public class JacksonGenericJsonProvider implements GenericJsonProvider {

    private final ObjectMapper mapper;
    private final GenericTreeSerializer serializer;
    private final GenericTreeDeserializer deserializer;

    public JacksonGenericJsonProvider() {
        this(GoTreeJackson.createObjectMapper());
    }

    public JacksonGenericJsonProvider(ObjectMapper mapper) {
        this.mapper = mapper;
        this.serializer = new JacksonSerializer(mapper);
        this.deserializer = new JacksonDeserializer(mapper);
    }

    @Override
    public GenericTreeSerializer getSerializer() {
        return serializer;
    }

    @Override
    public GenericTreeDeserializer getDeserializer() {
        return deserializer;
    }

    @Override
    public String getName() {
        return "Jackson";
    }

    /**
     * Returns the underlying ObjectMapper for advanced usage.
     */
    public ObjectMapper getObjectMapper() {
        return mapper;
    }

    // ==================== Inner Classes ====================

    private static class JacksonSerializer implements GenericTreeSerializer {
        private final ObjectMapper mapper;
        private final ObjectWriter documentWriter;

        JacksonSerializer(ObjectMapper mapper) {
            this.mapper = mapper;
            this.documentWriter = mapper.writer(GoTreeJackson.createDocumentPrinter());
        }

        @Override
        public String serialize(GenericNode tree) throws GenericJsonException {
            try {
                return mapper.writeValueAsString(tree);
            } catch (Exception e) {
                throw new GenericJsonException("Failed to serialize generic tree", e);
            }
        }

        @Override
        public String render(GenericNode tree) throws GenericJsonException {
            try {
                return documentWriter.writeValueAsString(tree) + "\n";
            } catch (Exception e) {
                throw new GenericJsonException("Failed to serialize generic tree", e);
            }
        }

        @Override
        public void write(GenericNode tree, OutputStream out) throws GenericJsonException {
            try {
                documentWriter.without(JsonGenerator.Feature.AUTO_CLOSE_TARGET).writeValue(out, tree);
                out.write('\n');
                out.flush();
            } catch (IOException e) {
                throw new GenericJsonException("Failed to write generic tree", e);
            }
        }
    }

    private static class JacksonDeserializer implements GenericTreeDeserializer {
        private final ObjectMapper mapper;

        JacksonDeserializer(ObjectMapper mapper) {
            this.mapper = mapper;
        }

        @Override
        public GenericNode deserialize(String json) throws GenericJsonException {
            try {
                return mapper.readValue(json, GenericNode.class);
            } catch (Exception e) {
                throw new GenericJsonException("Failed to deserialize generic tree", e);
            }
        }
    }
}
