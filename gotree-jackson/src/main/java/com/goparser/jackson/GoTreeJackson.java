package com.goparser.jackson;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonFactoryBuilder;
import com.fasterxml.jackson.core.StreamReadConstraints;
import com.fasterxml.jackson.core.StreamWriteConstraints;
import com.fasterxml.jackson.core.util.DefaultIndenter;
import com.fasterxml.jackson.core.util.DefaultPrettyPrinter;
import com.fasterxml.jackson.core.util.Separators;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.module.paramnames.ParameterNamesModule;

/**
 * Factory for creating properly configured ObjectMapper instances for generic tree serialization.
 *
 * Usage:
 * <pre>
 * ObjectMapper mapper = GoTreeJackson.createObjectMapper();
 * String json = mapper.writeValueAsString(tree);
 * GenericNode tree = mapper.readValue(json, GenericNode.class);
 * </pre>
 */
public final class GoTreeJackson {

    /**
     * Generic trees mirror the nesting of the source, which is not bounded by
     * Jackson's default of 1000 levels.
     */
    public static final int MAX_NESTING_DEPTH = Integer.MAX_VALUE;

    private GoTreeJackson() {
        // Utility class
    }

    /**
     * Creates a new ObjectMapper configured for generic trees.
     *
     * The returned mapper:
     * - Writes GenericNode properties in the order name, type, children, value, comments
     * - Escapes {@code <}, {@code >} and {@code &} the way Go's encoding/json does
     * - Accepts arbitrarily deep documents in both directions
     *
     * @return A new configured ObjectMapper instance
     */
    public static ObjectMapper createObjectMapper() {
        JsonFactory factory = new JsonFactoryBuilder()
            .streamReadConstraints(StreamReadConstraints.builder().maxNestingDepth(MAX_NESTING_DEPTH).build())
            .streamWriteConstraints(StreamWriteConstraints.builder().maxNestingDepth(MAX_NESTING_DEPTH).build())
            .characterEscapes(new HtmlSafeCharacterEscapes())
            .build();

        ObjectMapper mapper = new ObjectMapper(factory);
        mapper.registerModule(new ParameterNamesModule());

        // Exclude null values by default
        mapper.setSerializationInclusion(JsonInclude.Include.NON_NULL);

        // Ignore unknown properties during deserialization
        mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

        mapper.registerModule(new GenericTreeModule());

        return mapper;
    }

    /**
     * Pretty printer for output documents: two-space indentation, every object
     * property and array element on its own line, and {@code "key": value} spacing.
     */
    public static DefaultPrettyPrinter createDocumentPrinter() {
        DefaultIndenter indenter = new DefaultIndenter("  ", "\n");
        return new DefaultPrettyPrinter()
            .withObjectIndenter(indenter)
            .withArrayIndenter(indenter)
            .withSeparators(Separators.createDefaultInstance()
                .withObjectFieldValueSpacing(Separators.Spacing.AFTER));
    }
}
