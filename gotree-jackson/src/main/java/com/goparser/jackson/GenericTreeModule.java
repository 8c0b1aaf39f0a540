package com.goparser.jackson;

import com.fasterxml.jackson.core.Version;
import com.fasterxml.jackson.databind.module.SimpleModule;
import com.goparser.generic.GenericNode;

/**
 * Jackson module that registers the streaming serializer and deserializer for
 * {@link GenericNode}.
 *
 * Both walk the tree with an explicit stack, so documents as deep as the
 * source nesting are handled without growing the thread stack.
 */
public class GenericTreeModule extends SimpleModule {

    public GenericTreeModule() {
        super("GenericTreeModule", new Version(1, 0, 0, null, "com.goparser", "gotree-jackson"));
        addSerializer(GenericNode.class, new GenericNodeSerializer());
        addDeserializer(GenericNode.class, new GenericNodeDeserializer());
    }
}
