package com.goparser.json;

import com.goparser.generic.GenericNode;

/**
 * Interface for reading generic trees from JSON.
 */
public interface GenericTreeDeserializer {

    /**
     * Deserializes a JSON document to a generic tree.
     *
     * @param json the JSON document
     * @return the root of the tree
     * @throws GenericJsonException if the document is malformed or a node has no type
     */
    GenericNode deserialize(String json) throws GenericJsonException;
}
