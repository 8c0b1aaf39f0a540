package com.goparser.json;

import com.goparser.generic.GenericNode;

import java.io.OutputStream;

/**
 * Interface for writing generic trees as JSON.
 *
 * <p>Properties are written in the order {@code name, type, children, value, comments};
 * a property whose value is null or an empty list is left out.</p>
 */
public interface GenericTreeSerializer {

    /**
     * Serializes a tree to a single-line JSON string.
     *
     * @param tree the root of the tree
     * @return the compact JSON representation
     * @throws GenericJsonException if serialization fails
     */
    String serialize(GenericNode tree) throws GenericJsonException;

    /**
     * Renders a tree as an output document: two-space indentation, one array element
     * per line, {@code "key": value} spacing and a trailing newline.
     *
     * @param tree the root of the tree
     * @return the indented JSON document
     * @throws GenericJsonException if serialization fails
     */
    String render(GenericNode tree) throws GenericJsonException;

    /**
     * Writes the {@link #render(GenericNode) rendered} document to a stream as UTF-8.
     * The stream is flushed but not closed.
     *
     * @throws GenericJsonException if serialization or writing fails
     */
    void write(GenericNode tree, OutputStream out) throws GenericJsonException;
}
