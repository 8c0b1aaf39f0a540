package com.goparser.cli;

import com.goparser.ParseException;
import com.goparser.Parser;
import com.goparser.ast.File;
import com.goparser.ast.Node;
import com.goparser.generic.GenericNode;
import com.goparser.generic.NodeDispatcher;
import com.goparser.generic.UnsupportedNodeKindException;
import com.goparser.json.GenericJsonException;
import com.goparser.json.GenericTreeSerializer;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Converts one Go source file into its JSON document next to it.
 *
 * <p>The document is rendered completely before the output file is opened, so a unit
 * that fails at any stage leaves no output behind. An existing output file is
 * overwritten.</p>
 */
public class SourceUnitConverter {
    private final GenericTreeSerializer serializer;
    private final String outputExtension;
    private final boolean compact;

    public SourceUnitConverter(GenericTreeSerializer serializer, String outputExtension, boolean compact) {
        this.serializer = serializer;
        this.outputExtension = outputExtension;
        this.compact = compact;
    }

    /**
     * @return the path of the written document
     */
    public Path convert(Path source) throws UnitConversionException {
        String text;
        try {
            text = Files.readString(source, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UnitConversionException(FailureType.PATH, source,
                "Cannot read " + source + ": " + e.getMessage(), e);
        }

        File file;
        try {
            file = Parser.parse(text);
        } catch (ParseException e) {
            throw new UnitConversionException(FailureType.PARSE, source, source + ":" + e.getMessage(), e);
        }
        return convert(source, file);
    }

    /**
     * Converts an already parsed syntax tree and writes it next to {@code source}.
     */
    Path convert(Path source, Node root) throws UnitConversionException {
        GenericNode tree;
        try {
            tree = NodeDispatcher.classify(root);
        } catch (UnsupportedNodeKindException e) {
            throw new UnitConversionException(FailureType.UNSUPPORTED_NODE_KIND, source, e.getMessage(), e);
        }

        String document;
        try {
            document = compact ? serializer.serialize(tree) + "\n" : serializer.render(tree);
        } catch (GenericJsonException e) {
            throw new UnitConversionException(FailureType.ENCODE, source, e.getMessage(), e);
        }

        Path target = outputPathFor(source);
        try {
            Files.writeString(target, document, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UnitConversionException(FailureType.WRITE, source,
                "Cannot write " + target + ": " + e.getMessage(), e);
        }
        return target;
    }

    /**
     * The source path with its last extension replaced by the output extension.
     */
    public Path outputPathFor(Path source) {
        String fileName = source.getFileName().toString();
        int dot = fileName.lastIndexOf('.');
        String base = dot > 0 ? fileName.substring(0, dot) : fileName;
        return source.resolveSibling(base + "." + outputExtension);
    }
}
