package com.goparser.cli;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Feeds a single source file, or every source file below a directory, to a
 * {@link SourceUnitConverter}.
 *
 * <p>Files are converted one at a time in sorted path order. Without fail-fast, a
 * failing unit is reported and the walk goes on with the next one.</p>
 */
public class SourceUnitWalker {
    private final SourceUnitConverter converter;
    private final String sourceExtension;
    private final boolean failFast;
    private final boolean verbose;

    public SourceUnitWalker(SourceUnitConverter converter, String sourceExtension, boolean failFast, boolean verbose) {
        this.converter = converter;
        this.sourceExtension = sourceExtension;
        this.failFast = failFast;
        this.verbose = verbose;
    }

    /**
     * @throws UnitConversionException if the input cannot be accessed, or on the first
     *         failing unit in fail-fast mode
     */
    public WalkReport walk(Path input) throws UnitConversionException {
        List<Path> units = discover(input);
        if (verbose) {
            System.out.println("Found " + units.size() + " source file(s) under " + input);
        }

        List<String> written = new ArrayList<>();
        List<UnitFailure> failures = new ArrayList<>();
        int processed = 0;
        for (Path unit : units) {
            processed++;
            try {
                Path target = converter.convert(unit);
                written.add(target.toString());
                System.out.println("AST generated and saved to " + target);
            } catch (UnitConversionException e) {
                if (failFast) {
                    throw e;
                }
                failures.add(UnitFailure.of(e));
                System.err.println("Error processing file: " + e.getMessage());
                if (verbose) {
                    e.printStackTrace();
                }
            }
        }
        return new WalkReport(processed, written, failures);
    }

    List<Path> discover(Path input) throws UnitConversionException {
        if (!Files.exists(input)) {
            throw new UnitConversionException(FailureType.PATH, input, "No such file or directory: " + input);
        }
        if (!Files.isDirectory(input)) {
            return List.of(input);
        }
        try (Stream<Path> paths = Files.walk(input)) {
            return paths.filter(Files::isRegularFile)
                .filter(this::hasSourceExtension)
                .sorted()
                .collect(Collectors.toList());
        } catch (IOException | UncheckedIOException e) {
            throw new UnitConversionException(FailureType.PATH, input,
                "Cannot walk " + input + ": " + e.getMessage(), e);
        }
    }

    private boolean hasSourceExtension(Path path) {
        return path.getFileName().toString().endsWith("." + sourceExtension);
    }
}
