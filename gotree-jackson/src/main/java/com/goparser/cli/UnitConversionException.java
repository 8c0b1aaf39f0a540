package com.goparser.cli;

import java.nio.file.Path;

/**
 * Failure to convert one source unit, tagged with the stage that failed.
 */
public class UnitConversionException extends Exception {
    private final FailureType type;
    private final Path source;

    public UnitConversionException(FailureType type, Path source, String message, Throwable cause) {
        super(message, cause);
        this.type = type;
        this.source = source;
    }

    public UnitConversionException(FailureType type, Path source, String message) {
        this(type, source, message, null);
    }

    public FailureType type() {
        return type;
    }

    public Path source() {
        return source;
    }
}
