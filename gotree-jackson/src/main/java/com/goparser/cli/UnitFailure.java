package com.goparser.cli;

public record UnitFailure(
    String file,
    FailureType type,
    String message  // Can be null
) {
    static UnitFailure of(UnitConversionException e) {
        return new UnitFailure(e.source().toString(), e.type(), e.getMessage());
    }
}
