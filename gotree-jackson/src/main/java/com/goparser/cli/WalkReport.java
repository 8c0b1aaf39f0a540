package com.goparser.cli;

import java.util.List;

/**
 * Summary of one walk: how many units were attempted, which documents were written
 * and which units failed.
 */
public record WalkReport(
    int processed,
    List<String> written,
    List<UnitFailure> failures
) {
    public WalkReport {
        written = List.copyOf(written);
        failures = List.copyOf(failures);
    }

    public boolean hasFailures() {
        return !failures.isEmpty();
    }
}
