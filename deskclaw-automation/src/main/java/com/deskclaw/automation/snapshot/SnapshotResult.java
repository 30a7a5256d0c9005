package com.deskclaw.automation.snapshot;

import java.util.List;

/**
 * Immutable output of one snapshot build.
 *
 * @param text         rendered lines, each terminated by a newline
 * @param lines        structured form of the same lines
 * @param elementCount number of emitted lines
 * @param truncated    whether the element cap cut the traversal short
 */
public record SnapshotResult(String text, List<SnapshotLine> lines, int elementCount, boolean truncated) {

    public SnapshotResult {
        lines = lines == null ? List.of() : List.copyOf(lines);
    }

    public boolean isEmpty() {
        return elementCount == 0;
    }
}
