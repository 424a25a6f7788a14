package com.labelops.core.parse;

/**
 * A text block that could not be turned into a record. Carries no block content so it can be
 * logged and written to manifests.
 *
 * @param blockIndex 1-based position of the block in the input
 * @param lineCount  usable lines found in the block
 */
public record ParseWarning(int blockIndex, int lineCount, String reason) {

    @Override
    public String toString() {
        return "block %d (%d line(s)): %s".formatted(blockIndex, lineCount, reason);
    }
}
