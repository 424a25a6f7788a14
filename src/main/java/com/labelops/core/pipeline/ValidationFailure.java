package com.labelops.core.pipeline;

import java.util.List;

/**
 * A parsed record dropped from output because required values are missing. Lists field names
 * only.
 *
 * @param blockIndex 1-based block the record came from
 */
public record ValidationFailure(int blockIndex, List<String> problems) {

    public ValidationFailure {
        problems = List.copyOf(problems);
    }

    @Override
    public String toString() {
        return "block %d: %s".formatted(blockIndex, String.join(", ", problems));
    }
}
