package com.labelops.core.pipeline;

import com.labelops.core.ai.AiSummary;
import com.labelops.core.parse.ParseWarning;

import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Outcome of a pipeline run. In a dry run the output paths are the ones that would have been
 * written and no manifest exists.
 */
public record BatchResult(String batchId,
                          String clientId,
                          int recordCount,
                          Path outputXlsx,
                          Path trackingCsv,
                          Path manifestPath,
                          AiSummary aiSummary,
                          List<ParseWarning> parseWarnings,
                          List<ValidationFailure> validationFailures,
                          Map<String, Integer> servicesUsed,
                          String inputTextSha256,
                          boolean dryRun) {

    public BatchResult {
        parseWarnings = List.copyOf(parseWarnings);
        validationFailures = List.copyOf(validationFailures);
        servicesUsed = Collections.unmodifiableMap(new LinkedHashMap<>(servicesUsed));
    }

    public Optional<Path> manifest() {
        return Optional.ofNullable(manifestPath);
    }
}
