package com.labelops.cli;

import com.labelops.core.ai.RiskLevel;
import com.labelops.core.pipeline.BatchRequest;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Options of {@code labelops process}.
 */
public record ProcessOptions(String clientId,
                             Path input,
                             boolean dryRun,
                             boolean useAi,
                             RiskLevel maxRisk,
                             int maxAiCalls,
                             Path logDir) {

    private static final Set<String> VALUED = Set.of(
        "--client", "--input", "--use-ai", "--auto-apply-max-risk", "--max-ai-calls", "--log-dir");

    public static ProcessOptions parse(List<String> args) throws UsageException {
        OptionReader options = OptionReader.read(args, VALUED, Set.of("--dry-run"));
        return new ProcessOptions(
            options.required("--client").toLowerCase(Locale.ROOT),
            Paths.get(options.required("--input")),
            options.has("--dry-run"),
            options.flag("--use-ai", false),
            options.risk("--auto-apply-max-risk", RiskLevel.LOW),
            options.integer("--max-ai-calls", BatchRequest.DEFAULT_MAX_AI_CALLS, 0),
            options.path("--log-dir"));
    }
}
