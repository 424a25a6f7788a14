package com.labelops.cli;

import com.labelops.core.ai.RiskLevel;
import com.labelops.core.pipeline.BatchRequest;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Options of {@code labelops daemon}.
 *
 * @param clientIds empty means every configured client
 * @param logDir    {@code null} keeps the environment's log directory
 */
public record DaemonOptions(List<String> clientIds,
                            boolean useTelegram,
                            boolean useAi,
                            RiskLevel maxRisk,
                            int maxAiCalls,
                            boolean recursive,
                            Path logDir,
                            int pollSeconds) {

    static final int DEFAULT_POLL_SECONDS = 2;

    private static final Set<String> VALUED = Set.of(
        "--clients", "--use-telegram", "--use-ai", "--auto-apply-max-risk", "--max-ai-calls",
        "--recursive", "--log-dir", "--poll-seconds");

    public static DaemonOptions parse(List<String> args) throws UsageException {
        OptionReader options = OptionReader.read(args, VALUED, Set.of());
        return new DaemonOptions(
            clients(options.string("--clients", "all")),
            options.flag("--use-telegram", true),
            options.flag("--use-ai", false),
            options.risk("--auto-apply-max-risk", RiskLevel.LOW),
            options.integer("--max-ai-calls", BatchRequest.DEFAULT_MAX_AI_CALLS, 0),
            options.flag("--recursive", false),
            options.path("--log-dir"),
            options.integer("--poll-seconds", DEFAULT_POLL_SECONDS, 1));
    }

    private static List<String> clients(String raw) throws UsageException {
        if (raw.equalsIgnoreCase("all")) {
            return List.of();
        }
        List<String> ids = new ArrayList<>();
        for (String part : raw.split(",")) {
            if (!part.isBlank()) {
                ids.add(part.trim().toLowerCase(Locale.ROOT));
            }
        }
        if (ids.isEmpty()) {
            throw new UsageException("--clients expects all or a comma separated list");
        }
        return List.copyOf(ids);
    }
}
