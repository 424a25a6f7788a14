package com.labelops.cli;

import com.labelops.config.ConfigException;
import com.labelops.config.ConfigStore;
import com.labelops.config.EffectiveSettings;
import com.labelops.config.LabelOpsEnvironment;
import com.labelops.config.UnknownClientException;
import com.labelops.core.ai.AddressCorrector;
import com.labelops.core.ai.NoopAddressCorrector;
import com.labelops.core.ai.OpenAiAddressCorrector;
import com.labelops.core.output.OutputWriteException;
import com.labelops.core.pipeline.BatchRequest;
import com.labelops.core.pipeline.BatchResult;
import com.labelops.core.pipeline.BatchSource;
import com.labelops.core.pipeline.EmptyBatchException;
import com.labelops.core.pipeline.PipelineRunner;
import com.labelops.daemon.DaemonWatcher;
import com.labelops.daemon.FailureHandler;
import com.labelops.daemon.FailureLedger;
import com.labelops.daemon.WatcherListener;
import com.labelops.daemon.WatcherOptions;
import com.labelops.integration.telegram.AllowlistStore;
import com.labelops.integration.telegram.InboxWriter;
import com.labelops.integration.telegram.IngestRouter;
import com.labelops.integration.telegram.TelegramHttpApi;
import com.labelops.integration.telegram.TelegramIngestBot;
import com.labelops.logging.AppLogger;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Command line entry point: {@code daemon} runs the watcher (and optionally the Telegram bot)
 * until interrupted, {@code process} runs a single batch from a file.
 */
public final class LabelOpsApplication {
    private static final Logger LOGGER = AppLogger.get();

    public static final int EXIT_OK = 0;
    public static final int EXIT_CONFIG = 1;
    public static final int EXIT_USAGE = 2;
    public static final int EXIT_BATCH_FAILED = 3;

    static final String USAGE = """
        Usage:
          labelops daemon [--clients all|client_01,client_02] [--use-telegram 0|1] [--use-ai 0|1]
                          [--auto-apply-max-risk low|medium|high] [--max-ai-calls N] [--recursive 0|1]
                          [--log-dir PATH] [--poll-seconds N]
          labelops process --client ID --input FILE [--dry-run] [--use-ai 0|1]
                          [--auto-apply-max-risk low|medium|high] [--max-ai-calls N] [--log-dir PATH]
        """;

    private final LabelOpsEnvironment environment;
    private final PrintStream out;
    private final Clock clock;

    LabelOpsApplication(LabelOpsEnvironment environment, PrintStream out, Clock clock) {
        this.environment = environment;
        this.out = out;
        this.clock = clock;
    }

    public static void main(String[] args) {
        LabelOpsApplication app = new LabelOpsApplication(LabelOpsEnvironment.fromSystem(), System.out, Clock.systemUTC());
        System.exit(app.run(args));
    }

    int run(String[] args) {
        if (args == null || args.length == 0) {
            out.print(USAGE);
            return EXIT_USAGE;
        }
        List<String> rest = Arrays.asList(args).subList(1, args.length);
        try {
            return switch (args[0]) {
                case "daemon" -> runDaemon(DaemonOptions.parse(rest));
                case "process" -> runProcess(ProcessOptions.parse(rest));
                case "-h", "--help", "help" -> {
                    out.print(USAGE);
                    yield EXIT_OK;
                }
                default -> throw new UsageException("Unknown command: " + args[0]);
            };
        } catch (UsageException ex) {
            out.println(ex.getMessage());
            out.print(USAGE);
            return EXIT_USAGE;
        }
    }

    int runProcess(ProcessOptions options) {
        LabelOpsEnvironment env = environment.withLogDirectory(options.logDir());
        configureLogging(env);
        ConfigStore store;
        try {
            store = ConfigStore.open(env);
        } catch (ConfigException ex) {
            LOGGER.severe("Configuration error: " + ex.getMessage());
            return EXIT_CONFIG;
        }

        EffectiveSettings settings;
        String rawText;
        try {
            settings = store.resolve(options.clientId());
            rawText = Files.readString(options.input(), StandardCharsets.UTF_8);
        } catch (UnknownClientException ex) {
            out.println(ex.getMessage());
            return EXIT_USAGE;
        } catch (IOException ex) {
            out.println("Cannot read input %s: %s".formatted(options.input(), ex.getMessage()));
            return EXIT_USAGE;
        }

        PipelineRunner runner = new PipelineRunner(corrector(options.useAi()), manifestDirectory(env));
        BatchRequest request = BatchRequest.builder(settings, rawText, BatchSource.CLI)
            .inputFiles(List.of(options.input().getFileName().toString()))
            .useAi(options.useAi())
            .maxRisk(options.maxRisk())
            .maxAiCalls(options.maxAiCalls())
            .dryRun(options.dryRun())
            .build();
        try {
            BatchResult result = runner.run(request);
            out.println(summary(result));
            return EXIT_OK;
        } catch (EmptyBatchException | OutputWriteException ex) {
            LOGGER.log(Level.SEVERE, "Batch failed for " + options.clientId(), ex);
            out.println("Batch failed: " + ex.getMessage());
            return EXIT_BATCH_FAILED;
        }
    }

    int runDaemon(DaemonOptions options) {
        LabelOpsEnvironment env = environment.withLogDirectory(options.logDir());
        configureLogging(env);
        ConfigStore store;
        try {
            store = ConfigStore.open(env);
        } catch (ConfigException ex) {
            LOGGER.severe("Configuration error: " + ex.getMessage());
            return EXIT_CONFIG;
        }

        List<String> clients = options.clientIds().isEmpty() ? store.current().clientIds() : options.clientIds();
        for (String clientId : clients) {
            try {
                store.resolve(clientId).folders().createAll();
            } catch (UnknownClientException ex) {
                out.println(ex.getMessage());
                return EXIT_USAGE;
            } catch (IOException ex) {
                LOGGER.severe("Cannot create folders for %s: %s".formatted(clientId, ex.getMessage()));
                return EXIT_CONFIG;
            }
        }

        PipelineRunner runner = new PipelineRunner(corrector(options.useAi()), manifestDirectory(env));
        WatcherOptions watcherOptions = new WatcherOptions(
            options.clientIds(),
            options.useAi(),
            options.maxRisk(),
            options.maxAiCalls(),
            options.recursive(),
            Duration.ofSeconds(options.pollSeconds()),
            WatcherOptions.DEFAULT_SETTLE);
        DaemonWatcher watcher = new DaemonWatcher(
            store,
            runner,
            new FailureHandler(new FailureLedger(env.logDirectory(), clock), clock),
            watcherOptions,
            WatcherListener.NONE,
            clock);
        TelegramIngestBot bot = options.useTelegram() ? telegramBot(store, env) : null;

        CountDownLatch stopped = new CountDownLatch(1);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            LOGGER.info("Shutdown requested");
            try {
                watcher.stop();
                if (bot != null) {
                    bot.stop();
                }
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
            } finally {
                stopped.countDown();
            }
        }, "labelops-shutdown"));

        watcher.start();
        if (bot != null) {
            try {
                bot.start();
            } catch (IOException ex) {
                LOGGER.warning("Telegram bot disabled: " + ex.getMessage());
            }
        }
        try {
            stopped.await();
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
        }
        return EXIT_OK;
    }

    private TelegramIngestBot telegramBot(ConfigStore store, LabelOpsEnvironment env) {
        String token = System.getenv("TELEGRAM_BOT_TOKEN");
        if (token == null || token.isBlank()) {
            LOGGER.warning("TELEGRAM_BOT_TOKEN not set; Telegram bot disabled");
            return null;
        }
        return new TelegramIngestBot(
            new TelegramHttpApi(token),
            new AllowlistStore(env.allowlistFile()),
            new IngestRouter(() -> store.current().clientIds(), IngestRouter.DEFAULT_FALLBACK_CLIENT),
            new InboxWriter(clock),
            store);
    }

    private static AddressCorrector corrector(boolean useAi) {
        if (!useAi) {
            return NoopAddressCorrector.INSTANCE;
        }
        OpenAiAddressCorrector corrector = OpenAiAddressCorrector.fromEnvironment();
        if (!corrector.isConfigured()) {
            LOGGER.warning("AI review requested but OPENAI_API_KEY is not set; review calls will be reported unavailable");
        }
        return corrector;
    }

    static Path manifestDirectory(LabelOpsEnvironment env) {
        return env.logDirectory().resolve("manifests");
    }

    private static void configureLogging(LabelOpsEnvironment env) {
        try {
            AppLogger.configure(env.logDirectory());
        } catch (IOException ex) {
            LOGGER.warning("File logging disabled, cannot use %s: %s".formatted(env.logDirectory(), ex.getMessage()));
        }
    }

    static String summary(BatchResult result) {
        StringBuilder text = new StringBuilder()
            .append("batch ").append(result.batchId()).append(" client ").append(result.clientId())
            .append(": ").append(result.recordCount()).append(" record(s)");
        if (result.dryRun()) {
            text.append(" (dry run, nothing written)");
        } else {
            text.append(System.lineSeparator()).append("  workbook: ").append(result.outputXlsx())
                .append(System.lineSeparator()).append("  tracking: ").append(result.trackingCsv());
            result.manifest().ifPresent(path ->
                text.append(System.lineSeparator()).append("  manifest: ").append(path));
        }
        if (!result.parseWarnings().isEmpty() || !result.validationFailures().isEmpty()) {
            text.append(System.lineSeparator()).append("  skipped: ")
                .append(result.parseWarnings().size()).append(" parse warning(s), ")
                .append(result.validationFailures().size()).append(" validation failure(s)");
        }
        return text.toString();
    }
}
