package com.labelops.daemon;

import com.labelops.config.ConfigStore;
import com.labelops.config.EffectiveSettings;
import com.labelops.config.FolderKind;
import com.labelops.config.UnknownClientException;
import com.labelops.core.pipeline.BatchRequest;
import com.labelops.core.pipeline.BatchResult;
import com.labelops.core.pipeline.BatchSource;
import com.labelops.core.pipeline.PipelineRunner;
import com.labelops.logging.AppLogger;
import com.labelops.logging.LogRedactor;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Watches client inboxes and feeds settled files, one at a time and in arrival order, through the
 * pipeline. Processed inputs go to the client's archive; failing ones are quarantined and the
 * watcher carries on.
 */
public final class DaemonWatcher {
    private static final Logger LOGGER = AppLogger.get();
    static final String TELEGRAM_FILE_PREFIX = "telegram_";

    private final ConfigStore configStore;
    private final PipelineRunner pipeline;
    private final FailureHandler failureHandler;
    private final WatcherOptions options;
    private final WatcherListener listener;
    private final FolderScanner scanner;
    private final Clock clock;

    private final BlockingQueue<PendingFile> queue = new LinkedBlockingQueue<>();
    private final Set<Path> known = ConcurrentHashMap.newKeySet();
    private final Map<String, WatchState> states = new ConcurrentHashMap<>();

    private volatile boolean running;
    private Thread scannerThread;
    private Thread workerThread;

    public DaemonWatcher(ConfigStore configStore,
                         PipelineRunner pipeline,
                         FailureHandler failureHandler,
                         WatcherOptions options,
                         WatcherListener listener,
                         Clock clock) {
        this.configStore = Objects.requireNonNull(configStore, "configStore");
        this.pipeline = Objects.requireNonNull(pipeline, "pipeline");
        this.failureHandler = Objects.requireNonNull(failureHandler, "failureHandler");
        this.options = Objects.requireNonNull(options, "options");
        this.listener = listener == null ? WatcherListener.NONE : listener;
        this.clock = Objects.requireNonNull(clock, "clock");
        this.scanner = new FolderScanner(options.settle(), clock);
    }

    public synchronized void start() {
        if (running) {
            return;
        }
        running = true;
        scannerThread = new Thread(this::scanLoop, "labelops-scanner");
        scannerThread.setDaemon(true);
        workerThread = new Thread(this::workLoop, "labelops-worker");
        scannerThread.start();
        workerThread.start();
        LOGGER.info("Daemon watching %s (poll %ds, recursive=%s)".formatted(
            watchedClients(), options.pollInterval().toSeconds(), options.recursive()));
    }

    /**
     * Stops queueing new files and waits for the file in flight. Queued files stay in their inbox
     * for the next run.
     */
    public void stop() throws InterruptedException {
        Thread scan;
        Thread work;
        synchronized (this) {
            if (!running) {
                return;
            }
            running = false;
            scan = scannerThread;
            work = workerThread;
        }
        scan.interrupt();
        scan.join(TimeUnit.SECONDS.toMillis(5));
        work.join();
        LOGGER.info("Daemon stopped; %d file(s) left queued".formatted(queue.size()));
    }

    public boolean isRunning() {
        return running;
    }

    public WatchState state(String clientId) {
        return states.getOrDefault(clientId, WatchState.IDLE);
    }

    int queuedCount() {
        return queue.size();
    }

    /**
     * Reloads changed configuration, then queues every settled inbox file not seen before.
     *
     * @return number of files queued by this poll
     */
    public int pollOnce() {
        configStore.reloadIfChanged();
        known.removeIf(path -> !Files.exists(path));

        List<PendingFile> found = new ArrayList<>();
        for (String clientId : watchedClients()) {
            try {
                EffectiveSettings settings = configStore.resolve(clientId);
                Files.createDirectories(settings.folders().inTxt());
                found.addAll(scanner.settledFiles(clientId, settings.folders().inTxt(), options.recursive()));
            } catch (UnknownClientException ex) {
                LOGGER.warning("Not watching %s: no longer configured".formatted(ex.getClientId()));
            } catch (IOException ex) {
                LOGGER.warning("Inbox scan failed for %s: %s".formatted(clientId, ex.getMessage()));
            }
        }
        found.sort(PendingFile.ARRIVAL_ORDER);

        int queued = 0;
        for (PendingFile file : found) {
            if (!known.add(file.path())) {
                continue;
            }
            queue.add(file);
            queued++;
            setState(file.clientId(), WatchState.DETECTED);
            LOGGER.info("Queued %s for %s".formatted(file.path().getFileName(), file.clientId()));
            listener.onDetected(file.clientId(), file.path());
        }
        return queued;
    }

    /**
     * Processes the next queued file, waiting up to {@code timeout} for one to arrive.
     *
     * @return {@code false} when nothing was queued
     */
    public boolean processNext(Duration timeout) throws InterruptedException {
        PendingFile file = queue.poll(timeout.toMillis(), TimeUnit.MILLISECONDS);
        if (file == null) {
            return false;
        }
        process(file);
        return true;
    }

    private void process(PendingFile file) {
        String clientId = file.clientId();
        Path input = file.path();
        if (!Files.exists(input)) {
            LOGGER.warning("%s disappeared before processing".formatted(input.getFileName()));
            setState(clientId, WatchState.IDLE);
            return;
        }

        setState(clientId, WatchState.PROCESSING);
        listener.onProcessingStarted(clientId, input);
        Path failuresDir = configStore.environment().clientsRoot()
            .resolve(clientId)
            .resolve(FolderKind.FAILURES.defaultDirectoryName());
        try {
            EffectiveSettings settings = configStore.resolve(clientId);
            failuresDir = settings.folders().failures();
            String rawText = Files.readString(input, StandardCharsets.UTF_8);
            BatchRequest request = BatchRequest.builder(settings, rawText, sourceOf(input))
                .inputFiles(List.of(input.getFileName().toString()))
                .useAi(options.useAi())
                .maxRisk(options.maxRisk())
                .maxAiCalls(options.maxAiCalls())
                .build();
            BatchResult result = pipeline.run(request);
            Path archived = FileMoves.moveUnique(input, settings.folders().archive(), clock);
            LOGGER.info("Archived %s as %s (%d record(s))".formatted(
                input.getFileName(), archived.getFileName(), result.recordCount()));
            setState(clientId, WatchState.IDLE);
            listener.onArchived(clientId, input, archived, result);
        } catch (Exception ex) {
            LOGGER.log(Level.WARNING, "Processing %s for %s failed: %s".formatted(
                input.getFileName(), clientId, LogRedactor.redact(ex.getMessage())), ex);
            quarantine(clientId, input, failuresDir, ex);
        }
    }

    private void quarantine(String clientId, Path input, Path failuresDir, Exception cause) {
        try {
            Path quarantined = failureHandler.quarantine(clientId, input, failuresDir, cause);
            setState(clientId, WatchState.QUARANTINED);
            listener.onQuarantined(clientId, input, quarantined, cause);
        } catch (IOException ex) {
            // the input stays in the inbox and in the known set, so it is not retried in a loop
            LOGGER.log(Level.SEVERE, "Could not quarantine %s for %s".formatted(input.getFileName(), clientId), ex);
            setState(clientId, WatchState.QUARANTINED);
        }
    }

    private void scanLoop() {
        while (running) {
            try {
                pollOnce();
            } catch (RuntimeException ex) {
                LOGGER.log(Level.SEVERE, "Inbox poll failed", ex);
            }
            try {
                Thread.sleep(options.pollInterval().toMillis());
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
                return;
            }
        }
    }

    private void workLoop() {
        while (running) {
            try {
                processNext(Duration.ofMillis(500));
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
                return;
            } catch (RuntimeException ex) {
                LOGGER.log(Level.SEVERE, "Worker error", ex);
            }
        }
    }

    private List<String> watchedClients() {
        return options.clientIds().isEmpty()
            ? List.copyOf(configStore.current().clientIds())
            : options.clientIds();
    }

    private void setState(String clientId, WatchState state) {
        WatchState previous = states.put(clientId, state);
        if (previous != state) {
            listener.onStateChanged(clientId, state);
        }
    }

    static BatchSource sourceOf(Path input) {
        return input.getFileName().toString().startsWith(TELEGRAM_FILE_PREFIX) ? BatchSource.TELEGRAM : BatchSource.WATCH;
    }
}
