package com.labelops.config;

import com.labelops.logging.AppLogger;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.attribute.FileTime;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.regex.Pattern;

/**
 * Owns the current {@link ClientConfigSet} snapshot. Reloads swap the whole snapshot so a batch
 * that already resolved its settings keeps the version it started with.
 */
public final class ConfigStore {
    private static final Logger LOGGER = AppLogger.get();
    private static final Pattern WINDOWS_ABSOLUTE = Pattern.compile("^[A-Za-z]:[\\\\/].*");

    private final LabelOpsEnvironment environment;
    private final AtomicReference<ClientConfigSet> current = new AtomicReference<>();
    private final AtomicLong versions = new AtomicLong();
    private volatile FileTime loadedModifiedTime;

    private ConfigStore(LabelOpsEnvironment environment) {
        this.environment = Objects.requireNonNull(environment, "environment");
    }

    /**
     * Loads and validates the configuration file named by the environment.
     */
    public static ConfigStore open(LabelOpsEnvironment environment) throws ConfigException {
        ConfigStore store = new ConfigStore(environment);
        store.reload();
        return store;
    }

    /**
     * Wraps an already built snapshot, for callers that do not read a file.
     */
    public static ConfigStore of(LabelOpsEnvironment environment, ClientConfigSet configs) throws ConfigValidationException {
        validate(configs);
        ConfigStore store = new ConfigStore(environment);
        store.versions.set(configs.version());
        store.current.set(configs);
        return store;
    }

    public static ClientConfigSet load(Path path) throws ConfigNotFoundException, ConfigParseException {
        return ClientConfigReader.toConfigSet(ClientConfigReader.readDocument(path), 1, path);
    }

    public static void validate(ClientConfigSet configs) throws ConfigValidationException {
        ClientConfigValidator.validate(configs);
    }

    public static EffectiveSettings resolve(ClientConfigSet configs,
                                            String clientId,
                                            LabelOpsEnvironment environment) throws UnknownClientException {
        ClientConfig client = configs.get(clientId);
        Path clientRoot = environment.clientsRoot().resolve(client.clientId());

        Map<FolderKind, Path> folders = new EnumMap<>(FolderKind.class);
        for (FolderKind kind : FolderKind.values()) {
            String override = client.folders().get(kind);
            folders.put(kind, override == null
                ? clientRoot.resolve(kind.defaultDirectoryName())
                : resolveAgainst(clientRoot, override));
        }

        Path template = client.templatePath() == null
            ? environment.defaultTemplate()
            : resolveAgainst(environment.root(), client.templatePath());

        return new EffectiveSettings(
            client.clientId(),
            client.displayNameOrId(),
            client.defaults(),
            client.services(),
            client.mapping(),
            template,
            new ClientFolders(
                folders.get(FolderKind.IN_TXT),
                folders.get(FolderKind.READY_XLSX),
                folders.get(FolderKind.ARCHIVE),
                folders.get(FolderKind.TRACKING_OUT),
                folders.get(FolderKind.FAILURES)
            ),
            configs.version()
        );
    }

    public LabelOpsEnvironment environment() {
        return environment;
    }

    public ClientConfigSet current() {
        return current.get();
    }

    public EffectiveSettings resolve(String clientId) throws UnknownClientException {
        return resolve(current(), clientId, environment);
    }

    /**
     * Reads, validates and publishes a new snapshot. The previous snapshot stays in place when
     * anything fails.
     */
    public synchronized ClientConfigSet reload() throws ConfigException {
        Path file = environment.configFile();
        FileTime modified = modifiedTime(file);
        ClientConfigSet loaded = load(file);
        validate(loaded);
        ClientConfigSet published = loaded.withVersion(versions.incrementAndGet());
        current.set(published);
        loadedModifiedTime = modified;
        LOGGER.info("Loaded client configuration v%d from %s (%d clients)"
            .formatted(published.version(), file, published.clientIds().size()));
        return published;
    }

    /**
     * Reloads when the configuration file changed on disk since the last successful load.
     *
     * @return {@code true} when a new snapshot was published
     */
    public boolean reloadIfChanged() {
        Path file = environment.configFile();
        FileTime modified = modifiedTime(file);
        if (modified == null || modified.equals(loadedModifiedTime)) {
            return false;
        }
        try {
            reload();
            return true;
        } catch (ConfigException ex) {
            loadedModifiedTime = modified;
            LOGGER.log(Level.SEVERE, "Keeping configuration v%d; reload failed: %s"
                .formatted(current().version(), ex.getMessage()));
            return false;
        }
    }

    private static Path resolveAgainst(Path base, String value) {
        if (WINDOWS_ABSOLUTE.matcher(value).matches()) {
            return Paths.get(value);
        }
        Path path = Paths.get(value);
        return path.isAbsolute() ? path : base.resolve(path);
    }

    private static FileTime modifiedTime(Path file) {
        try {
            return Files.exists(file) ? Files.getLastModifiedTime(file) : null;
        } catch (IOException ex) {
            return null;
        }
    }
}
