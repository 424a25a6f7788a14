package com.labelops.config;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Objects;
import java.util.function.Function;

/**
 * Resolves the operational filesystem layout from system properties, environment variables and
 * the default root. System properties win over environment variables.
 */
public final class LabelOpsEnvironment {
    static final String ROOT_PROPERTY = "labelops.root";
    static final String CONFIG_PROPERTY = "labelops.config";
    static final String LOG_DIR_PROPERTY = "labelops.logDir";
    static final String ALLOWLIST_PROPERTY = "labelops.telegramAllowlist";

    public static final String DEFAULT_TEMPLATE_NAME = "ClickDrop_import_template_no_header.xlsx";

    private final Path root;
    private final Path configFile;
    private final Path logDirectory;
    private final Path allowlistFile;

    public LabelOpsEnvironment(Path root, Path configFile, Path logDirectory, Path allowlistFile) {
        this.root = Objects.requireNonNull(root, "root");
        this.configFile = configFile == null ? root.resolve("config").resolve("clients.yaml") : configFile;
        this.logDirectory = logDirectory == null ? root.resolve("Logs") : logDirectory;
        this.allowlistFile = allowlistFile == null
            ? root.resolve("config").resolve("telegram_allowlist.json")
            : allowlistFile;
    }

    public static LabelOpsEnvironment fromSystem() {
        return from(System::getenv);
    }

    static LabelOpsEnvironment from(Function<String, String> env) {
        String rootValue = firstNonBlank(System.getProperty(ROOT_PROPERTY), env.apply("LABELOPS_ROOT"));
        Path root = rootValue != null
            ? Paths.get(rootValue)
            : Paths.get(System.getProperty("user.home"), "LabelOps");
        return new LabelOpsEnvironment(
            root,
            toPath(firstNonBlank(System.getProperty(CONFIG_PROPERTY), env.apply("LABELOPS_CONFIG"))),
            toPath(firstNonBlank(System.getProperty(LOG_DIR_PROPERTY), env.apply("LABELOPS_LOG_DIR"))),
            toPath(firstNonBlank(System.getProperty(ALLOWLIST_PROPERTY), env.apply("LABELOPS_TELEGRAM_ALLOWLIST")))
        );
    }

    public static LabelOpsEnvironment rootedAt(Path root) {
        return new LabelOpsEnvironment(root, null, null, null);
    }

    public Path root() {
        return root;
    }

    public Path configFile() {
        return configFile;
    }

    public Path logDirectory() {
        return logDirectory;
    }

    public Path allowlistFile() {
        return allowlistFile;
    }

    public Path clientsRoot() {
        return root.resolve("Clients");
    }

    public Path defaultTemplate() {
        return root.resolve("assets").resolve(DEFAULT_TEMPLATE_NAME);
    }

    public LabelOpsEnvironment withLogDirectory(Path override) {
        if (override == null) {
            return this;
        }
        return new LabelOpsEnvironment(root, configFile, override, allowlistFile);
    }

    private static Path toPath(String value) {
        return value == null ? null : Paths.get(value);
    }

    private static String firstNonBlank(String... values) {
        for (String value : values) {
            if (value != null && !value.isBlank()) {
                return value.trim();
            }
        }
        return null;
    }
}
