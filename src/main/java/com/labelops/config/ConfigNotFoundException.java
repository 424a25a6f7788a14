package com.labelops.config;

import java.nio.file.Path;

public class ConfigNotFoundException extends ConfigException {
    private final Path path;

    public ConfigNotFoundException(Path path) {
        super("Config file not found: " + path);
        this.path = path;
    }

    public Path getPath() {
        return path;
    }
}
