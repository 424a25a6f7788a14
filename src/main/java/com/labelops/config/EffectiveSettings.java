package com.labelops.config;

import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

/**
 * Fully resolved settings handed to a single batch.
 */
public record EffectiveSettings(String clientId,
                                String displayName,
                                ClientDefaults defaults,
                                List<ServiceRule> services,
                                TemplateMapping mapping,
                                Path templatePath,
                                ClientFolders folders,
                                long configVersion) {

    public EffectiveSettings {
        Objects.requireNonNull(clientId, "clientId");
        Objects.requireNonNull(defaults, "defaults");
        Objects.requireNonNull(mapping, "mapping");
        Objects.requireNonNull(templatePath, "templatePath");
        Objects.requireNonNull(folders, "folders");
        services = services == null ? List.of() : List.copyOf(services);
    }
}
