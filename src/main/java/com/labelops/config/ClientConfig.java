package com.labelops.config;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * One client's section of the configuration document.
 *
 * @param services     rules in configured priority order
 * @param templatePath optional template override, {@code null} for the shared template
 * @param folders      folder overrides as written in the document; absent kinds use the convention
 */
public record ClientConfig(String clientId,
                           String displayName,
                           ClientDefaults defaults,
                           List<ServiceRule> services,
                           TemplateMapping mapping,
                           String templatePath,
                           Map<FolderKind, String> folders) {

    public ClientConfig {
        Objects.requireNonNull(clientId, "clientId");
        defaults = defaults == null ? new ClientDefaults(null, null, null, null) : defaults;
        services = services == null ? List.of() : List.copyOf(services);
        mapping = mapping == null ? new TemplateMapping(Map.of()) : mapping;
        templatePath = templatePath == null || templatePath.isBlank() ? null : templatePath.trim();
        EnumMap<FolderKind, String> copy = new EnumMap<>(FolderKind.class);
        if (folders != null) {
            folders.forEach((kind, value) -> {
                if (value != null && !value.isBlank()) {
                    copy.put(kind, value.trim());
                }
            });
        }
        folders = Collections.unmodifiableMap(copy);
    }

    public String displayNameOrId() {
        return displayName == null || displayName.isBlank() ? clientId : displayName;
    }

    public Optional<ServiceRule> defaultRule() {
        return services.stream().filter(ServiceRule::isDefault).findFirst();
    }
}
