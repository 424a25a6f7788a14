package com.labelops.config;

import com.labelops.logging.AppLogger;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * Reads the YAML client configuration document into typed {@link ClientConfig}s.
 *
 * <p>Conversion is lenient: values of the wrong shape are kept as "missing" so that
 * {@link ClientConfigValidator} can report them together with every other violation.
 */
public final class ClientConfigReader {
    private static final Logger LOGGER = AppLogger.get();

    private ClientConfigReader() {
    }

    public static Map<String, Object> readDocument(Path path) throws ConfigNotFoundException, ConfigParseException {
        if (path == null || !Files.isRegularFile(path)) {
            throw new ConfigNotFoundException(path);
        }
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            return readDocument(reader);
        } catch (IOException ex) {
            throw new ConfigParseException("Unable to read config file " + path + ": " + ex.getMessage(), ex);
        }
    }

    public static Map<String, Object> readDocument(Reader reader) throws ConfigParseException {
        Object root;
        try {
            root = new Yaml(new SafeConstructor(new LoaderOptions())).load(reader);
        } catch (YAMLException ex) {
            throw new ConfigParseException("Malformed YAML in client configuration: " + ex.getMessage(), ex);
        }
        if (root == null) {
            return Map.of();
        }
        if (!(root instanceof Map<?, ?> map)) {
            throw new ConfigParseException("Config root must be a mapping of client IDs to settings.");
        }
        Map<String, Object> document = new LinkedHashMap<>();
        map.forEach((key, value) -> document.put(String.valueOf(key), value));
        return document;
    }

    public static ClientConfigSet toConfigSet(Map<String, Object> document, long version, Path source) {
        List<String> problems = new ArrayList<>();
        List<ClientConfig> clients = new ArrayList<>();
        document.forEach((clientId, section) -> {
            if (!(section instanceof Map<?, ?> map)) {
                problems.add("Client %s: configuration must be a mapping.".formatted(clientId));
                return;
            }
            clients.add(toClient(clientId, map, problems));
        });
        return new ClientConfigSet(version, source, clients, problems);
    }

    private static ClientConfig toClient(String clientId, Map<?, ?> section, List<String> problems) {
        String displayName = text(section.get("display_name"));
        ClientDefaults defaults = toDefaults(clientId, section.get("defaults"), problems);
        List<ServiceRule> services = toServices(clientId, section.get("services"), problems);

        Map<?, ?> legacyClickDrop = section.get("clickdrop") instanceof Map<?, ?> map ? map : Map.of();
        Object mappingSection = section.containsKey("template_mapping")
            ? section.get("template_mapping")
            : legacyClickDrop.get("column_mapping");
        TemplateMapping mapping = toMapping(clientId, mappingSection, problems);

        String templatePath = Optional.ofNullable(text(section.get("template_path")))
            .orElse(text(legacyClickDrop.get("template_path")));

        Map<FolderKind, String> folders = toFolders(clientId, section.get("folders"), problems);
        return new ClientConfig(clientId, displayName, defaults, services, mapping, templatePath, folders);
    }

    private static ClientDefaults toDefaults(String clientId, Object value, List<String> problems) {
        if (value == null) {
            return new ClientDefaults(null, null, null, null);
        }
        if (!(value instanceof Map<?, ?> defaults)) {
            problems.add("Client %s: defaults must be a mapping.".formatted(clientId));
            return new ClientDefaults(null, null, null, null);
        }
        return new ClientDefaults(
            text(defaults.get("service")),
            number(defaults.get("weight_kg")),
            text(defaults.get("country")),
            text(defaults.get("reference_prefix"))
        );
    }

    private static List<ServiceRule> toServices(String clientId, Object value, List<String> problems) {
        List<ServiceRule> rules = new ArrayList<>();
        if (value == null) {
            return rules;
        }
        if (!(value instanceof List<?> entries)) {
            problems.add("Client %s: services must be a list.".formatted(clientId));
            return rules;
        }
        int index = 0;
        for (Object entry : entries) {
            index++;
            if (!(entry instanceof Map<?, ?> service)) {
                problems.add("Client %s: service entry %d must be a mapping.".formatted(clientId, index));
                continue;
            }
            Object triggerValue = service.get("trigger");
            String type = triggerValue instanceof Map<?, ?> trigger ? text(trigger.get("type")) : null;
            if (type == null) {
                problems.add("Client %s: service entry %d missing trigger type.".formatted(clientId, index));
                continue;
            }
            ServiceTrigger trigger;
            switch (type.toLowerCase(Locale.ROOT)) {
                case "default" -> trigger = ServiceTrigger.byDefault();
                case "tag" -> trigger = ServiceTrigger.tag(text(((Map<?, ?>) triggerValue).get("tag")));
                default -> {
                    problems.add("Client %s: service entry %d has unknown trigger type '%s'."
                        .formatted(clientId, index, type));
                    continue;
                }
            }
            rules.add(new ServiceRule(text(service.get("name")), text(service.get("code")), trigger));
        }
        return rules;
    }

    private static TemplateMapping toMapping(String clientId, Object value, List<String> problems) {
        if (value == null) {
            return new TemplateMapping(Map.of());
        }
        if (!(value instanceof Map<?, ?> entries)) {
            problems.add("Client %s: template_mapping must be a mapping.".formatted(clientId));
            return new TemplateMapping(Map.of());
        }
        Map<MappingField, Integer> columns = new EnumMap<>(MappingField.class);
        entries.forEach((key, column) -> {
            Optional<MappingField> field = MappingField.fromKey(String.valueOf(key));
            if (field.isEmpty()) {
                LOGGER.fine("Ignoring unknown template_mapping field '%s' for %s".formatted(key, clientId));
                return;
            }
            // non-integer columns are kept as 0 so validation reports them
            columns.put(field.get(), column instanceof Integer integer ? integer : 0);
        });
        return new TemplateMapping(columns);
    }

    private static Map<FolderKind, String> toFolders(String clientId, Object value, List<String> problems) {
        Map<FolderKind, String> folders = new EnumMap<>(FolderKind.class);
        if (value == null) {
            return folders;
        }
        if (!(value instanceof Map<?, ?> entries)) {
            problems.add("Client %s: folders must be a mapping if provided.".formatted(clientId));
            return folders;
        }
        for (FolderKind kind : FolderKind.values()) {
            String folder = text(entries.get(kind.key()));
            if (folder != null) {
                folders.put(kind, folder);
            }
        }
        return folders;
    }

    private static String text(Object value) {
        if (value == null) {
            return null;
        }
        String text = String.valueOf(value).trim();
        return text.isEmpty() ? null : text;
    }

    private static Double number(Object value) {
        if (value instanceof Number number) {
            return number.doubleValue();
        }
        String text = text(value);
        if (text == null) {
            return null;
        }
        try {
            return Double.parseDouble(text);
        } catch (NumberFormatException ex) {
            return null;
        }
    }
}
