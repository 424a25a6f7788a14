package com.labelops.config;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Checks a {@link ClientConfigSet} against the rules every client must satisfy.
 */
public final class ClientConfigValidator {
    public static final Pattern CLIENT_ID_PATTERN = Pattern.compile("^client_\\d{2}$");

    private ClientConfigValidator() {
    }

    public static void validate(ClientConfigSet configs) throws ConfigValidationException {
        List<String> violations = violations(configs);
        if (!violations.isEmpty()) {
            throw new ConfigValidationException(violations);
        }
    }

    public static List<String> violations(ClientConfigSet configs) {
        List<String> violations = new ArrayList<>(configs.readProblems());
        for (ClientConfig client : configs.clients()) {
            check(client, violations);
        }
        return violations;
    }

    private static void check(ClientConfig client, List<String> violations) {
        String id = client.clientId();
        if (!CLIENT_ID_PATTERN.matcher(id).matches()) {
            violations.add("Invalid client ID format: %s (expected client_NN).".formatted(id));
        }
        if (client.displayName() == null || client.displayName().isBlank()) {
            violations.add("Client %s: display_name is missing.".formatted(id));
        }

        ClientDefaults defaults = client.defaults();
        if (defaults.service() == null) {
            violations.add("Client %s: defaults missing 'service'.".formatted(id));
        }
        if (defaults.weightKg() == null) {
            violations.add("Client %s: defaults 'weight_kg' is missing or not a number.".formatted(id));
        } else if (!(defaults.weightKg() > 0)) {
            violations.add("Client %s: defaults 'weight_kg' must be positive.".formatted(id));
        }

        checkServices(client, violations);
        checkMapping(client, violations);
    }

    private static void checkServices(ClientConfig client, List<String> violations) {
        String id = client.clientId();
        List<ServiceRule> services = client.services();
        if (services.isEmpty()) {
            violations.add("Client %s: services must be a non-empty list.".formatted(id));
        }
        int index = 0;
        int defaults = 0;
        for (ServiceRule rule : services) {
            index++;
            if (rule.name().isEmpty()) {
                violations.add("Client %s: service entry %d missing name.".formatted(id, index));
            }
            if (rule.isDefault()) {
                defaults++;
            } else if (rule.trigger().tag() == null || rule.trigger().tag().isEmpty()) {
                violations.add("Client %s: service entry %d tag trigger missing tag.".formatted(id, index));
            }
        }
        if (defaults == 0) {
            violations.add("Client %s: no default service rule; exactly one is required.".formatted(id));
        } else if (defaults > 1) {
            violations.add("Client %s: %d default service rules; exactly one is allowed.".formatted(id, defaults));
        }
    }

    private static void checkMapping(ClientConfig client, List<String> violations) {
        String id = client.clientId();
        Map<MappingField, Integer> columns = client.mapping().columns();
        List<String> missing = MappingField.requiredFields().stream()
            .filter(field -> !columns.containsKey(field))
            .map(MappingField::key)
            .sorted()
            .collect(Collectors.toList());
        if (!missing.isEmpty()) {
            violations.add("Client %s: template_mapping missing fields: %s".formatted(id, String.join(", ", missing)));
        }
        columns.forEach((field, column) -> {
            if (column == null || column < 1) {
                violations.add("Client %s: template_mapping for '%s' must be an integer >= 1."
                    .formatted(id, field.key()));
            }
        });
    }
}
