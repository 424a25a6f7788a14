package com.labelops.config;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ClientConfigValidatorTest {

    private static ClientConfig client(String id, List<ServiceRule> services, TemplateMapping mapping) {
        return new ClientConfig(id, "Shop", new ClientDefaults("Tracked 48", 0.5, null, null),
            services, mapping, null, Map.of());
    }

    @Test
    void acceptsCompleteClient() {
        ClientConfigSet configs = new ClientConfigSet(1, null, List.of(
            client("client_01", List.of(ServiceRule.tagged("Tracked 24", "EXPRESS"), ServiceRule.fallback("Tracked 48")),
                TemplateMapping.clickAndDrop())));

        assertDoesNotThrow(() -> ClientConfigValidator.validate(configs));
    }

    @Test
    void requiresExactlyOneDefaultRule() {
        ClientConfigSet none = new ClientConfigSet(1, null, List.of(
            client("client_01", List.of(ServiceRule.tagged("Tracked 24", "EXPRESS")), TemplateMapping.clickAndDrop())));

        List<String> violations = ClientConfigValidator.violations(none);

        assertEquals(List.of("Client client_01: no default service rule; exactly one is required."), violations);
    }

    @Test
    void tagRulesNeedATag() {
        ClientConfigSet configs = new ClientConfigSet(1, null, List.of(
            client("client_01", List.of(ServiceRule.tagged("Tracked 24", " "), ServiceRule.fallback("Tracked 48")),
                TemplateMapping.clickAndDrop())));

        List<String> violations = ClientConfigValidator.violations(configs);

        assertEquals(List.of("Client client_01: service entry 1 tag trigger missing tag."), violations);
    }

    @Test
    void mappingColumnsMustBePositive() {
        TemplateMapping mapping = TemplateMapping.clickAndDrop().with(MappingField.POSTCODE, 0);
        ClientConfigSet configs = new ClientConfigSet(1, null, List.of(
            client("client_01", List.of(ServiceRule.fallback("Tracked 48")), mapping)));

        List<String> violations = ClientConfigValidator.violations(configs);

        assertEquals(1, violations.size());
        assertTrue(violations.get(0).contains("'postcode' must be an integer >= 1"));
    }

    @Test
    void missingMappingFieldsAreListedSorted() {
        TemplateMapping mapping = TemplateMapping.clickAndDrop()
            .with(MappingField.WEIGHT_KG, null)
            .with(MappingField.COUNTY, null);
        ClientConfigSet configs = new ClientConfigSet(1, null, List.of(
            client("client_01", List.of(ServiceRule.fallback("Tracked 48")), mapping)));

        List<String> violations = ClientConfigValidator.violations(configs);

        assertEquals(List.of("Client client_01: template_mapping missing fields: county, weight_kg"), violations);
    }
}
