package com.labelops.config;

import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;

class LabelOpsEnvironmentTest {

    @Test
    void layoutFollowsTheRoot() {
        LabelOpsEnvironment environment = LabelOpsEnvironment.rootedAt(Path.of("/srv/labelops"));

        assertEquals(Path.of("/srv/labelops/config/clients.yaml"), environment.configFile());
        assertEquals(Path.of("/srv/labelops/Logs"), environment.logDirectory());
        assertEquals(Path.of("/srv/labelops/config/telegram_allowlist.json"), environment.allowlistFile());
        assertEquals(Path.of("/srv/labelops/Clients"), environment.clientsRoot());
        assertEquals(Path.of("/srv/labelops/assets/ClickDrop_import_template_no_header.xlsx"),
            environment.defaultTemplate());
    }

    @Test
    void environmentVariablesOverrideDefaults() {
        Map<String, String> variables = Map.of(
            "LABELOPS_ROOT", "/data/labels",
            "LABELOPS_LOG_DIR", " /var/log/labelops ");

        LabelOpsEnvironment environment = LabelOpsEnvironment.from(variables::get);

        assertEquals(Path.of("/data/labels"), environment.root());
        assertEquals(Path.of("/var/log/labelops"), environment.logDirectory());
        assertEquals(Path.of("/data/labels/config/clients.yaml"), environment.configFile());
    }

    @Test
    void logDirectoryOverride() {
        LabelOpsEnvironment environment = LabelOpsEnvironment.rootedAt(Path.of("/srv/labelops"));

        assertSame(environment, environment.withLogDirectory(null));
        assertEquals(Path.of("/tmp/logs"), environment.withLogDirectory(Path.of("/tmp/logs")).logDirectory());
    }
}
