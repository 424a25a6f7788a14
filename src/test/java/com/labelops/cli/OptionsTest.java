package com.labelops.cli;

import com.labelops.core.ai.RiskLevel;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class OptionsTest {

    @Test
    void daemonDefaults() throws Exception {
        DaemonOptions options = DaemonOptions.parse(List.of());

        assertTrue(options.clientIds().isEmpty());
        assertTrue(options.useTelegram());
        assertFalse(options.useAi());
        assertEquals(RiskLevel.LOW, options.maxRisk());
        assertEquals(50, options.maxAiCalls());
        assertFalse(options.recursive());
        assertNull(options.logDir());
        assertEquals(DaemonOptions.DEFAULT_POLL_SECONDS, options.pollSeconds());
    }

    @Test
    void daemonAcceptsBothValueForms() throws Exception {
        DaemonOptions options = DaemonOptions.parse(List.of(
            "--clients=CLIENT_01, client_02", "--use-telegram", "0", "--use-ai=1",
            "--auto-apply-max-risk", "Medium", "--max-ai-calls", "0", "--log-dir", "/var/log/labelops"));

        assertEquals(List.of("client_01", "client_02"), options.clientIds());
        assertFalse(options.useTelegram());
        assertTrue(options.useAi());
        assertEquals(RiskLevel.MEDIUM, options.maxRisk());
        assertEquals(0, options.maxAiCalls());
        assertEquals(Path.of("/var/log/labelops"), options.logDir());
    }

    @Test
    void daemonRejectsBadValues() {
        assertThrows(UsageException.class, () -> DaemonOptions.parse(List.of("--use-ai", "yes")));
        assertThrows(UsageException.class, () -> DaemonOptions.parse(List.of("--auto-apply-max-risk", "extreme")));
        assertThrows(UsageException.class, () -> DaemonOptions.parse(List.of("--max-ai-calls", "-1")));
        assertThrows(UsageException.class, () -> DaemonOptions.parse(List.of("--poll-seconds", "fast")));
        assertThrows(UsageException.class, () -> DaemonOptions.parse(List.of("--clients", ",")));
        assertThrows(UsageException.class, () -> DaemonOptions.parse(List.of("--verbose")));
        assertThrows(UsageException.class, () -> DaemonOptions.parse(List.of("--log-dir")));
        assertThrows(UsageException.class, () -> DaemonOptions.parse(List.of("client_01")));
    }

    @Test
    void processNeedsClientAndInput() throws Exception {
        ProcessOptions options = ProcessOptions.parse(List.of("--client", "Client_01", "--input", "orders.txt", "--dry-run"));

        assertEquals("client_01", options.clientId());
        assertEquals(Path.of("orders.txt"), options.input());
        assertTrue(options.dryRun());
        assertFalse(options.useAi());

        UsageException missing = assertThrows(UsageException.class,
            () -> ProcessOptions.parse(List.of("--input", "orders.txt")));
        assertEquals("--client is required", missing.getMessage());
        assertThrows(UsageException.class, () -> ProcessOptions.parse(List.of("--client", "client_01")));
        assertThrows(UsageException.class,
            () -> ProcessOptions.parse(List.of("--client", "client_01", "--input", "a.txt", "--dry-run=1")));
    }
}
