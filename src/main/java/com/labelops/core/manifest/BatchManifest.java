package com.labelops.core.manifest;

import com.labelops.core.ai.AiSummary;

import org.json.JSONArray;
import org.json.JSONObject;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Instant;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Audit record of one batch. Only file names, hashes and counts are kept; raw text and address
 * values never enter a manifest.
 */
public record BatchManifest(String batchId,
                            Instant createdUtc,
                            String clientId,
                            String source,
                            List<String> inputFiles,
                            String inputTextSha256,
                            String outputXlsx,
                            String trackingCsv,
                            int recordCount,
                            Map<String, Object> defaultsUsed,
                            Map<String, Integer> servicesUsed,
                            int parseWarningCount,
                            int validationFailureCount,
                            AiSummary ai,
                            long configVersion,
                            List<String> notes) {

    public static final String MANIFEST_VERSION = "1.0";

    public BatchManifest {
        Objects.requireNonNull(batchId, "batchId");
        Objects.requireNonNull(createdUtc, "createdUtc");
        Objects.requireNonNull(clientId, "clientId");
        Objects.requireNonNull(ai, "ai");
        inputFiles = inputFiles == null ? List.of() : List.copyOf(inputFiles);
        defaultsUsed = defaultsUsed == null ? Map.of() : new LinkedHashMap<>(defaultsUsed);
        servicesUsed = servicesUsed == null ? Map.of() : new LinkedHashMap<>(servicesUsed);
        notes = notes == null ? List.of() : List.copyOf(notes);
    }

    public static String sha256Hex(String text) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(text.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException ex) {
            throw new IllegalStateException("SHA-256 not available", ex);
        }
    }

    public JSONObject toJson() {
        JSONObject root = new JSONObject();
        root.put("manifest_version", MANIFEST_VERSION);
        root.put("batch_id", batchId);
        root.put("created_utc", createdUtc.toString());
        root.put("client_id", clientId);
        root.put("source", source);
        root.put("input_files", new JSONArray(inputFiles));
        root.put("input_text_sha256", inputTextSha256);
        root.put("output_xlsx", outputXlsx == null ? "" : outputXlsx);
        root.put("tracking_csv", trackingCsv == null ? "" : trackingCsv);
        root.put("record_count", recordCount);

        JSONObject defaults = new JSONObject();
        defaultsUsed.forEach((key, value) -> defaults.put(key, value == null ? JSONObject.NULL : value));
        root.put("defaults_used", defaults);

        JSONObject services = new JSONObject();
        servicesUsed.forEach(services::put);
        root.put("services_used", services);

        root.put("parse_warning_count", parseWarningCount);
        root.put("validation_failure_count", validationFailureCount);
        root.put("config_version", configVersion);

        JSONObject aiJson = new JSONObject();
        aiJson.put("enabled", ai.enabled());
        aiJson.put("auto_apply_max_risk", ai.maxRisk().key());
        aiJson.put("calls", ai.calls());
        aiJson.put("applied_count", ai.applied());
        aiJson.put("flagged_count", ai.flagged());
        aiJson.put("unavailable_count", ai.unavailable());
        aiJson.put("skipped_over_budget", ai.skippedOverBudget());
        root.put("ai", aiJson);

        root.put("notes", new JSONArray(notes));
        return root;
    }
}
