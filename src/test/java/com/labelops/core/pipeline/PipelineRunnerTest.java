package com.labelops.core.pipeline;

import com.labelops.TestFixtures;
import com.labelops.config.ConfigStore;
import com.labelops.config.EffectiveSettings;
import com.labelops.config.MappingField;
import com.labelops.core.ai.AddressCorrector;
import com.labelops.core.ai.AiSummary;
import com.labelops.core.ai.CorrectorUnavailableException;
import com.labelops.core.ai.NoopAddressCorrector;
import com.labelops.core.ai.RiskLevel;
import com.labelops.core.ai.Suggestion;
import com.labelops.core.manifest.BatchManifest;
import com.labelops.core.manifest.ManifestWriter;
import com.labelops.core.output.ClickDropWorkbookWriter;
import com.labelops.core.output.OutputWriteException;
import com.labelops.core.output.TrackingCsvWriter;
import org.json.JSONObject;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PipelineRunnerTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2026-10-19T08:30:00Z"), ZoneOffset.UTC);
    private static final String TEXT = TestFixtures.GRACE + "\n\nEXPRESS\n" + TestFixtures.MARTIN + "\n\nLonely line\n";

    @TempDir
    Path root;

    private ConfigStore store;
    private EffectiveSettings settings;
    private Path manifests;

    @BeforeEach
    void setUp() throws Exception {
        store = TestFixtures.store(root);
        settings = store.resolve("client_01");
        manifests = root.resolve("Logs").resolve("manifests");
    }

    private PipelineRunner runner(AddressCorrector corrector) {
        return new PipelineRunner(corrector, new ClickDropWorkbookWriter(), new TrackingCsvWriter(),
            new ManifestWriter(), manifests, CLOCK);
    }

    private BatchRequest.Builder request(String text) {
        return BatchRequest.builder(settings, text, BatchSource.CLI).inputFiles(List.of("orders.txt"));
    }

    @Test
    void producesWorkbookTrackingFileAndManifest() throws Exception {
        BatchResult result = runner(NoopAddressCorrector.INSTANCE).run(request(TEXT).build());

        assertEquals(2, result.recordCount());
        assertEquals(1, result.parseWarnings().size());
        assertEquals(3, result.parseWarnings().get(0).blockIndex());
        assertEquals(Map.of("Royal Mail Tracked 48", 1, "Royal Mail Tracked 24", 1), result.servicesUsed());
        assertTrue(Files.isRegularFile(result.outputXlsx()));
        assertTrue(Files.isRegularFile(result.trackingCsv()));
        assertEquals(settings.folders().readyXlsx(), result.outputXlsx().getParent());
        assertEquals(settings.folders().trackingOut(), result.trackingCsv().getParent());
        String baseName = "client_01_20261019_083000_" + result.batchId().substring(0, 8);
        assertEquals(baseName + ".xlsx", result.outputXlsx().getFileName().toString());
        assertEquals(baseName + "_tracking.csv", result.trackingCsv().getFileName().toString());
        assertEquals(32, result.batchId().length());

        List<String> csv = Files.readAllLines(result.trackingCsv(), StandardCharsets.UTF_8);
        assertEquals("Grace O'Neil,AB53 8HY,Royal Mail Tracked 48,0.5,ACME-1,,No", csv.get(1));
        assertEquals("Martin Wilkie,CF64 4BU,Royal Mail Tracked 24,0.5,ACME-2,,No", csv.get(2));

        Path manifestPath = result.manifest().orElseThrow();
        assertEquals(manifests, manifestPath.getParent());
        JSONObject manifest = new JSONObject(Files.readString(manifestPath));
        assertEquals(result.batchId(), manifest.getString("batch_id"));
        assertEquals("client_01", manifest.getString("client_id"));
        assertEquals("cli", manifest.getString("source"));
        assertEquals(BatchManifest.sha256Hex(TEXT), manifest.getString("input_text_sha256"));
        assertEquals(result.inputTextSha256(), manifest.getString("input_text_sha256"));
        assertEquals(2, manifest.getInt("record_count"));
        assertEquals(1, manifest.getInt("parse_warning_count"));
        assertEquals(1L, manifest.getLong("config_version"));
        assertEquals(result.outputXlsx().getFileName().toString(), manifest.getString("output_xlsx"));
        assertFalse(manifest.getJSONObject("ai").getBoolean("enabled"));
    }

    @Test
    void manifestCarriesNoAddressContent() throws Exception {
        BatchResult result = runner(NoopAddressCorrector.INSTANCE).run(request(TEXT).build());

        String manifest = Files.readString(result.manifest().orElseThrow());
        for (String value : List.of("Grace", "Martin", "Stonehaven", "AB53", "CF64", "Riverside", "Lonely")) {
            assertFalse(manifest.contains(value), value + " leaked into the manifest");
        }
    }

    @Test
    void dryRunReportsTheSameOutcomeAndWritesNothing() throws Exception {
        BatchResult real = runner(NoopAddressCorrector.INSTANCE).run(request(TEXT).build());
        Files.delete(real.outputXlsx());
        Files.delete(real.trackingCsv());
        Files.delete(real.manifest().orElseThrow());

        BatchResult dry = runner(NoopAddressCorrector.INSTANCE).run(request(TEXT).dryRun(true).build());

        assertTrue(dry.dryRun());
        assertEquals(real.recordCount(), dry.recordCount());
        assertEquals(real.servicesUsed(), dry.servicesUsed());
        assertEquals(real.parseWarnings(), dry.parseWarnings());
        assertEquals(real.inputTextSha256(), dry.inputTextSha256());
        assertTrue(dry.manifest().isEmpty());
        assertFalse(Files.exists(dry.outputXlsx()));
        assertFalse(Files.exists(dry.trackingCsv()));
        try (var files = Files.list(manifests)) {
            assertEquals(0, files.count());
        }
    }

    @Test
    void invalidRecordsAreDroppedAndReported() throws Exception {
        BatchResult result = runner(NoopAddressCorrector.INSTANCE)
            .run(request(TestFixtures.GRACE + "\n\nJane Doe\n1 Road").build());

        assertEquals(1, result.recordCount());
        assertEquals(1, result.validationFailures().size());
        ValidationFailure failure = result.validationFailures().get(0);
        assertEquals(2, failure.blockIndex());
        assertTrue(failure.problems().contains("postcode missing"));
        assertTrue(failure.problems().contains("town_city missing"));
    }

    @Test
    void batchWithoutValidRecordsFailsAndWritesNothing() {
        EmptyBatchException ex = assertThrows(EmptyBatchException.class,
            () -> runner(NoopAddressCorrector.INSTANCE).run(request("Lonely line\n\nJane Doe\n1 Road").build()));

        assertEquals(1, ex.getParseWarnings());
        assertEquals(1, ex.getValidationFailures());
        assertFalse(Files.exists(settings.folders().readyXlsx()));
        assertFalse(Files.exists(manifests));
    }

    @Test
    void missingTemplateFailsTheBatch() throws Exception {
        Files.delete(settings.templatePath());

        assertThrows(OutputWriteException.class,
            () -> runner(NoopAddressCorrector.INSTANCE).run(request(TestFixtures.GRACE).build()));
        assertFalse(Files.exists(settings.folders().trackingOut()));
    }

    @Test
    void trackingFailureLeavesNoWorkbookBehind() throws Exception {
        Path trackingOut = settings.folders().trackingOut();
        Files.createDirectories(trackingOut.getParent());
        Files.writeString(trackingOut, "not a directory");

        assertThrows(OutputWriteException.class,
            () -> runner(NoopAddressCorrector.INSTANCE).run(request(TestFixtures.GRACE).build()));

        Path readyXlsx = settings.folders().readyXlsx();
        if (Files.exists(readyXlsx)) {
            try (var files = Files.list(readyXlsx)) {
                assertEquals(List.of(), files.collect(Collectors.toList()));
            }
        }
        assertFalse(Files.exists(manifests));
    }

    @Test
    void commaSeparatedSingleLineBlocksBecomeRecords() throws Exception {
        String text = "Grace O'Neil, Flat 2, 10 High Street, Stonehaven, Aberdeenshire, AB538HY, UK\n\n"
            + "Martin Wilkie, Unit 7, Riverside Estate, Dock Road, Barry, CF644BU, United Kingdom";

        BatchResult result = runner(NoopAddressCorrector.INSTANCE).run(request(text).build());

        assertEquals(2, result.recordCount());
        assertTrue(result.parseWarnings().isEmpty());
        List<String> csv = Files.readAllLines(result.trackingCsv(), StandardCharsets.UTF_8);
        assertEquals("Grace O'Neil,AB53 8HY,Royal Mail Tracked 48,0.5,ACME-1,,No", csv.get(1));
        assertEquals("Martin Wilkie,CF64 4BU,Royal Mail Tracked 48,0.5,ACME-2,,No", csv.get(2));
    }

    @Test
    void misspeltCountryIsSentForReview() throws Exception {
        List<String> seenCountries = new ArrayList<>();
        AddressCorrector corrector = record -> {
            seenCountries.add(record.country());
            return List.of(new Suggestion(MappingField.COUNTRY, "UNITED KINGDOM", 0.95, RiskLevel.LOW, "spelling"));
        };

        BatchResult result = runner(corrector)
            .run(request("Jane Doe\n1 Road\nLondon\nSW1A 2AA\nUnited Kingsom").useAi(true).build());

        assertEquals(List.of("UNITED KINGSOM"), seenCountries);
        assertEquals(1, result.aiSummary().applied());
        assertEquals(1, result.recordCount());
    }

    @Test
    void manifestFailureKeepsBatchOutputs() throws Exception {
        Files.createDirectories(manifests.getParent());
        Files.writeString(manifests, "not a directory");

        BatchResult result = runner(NoopAddressCorrector.INSTANCE).run(request(TestFixtures.GRACE).build());

        assertTrue(result.manifest().isEmpty());
        assertTrue(Files.isRegularFile(result.outputXlsx()));
        assertTrue(Files.isRegularFile(result.trackingCsv()));
    }

    @Test
    void lowRiskSuggestionsAreAppliedAndOthersFlagged() throws Exception {
        AddressCorrector corrector = record -> List.of(
            new Suggestion(MappingField.POSTCODE, "sw1a2aa", 0.9, RiskLevel.LOW, "lookup"),
            new Suggestion(MappingField.COUNTY, "Greater London", 0.5, RiskLevel.HIGH, "guess"));

        BatchResult result = runner(corrector).run(request("Jane Doe\n1 Road\nLondon").useAi(true).build());

        assertEquals(1, result.recordCount());
        assertEquals(new AiSummary(true, RiskLevel.LOW, 1, 1, 1, 0, 0), result.aiSummary());
        List<String> csv = Files.readAllLines(result.trackingCsv(), StandardCharsets.UTF_8);
        assertEquals("Jane Doe,SW1A 2AA,Royal Mail Tracked 48,0.5,ACME-1,AI review: county (high),Yes", csv.get(1));
    }

    @Test
    void higherCeilingAppliesMoreSuggestions() throws Exception {
        AddressCorrector corrector = record -> List.of(
            new Suggestion(MappingField.POSTCODE, "SW1A 2AA", 0.9, RiskLevel.MEDIUM, "lookup"));

        BatchResult result = runner(corrector)
            .run(request("Jane Doe\n1 Road\nLondon").useAi(true).maxRisk(RiskLevel.MEDIUM).build());

        assertEquals(1, result.aiSummary().applied());
        assertEquals(0, result.aiSummary().flagged());
    }

    @Test
    void callBudgetLimitsCorrectorCalls() throws Exception {
        AtomicInteger calls = new AtomicInteger();
        AddressCorrector corrector = record -> {
            calls.incrementAndGet();
            return List.of(new Suggestion(MappingField.POSTCODE, "SW1A 2AA", 0.9, RiskLevel.LOW, "lookup"));
        };

        BatchResult result = runner(corrector).run(request("Jane Doe\n1 Road\nLondon\n\nJohn Roe\n2 Road\nLeeds")
            .useAi(true).maxAiCalls(1).build());

        assertEquals(1, calls.get());
        assertEquals(1, result.aiSummary().calls());
        assertEquals(1, result.aiSummary().skippedOverBudget());
        assertEquals(1, result.recordCount());
        assertEquals(1, result.validationFailures().size());
    }

    @Test
    void unavailableCorrectorLeavesRecordsUnchanged() throws Exception {
        AddressCorrector corrector = record -> {
            throw new CorrectorUnavailableException("timed out");
        };

        BatchResult result = runner(corrector)
            .run(request("Jane Doe\n1 Road\nLond?n\nSW1A 2AA").useAi(true).build());

        assertEquals(1, result.recordCount());
        assertEquals(1, result.aiSummary().unavailable());
        assertEquals(0, result.aiSummary().applied());
        assertTrue(Files.readAllLines(result.trackingCsv()).get(1).endsWith(",No"));
    }

    @Test
    void correctorIsNotCalledWhenAiIsOff() throws Exception {
        AtomicInteger calls = new AtomicInteger();
        AddressCorrector corrector = record -> {
            calls.incrementAndGet();
            return List.of();
        };

        BatchResult result = runner(corrector).run(request("Jane Doe\n1 Road\nLondon\nSW1A 2AA").build());

        assertEquals(0, calls.get());
        assertEquals(AiSummary.disabled(RiskLevel.LOW), result.aiSummary());
    }

    @Test
    void batchesOfOneClientDoNotOverlap() throws Exception {
        AtomicInteger active = new AtomicInteger();
        AtomicInteger maxActive = new AtomicInteger();
        AddressCorrector corrector = record -> {
            maxActive.accumulateAndGet(active.incrementAndGet(), Math::max);
            try {
                Thread.sleep(100);
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
            }
            active.decrementAndGet();
            return List.of(new Suggestion(MappingField.POSTCODE, "SW1A 2AA", 0.9, RiskLevel.LOW, "lookup"));
        };
        PipelineRunner runner = runner(corrector);
        BatchRequest request = request("Jane Doe\n1 Road\nLondon").useAi(true).build();

        ExecutorService executor = Executors.newFixedThreadPool(3);
        List<Future<BatchResult>> futures = new ArrayList<>();
        try {
            for (int i = 0; i < 3; i++) {
                futures.add(executor.submit(() -> runner.run(request)));
            }
            List<String> ids = new ArrayList<>();
            for (Future<BatchResult> future : futures) {
                ids.add(future.get(10, TimeUnit.SECONDS).batchId());
            }
            assertNotEquals(ids.get(0), ids.get(1));
        } finally {
            executor.shutdownNow();
        }

        assertEquals(1, maxActive.get());
    }
}
