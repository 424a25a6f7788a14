package com.labelops.core.pipeline;

import com.labelops.config.EffectiveSettings;
import com.labelops.config.MappingField;
import com.labelops.config.ServiceRule;
import com.labelops.core.ai.AddressCorrector;
import com.labelops.core.ai.AiSummary;
import com.labelops.core.ai.CorrectorUnavailableException;
import com.labelops.core.ai.ReviewHeuristics;
import com.labelops.core.ai.Suggestion;
import com.labelops.core.manifest.BatchManifest;
import com.labelops.core.manifest.ManifestWriteException;
import com.labelops.core.manifest.ManifestWriter;
import com.labelops.core.output.ClickDropWorkbookWriter;
import com.labelops.core.output.OutputWriteException;
import com.labelops.core.output.StagedFile;
import com.labelops.core.output.TrackingCsvWriter;
import com.labelops.core.parse.AddressRecord;
import com.labelops.core.parse.ParseWarning;
import com.labelops.core.parse.ParsedBlock;
import com.labelops.core.parse.RecordParser;
import com.labelops.core.parse.UkPostcodes;
import com.labelops.core.service.ServiceMatcher;
import com.labelops.logging.AppLogger;
import com.labelops.logging.LogRedactor;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.logging.Logger;
import java.util.stream.Collectors;

/**
 * Runs one batch end to end: parse, service selection, optional AI review, validation, output
 * files and manifest. Batches of the same client never overlap; different clients run freely.
 */
public final class PipelineRunner {
    private static final Logger LOGGER = AppLogger.get();
    private static final DateTimeFormatter FILE_STAMP =
        DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss").withZone(ZoneOffset.UTC);

    private final AddressCorrector corrector;
    private final ClickDropWorkbookWriter workbookWriter;
    private final TrackingCsvWriter trackingWriter;
    private final ManifestWriter manifestWriter;
    private final Path manifestDirectory;
    private final Clock clock;
    private final Map<String, ReentrantLock> clientLocks = new ConcurrentHashMap<>();

    public PipelineRunner(AddressCorrector corrector, Path manifestDirectory) {
        this(corrector, new ClickDropWorkbookWriter(), new TrackingCsvWriter(), new ManifestWriter(),
            manifestDirectory, Clock.systemUTC());
    }

    public PipelineRunner(AddressCorrector corrector,
                          ClickDropWorkbookWriter workbookWriter,
                          TrackingCsvWriter trackingWriter,
                          ManifestWriter manifestWriter,
                          Path manifestDirectory,
                          Clock clock) {
        this.corrector = Objects.requireNonNull(corrector, "corrector");
        this.workbookWriter = Objects.requireNonNull(workbookWriter, "workbookWriter");
        this.trackingWriter = Objects.requireNonNull(trackingWriter, "trackingWriter");
        this.manifestWriter = Objects.requireNonNull(manifestWriter, "manifestWriter");
        this.manifestDirectory = Objects.requireNonNull(manifestDirectory, "manifestDirectory");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public BatchResult run(BatchRequest request) throws EmptyBatchException, OutputWriteException {
        Objects.requireNonNull(request, "request");
        ReentrantLock lock = clientLocks.computeIfAbsent(request.clientId(), id -> new ReentrantLock());
        lock.lock();
        try {
            return runLocked(request);
        } finally {
            lock.unlock();
        }
    }

    private BatchResult runLocked(BatchRequest request) throws EmptyBatchException, OutputWriteException {
        EffectiveSettings settings = request.settings();
        String batchId = UUID.randomUUID().toString().replace("-", "");
        Instant created = Instant.now(clock);
        LOGGER.info("Batch %s started for %s (source=%s, config v%d%s)".formatted(
            shortId(batchId), settings.clientId(), request.source().key(), settings.configVersion(),
            request.dryRun() ? ", dry run" : ""));

        List<ParseWarning> warnings = new ArrayList<>();
        List<Entry> entries = new ArrayList<>();
        RecordParser parser = new RecordParser(settings.defaults(), tags(settings.services()));
        for (ParsedBlock block : parser.parse(request.rawText())) {
            block.warning().ifPresent(warning -> {
                warnings.add(warning);
                LOGGER.warning("Batch %s skipped %s".formatted(shortId(batchId), warning));
            });
            if (block.record().isPresent()) {
                ServiceRule rule = ServiceMatcher.match(block.text(), settings.services());
                AddressRecord record = block.record().get().with(MappingField.SERVICE, rule.name());
                entries.add(new Entry(block.index(), record));
            }
        }

        AiSummary aiSummary = request.useAi()
            ? review(entries, request, batchId)
            : AiSummary.disabled(request.maxRisk());

        String prefix = settings.defaults().referencePrefix();
        if (prefix != null) {
            for (int i = 0; i < entries.size(); i++) {
                Entry entry = entries.get(i);
                if (entry.record.reference().isEmpty()) {
                    entries.set(i, entry.with(entry.record.with(MappingField.REFERENCE, prefix + (i + 1))));
                }
            }
        }

        List<ValidationFailure> failures = new ArrayList<>();
        List<AddressRecord> valid = new ArrayList<>();
        for (Entry entry : entries) {
            List<String> problems = RecordValidator.problems(entry.record);
            if (problems.isEmpty()) {
                valid.add(entry.record);
            } else {
                ValidationFailure failure = new ValidationFailure(entry.blockIndex, problems);
                failures.add(failure);
                LOGGER.warning("Batch %s dropped %s".formatted(shortId(batchId), failure));
            }
        }
        if (valid.isEmpty()) {
            throw new EmptyBatchException(settings.clientId(), warnings.size(), failures.size());
        }

        Map<String, Integer> servicesUsed = new LinkedHashMap<>();
        valid.forEach(record -> servicesUsed.merge(record.service(), 1, Integer::sum));

        String baseName = "%s_%s_%s".formatted(settings.clientId(), FILE_STAMP.format(created), shortId(batchId));
        String inputSha = BatchManifest.sha256Hex(request.rawText());
        Path xlsx = settings.folders().readyXlsx().resolve(baseName + ".xlsx");
        Path csv = settings.folders().trackingOut().resolve(baseName + "_tracking.csv");
        Path manifestPath = null;

        if (!request.dryRun()) {
            writeOutputs(valid, settings, xlsx, csv);
            BatchManifest manifest = new BatchManifest(
                batchId,
                created,
                settings.clientId(),
                request.source().key(),
                request.inputFiles(),
                inputSha,
                xlsx.getFileName().toString(),
                csv.getFileName().toString(),
                valid.size(),
                settings.defaults().asMap(),
                servicesUsed,
                warnings.size(),
                failures.size(),
                aiSummary,
                settings.configVersion(),
                manifestNotes(warnings, failures));
            try {
                manifestPath = manifestWriter.write(manifest, manifestDirectory);
            } catch (ManifestWriteException ex) {
                LOGGER.severe("Batch %s manifest not written: %s".formatted(shortId(batchId), LogRedactor.redact(
                    ex.getCause() == null ? ex.getMessage() : ex.getCause().getMessage())));
            }
        }

        LOGGER.info("Batch %s finished for %s: %d record(s), %d warning(s), %d dropped, services %s%s".formatted(
            shortId(batchId), settings.clientId(), valid.size(), warnings.size(), failures.size(), servicesUsed,
            request.dryRun() ? " (dry run, nothing written)" : ""));

        return new BatchResult(
            batchId,
            settings.clientId(),
            valid.size(),
            xlsx,
            csv,
            manifestPath,
            aiSummary,
            warnings,
            failures,
            servicesUsed,
            inputSha,
            request.dryRun());
    }

    /**
     * Stages the workbook and the tracking CSV before either is renamed into place, so a batch
     * never leaves one without the other.
     */
    private void writeOutputs(List<AddressRecord> valid, EffectiveSettings settings, Path xlsx, Path csv)
            throws OutputWriteException {
        StagedFile workbook = workbookWriter.stage(valid, settings.mapping(), settings.templatePath(),
            xlsx.getParent(), xlsx.getFileName().toString());
        StagedFile tracking;
        try {
            tracking = trackingWriter.stage(valid, csv.getParent(), csv.getFileName().toString());
        } catch (OutputWriteException ex) {
            workbook.discard();
            throw ex;
        }
        StagedFile.commitAll(List.of(workbook, tracking));
    }

    /**
     * Sends records that need review to the corrector while the call budget lasts and applies
     * suggestions whose risk does not exceed the request's ceiling.
     */
    private AiSummary review(List<Entry> entries, BatchRequest request, String batchId) {
        int calls = 0;
        int applied = 0;
        int flagged = 0;
        int unavailable = 0;
        int skipped = 0;

        for (int i = 0; i < entries.size(); i++) {
            Entry entry = entries.get(i);
            if (!ReviewHeuristics.needsReview(entry.record)) {
                continue;
            }
            if (calls >= request.maxAiCalls()) {
                skipped++;
                continue;
            }
            calls++;
            List<Suggestion> suggestions;
            try {
                suggestions = corrector.suggest(entry.record);
            } catch (CorrectorUnavailableException ex) {
                unavailable++;
                LOGGER.warning("Batch %s AI review unavailable for block %d: %s".formatted(
                    shortId(batchId), entry.blockIndex, LogRedactor.redact(ex.getMessage())));
                continue;
            }
            if (suggestions.isEmpty()) {
                continue;
            }

            AddressRecord record = entry.record.withAiFlag(true);
            List<String> held = new ArrayList<>();
            for (Suggestion suggestion : suggestions) {
                if (suggestion.appliesWithin(request.maxRisk())) {
                    record = record.with(suggestion.field(), appliedValue(suggestion));
                    applied++;
                } else {
                    held.add("%s (%s)".formatted(suggestion.field().key(), suggestion.risk().key()));
                    flagged++;
                }
            }
            if (!held.isEmpty()) {
                record = record.withNote("AI review: " + String.join(", ", held));
            }
            entries.set(i, entry.with(record));
        }

        if (skipped > 0) {
            LOGGER.warning("Batch %s: AI call budget of %d reached, %d record(s) left unreviewed"
                .formatted(shortId(batchId), request.maxAiCalls(), skipped));
        }
        return new AiSummary(true, request.maxRisk(), calls, applied, flagged, unavailable, skipped);
    }

    private static String appliedValue(Suggestion suggestion) {
        if (suggestion.field() == MappingField.POSTCODE && UkPostcodes.isValid(suggestion.proposedValue())) {
            return UkPostcodes.normalize(suggestion.proposedValue());
        }
        return suggestion.proposedValue();
    }

    private static List<String> tags(List<ServiceRule> rules) {
        return rules.stream()
            .filter(rule -> !rule.isDefault())
            .map(rule -> rule.trigger().tag())
            .filter(Objects::nonNull)
            .collect(Collectors.toList());
    }

    private static List<String> manifestNotes(List<ParseWarning> warnings, List<ValidationFailure> failures) {
        List<String> notes = new ArrayList<>();
        warnings.forEach(warning -> notes.add("parse warning: " + warning));
        failures.forEach(failure -> notes.add("validation failure: " + failure));
        return notes;
    }

    private static String shortId(String batchId) {
        return batchId.substring(0, 8);
    }

    private record Entry(int blockIndex, AddressRecord record) {

        Entry with(AddressRecord replacement) {
            return new Entry(blockIndex, replacement);
        }
    }
}
