package info.isaksson.erland.tokenexport.core;

import com.fasterxml.jackson.databind.node.ObjectNode;
import info.isaksson.erland.tokenexport.emitter.ConversionOptions;
import info.isaksson.erland.tokenexport.emitter.ConversionResult;
import info.isaksson.erland.tokenexport.emitter.Diagnostic;
import info.isaksson.erland.tokenexport.emitter.Diagnostics;
import info.isaksson.erland.tokenexport.emitter.TokenConverter;
import info.isaksson.erland.tokenexport.emitter.TokenJson;
import info.isaksson.erland.tokenexport.model.Variable;
import info.isaksson.erland.tokenexport.model.VariableCollection;
import info.isaksson.erland.tokenexport.model.VariableMode;
import info.isaksson.erland.tokenexport.platform.Platform;
import info.isaksson.erland.tokenexport.platform.PlatformCodeGenerator;
import info.isaksson.erland.tokenexport.validate.ValidationError;
import info.isaksson.erland.tokenexport.validate.ValidationResult;
import info.isaksson.erland.tokenexport.validate.ValidationWarning;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Runs one export: settings validation, conversion, file generation, summary and manifest.
 *
 * <p>Each call to {@link #export} keeps its state local, so one coordinator may serve several
 * threads. Progress is reported as {@code SCANNING -> CONVERTING -> GENERATING -> COMPLETE}.</p>
 */
public final class ExportCoordinator {

    private static final Logger log = LoggerFactory.getLogger(ExportCoordinator.class);

    public static final String CANONICAL_FILE = "design-tokens.json";
    public static final String EXTENDED_FILE = "extended-tokens.json";
    public static final String SUMMARY_FILE = "README.md";
    public static final String MANIFEST_FILE = "export-manifest.json";

    private final ProgressListener listener;
    private final Clock clock;
    private final ExportSettingsValidator settingsValidator = new ExportSettingsValidator();
    private final TokenConverter converter = new TokenConverter();
    private final PlatformCodeGenerator platformGenerator = new PlatformCodeGenerator();

    public ExportCoordinator() {
        this(null, Clock.systemUTC());
    }

    public ExportCoordinator(ProgressListener listener) {
        this(listener, Clock.systemUTC());
    }

    public ExportCoordinator(ProgressListener listener, Clock clock) {
        this.listener = listener;
        this.clock = clock == null ? Clock.systemUTC() : clock;
    }

    public static String platformFile(Platform platform) {
        return "platform-tokens-" + platform.tag + ".json";
    }

    public ExportResult export(List<VariableCollection> collections, List<Variable> variables, ExportSettings settings) {
        List<VariableCollection> cs = collections == null ? List.of() : collections;
        List<Variable> vs = variables == null ? List.of() : variables;
        List<String> warnings = new ArrayList<>();
        List<String> errors = new ArrayList<>();

        try {
            ValidationResult settingsCheck = settingsValidator.validate(settings);
            for (ValidationWarning w : settingsCheck.warnings) {
                warnings.add("Export settings warning [" + w.code + "] " + w.path + ": " + w.message);
            }
            if (!settingsCheck.valid) {
                for (ValidationError e : settingsCheck.errors) {
                    errors.add("Export settings error [" + e.code + "] " + e.path + ": " + e.message);
                }
                log.warn("Export rejected: {} settings error(s)", settingsCheck.errors.size());
                return failed(warnings, errors);
            }
            return run(cs, vs, settings, warnings, errors);
        } catch (RuntimeException e) {
            log.error("Export failed", e);
            errors.add("Export failed: " + (e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage()));
            return failed(warnings, errors);
        }
    }

    private ExportResult run(List<VariableCollection> collections,
                             List<Variable> variables,
                             ExportSettings settings,
                             List<String> warnings,
                             List<String> errors) {
        ExportFormat format = ExportFormat.fromTag(settings.format);
        ConversionOptions options = settingsValidator.toConversionOptions(settings);

        if (collections.isEmpty()) warnings.add("No collections provided for export");
        if (variables.isEmpty()) warnings.add("No variables provided for export");
        warnUnknownModes(collections, options.selectedModes, warnings);

        report(ExportStage.SCANNING, "Scanning variables...", 0, variables.size(), 0);
        report(ExportStage.CONVERTING, "Converting tokens...", 0, variables.size(), 25);

        ConversionResult conversion = converter.convert(collections, variables, options);
        Diagnostics documentDiagnostics = new Diagnostics();

        int tokenCount = conversion.tokenCount();
        if (conversion.canonicalBuilt && conversion.extendedBuilt
                && conversion.canonicalTokens.size() != conversion.extendedTokens.size()) {
            documentDiagnostics.error("TOKEN_COUNT_MISMATCH",
                    "Canonical and extended token counts differ: " + conversion.canonicalTokens.size()
                            + " vs " + conversion.extendedTokens.size());
        }

        report(ExportStage.GENERATING, "Generating files...", 0, 4, 50);

        List<ExportFile> files = new ArrayList<>();
        ObjectNode canonicalDocument = null;
        if (conversion.canonicalBuilt) {
            canonicalDocument = TokenJson.canonicalDocument(conversion.canonicalTokens, options.structure,
                    documentDiagnostics);
        }
        if (format == ExportFormat.CANONICAL || format == ExportFormat.BOTH) {
            files.add(new ExportFile(CANONICAL_FILE, TokenJson.write(canonicalDocument), ExportFormat.CANONICAL.tag));
            report(ExportStage.GENERATING, "Generated canonical tokens file", 1, 4, 60);
        }
        if (format.buildsExtended()) {
            files.add(new ExportFile(EXTENDED_FILE,
                    TokenJson.write(TokenJson.extendedDocument(conversion.extendedTokens)), ExportFormat.EXTENDED.tag));
            report(ExportStage.GENERATING, "Generated extended tokens file", 2, 4, 70);
        }
        if (format == ExportFormat.PLATFORM_CODE) {
            Platform platform = Platform.fromTag(settings.platform);
            ObjectNode platformDocument = platformGenerator.generate(canonicalDocument, platform);
            files.add(new ExportFile(platformFile(platform), TokenJson.write(platformDocument),
                    ExportFormat.PLATFORM_CODE.tag));
            report(ExportStage.GENERATING, "Generated platform tokens file (" + platform.tag + ")", 2, 4, 70);
        }

        collect(conversion.warnings, warnings);
        collect(conversion.errors, errors);
        collect(documentDiagnostics.warnings(), warnings);
        collect(documentDiagnostics.errors(), errors);

        String exportDate = DateTimeFormatter.ISO_INSTANT.format(Instant.now(clock));

        files.add(new ExportFile(SUMMARY_FILE,
                SummaryGenerator.markdown(exportDate, tokenCount, collections.size(),
                        warnings.size(), errors.size(), files),
                "summary"));
        report(ExportStage.GENERATING, "Generated summary", 3, 4, 80);

        ExportStatistics manifestStats = statistics(tokenCount, files, collections.size(), warnings, errors);
        files.add(new ExportFile(MANIFEST_FILE,
                ManifestGenerator.json(exportDate, settings, manifestStats, files, warnings, errors),
                "manifest"));
        report(ExportStage.GENERATING, "Generated manifest", 4, 4, 90);

        report(ExportStage.COMPLETE, "Export complete", files.size(), files.size(), 100);

        ExportStatistics stats = statistics(tokenCount, files, collections.size(), warnings, errors);
        log.info("Exported {} tokens into {} files ({} warnings, {} errors)",
                tokenCount, files.size(), warnings.size(), errors.size());
        return new ExportResult(files, stats, warnings, errors);
    }

    private static void warnUnknownModes(List<VariableCollection> collections, List<String> selected,
                                         List<String> warnings) {
        if (selected.isEmpty() || collections.isEmpty()) return;
        Set<String> known = new HashSet<>();
        for (VariableCollection c : collections) {
            for (VariableMode m : c.modes) known.add(m.name);
        }
        for (String name : selected) {
            if (!known.contains(name)) warnings.add("Selected mode \"" + name + "\" does not exist in any collection");
        }
    }

    private static ExportStatistics statistics(int tokenCount, List<ExportFile> files, int collectionCount,
                                               List<String> warnings, List<String> errors) {
        long bytes = 0;
        for (ExportFile f : files) bytes += f.byteSize;
        return new ExportStatistics(tokenCount, files.size(), bytes, collectionCount, warnings.size(), errors.size());
    }

    private static void collect(List<Diagnostic> diagnostics, List<String> into) {
        for (Diagnostic d : diagnostics) {
            into.add("[" + d.code + "] " + d.message);
        }
    }

    private static ExportResult failed(List<String> warnings, List<String> errors) {
        return new ExportResult(List.of(),
                new ExportStatistics(0, 0, 0, 0, warnings.size(), errors.size()),
                warnings, errors);
    }

    private void report(ExportStage stage, String message, int current, int total, int percentage) {
        if (listener == null) return;
        try {
            listener.onProgress(new ExportProgress(stage, message, current, total, percentage));
        } catch (RuntimeException e) {
            log.warn("Progress listener failed at stage {}", stage, e);
        }
    }
}
