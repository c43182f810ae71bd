package info.isaksson.erland.tokenexport.core;

import java.util.List;
import java.util.Optional;

/** Outcome of one export. Successful iff there are no errors. */
public final class ExportResult {
    public final boolean success;
    public final List<ExportFile> files;
    public final ExportStatistics statistics;
    public final List<String> warnings;
    public final List<String> errors;

    ExportResult(List<ExportFile> files, ExportStatistics statistics, List<String> warnings, List<String> errors) {
        this.files = files == null ? List.of() : List.copyOf(files);
        this.statistics = statistics;
        this.warnings = warnings == null ? List.of() : List.copyOf(warnings);
        this.errors = errors == null ? List.of() : List.copyOf(errors);
        this.success = this.errors.isEmpty();
    }

    public Optional<ExportFile> file(String filename) {
        for (ExportFile f : files) {
            if (f.filename.equals(filename)) return Optional.of(f);
        }
        return Optional.empty();
    }
}
