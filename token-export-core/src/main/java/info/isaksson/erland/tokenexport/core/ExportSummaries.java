package info.isaksson.erland.tokenexport.core;

/** Console rendering of an {@link ExportResult}. */
public final class ExportSummaries {

    private ExportSummaries() {}

    private static final String RULE = "=".repeat(50);

    public static String formatConsole(ExportResult result) {
        StringBuilder sb = new StringBuilder();
        sb.append(RULE).append('\n');
        sb.append("EXPORT SUMMARY\n");
        sb.append(RULE).append("\n\n");
        sb.append(result.success ? "Export completed successfully" : "Export completed with errors").append("\n\n");

        ExportStatistics s = result.statistics;
        sb.append("STATISTICS:\n");
        sb.append("  Tokens exported: ").append(s.tokenCount).append('\n');
        sb.append("  Files generated: ").append(s.fileCount).append('\n');
        sb.append("  Total size: ").append(FileSizes.format(s.totalBytes)).append('\n');
        sb.append("  Collections: ").append(s.collectionCount).append('\n');
        sb.append("  Warnings: ").append(s.warningCount).append('\n');
        sb.append("  Errors: ").append(s.errorCount).append('\n');

        if (!result.files.isEmpty()) {
            sb.append("\nFILES:\n");
            for (ExportFile f : result.files) {
                sb.append("  ").append(f.filename).append(" (").append(FileSizes.format(f.byteSize)).append(")\n");
            }
        }
        if (!result.warnings.isEmpty()) {
            sb.append("\nWARNINGS:\n");
            for (String w : result.warnings) sb.append("  ").append(w).append('\n');
        }
        if (!result.errors.isEmpty()) {
            sb.append("\nERRORS:\n");
            for (String e : result.errors) sb.append("  ").append(e).append('\n');
        }
        sb.append('\n').append(RULE).append('\n');
        return sb.toString();
    }
}
