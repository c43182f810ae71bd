package info.isaksson.erland.tokenexport.core;

import java.util.List;

/**
 * Human-readable Markdown summary written as {@code README.md} next to the token files.
 */
public final class SummaryGenerator {

    private SummaryGenerator() {}

    public static String markdown(String exportDate,
                                  int tokenCount,
                                  int collectionCount,
                                  int warningCount,
                                  int errorCount,
                                  List<ExportFile> files) {
        StringBuilder report = new StringBuilder();
        report.append("# Exported design tokens\n\n");

        report.append("## Summary\n\n");
        report.append("- Export date: `").append(exportDate).append("`\n");
        report.append("- Tokens: **").append(tokenCount).append("**\n");
        report.append("- Collections: **").append(collectionCount).append("**\n");
        report.append("- Warnings: **").append(warningCount).append("**\n");
        report.append("- Errors: **").append(errorCount).append("**\n\n");

        report.append("## Files\n\n");
        if (files.isEmpty()) {
            report.append("_(none)_\n");
        } else {
            report.append("| File | Format | Size |\n");
            report.append("|---|---|---:|\n");
            for (ExportFile f : files) {
                report.append("| `").append(f.filename).append("` | ")
                        .append(f.formatTag).append(" | ")
                        .append(FileSizes.format(f.byteSize)).append(" |\n");
            }
            report.append("\n- `export-manifest.json`: settings, statistics and diagnostics of this export\n");
        }

        report.append("\n## Formats\n\n");
        report.append("- `design-tokens.json`: canonical tokens with `$value`, `$type` and optional `$description`; ")
                .append("references use `{token.name}`.\n");
        report.append("- `extended-tokens.json`: flat tokens with `$schema`, `value`, `uuid` and optional ")
                .append("`component`, `private`, `deprecated` and per-mode `sets`.\n");
        report.append("- `platform-tokens-<platform>.json`: canonical tokens with values rewritten for the target ")
                .append("platform; each leaf keeps `path` and `original.value`.\n");
        return report.toString();
    }
}
