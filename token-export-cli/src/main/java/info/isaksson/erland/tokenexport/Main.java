package info.isaksson.erland.tokenexport;

import info.isaksson.erland.tokenexport.core.ExportCoordinator;
import info.isaksson.erland.tokenexport.core.ExportFile;
import info.isaksson.erland.tokenexport.core.ExportResult;
import info.isaksson.erland.tokenexport.core.ExportSettings;
import info.isaksson.erland.tokenexport.core.ExportSummaries;
import info.isaksson.erland.tokenexport.model.VariableJson;
import info.isaksson.erland.tokenexport.model.VariableSet;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;

/**
 * Command line entry point: reads a variables document, runs an export and writes the files.
 *
 * <p>Exit codes: 0 success, 1 usage error, 2 I/O error or unexpected failure, 3 export finished
 * with errors.</p>
 */
public final class Main {

    static final int EXIT_OK = 0;
    static final int EXIT_USAGE = 1;
    static final int EXIT_IO = 2;
    static final int EXIT_EXPORT_ERRORS = 3;

    public static void main(String[] args) {
        System.exit(run(args));
    }

    /**
     * Testable entrypoint that returns an exit code instead of calling System.exit.
     */
    public static int run(String[] args) {
        CliArgs parsed;
        try {
            parsed = CliArgs.parse(args);
        } catch (IllegalArgumentException ex) {
            System.err.println("Error: " + ex.getMessage());
            System.err.println();
            CliArgs.printHelp();
            return EXIT_USAGE;
        }

        if (parsed.help) {
            CliArgs.printHelp();
            return EXIT_OK;
        }

        if (parsed.input == null) {
            System.err.println("Error: --input is required.");
            System.err.println();
            CliArgs.printHelp();
            return EXIT_USAGE;
        }

        Path inputPath = Paths.get(parsed.input).toAbsolutePath().normalize();
        if (!Files.isRegularFile(inputPath)) {
            System.err.println("Error: --input does not exist or is not a file: " + inputPath);
            return EXIT_USAGE;
        }
        Path outDir = Paths.get(parsed.output).toAbsolutePath().normalize();

        try {
            VariableSet input = VariableJson.read(inputPath);
            ExportResult result = new ExportCoordinator().export(input.collections, input.variables, parsed.settings);

            if (!result.files.isEmpty()) {
                Files.createDirectories(outDir);
                for (ExportFile f : result.files) {
                    Files.writeString(outDir.resolve(f.filename), f.content, StandardCharsets.UTF_8);
                }
            }

            System.out.print(ExportSummaries.formatConsole(result));
            if (!result.files.isEmpty()) {
                System.out.println("Wrote " + result.files.size() + " files to " + outDir);
            }
            return result.success ? EXIT_OK : EXIT_EXPORT_ERRORS;
        } catch (IOException e) {
            System.err.println("Error: " + e.getMessage());
            return EXIT_IO;
        } catch (RuntimeException e) {
            System.err.println("Error: unexpected failure: " + e);
            return EXIT_IO;
        }
    }

    static final class CliArgs {
        boolean help = false;
        String input;
        String output = "./output";
        final ExportSettings settings = new ExportSettings();

        static CliArgs parse(String[] args) {
            CliArgs out = new CliArgs();
            List<String> modes = new ArrayList<>();

            for (int i = 0; i < args.length; i++) {
                String a = args[i];
                if (a == null) continue;

                // support --modes=Light,Dark
                if (a.startsWith("--modes=")) {
                    addModes(modes, a.substring("--modes=".length()));
                    continue;
                }

                switch (a) {
                    case "--help":
                    case "-h":
                        out.help = true;
                        break;
                    case "--input":
                        out.input = requireValue(args, ++i, "--input");
                        break;
                    case "--output":
                        out.output = requireValue(args, ++i, "--output");
                        break;
                    case "--format":
                        out.settings.format = requireValue(args, ++i, "--format");
                        break;
                    case "--structure":
                        out.settings.structure = requireValue(args, ++i, "--structure");
                        break;
                    case "--naming":
                        out.settings.namingConvention = requireValue(args, ++i, "--naming");
                        break;
                    case "--unit":
                        out.settings.defaultUnit = requireValue(args, ++i, "--unit");
                        break;
                    case "--ids":
                        out.settings.identifierMode = requireValue(args, ++i, "--ids");
                        break;
                    case "--platform":
                        out.settings.platform = requireValue(args, ++i, "--platform");
                        break;
                    case "--modes":
                        addModes(modes, requireValue(args, ++i, "--modes"));
                        break;
                    case "--include-private":
                        if (i + 1 < args.length && looksLikeBoolean(args[i + 1])) {
                            out.settings.includePrivate = parseBoolean(args[++i], a);
                        } else {
                            out.settings.includePrivate = true;
                        }
                        break;
                    case "--include-deprecated":
                        if (i + 1 < args.length && looksLikeBoolean(args[i + 1])) {
                            out.settings.includeDeprecated = parseBoolean(args[++i], a);
                        } else {
                            out.settings.includeDeprecated = true;
                        }
                        break;
                    case "--include-metadata":
                        if (i + 1 < args.length && looksLikeBoolean(args[i + 1])) {
                            out.settings.includeMetadata = parseBoolean(args[++i], a);
                        } else {
                            out.settings.includeMetadata = true;
                        }
                        break;
                    default:
                        if (a.startsWith("--")) {
                            throw new IllegalArgumentException("Unknown argument: " + a);
                        }
                        // allow a bare path as shorthand for --input
                        if (out.input == null) {
                            out.input = a;
                        } else {
                            throw new IllegalArgumentException("Unexpected extra argument: " + a);
                        }
                }
            }

            out.settings.selectedModes = modes;
            return out;
        }

        private static void addModes(List<String> into, String csv) {
            for (String m : csv.split(",")) {
                String s = m.trim();
                if (!s.isEmpty()) into.add(s);
            }
        }

        static String requireValue(String[] args, int index, String flag) {
            if (index >= args.length) {
                throw new IllegalArgumentException("Missing value for " + flag);
            }
            String v = args[index];
            if (v == null || v.isBlank() || v.startsWith("--")) {
                throw new IllegalArgumentException("Invalid value for " + flag + ": " + v);
            }
            return v;
        }

        static boolean parseBoolean(String v, String flag) {
            if (v == null) throw new IllegalArgumentException("Missing value for " + flag);
            String s = v.trim().toLowerCase();
            if (s.equals("true") || s.equals("1") || s.equals("yes")) return true;
            if (s.equals("false") || s.equals("0") || s.equals("no")) return false;
            throw new IllegalArgumentException("Invalid boolean for " + flag + ": " + v);
        }

        static boolean looksLikeBoolean(String v) {
            if (v == null) return false;
            String s = v.trim().toLowerCase();
            return s.equals("true") || s.equals("false") || s.equals("1") || s.equals("0") || s.equals("yes") || s.equals("no");
        }

        static void printHelp() {
            System.out.println(
                    "design-token-export\n" +
                    "\n" +
                    "Usage:\n" +
                    "  java -jar token-export-cli.jar --input <variables.json> [--output <dir>] [options]\n" +
                    "\n" +
                    "Options:\n" +
                    "  --input <file>         Variables document with \"collections\" and \"variables\" (required)\n" +
                    "  --output <dir>         Output folder (default: ./output)\n" +
                    "  --format <fmt>         canonical | extended | both | platform-code (default: canonical)\n" +
                    "  --structure <s>        flat | nested (default: nested)\n" +
                    "  --naming <c>           kebab | camel | snake | original (default: kebab)\n" +
                    "  --unit <u>             Unit for unit-less dimensions: px | rem (default: px)\n" +
                    "  --ids <mode>           deterministic | random | none (default: deterministic)\n" +
                    "  --platform <p>         Target of platform-code: web | ios | android | compose (default: web)\n" +
                    "  --modes <names>        Comma-separated mode names to export (repeatable; default: all)\n" +
                    "  --include-private [bool]     Export hidden variables (default: false)\n" +
                    "  --include-deprecated [bool]  Export deprecated variables (default: true)\n" +
                    "  --include-metadata [bool]    Add variable metadata to canonical tokens (default: false)\n" +
                    "  -h, --help             Show help\n" +
                    "\n" +
                    "Exit codes:\n" +
                    "  0 success, 1 usage error, 2 I/O error, 3 export completed with errors\n" +
                    "\n" +
                    "Examples:\n" +
                    "  java -jar token-export-cli.jar --input variables.json --format both --output out\n" +
                    "  java -jar token-export-cli.jar variables.json --format platform-code --platform ios\n"
            );
        }
    }
}
