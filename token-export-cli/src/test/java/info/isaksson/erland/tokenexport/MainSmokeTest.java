package info.isaksson.erland.tokenexport;

import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class MainSmokeTest {

    private static Path copyFixture(Path dir) throws IOException {
        Path input = dir.resolve("variables.json");
        try (var in = MainSmokeTest.class.getResourceAsStream("/variables/sample-variables.json")) {
            assertTrue(in != null, "fixture must exist in test resources");
            Files.copy(in, input);
        }
        return input;
    }

    @Test
    void exportsBothFormatsToOutputFolder() throws IOException {
        Path tmpDir = Files.createTempDirectory("token-export-");
        Path input = copyFixture(tmpDir);
        Path outDir = tmpDir.resolve("out");

        int code = Main.run(new String[] {
                "--input", input.toString(),
                "--output", outDir.toString(),
                "--format", "both",
                "--modes=Light,Dark"
        });
        assertEquals(Main.EXIT_OK, code);
        assertTrue(Files.exists(outDir.resolve("design-tokens.json")));
        assertTrue(Files.exists(outDir.resolve("extended-tokens.json")));
        assertTrue(Files.exists(outDir.resolve("README.md")));
        String manifest = Files.readString(outDir.resolve("export-manifest.json"));
        assertTrue(manifest.contains("\"tokenCount\" : 7"), manifest);
    }

    @Test
    void bareInputPathAndPlatformCode() throws IOException {
        Path tmpDir = Files.createTempDirectory("token-export-");
        Path input = copyFixture(tmpDir);
        Path outDir = tmpDir.resolve("ios");

        int code = Main.run(new String[] {
                input.toString(),
                "--output", outDir.toString(),
                "--format", "platform-code",
                "--platform", "ios",
                "--include-private", "true"
        });
        assertEquals(Main.EXIT_OK, code);
        String ios = Files.readString(outDir.resolve("platform-tokens-ios.json"));
        assertTrue(ios.contains("CGFloat(4)"), ios);
        assertTrue(ios.contains("internal"), "hidden variable exported with --include-private");
    }

    @Test
    void invalidSettingsExitWithExportErrors() throws IOException {
        Path tmpDir = Files.createTempDirectory("token-export-");
        Path input = copyFixture(tmpDir);
        Path outDir = tmpDir.resolve("out");

        int code = Main.run(new String[] {"--input", input.toString(), "--output", outDir.toString(), "--format", "xml"});
        assertEquals(Main.EXIT_EXPORT_ERRORS, code);
        assertFalse(Files.exists(outDir), "nothing is written when settings are rejected");
    }

    @Test
    void usageErrors() {
        assertEquals(Main.EXIT_USAGE, Main.run(new String[0]));
        assertEquals(Main.EXIT_USAGE, Main.run(new String[] {"--format"}));
        assertEquals(Main.EXIT_USAGE, Main.run(new String[] {"--bogus"}));
        assertEquals(Main.EXIT_USAGE, Main.run(new String[] {"--input", "does/not/exist.json"}));
        assertEquals(Main.EXIT_OK, Main.run(new String[] {"--help"}));
    }

    @Test
    void malformedInputIsAnIoError() throws IOException {
        Path tmpDir = Files.createTempDirectory("token-export-");
        Path input = tmpDir.resolve("broken.json");
        Files.writeString(input, "{ not json");
        assertEquals(Main.EXIT_IO, Main.run(new String[] {"--input", input.toString(), "--output", tmpDir.resolve("out").toString()}));
    }
}
