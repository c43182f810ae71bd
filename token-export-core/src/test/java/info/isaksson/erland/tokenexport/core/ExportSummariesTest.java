package info.isaksson.erland.tokenexport.core;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class ExportSummariesTest {

    @Test
    void successfulExport() {
        ExportResult r = new ExportCoordinator().export(List.of(), List.of(), new ExportSettings());
        String text = ExportSummaries.formatConsole(r);
        assertTrue(text.contains("EXPORT SUMMARY"));
        assertTrue(text.contains("Export completed successfully"));
        assertTrue(text.contains("Tokens exported: 0"));
        assertTrue(text.contains("FILES:"));
        assertTrue(text.contains("  README.md ("));
        assertTrue(text.contains("WARNINGS:"));
        assertFalse(text.contains("ERRORS:"));
    }

    @Test
    void failedExport() {
        ExportSettings s = new ExportSettings();
        s.structure = "tree";
        ExportResult r = new ExportCoordinator().export(List.of(), List.of(), s);
        String text = ExportSummaries.formatConsole(r);
        assertTrue(text.contains("Export completed with errors"));
        assertTrue(text.contains("ERRORS:"));
        assertTrue(text.contains("INVALID_STRUCTURE"));
        assertFalse(text.contains("FILES:"));
    }
}
