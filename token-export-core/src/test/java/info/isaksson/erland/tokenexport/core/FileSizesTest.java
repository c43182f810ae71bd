package info.isaksson.erland.tokenexport.core;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class FileSizesTest {

    @Test
    void formatsBytesKilobytesAndMegabytes() {
        assertEquals("0 B", FileSizes.format(0));
        assertEquals("1023 B", FileSizes.format(1023));
        assertEquals("1.5 KB", FileSizes.format(1536));
        assertEquals("2.0 MB", FileSizes.format(2L * 1024 * 1024));
    }

    @Test
    void exportFileSizeIsUtf8Length() {
        assertEquals(3, new ExportFile("a.txt", "abc", "summary").byteSize);
        assertEquals(2, new ExportFile("b.txt", "é", "summary").byteSize);
        assertEquals(0, new ExportFile("c.txt", null, "summary").byteSize);
    }
}
