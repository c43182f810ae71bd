package info.isaksson.erland.tokenexport.core;

import java.util.Locale;

public final class FileSizes {
    private FileSizes() {}

    /** {@code 512 B}, {@code 1.5 KB}, {@code 2.0 MB}. */
    public static String format(long bytes) {
        if (bytes < 1024) return bytes + " B";
        if (bytes < 1024 * 1024) return String.format(Locale.ROOT, "%.1f KB", bytes / 1024.0);
        return String.format(Locale.ROOT, "%.1f MB", bytes / (1024.0 * 1024.0));
    }
}
