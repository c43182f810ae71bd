package info.isaksson.erland.tokenexport.core;

import java.nio.charset.StandardCharsets;
import java.util.Objects;

/** One generated file, held in memory. */
public final class ExportFile {
    public final String filename;
    public final String content;

    /** {@code canonical}, {@code extended}, {@code platform-code}, {@code summary} or {@code manifest}. */
    public final String formatTag;

    /** UTF-8 length of {@link #content}. */
    public final long byteSize;

    public ExportFile(String filename, String content, String formatTag) {
        this.filename = Objects.requireNonNull(filename, "filename must not be null");
        this.content = content == null ? "" : content;
        this.formatTag = formatTag;
        this.byteSize = this.content.getBytes(StandardCharsets.UTF_8).length;
    }

    @Override public String toString() {
        return filename + " (" + byteSize + " bytes)";
    }
}
