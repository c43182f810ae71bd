package info.isaksson.erland.tokenexport.core;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

@JsonPropertyOrder({"tokenCount", "fileCount", "totalBytes", "collectionCount", "warningCount", "errorCount"})
public final class ExportStatistics {
    public final int tokenCount;
    public final int fileCount;
    public final long totalBytes;
    public final int collectionCount;
    public final int warningCount;
    public final int errorCount;

    public ExportStatistics(int tokenCount, int fileCount, long totalBytes,
                            int collectionCount, int warningCount, int errorCount) {
        this.tokenCount = tokenCount;
        this.fileCount = fileCount;
        this.totalBytes = totalBytes;
        this.collectionCount = collectionCount;
        this.warningCount = warningCount;
        this.errorCount = errorCount;
    }
}
