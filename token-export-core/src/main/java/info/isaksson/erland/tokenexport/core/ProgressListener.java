package info.isaksson.erland.tokenexport.core;

/** Receives progress notifications; exceptions it throws are logged and ignored. */
@FunctionalInterface
public interface ProgressListener {
    void onProgress(ExportProgress progress);
}
