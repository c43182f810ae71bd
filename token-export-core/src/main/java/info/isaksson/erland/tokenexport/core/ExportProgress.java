package info.isaksson.erland.tokenexport.core;

/** One progress notification. */
public final class ExportProgress {
    public final ExportStage stage;
    public final String message;
    public final int current;
    public final int total;
    /** 0..100, never decreasing within one export. */
    public final int percentage;

    public ExportProgress(ExportStage stage, String message, int current, int total, int percentage) {
        this.stage = stage;
        this.message = message;
        this.current = current;
        this.total = total;
        this.percentage = percentage;
    }

    @Override public String toString() {
        return stage + " " + percentage + "% " + message;
    }
}
