package info.isaksson.erland.tokenexport.core;

/** Pipeline stages, in the order they are reported. */
public enum ExportStage {
    SCANNING,
    CONVERTING,
    GENERATING,
    COMPLETE
}
