package info.isaksson.erland.tokenexport.emitter;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/** A warning or accumulated error produced while converting variables. */
public final class Diagnostic {

    public enum Severity { WARNING, ERROR }

    public final Severity severity;

    /** Code stable across versions. */
    public final String code;

    /** Human-readable message. */
    public final String message;

    /** Optional structured context (stable keys recommended). */
    public final Map<String, String> context;

    public Diagnostic(Severity severity, String code, String message, Map<String, String> context) {
        this.severity = Objects.requireNonNull(severity, "severity must not be null");
        this.code = Objects.requireNonNull(code, "code must not be null");
        this.message = Objects.requireNonNull(message, "message must not be null");
        if (context == null || context.isEmpty()) {
            this.context = Collections.emptyMap();
        } else {
            this.context = Collections.unmodifiableMap(new LinkedHashMap<>(context));
        }
    }

    public boolean isError() {
        return severity == Severity.ERROR;
    }

    @Override public String toString() {
        return severity + " [" + code + "] " + message;
    }
}
