package info.isaksson.erland.tokenexport.validate;

import java.util.Objects;

/** A problem that makes the validated subject invalid. */
public final class ValidationError {

    /** Error code stable across versions. */
    public final String code;

    public final String message;

    /** Token name or settings field the error refers to; optional. */
    public final String path;

    /** Offending value rendered as text; optional. */
    public final String value;

    public ValidationError(String code, String message, String path, String value) {
        this.code = Objects.requireNonNull(code, "code must not be null");
        this.message = Objects.requireNonNull(message, "message must not be null");
        this.path = path;
        this.value = value;
    }

    public ValidationError(String code, String message, String path) {
        this(code, message, path, null);
    }

    @Override public String toString() {
        return "[" + code + "] " + message + (path == null ? "" : " (" + path + ")");
    }
}
