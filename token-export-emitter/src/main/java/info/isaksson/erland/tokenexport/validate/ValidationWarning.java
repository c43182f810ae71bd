package info.isaksson.erland.tokenexport.validate;

import java.util.Objects;

/** A soft issue; never affects validity. */
public final class ValidationWarning {
    public final String code;
    public final String message;
    public final String path;
    public final String suggestion;

    public ValidationWarning(String code, String message, String path, String suggestion) {
        this.code = Objects.requireNonNull(code, "code must not be null");
        this.message = Objects.requireNonNull(message, "message must not be null");
        this.path = path;
        this.suggestion = suggestion;
    }

    @Override public String toString() {
        return "[" + code + "] " + message + (path == null ? "" : " (" + path + ")");
    }
}
