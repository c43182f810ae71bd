package info.isaksson.erland.tokenexport.emitter;

import info.isaksson.erland.tokenexport.validate.ValidationError;
import info.isaksson.erland.tokenexport.validate.ValidationResult;
import info.isaksson.erland.tokenexport.validate.ValidationWarning;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Collects warnings and errors during conversion.
 *
 * <p>Entries keep the order in which they were reported, which follows the input traversal order.</p>
 */
public final class Diagnostics {

    private final List<Diagnostic> entries = new ArrayList<>();

    public void warn(String code, String message) {
        add(Diagnostic.Severity.WARNING, code, message, null);
    }

    public void warn(String code, String message, String k1, String v1) {
        add(Diagnostic.Severity.WARNING, code, message, ctx(k1, v1));
    }

    public void error(String code, String message) {
        add(Diagnostic.Severity.ERROR, code, message, null);
    }

    public void error(String code, String message, String k1, String v1) {
        add(Diagnostic.Severity.ERROR, code, message, ctx(k1, v1));
    }

    public void error(String code, String message, String k1, String v1, String k2, String v2) {
        Map<String, String> c = ctx(k1, v1);
        c.put(k2, v2);
        add(Diagnostic.Severity.ERROR, code, message, c);
    }

    /** Copies every error and warning of a validation run, tagging each with {@code path}. */
    public void addAll(ValidationResult result) {
        if (result == null) return;
        for (ValidationError e : result.errors) {
            add(Diagnostic.Severity.ERROR, e.code, e.message, e.path == null ? null : ctx("path", e.path));
        }
        for (ValidationWarning w : result.warnings) {
            add(Diagnostic.Severity.WARNING, w.code, w.message, w.path == null ? null : ctx("path", w.path));
        }
    }

    public List<Diagnostic> all() {
        return Collections.unmodifiableList(new ArrayList<>(entries));
    }

    public List<Diagnostic> errors() {
        List<Diagnostic> out = new ArrayList<>();
        for (Diagnostic d : entries) {
            if (d.isError()) out.add(d);
        }
        return Collections.unmodifiableList(out);
    }

    public List<Diagnostic> warnings() {
        List<Diagnostic> out = new ArrayList<>();
        for (Diagnostic d : entries) {
            if (!d.isError()) out.add(d);
        }
        return Collections.unmodifiableList(out);
    }

    public boolean hasErrors() {
        for (Diagnostic d : entries) {
            if (d.isError()) return true;
        }
        return false;
    }

    private void add(Diagnostic.Severity severity, String code, String message, Map<String, String> context) {
        entries.add(new Diagnostic(severity, code, message, context));
    }

    private static Map<String, String> ctx(String k, String v) {
        Map<String, String> m = new LinkedHashMap<>();
        m.put(k, v);
        return m;
    }
}
