package info.isaksson.erland.tokenexport.emitter;

import info.isaksson.erland.tokenexport.validate.ValidationError;
import info.isaksson.erland.tokenexport.validate.ValidationResult;
import info.isaksson.erland.tokenexport.validate.ValidationWarning;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class DiagnosticsTest {

    @Test
    void entriesKeepReportingOrder() {
        Diagnostics d = new Diagnostics();
        d.warn("W1", "first");
        d.error("E1", "second", "variable", "a");
        d.warn("W2", "third", "token", "b");

        assertEquals(List.of("W1", "E1", "W2"), d.all().stream().map(x -> x.code).toList());
        assertEquals(1, d.errors().size());
        assertEquals(2, d.warnings().size());
        assertTrue(d.hasErrors());
        assertEquals("a", d.errors().get(0).context.get("variable"));
    }

    @Test
    void validationResultsKeepTheirPath() {
        Diagnostics d = new Diagnostics();
        d.addAll(new ValidationResult(
                List.of(new ValidationError("INVALID_COLOR", "bad", "color-red")),
                List.of(new ValidationWarning("UNKNOWN_TYPE", "odd", null, null))));
        d.addAll(null);

        assertEquals("color-red", d.errors().get(0).context.get("path"));
        assertTrue(d.warnings().get(0).context.isEmpty());
    }

    @Test
    void snapshotsAreImmutable() {
        Diagnostics d = new Diagnostics();
        d.warn("W", "w");
        assertThrows(UnsupportedOperationException.class, () -> d.all().clear());
        assertFalse(new Diagnostics().hasErrors());
    }
}
