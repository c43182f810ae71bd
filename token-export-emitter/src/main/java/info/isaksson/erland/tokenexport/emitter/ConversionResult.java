package info.isaksson.erland.tokenexport.emitter;

import info.isaksson.erland.tokenexport.token.CanonicalToken;
import info.isaksson.erland.tokenexport.token.ExtendedToken;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Token maps and diagnostics of one conversion. Maps iterate in input traversal order.
 */
public final class ConversionResult {
    /** Empty when canonical tokens were not requested. */
    public final Map<String, CanonicalToken> canonicalTokens;
    /** Empty when extended tokens were not requested. */
    public final Map<String, ExtendedToken> extendedTokens;

    public final boolean canonicalBuilt;
    public final boolean extendedBuilt;

    public final List<Diagnostic> warnings;
    public final List<Diagnostic> errors;

    /** Variables that produced at least one token. */
    public final int convertedVariables;

    public ConversionResult(Map<String, CanonicalToken> canonicalTokens,
                            Map<String, ExtendedToken> extendedTokens,
                            boolean canonicalBuilt,
                            boolean extendedBuilt,
                            List<Diagnostic> warnings,
                            List<Diagnostic> errors,
                            int convertedVariables) {
        this.canonicalTokens = Collections.unmodifiableMap(new LinkedHashMap<>(canonicalTokens));
        this.extendedTokens = Collections.unmodifiableMap(new LinkedHashMap<>(extendedTokens));
        this.canonicalBuilt = canonicalBuilt;
        this.extendedBuilt = extendedBuilt;
        this.warnings = warnings == null ? List.of() : List.copyOf(warnings);
        this.errors = errors == null ? List.of() : List.copyOf(errors);
        this.convertedVariables = convertedVariables;
    }

    public int tokenCount() {
        return Math.max(canonicalTokens.size(), extendedTokens.size());
    }
}
