package info.isaksson.erland.tokenexport.emitter;

import java.util.ArrayList;
import java.util.List;

/**
 * Typed options for {@link TokenConverter}. Export settings are parsed into this form once they
 * have been validated.
 */
public final class ConversionOptions {
    public boolean buildCanonical = true;
    public boolean buildExtended = false;

    public TokenStructure structure = TokenStructure.FLAT;
    public NamingConvention namingConvention = NamingConvention.KEBAB;
    public DimensionUnit defaultUnit = DimensionUnit.PX;
    public IdentifierMode identifierMode = IdentifierMode.DETERMINISTIC;

    /** Export variables flagged hidden. */
    public boolean includePrivate = false;
    public boolean includeDeprecated = true;

    /** Write variable metadata under the canonical token's extension key. */
    public boolean includeMetadata = false;

    /** Mode names to export; empty means every mode. */
    public List<String> selectedModes = new ArrayList<>();
}
