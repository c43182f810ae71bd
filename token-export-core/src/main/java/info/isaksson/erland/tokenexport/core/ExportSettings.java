package info.isaksson.erland.tokenexport.core;

import java.util.ArrayList;
import java.util.List;

/**
 * User-facing export settings.
 *
 * <p>Enumerated settings are kept as tags so unknown values can be reported by
 * {@link ExportSettingsValidator} instead of failing at parse time.</p>
 */
public final class ExportSettings {
    /** {@code canonical}, {@code extended}, {@code both} or {@code platform-code}. */
    public String format = "canonical";
    /** {@code flat} or {@code nested}. */
    public String structure = "nested";
    /** {@code kebab}, {@code camel}, {@code snake} or {@code original}. */
    public String namingConvention = "kebab";
    /** {@code px} or {@code rem}. */
    public String defaultUnit = "px";
    /** {@code deterministic}, {@code random} or {@code none}. */
    public String identifierMode = "deterministic";
    /** Used by {@code platform-code}: {@code web}, {@code ios}, {@code android} or {@code compose}. */
    public String platform = "web";

    public boolean includePrivate = false;
    public boolean includeDeprecated = true;
    public boolean includeMetadata = false;

    /** Mode names; empty exports every mode. */
    public List<String> selectedModes = new ArrayList<>();

    public ExportSettings copy() {
        ExportSettings s = new ExportSettings();
        s.format = format;
        s.structure = structure;
        s.namingConvention = namingConvention;
        s.defaultUnit = defaultUnit;
        s.identifierMode = identifierMode;
        s.platform = platform;
        s.includePrivate = includePrivate;
        s.includeDeprecated = includeDeprecated;
        s.includeMetadata = includeMetadata;
        s.selectedModes = selectedModes == null ? new ArrayList<>() : new ArrayList<>(selectedModes);
        return s;
    }
}
