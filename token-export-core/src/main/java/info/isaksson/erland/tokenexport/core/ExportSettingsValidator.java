package info.isaksson.erland.tokenexport.core;

import info.isaksson.erland.tokenexport.emitter.ConversionOptions;
import info.isaksson.erland.tokenexport.emitter.DimensionUnit;
import info.isaksson.erland.tokenexport.emitter.IdentifierMode;
import info.isaksson.erland.tokenexport.emitter.NamingConvention;
import info.isaksson.erland.tokenexport.emitter.TokenStructure;
import info.isaksson.erland.tokenexport.platform.Platform;
import info.isaksson.erland.tokenexport.validate.ValidationError;
import info.isaksson.erland.tokenexport.validate.ValidationResult;
import info.isaksson.erland.tokenexport.validate.ValidationWarning;

import java.util.ArrayList;
import java.util.List;

/**
 * Checks {@link ExportSettings} and turns valid settings into {@link ConversionOptions}.
 *
 * <p>An unknown {@code format}, {@code structure} or (for {@code platform-code}) {@code platform} is an
 * error. An unknown naming convention, unit or identifier mode is a warning and falls back to the
 * default.</p>
 */
public final class ExportSettingsValidator {

    public ValidationResult validate(ExportSettings settings) {
        List<ValidationError> errors = new ArrayList<>();
        List<ValidationWarning> warnings = new ArrayList<>();
        if (settings == null) {
            errors.add(new ValidationError("MISSING_SETTINGS", "Export settings are missing", "settings"));
            return new ValidationResult(errors, warnings);
        }

        ExportFormat format = ExportFormat.fromTag(settings.format);
        if (format == null) {
            errors.add(new ValidationError("INVALID_FORMAT",
                    "Invalid format \"" + settings.format + "\". Must be one of: " + ExportFormat.expected(),
                    "format", settings.format));
        }
        if (!TokenStructure.isTag(settings.structure)) {
            errors.add(new ValidationError("INVALID_STRUCTURE",
                    "Invalid structure \"" + settings.structure + "\". Must be one of: " + TokenStructure.expected(),
                    "structure", settings.structure));
        }
        if (format == ExportFormat.PLATFORM_CODE && !Platform.isTag(settings.platform)) {
            errors.add(new ValidationError("INVALID_PLATFORM",
                    "Invalid platform \"" + settings.platform + "\". Must be one of: web, ios, android, compose",
                    "platform", settings.platform));
        }

        if (!NamingConvention.isTag(settings.namingConvention)) {
            warnings.add(new ValidationWarning("INVALID_NAMING_CONVENTION",
                    "Unknown naming convention \"" + settings.namingConvention + "\"", "namingConvention",
                    "Valid conventions: " + NamingConvention.expected()));
        }
        if (!DimensionUnit.isTag(settings.defaultUnit)) {
            warnings.add(new ValidationWarning("INVALID_DEFAULT_UNIT",
                    "Unknown default unit \"" + settings.defaultUnit + "\"", "defaultUnit",
                    "Valid units: " + DimensionUnit.expected()));
        }
        if (!IdentifierMode.isTag(settings.identifierMode)) {
            warnings.add(new ValidationWarning("INVALID_IDENTIFIER_MODE",
                    "Unknown identifier mode \"" + settings.identifierMode + "\"", "identifierMode",
                    "Valid modes: " + IdentifierMode.expected()));
        }
        return new ValidationResult(errors, warnings);
    }

    /** Conversion options for settings that passed {@link #validate}. */
    public ConversionOptions toConversionOptions(ExportSettings settings) {
        ExportFormat format = ExportFormat.fromTag(settings.format);
        if (format == null) throw new IllegalArgumentException("Invalid format: " + settings.format);

        ConversionOptions o = new ConversionOptions();
        o.buildCanonical = format.buildsCanonical();
        o.buildExtended = format.buildsExtended();
        o.structure = TokenStructure.fromTag(settings.structure);
        o.namingConvention = NamingConvention.isTag(settings.namingConvention)
                ? NamingConvention.fromTag(settings.namingConvention) : NamingConvention.KEBAB;
        o.defaultUnit = DimensionUnit.isTag(settings.defaultUnit)
                ? DimensionUnit.fromTag(settings.defaultUnit) : DimensionUnit.PX;
        o.identifierMode = IdentifierMode.isTag(settings.identifierMode)
                ? IdentifierMode.fromTag(settings.identifierMode) : IdentifierMode.DETERMINISTIC;
        o.includePrivate = settings.includePrivate;
        o.includeDeprecated = settings.includeDeprecated;
        o.includeMetadata = settings.includeMetadata;
        o.selectedModes = settings.selectedModes == null ? new ArrayList<>() : new ArrayList<>(settings.selectedModes);
        return o;
    }
}
