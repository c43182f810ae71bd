package info.isaksson.erland.tokenexport.core;

import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import info.isaksson.erland.tokenexport.emitter.TokenJson;

import java.util.List;

/** Machine-readable manifest written as {@code export-manifest.json}. */
public final class ManifestGenerator {

    public static final String MANIFEST_VERSION = "1.0.0";

    private ManifestGenerator() {}

    public static String json(String exportDate,
                              ExportSettings settings,
                              ExportStatistics statistics,
                              List<ExportFile> files,
                              List<String> warnings,
                              List<String> errors) {
        ObjectNode root = JsonNodeFactory.instance.objectNode();
        root.put("version", MANIFEST_VERSION);
        root.put("exportDate", exportDate);

        ObjectNode s = root.putObject("settings");
        s.put("format", settings.format);
        s.put("structure", settings.structure);
        s.put("namingConvention", settings.namingConvention);
        s.put("defaultUnit", settings.defaultUnit);
        s.put("identifierMode", settings.identifierMode);
        s.put("platform", settings.platform);
        s.put("includePrivate", settings.includePrivate);
        s.put("includeDeprecated", settings.includeDeprecated);
        s.put("includeMetadata", settings.includeMetadata);
        ArrayNode modes = s.putArray("selectedModes");
        if (settings.selectedModes != null) settings.selectedModes.forEach(modes::add);

        root.set("statistics", TokenJson.mapper().valueToTree(statistics));

        ArrayNode f = root.putArray("files");
        for (ExportFile file : files) {
            ObjectNode o = f.addObject();
            o.put("filename", file.filename);
            o.put("format", file.formatTag);
            o.put("size", file.byteSize);
        }
        ArrayNode w = root.putArray("warnings");
        warnings.forEach(w::add);
        ArrayNode e = root.putArray("errors");
        errors.forEach(e::add);
        return TokenJson.write(root);
    }
}
