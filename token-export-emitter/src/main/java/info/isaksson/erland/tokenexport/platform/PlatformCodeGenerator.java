package info.isaksson.erland.tokenexport.platform;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import info.isaksson.erland.tokenexport.emitter.TokenConverter;
import info.isaksson.erland.tokenexport.validate.ValuePredicates;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Turns a canonical token document into a platform code document.
 *
 * <p>Groups are walked recursively; keys starting with {@code $} are skipped. Every leaf becomes
 * {@code {value, type?, path[], comment?, original{value}}} with {@code value} rewritten by the
 * {@link PlatformFormatters} entry for its type. Alias references are never rewritten.</p>
 */
public final class PlatformCodeGenerator {

    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

    public ObjectNode generate(ObjectNode canonicalDocument, Platform platform) {
        if (canonicalDocument == null) throw new IllegalArgumentException("canonicalDocument is null");
        if (platform == null) throw new IllegalArgumentException("platform is null");
        return group(canonicalDocument, new ArrayList<>(), platform);
    }

    private ObjectNode group(JsonNode node, List<String> path, Platform platform) {
        ObjectNode out = NODES.objectNode();
        Iterator<Map.Entry<String, JsonNode>> it = node.fields();
        while (it.hasNext()) {
            Map.Entry<String, JsonNode> e = it.next();
            if (e.getKey().startsWith("$") || !e.getValue().isObject()) continue;
            List<String> childPath = new ArrayList<>(path);
            childPath.add(e.getKey());
            out.set(e.getKey(), e.getValue().has("$value")
                    ? leaf(e.getValue(), childPath, platform)
                    : group(e.getValue(), childPath, platform));
        }
        return out;
    }

    private ObjectNode leaf(JsonNode token, List<String> path, Platform platform) {
        JsonNode value = token.get("$value");
        String type = token.hasNonNull("$type") ? token.get("$type").asText() : null;

        ObjectNode out = NODES.objectNode();
        out.set("value", format(value, type, schemaHint(token), platform));
        if (type != null) out.put("type", type);
        ArrayNode p = out.putArray("path");
        for (String s : path) p.add(s);
        if (token.hasNonNull("$description")) out.put("comment", token.get("$description").asText());
        out.putObject("original").set("value", value.deepCopy());

        // tokens nested below another token's path
        ObjectNode children = group(token, path, platform);
        if (!children.isEmpty()) out.setAll(children);
        return out;
    }

    private static JsonNode format(JsonNode value, String type, String hint, Platform platform) {
        if (ValuePredicates.isReference(value)) return value.deepCopy();
        ValueFormatter f = PlatformFormatters.lookup(platform, type);
        if (f == null) return value.deepCopy();
        return NODES.textNode(f.format(value, hint));
    }

    private static String schemaHint(JsonNode token) {
        JsonNode hint = token.path("$extensions").path(TokenConverter.EXTENSION_KEY).path("schemaHint");
        return hint.isTextual() ? hint.asText() : null;
    }
}
