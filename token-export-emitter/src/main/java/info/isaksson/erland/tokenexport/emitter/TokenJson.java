package info.isaksson.erland.tokenexport.emitter;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.util.DefaultIndenter;
import com.fasterxml.jackson.core.util.DefaultPrettyPrinter;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import info.isaksson.erland.tokenexport.token.CanonicalToken;
import info.isaksson.erland.tokenexport.token.ExtendedSetEntry;
import info.isaksson.erland.tokenexport.token.ExtendedToken;

import java.io.UncheckedIOException;
import java.util.Map;

/**
 * Token documents as JSON.
 *
 * <p>Writing is deterministic: object keys keep insertion order, which follows the input traversal
 * order, and every document ends with a newline.</p>
 */
public final class TokenJson {

    private static final ObjectMapper MAPPER = createMapper();
    private static final DefaultPrettyPrinter PRETTY = createPrettyPrinter();
    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

    private TokenJson() {}

    public static ObjectMapper mapper() {
        return MAPPER;
    }

    /** Pretty-printed JSON with a trailing newline. */
    public static String write(JsonNode node) {
        try {
            return MAPPER.writer(PRETTY).writeValueAsString(node) + "\n";
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException(e);
        }
    }

    /** Values and metadata are copied, so edits to the returned node never reach the token. */
    public static ObjectNode canonicalNode(CanonicalToken token) {
        ObjectNode o = NODES.objectNode();
        o.set("$value", token.value == null ? NODES.nullNode() : token.value.deepCopy());
        if (token.type != null) o.put("$type", token.type);
        if (token.description != null) o.put("$description", token.description);
        if (token.deprecated) {
            if (token.deprecatedComment != null) {
                o.put("$deprecated", token.deprecatedComment);
            } else {
                o.put("$deprecated", true);
            }
        }
        if (token.schemaHint != null || token.metadata != null) {
            ObjectNode ext = o.putObject("$extensions").putObject(TokenConverter.EXTENSION_KEY);
            if (token.schemaHint != null) ext.put("schemaHint", token.schemaHint.tag);
            if (token.metadata != null) ext.setAll(token.metadata.deepCopy());
        }
        return o;
    }

    public static ObjectNode extendedNode(ExtendedToken token) {
        ObjectNode o = NODES.objectNode();
        o.put("$schema", token.schemaUrl);
        o.set("value", token.value == null ? NODES.nullNode() : token.value.deepCopy());
        if (token.stableId != null) o.put("uuid", token.stableId);
        if (token.component != null) o.put("component", token.component);
        if (token.isPrivate) o.put("private", true);
        if (token.deprecated) o.put("deprecated", true);
        if (token.deprecatedComment != null) o.put("deprecated_comment", token.deprecatedComment);
        if (!token.sets.isEmpty()) {
            ObjectNode sets = o.putObject("sets");
            for (Map.Entry<String, ExtendedSetEntry> e : token.sets.entrySet()) {
                ObjectNode entry = sets.putObject(e.getKey());
                entry.put("$schema", e.getValue().schemaUrl);
                entry.set("value", e.getValue().value == null ? NODES.nullNode() : e.getValue().value.deepCopy());
                if (e.getValue().stableId != null) entry.put("uuid", e.getValue().stableId);
            }
        }
        return o;
    }

    /**
     * Canonical document. {@code flat} writes one top-level key per token; {@code nested} splits keys on
     * {@code .} into groups. A token whose path passes through another token's leaf is nested inside
     * that leaf and reported as {@code TOKEN_PATH_CONFLICT}.
     */
    public static ObjectNode canonicalDocument(Map<String, CanonicalToken> tokens,
                                               TokenStructure structure,
                                               Diagnostics diagnostics) {
        ObjectNode root = NODES.objectNode();
        for (Map.Entry<String, CanonicalToken> e : tokens.entrySet()) {
            ObjectNode leaf = canonicalNode(e.getValue());
            if (structure != TokenStructure.NESTED) {
                root.set(e.getKey(), leaf);
                continue;
            }
            String[] parts = e.getKey().split("\\.");
            ObjectNode group = root;
            boolean conflict = false;
            for (int i = 0; i < parts.length - 1; i++) {
                if (parts[i].isEmpty()) continue;
                JsonNode child = group.get(parts[i]);
                if (child == null || !child.isObject()) {
                    child = group.putObject(parts[i]);
                } else if (child.has("$value")) {
                    conflict = true;
                }
                group = (ObjectNode) child;
            }
            String last = parts.length == 0 ? e.getKey() : parts[parts.length - 1];
            JsonNode existing = group.get(last);
            if (existing != null && existing.isObject() && !existing.has("$value")) {
                conflict = true;
                leaf.setAll((ObjectNode) existing);
            }
            group.set(last, leaf);
            if (conflict && diagnostics != null) {
                diagnostics.warn("TOKEN_PATH_CONFLICT",
                        "Token \"" + e.getKey() + "\" shares its path with a group or another token",
                        "token", e.getKey());
            }
        }
        return root;
    }

    /** Extended documents are always flat. */
    public static ObjectNode extendedDocument(Map<String, ExtendedToken> tokens) {
        ObjectNode root = NODES.objectNode();
        for (Map.Entry<String, ExtendedToken> e : tokens.entrySet()) {
            root.set(e.getKey(), extendedNode(e.getValue()));
        }
        return root;
    }

    private static ObjectMapper createMapper() {
        ObjectMapper om = new ObjectMapper();
        om.enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS);
        // Prevent Jackson from closing the provided OutputStream/Writer.
        om.getFactory().disable(JsonGenerator.Feature.AUTO_CLOSE_TARGET);
        om.enable(JsonGenerator.Feature.WRITE_BIGDECIMAL_AS_PLAIN);
        om.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        return om;
    }

    private static DefaultPrettyPrinter createPrettyPrinter() {
        DefaultPrettyPrinter pp = new DefaultPrettyPrinter();
        DefaultIndenter indenter = new DefaultIndenter("  ", "\n");
        pp.indentObjectsWith(indenter);
        pp.indentArraysWith(indenter);
        return pp;
    }
}
