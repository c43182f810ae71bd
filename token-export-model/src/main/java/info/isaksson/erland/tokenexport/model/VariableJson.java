package info.isaksson.erland.tokenexport.model;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.util.DefaultIndenter;
import com.fasterxml.jackson.core.util.DefaultPrettyPrinter;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonDeserializer;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.JsonSerializer;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.module.SimpleModule;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * JSON reading and writing for the input document ({@link VariableSet}).
 *
 * <p>Mode values use the host tool's shapes: numbers, strings and booleans as JSON literals,
 * colors as {@code {"r","g","b","a"?}} and aliases as {@code {"type":"VARIABLE_ALIAS","id":...}}.</p>
 */
public final class VariableJson {

    public static final String ALIAS_TYPE = "VARIABLE_ALIAS";

    private static final ObjectMapper MAPPER = createMapper();
    private static final DefaultPrettyPrinter PRETTY = createPrettyPrinter();

    private VariableJson() {}

    public static VariableSet read(Path path) throws IOException {
        if (path == null) throw new IllegalArgumentException("path is null");
        try (var in = Files.newInputStream(path)) {
            return MAPPER.readValue(in, VariableSet.class);
        }
    }

    public static VariableSet readFromString(String json) throws IOException {
        if (json == null) throw new IllegalArgumentException("json is null");
        return MAPPER.readValue(json, VariableSet.class);
    }

    public static String toJsonString(VariableSet set) throws IOException {
        if (set == null) throw new IllegalArgumentException("set is null");
        return MAPPER.writer(PRETTY).writeValueAsString(set) + "\n";
    }

    /** Converts one JSON mode value into a {@link ResolvedValue}. Returns null for JSON null. */
    public static ResolvedValue toResolvedValue(JsonNode node) throws IOException {
        if (node == null || node.isNull() || node.isMissingNode()) return null;
        if (node.isNumber()) return new NumberValue(node.asDouble());
        if (node.isTextual()) return new TextValue(node.asText());
        if (node.isBoolean()) return new BooleanValue(node.asBoolean());
        if (node.isObject()) {
            JsonNode type = node.get("type");
            if (type != null && ALIAS_TYPE.equals(type.asText())) {
                JsonNode id = node.get("id");
                return new AliasReference(id == null || id.isNull() ? null : id.asText());
            }
            if (node.has("r") && node.has("g") && node.has("b")) {
                JsonNode a = node.get("a");
                return new ColorComponents(
                        node.get("r").asDouble(),
                        node.get("g").asDouble(),
                        node.get("b").asDouble(),
                        a == null || a.isNull() ? null : a.asDouble());
            }
        }
        throw new IOException("Unsupported variable value: " + node);
    }

    private static ObjectMapper createMapper() {
        SimpleModule module = new SimpleModule("variable-values");
        module.addDeserializer(ResolvedValue.class, new ValueDeserializer());
        module.addSerializer(ResolvedValue.class, new ValueSerializer());

        ObjectMapper om = new ObjectMapper();
        om.registerModule(module);
        // Host exports carry fields this tool does not use.
        om.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        om.getFactory().disable(JsonGenerator.Feature.AUTO_CLOSE_TARGET);
        return om;
    }

    private static DefaultPrettyPrinter createPrettyPrinter() {
        DefaultPrettyPrinter pp = new DefaultPrettyPrinter();
        DefaultIndenter indenter = new DefaultIndenter("  ", "\n");
        pp.indentObjectsWith(indenter);
        pp.indentArraysWith(indenter);
        return pp;
    }

    private static final class ValueDeserializer extends JsonDeserializer<ResolvedValue> {
        @Override
        public ResolvedValue deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
            JsonNode node = p.getCodec().readTree(p);
            return toResolvedValue(node);
        }
    }

    private static final class ValueSerializer extends JsonSerializer<ResolvedValue> {
        @Override
        public void serialize(ResolvedValue value, JsonGenerator gen, SerializerProvider serializers) throws IOException {
            if (value instanceof AliasReference alias) {
                gen.writeStartObject();
                gen.writeStringField("type", ALIAS_TYPE);
                gen.writeStringField("id", alias.targetVariableId);
                gen.writeEndObject();
            } else if (value instanceof ColorComponents c) {
                gen.writeStartObject();
                gen.writeNumberField("r", c.r);
                gen.writeNumberField("g", c.g);
                gen.writeNumberField("b", c.b);
                if (c.a != null) gen.writeNumberField("a", c.a);
                gen.writeEndObject();
            } else if (value instanceof NumberValue n) {
                gen.writeNumber(n.value);
            } else if (value instanceof TextValue t) {
                gen.writeString(t.value);
            } else if (value instanceof BooleanValue b) {
                gen.writeBoolean(b.value);
            } else {
                gen.writeNull();
            }
        }
    }
}
