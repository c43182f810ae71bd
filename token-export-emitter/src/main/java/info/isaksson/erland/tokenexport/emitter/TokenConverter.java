package info.isaksson.erland.tokenexport.emitter;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import info.isaksson.erland.tokenexport.classify.ClassificationResult;
import info.isaksson.erland.tokenexport.classify.Confidence;
import info.isaksson.erland.tokenexport.classify.SchemaHint;
import info.isaksson.erland.tokenexport.classify.SemanticType;
import info.isaksson.erland.tokenexport.classify.TypeClassifier;
import info.isaksson.erland.tokenexport.model.AliasReference;
import info.isaksson.erland.tokenexport.model.NumberValue;
import info.isaksson.erland.tokenexport.model.ResolvedValue;
import info.isaksson.erland.tokenexport.model.TextValue;
import info.isaksson.erland.tokenexport.model.Variable;
import info.isaksson.erland.tokenexport.model.VariableCollection;
import info.isaksson.erland.tokenexport.model.VariableMode;
import info.isaksson.erland.tokenexport.token.CanonicalToken;
import info.isaksson.erland.tokenexport.token.ExtendedSchemas;
import info.isaksson.erland.tokenexport.token.ExtendedSetEntry;
import info.isaksson.erland.tokenexport.token.ExtendedToken;
import info.isaksson.erland.tokenexport.token.SchemaKind;
import info.isaksson.erland.tokenexport.validate.TokenStructureValidator;
import info.isaksson.erland.tokenexport.validate.ValidationResult;
import info.isaksson.erland.tokenexport.validate.ValuePredicates;
import info.isaksson.erland.tokenexport.validate.VariableValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Converts variables into canonical and extended tokens.
 *
 * <p>Collections are visited in input order, then their member variables, then any variable that
 * belongs to no collection. Problems with single variables are accumulated as diagnostics and never
 * abort the run.</p>
 */
public final class TokenConverter {

    private static final Logger log = LoggerFactory.getLogger(TokenConverter.class);

    /** Key under {@code $extensions} for hints and metadata written by this exporter. */
    public static final String EXTENSION_KEY = "design-token-export";

    private final TypeClassifier classifier = new TypeClassifier();
    private final VariableValidator variableValidator = new VariableValidator();

    public ConversionResult convert(List<VariableCollection> collections,
                                    List<Variable> variables,
                                    ConversionOptions options) {
        if (options == null) throw new IllegalArgumentException("options is null");
        return new Run(
                collections == null ? List.of() : collections,
                variables == null ? List.of() : variables,
                options).execute();
    }

    /** Mutable state of one conversion; never shared between calls. */
    private final class Run {
        final List<VariableCollection> collections;
        final List<Variable> variables;
        final ConversionOptions options;
        final TokenStructureValidator tokenValidator;

        final Map<String, Variable> byId = new LinkedHashMap<>();
        final Map<String, VariableCollection> collectionOf = new HashMap<>();

        final Map<String, CanonicalToken> canonical = new LinkedHashMap<>();
        final Map<String, ExtendedToken> extended = new LinkedHashMap<>();
        final Diagnostics diagnostics = new Diagnostics();
        int converted;

        Run(List<VariableCollection> collections, List<Variable> variables, ConversionOptions options) {
            this.collections = collections;
            this.variables = variables;
            this.options = options;
            this.tokenValidator = new TokenStructureValidator(options.identifierMode != IdentifierMode.NONE);
            for (Variable v : variables) {
                if (v != null && v.id != null) byId.putIfAbsent(v.id, v);
            }
            for (VariableCollection c : collections) {
                for (String id : c.variableIds) collectionOf.putIfAbsent(id, c);
            }
        }

        ConversionResult execute() {
            Set<String> visited = new HashSet<>();
            for (VariableCollection c : collections) {
                for (String id : c.variableIds) {
                    Variable v = byId.get(id);
                    if (v == null) {
                        diagnostics.warn("UNKNOWN_MEMBER_VARIABLE",
                                "Collection \"" + c.name + "\" references unknown variable " + id,
                                "collection", c.name);
                        continue;
                    }
                    if (visited.add(id)) convertGuarded(v, c);
                }
            }
            for (Variable v : variables) {
                if (v == null) continue;
                if (v.id == null || visited.add(v.id)) convertGuarded(v, null);
            }
            log.debug("Converted {} of {} variables ({} canonical, {} extended tokens)",
                    converted, variables.size(), canonical.size(), extended.size());
            return new ConversionResult(canonical, extended,
                    options.buildCanonical, options.buildExtended,
                    diagnostics.warnings(), diagnostics.errors(), converted);
        }

        private void convertGuarded(Variable v, VariableCollection collection) {
            try {
                convert(v, collection);
            } catch (RuntimeException e) {
                log.warn("Failed to convert variable {}", v.name, e);
                diagnostics.error("CONVERSION_FAILED",
                        "Failed to convert variable \"" + v.name + "\": " + e.getMessage(), "variable", v.name);
            }
        }

        private void convert(Variable v, VariableCollection collection) {
            ValidationResult structure = variableValidator.validateVariable(v);
            diagnostics.addAll(structure);
            if (!structure.valid || v.valuesByMode.isEmpty()) return;

            if (v.hidden && !options.includePrivate) {
                log.debug("Skipping hidden variable {}", v.name);
                return;
            }
            if (v.isDeprecated() && !options.includeDeprecated) {
                log.debug("Skipping deprecated variable {}", v.name);
                return;
            }

            List<String> modeIds = selectedModeIds(v, collection);
            List<String> present = new ArrayList<>();
            for (String modeId : modeIds) {
                ResolvedValue mv = v.valuesByMode.get(modeId);
                if (mv == null) {
                    diagnostics.addAll(variableValidator.validateVariableValue(v, modeId, null));
                } else {
                    present.add(modeId);
                }
            }
            if (present.isEmpty()) {
                diagnostics.warn("NO_SELECTED_MODE_VALUE",
                        "Variable \"" + v.name + "\" has no value in the selected modes", "variable", v.name);
                return;
            }

            String primaryMode = collection != null && present.contains(collection.defaultModeId)
                    ? collection.defaultModeId
                    : present.get(0);
            ResolvedValue value = v.valuesByMode.get(primaryMode);
            ValidationResult valueCheck = variableValidator.validateVariableValue(v, primaryMode, value);
            diagnostics.addAll(valueCheck);
            if (!valueCheck.valid) return;

            Variable target = null;
            ClassificationResult classification;
            if (value.isAlias()) {
                String targetId = ((AliasReference) value).targetVariableId;
                Resolved resolved = resolveAlias(v, targetId);
                if (resolved == null) return;
                target = byId.get(targetId);
                classification = classifier.classify(resolved.variable, resolved.value);
            } else {
                classification = representable(v, value, classifier.classify(v, value));
            }

            String key = TokenNaming.tokenKey(v.name, options.structure, options.namingConvention);
            boolean duplicate = options.buildCanonical ? canonical.containsKey(key) : extended.containsKey(key);
            if (duplicate) {
                diagnostics.warn("DUPLICATE_TOKEN_NAME",
                        "Duplicate token name \"" + key + "\"; variable \"" + v.name + "\" replaces the earlier token",
                        "token", key);
            }

            if (options.buildCanonical) {
                CanonicalToken token = canonicalToken(v, collection, value, target, classification, present);
                diagnostics.addAll(tokenValidator.validateToken(key, token, SchemaKind.CANONICAL));
                canonical.put(key, token);
            }
            if (options.buildExtended) {
                ExtendedToken token = extendedToken(v, collection, value, target, classification, present);
                diagnostics.addAll(tokenValidator.validateToken(key, token, SchemaKind.EXTENDED));
                extended.put(key, token);
            }
            converted++;
        }

        /**
         * Falls back to a plain number or string when the value has no valid canonical form for the
         * classified type, such as a {@code 12dp} dimension or a font weight of 950.
         */
        private ClassificationResult representable(Variable v, ResolvedValue value,
                                                   ClassificationResult classification) {
            SemanticType fallback = null;
            if (classification.semanticType == SemanticType.FONT_WEIGHT) {
                double weight = value instanceof NumberValue ? ((NumberValue) value).value
                        : value instanceof TextValue ? ValueTransformer.fontWeightNumber(((TextValue) value).value)
                        : Double.NaN;
                if (!ValuePredicates.isValidFontWeight(weight)) {
                    fallback = value instanceof NumberValue ? SemanticType.NUMBER : SemanticType.STRING;
                }
            } else if (classification.semanticType == SemanticType.DIMENSION && value instanceof TextValue
                    && !ValuePredicates.isValidDimension(((TextValue) value).value)) {
                fallback = SemanticType.STRING;
            }
            if (fallback == null) return classification;

            diagnostics.warn("TYPE_FALLBACK",
                    "Variable \"" + v.name + "\" looks like " + classification.semanticType
                            + " but its value has no valid " + classification.semanticType
                            + " form; exported as " + fallback,
                    "variable", v.name);
            return ClassificationResult.of(fallback, Confidence.LOW,
                    classification.reason + "; value outside the " + classification.semanticType + " range");
        }

        private CanonicalToken canonicalToken(Variable v, VariableCollection collection, ResolvedValue value,
                                              Variable target, ClassificationResult classification,
                                              List<String> modeIds) {
            JsonNode out;
            SchemaHint hint;
            if (target != null) {
                String targetKey = TokenNaming.tokenKey(target.name, options.structure, options.namingConvention);
                out = JsonNodeFactory.instance.textNode(TokenNaming.canonicalReference(targetKey));
                hint = SchemaHint.ALIAS;
            } else {
                out = ValueTransformer.canonical(value, classification.semanticType, options.defaultUnit);
                hint = classification.schemaHint;
            }
            ObjectNode metadata = options.includeMetadata ? metadata(v, collection, modeIds) : null;
            return new CanonicalToken(out, classification.semanticType.canonicalType, v.description, hint,
                    v.isDeprecated(), v.deprecationComment(), metadata);
        }

        private ExtendedToken extendedToken(Variable v, VariableCollection collection, ResolvedValue value,
                                            Variable target, ClassificationResult classification,
                                            List<String> modeIds) {
            String schemaUrl = target != null
                    ? ExtendedSchemas.url(SchemaHint.ALIAS)
                    : ExtendedSchemas.urlFor(classification.semanticType, classification.schemaHint);
            JsonNode out = extendedValue(value, classification.semanticType);

            Map<String, ExtendedSetEntry> sets = new LinkedHashMap<>();
            if (modesDiffer(v, modeIds)) {
                for (String modeId : modeIds) {
                    String modeName = collection == null ? modeId : collection.modeName(modeId);
                    ResolvedValue mv = v.valuesByMode.get(modeId);
                    String entrySchema = mv.isAlias() ? ExtendedSchemas.url(SchemaHint.ALIAS) : schemaUrl;
                    sets.put(modeName, new ExtendedSetEntry(entrySchema,
                            extendedValue(mv, classification.semanticType),
                            TokenIdStrategy.idFor(options.identifierMode, v.id, modeName)));
                }
            }
            return new ExtendedToken(schemaUrl, out,
                    TokenIdStrategy.idFor(options.identifierMode, v.id, null),
                    TokenNaming.componentOf(v.name),
                    v.hidden,
                    v.isDeprecated(),
                    v.deprecationComment(),
                    sets);
        }

        private JsonNode extendedValue(ResolvedValue value, SemanticType type) {
            if (value.isAlias()) {
                Variable t = byId.get(((AliasReference) value).targetVariableId);
                String name = t == null ? ((AliasReference) value).targetVariableId : t.name;
                return JsonNodeFactory.instance.textNode(TokenNaming.extendedReference(name));
            }
            return ValueTransformer.extended(value, type, options.defaultUnit);
        }

        private ObjectNode metadata(Variable v, VariableCollection collection, List<String> modeIds) {
            ObjectNode m = JsonNodeFactory.instance.objectNode();
            m.put("variableId", v.id);
            if (collection != null) {
                m.put("collectionId", collection.id);
                m.put("collectionName", collection.name);
            }
            ArrayNode scopes = m.putArray("scopes");
            for (String s : v.scopes) scopes.add(s);
            m.put("originalType", v.resolvedType.name());
            ArrayNode modes = m.putArray("modes");
            for (String modeId : modeIds) {
                modes.add(collection == null ? modeId : collection.modeName(modeId));
            }
            return m;
        }

        /** Selected mode ids in collection order; variables outside collections use their own mode ids. */
        private List<String> selectedModeIds(Variable v, VariableCollection collection) {
            List<String> selected = options.selectedModes == null ? List.of() : options.selectedModes;
            List<String> out = new ArrayList<>();
            if (collection != null && !collection.modes.isEmpty()) {
                for (VariableMode m : collection.modes) {
                    if (selected.isEmpty() || selected.contains(m.name)) out.add(m.modeId);
                }
                return out;
            }
            for (String modeId : v.valuesByMode.keySet()) {
                if (selected.isEmpty() || selected.contains(modeId)) out.add(modeId);
            }
            return out;
        }

        private boolean modesDiffer(Variable v, List<String> modeIds) {
            if (modeIds.size() < 2) return false;
            ResolvedValue first = v.valuesByMode.get(modeIds.get(0));
            for (int i = 1; i < modeIds.size(); i++) {
                if (!Objects.equals(first, v.valuesByMode.get(modeIds.get(i)))) return true;
            }
            return false;
        }

        /**
         * Follows an alias chain to its first non-alias value. Cycles and dangling targets are
         * recorded as errors and yield null.
         */
        private Resolved resolveAlias(Variable source, String targetId) {
            Set<String> chain = new LinkedHashSet<>();
            chain.add(source.id);
            String id = targetId;
            while (true) {
                if (!chain.add(id)) {
                    diagnostics.error("ALIAS_CYCLE",
                            "Circular alias reference detected for \"" + source.name + "\": "
                                    + String.join(" -> ", chain) + " -> " + id,
                            "variable", source.name);
                    return null;
                }
                Variable t = byId.get(id);
                if (t == null) {
                    diagnostics.error("ALIAS_TARGET_NOT_FOUND",
                            "Alias target not found: " + id, "variable", source.name, "target", id);
                    return null;
                }
                ResolvedValue tv = primaryValue(t);
                if (tv == null) {
                    diagnostics.error("ALIAS_TARGET_NO_VALUE",
                            "Alias target \"" + t.name + "\" has no value", "variable", source.name, "target", id);
                    return null;
                }
                if (!tv.isAlias()) return new Resolved(t, tv);
                id = ((AliasReference) tv).targetVariableId;
            }
        }

        private ResolvedValue primaryValue(Variable v) {
            VariableCollection c = collectionOf.get(v.id);
            if (c != null && c.defaultModeId != null && v.valuesByMode.containsKey(c.defaultModeId)) {
                return v.valuesByMode.get(c.defaultModeId);
            }
            for (ResolvedValue rv : v.valuesByMode.values()) return rv;
            return null;
        }
    }

    private static final class Resolved {
        final Variable variable;
        final ResolvedValue value;

        Resolved(Variable variable, ResolvedValue value) {
            this.variable = variable;
            this.value = value;
        }
    }
}
