package info.isaksson.erland.tokenexport.emitter;

import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Maps slash-separated variable names onto token keys and references.
 */
public final class TokenNaming {
    private TokenNaming() {}

    private static final Pattern CAMEL_SEPARATOR = Pattern.compile("[-_\\s]+(.)");

    /**
     * Token key for a variable name: braces and {@code $} removed, {@code /} replaced by the structure's
     * separator, then the naming convention applied.
     */
    public static String tokenKey(String name, TokenStructure structure, NamingConvention convention) {
        String separator = structure == TokenStructure.NESTED ? "." : "-";
        String s = (name == null ? "" : name)
                .replaceAll("[{}]", "")
                .replace("$", "")
                .replace("/", separator);

        switch (convention) {
            case KEBAB:
                return s.toLowerCase(Locale.ROOT).replaceAll("\\s+", "-");
            case CAMEL:
                return camel(s);
            case SNAKE:
                return s.toLowerCase(Locale.ROOT).replaceAll("[-\\s]+", "_");
            case ORIGINAL:
            default:
                return s;
        }
    }

    /** Canonical alias reference, {@code {key}}. */
    public static String canonicalReference(String targetKey) {
        return "{" + targetKey + "}";
    }

    /**
     * Extended alias reference: every path segment normalized to kebab-case and joined with {@code -}.
     * {@code colors/BorderColor/blue} becomes {@code {colors-border-color-blue}}.
     */
    public static String extendedReference(String targetName) {
        String[] parts = (targetName == null ? "" : targetName).split("/");
        StringBuilder sb = new StringBuilder("{");
        for (int i = 0; i < parts.length; i++) {
            if (i > 0) sb.append('-');
            sb.append(kebab(parts[i]));
        }
        return sb.append('}').toString();
    }

    /** First path segment, lower-cased, when the name has more than one segment. */
    public static String componentOf(String name) {
        if (name == null) return null;
        String[] parts = name.split("/");
        if (parts.length > 1 && !parts[0].isEmpty()) {
            return parts[0].toLowerCase(Locale.ROOT);
        }
        return null;
    }

    static String kebab(String segment) {
        String s = segment.replaceAll("([a-z])([A-Z])", "$1-$2");
        s = s.replaceAll("([A-Z]+)([A-Z][a-z])", "$1-$2");
        s = s.toLowerCase(Locale.ROOT);
        s = s.replaceAll("[\\s_]+", "-");
        s = s.replaceAll("-+", "-");
        return s.replaceAll("^-|-$", "");
    }

    private static String camel(String s) {
        Matcher m = CAMEL_SEPARATOR.matcher(s);
        StringBuilder sb = new StringBuilder();
        while (m.find()) {
            m.appendReplacement(sb, Matcher.quoteReplacement(m.group(1).toUpperCase(Locale.ROOT)));
        }
        m.appendTail(sb);
        return sb.toString();
    }
}
