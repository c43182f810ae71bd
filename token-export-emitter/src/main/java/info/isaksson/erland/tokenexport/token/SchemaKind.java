package info.isaksson.erland.tokenexport.token;

/** Output schema a token belongs to. */
public enum SchemaKind {
    /** Vendor-neutral {@code $value}/{@code $type} documents. */
    CANONICAL,
    /** Documents carrying a schema URL and a stable identifier per token. */
    EXTENDED
}
