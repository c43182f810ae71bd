package info.isaksson.erland.tokenexport.model;

/**
 * Primitive kind a design variable resolves to in the host tool.
 */
public enum ResolvedPrimitive {
    COLOR,
    FLOAT,
    STRING,
    BOOLEAN
}
