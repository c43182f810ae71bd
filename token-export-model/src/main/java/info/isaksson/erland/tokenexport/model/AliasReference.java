package info.isaksson.erland.tokenexport.model;

import java.util.Objects;

/**
 * Pointer to another variable. Resolved by the converter, never treated as a value.
 */
public final class AliasReference implements ResolvedValue {
    public final String targetVariableId;

    public AliasReference(String targetVariableId) {
        this.targetVariableId = targetVariableId;
    }

    @Override
    public boolean isAlias() {
        return true;
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof AliasReference)) return false;
        return Objects.equals(targetVariableId, ((AliasReference) o).targetVariableId);
    }

    @Override public int hashCode() {
        return Objects.hashCode(targetVariableId);
    }

    @Override public String toString() {
        return "AliasReference{" + targetVariableId + "}";
    }
}
