package info.isaksson.erland.tokenexport.model;

import java.util.Objects;

public final class TextValue implements ResolvedValue {
    public final String value;

    public TextValue(String value) {
        this.value = value == null ? "" : value;
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TextValue)) return false;
        return Objects.equals(value, ((TextValue) o).value);
    }

    @Override public int hashCode() {
        return value.hashCode();
    }

    @Override public String toString() {
        return "TextValue{" + value + "}";
    }
}
