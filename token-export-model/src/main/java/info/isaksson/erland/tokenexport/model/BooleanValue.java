package info.isaksson.erland.tokenexport.model;

public final class BooleanValue implements ResolvedValue {
    public final boolean value;

    public BooleanValue(boolean value) {
        this.value = value;
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof BooleanValue)) return false;
        return value == ((BooleanValue) o).value;
    }

    @Override public int hashCode() {
        return Boolean.hashCode(value);
    }

    @Override public String toString() {
        return "BooleanValue{" + value + "}";
    }
}
