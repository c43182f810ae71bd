package info.isaksson.erland.tokenexport.model;

public final class NumberValue implements ResolvedValue {
    public final double value;

    public NumberValue(double value) {
        this.value = value;
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof NumberValue)) return false;
        return Double.compare(value, ((NumberValue) o).value) == 0;
    }

    @Override public int hashCode() {
        return Double.hashCode(value);
    }

    @Override public String toString() {
        return "NumberValue{" + value + "}";
    }
}
