package ember.runtime;

/**
 * Number 值（IEEE 754 双精度）
 */
public final class EmberNumber extends EmberValue {

    /** 0 常量，也是包装对象的默认原始值 */
    public static final EmberNumber ZERO = new EmberNumber(0);

    private final double value;

    private EmberNumber(double value) {
        this.value = value;
    }

    public static EmberNumber of(double value) {
        // -0.0 不能共享 ZERO
        if (value == 0 && Double.doubleToRawLongBits(value) == 0L) return ZERO;
        return new EmberNumber(value);
    }

    public double getValue() {
        return value;
    }

    @Override
    public ValueType getType() {
        return ValueType.NUMBER;
    }

    @Override
    public double asNumber() {
        return value;
    }

    @Override
    public boolean equals(Object other) {
        if (other == this) return true;
        if (!(other instanceof EmberNumber)) return false;
        return Double.compare(value, ((EmberNumber) other).value) == 0;
    }

    @Override
    public int hashCode() {
        return Double.hashCode(value);
    }

    @Override
    public String toString() {
        return String.valueOf(value);
    }
}
