package ember.runtime;

/**
 * Boolean 值
 */
public final class EmberBoolean extends EmberValue {

    /** true 常量 */
    public static final EmberBoolean TRUE = new EmberBoolean(true);

    /** false 常量 */
    public static final EmberBoolean FALSE = new EmberBoolean(false);

    private final boolean value;

    private EmberBoolean(boolean value) {
        this.value = value;
    }

    /**
     * 获取布尔值实例
     */
    public static EmberBoolean of(boolean value) {
        return value ? TRUE : FALSE;
    }

    public boolean getValue() {
        return value;
    }

    @Override
    public ValueType getType() {
        return ValueType.BOOLEAN;
    }

    @Override
    public boolean asBoolean() {
        return value;
    }

    @Override
    public String toString() {
        return String.valueOf(value);
    }
}
