package ember.runtime;

/**
 * undefined 值和 null 值
 */
public final class EmberNull extends EmberValue {

    /** 唯一的 undefined 实例，也是新属性槽的初始值 */
    public static final EmberNull UNDEFINED = new EmberNull(false);

    /** 唯一的 null 实例 */
    public static final EmberNull NULL = new EmberNull(true);

    private final boolean isNullValue;

    private EmberNull(boolean isNullValue) {
        this.isNullValue = isNullValue;
    }

    @Override
    public ValueType getType() {
        return isNullValue ? ValueType.NULL : ValueType.UNDEFINED;
    }

    @Override
    public String toString() {
        return isNullValue ? "null" : "undefined";
    }
}
