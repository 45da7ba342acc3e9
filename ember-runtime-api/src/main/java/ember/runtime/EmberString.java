package ember.runtime;

import java.util.concurrent.ConcurrentHashMap;

/**
 * String 值
 */
public final class EmberString extends EmberValue {

    /** 空字符串常量 */
    public static final EmberString EMPTY = new EmberString("");

    /** 短字符串驻留池（<=64 字符），超过容量后不再缓存 */
    private static final ConcurrentHashMap<String, EmberString> INTERN_POOL = new ConcurrentHashMap<>();
    private static final int INTERN_MAX_LENGTH = 64;
    private static final int INTERN_MAX_SIZE = 4096;

    private final String value;

    private EmberString(String value) {
        this.value = value;
    }

    /**
     * 工厂方法：短字符串驻留，长字符串直接创建
     */
    public static EmberString of(String value) {
        if (value == null) {
            throw new NullPointerException("value");
        }
        if (value.isEmpty()) return EMPTY;
        if (value.length() <= INTERN_MAX_LENGTH) {
            EmberString cached = INTERN_POOL.get(value);
            if (cached != null) return cached;
            EmberString created = new EmberString(value);
            if (INTERN_POOL.size() < INTERN_MAX_SIZE) {
                EmberString existing = INTERN_POOL.putIfAbsent(value, created);
                return existing != null ? existing : created;
            }
            return created;
        }
        return new EmberString(value);
    }

    public String getValue() {
        return value;
    }

    @Override
    public ValueType getType() {
        return ValueType.STRING;
    }

    @Override
    public String asString() {
        return value;
    }

    @Override
    public boolean equals(Object other) {
        if (other == this) return true;
        if (!(other instanceof EmberString)) return false;
        return value.equals(((EmberString) other).value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return value;
    }
}
