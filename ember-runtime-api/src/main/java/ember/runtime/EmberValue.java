package ember.runtime;

import java.util.Locale;

/**
 * EmberScript 运行时值的基类
 *
 * <p>标签集合固定为 undefined、null、boolean、number、string、object 六种。
 * 对象引用由对象记录本身表示（见 {@code ember.runtime.types.EmberObject}）。</p>
 *
 * <p>这里不做任何类型强制转换：{@code asXxx()} 只在标签匹配时返回，
 * 否则抛出 {@link EmberException}。</p>
 */
public abstract class EmberValue {

    /**
     * 获取值的类型标签
     */
    public abstract ValueType getType();

    /**
     * 获取值的类型名称（用于错误消息和诊断输出）
     */
    public String getTypeName() {
        return getType().name().toLowerCase(Locale.ROOT);
    }

    // ============ 类型检查 ============

    public boolean isUndefined() {
        return getType() == ValueType.UNDEFINED;
    }

    public boolean isNull() {
        return getType() == ValueType.NULL;
    }

    public boolean isBoolean() {
        return getType() == ValueType.BOOLEAN;
    }

    public boolean isNumber() {
        return getType() == ValueType.NUMBER;
    }

    public boolean isString() {
        return getType() == ValueType.STRING;
    }

    public boolean isObject() {
        return getType() == ValueType.OBJECT;
    }

    // ============ 取值 ============

    public boolean asBoolean() {
        throw mismatch("boolean");
    }

    public double asNumber() {
        throw mismatch("number");
    }

    public String asString() {
        throw mismatch("string");
    }

    private EmberException mismatch(String expected) {
        return new EmberException("Expected " + expected + " but was " + getTypeName());
    }
}
