package ember.runtime.types;

import ember.runtime.ValueType;

/**
 * 对象记录的类别标签（封闭集合）
 */
public enum ObjectClass {
    OBJECT,
    ARRAY,
    /** 脚本定义的函数（携带函数体和闭包作用域） */
    FUNCTION,
    /** 宿主提供的原生函数 */
    NATIVE_FUNCTION,
    ERROR,
    BOOLEAN(ValueType.BOOLEAN),
    NUMBER(ValueType.NUMBER),
    STRING(ValueType.STRING);

    private final ValueType primitiveType;

    ObjectClass() {
        this(null);
    }

    ObjectClass(ValueType primitiveType) {
        this.primitiveType = primitiveType;
    }

    public boolean isCallable() {
        return this == FUNCTION || this == NATIVE_FUNCTION;
    }

    /**
     * 是否是原始值包装对象（原始值存放在 {@link EmberObject#getPrimitive()}）
     */
    public boolean isPrimitiveWrapper() {
        return primitiveType != null;
    }

    /**
     * @return 包装的原始值标签，非包装类别返回 null
     */
    public ValueType getPrimitiveType() {
        return primitiveType;
    }
}
