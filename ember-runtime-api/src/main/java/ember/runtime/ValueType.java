package ember.runtime;

/**
 * 运行时值的类型标签
 */
public enum ValueType {
    UNDEFINED,
    NULL,
    BOOLEAN,
    NUMBER,
    STRING,
    OBJECT
}
