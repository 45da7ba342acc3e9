package ember.runtime;

/**
 * EmberScript 基础运行时异常。
 *
 * <p>查找类操作以 {@code null} 表示"未找到"，不会抛出此异常；
 * 它只用于类型不匹配、输入格式错误等真正的错误。</p>
 */
public class EmberException extends RuntimeException {

    public EmberException(String message) {
        super(message);
    }

    public EmberException(String message, Throwable cause) {
        super(message, cause);
    }
}
