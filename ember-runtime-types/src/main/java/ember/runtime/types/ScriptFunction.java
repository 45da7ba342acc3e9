package ember.runtime.types;

/**
 * 脚本函数体。
 *
 * <p>由编译器 / 求值器实现，对象模型只保存引用，不解释其内容。</p>
 */
public interface ScriptFunction {

    String getName();

    int getArity();
}
