package ember.runtime.types;

import ember.runtime.EmberNumber;
import ember.runtime.EmberValue;
import ember.runtime.ValueType;

import java.util.Objects;

/**
 * 引用类型值背后的对象记录
 *
 * <p>属性存放在一棵独占的 {@link PropertyTree} 中。按类别不同，对象还可能携带：</p>
 * <ul>
 *   <li>{@link ObjectClass#FUNCTION}：函数体与定义处捕获的作用域（闭包）</li>
 *   <li>{@link ObjectClass#NATIVE_FUNCTION}：原生函数入口</li>
 *   <li>包装类（BOOLEAN / NUMBER / STRING）：原始值</li>
 * </ul>
 *
 * <p>原型引用不由本类使用，供上层做委托查找。对象的回收由宿主负责。</p>
 */
public final class EmberObject extends EmberValue {

    private final ObjectClass objectClass;
    private final PropertyTree properties = new PropertyTree();
    private final EmberValue primitive;
    private final ScriptFunction function;
    private final Environment scope;
    private final NativeFunction nativeFunction;
    private EmberObject prototype;

    private EmberObject(ObjectClass objectClass, EmberValue primitive,
                        ScriptFunction function, Environment scope, NativeFunction nativeFunction) {
        this.objectClass = objectClass;
        this.primitive = primitive;
        this.function = function;
        this.scope = scope;
        this.nativeFunction = nativeFunction;
    }

    // ============ 构造 ============

    /**
     * 创建不带函数信息的对象：属性为空、无原型、原始值为 0。
     * 函数类别必须通过 {@link #newFunction} / {@link #newNativeFunction} 创建。
     */
    public static EmberObject newObject(ObjectClass kind) {
        Objects.requireNonNull(kind, "kind");
        if (kind.isCallable()) {
            throw new IllegalArgumentException("Callable objects need a body: " + kind);
        }
        return new EmberObject(kind, EmberNumber.ZERO, null, null, null);
    }

    /**
     * 创建脚本函数对象
     *
     * @param body  函数体
     * @param scope 定义处的作用域，被闭包共享而非独占
     */
    public static EmberObject newFunction(ScriptFunction body, Environment scope) {
        Objects.requireNonNull(body, "body");
        Objects.requireNonNull(scope, "scope");
        return new EmberObject(ObjectClass.FUNCTION, EmberNumber.ZERO, body, scope, null);
    }

    public static EmberObject newNativeFunction(NativeFunction nativeFunction) {
        Objects.requireNonNull(nativeFunction, "nativeFunction");
        return new EmberObject(ObjectClass.NATIVE_FUNCTION, EmberNumber.ZERO, null, null, nativeFunction);
    }

    /**
     * 创建原始值包装对象，原始值的类型必须与类别一致
     */
    public static EmberObject newPrimitive(ObjectClass kind, EmberValue value) {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(value, "value");
        if (!kind.isPrimitiveWrapper()) {
            throw new IllegalArgumentException("Not a primitive wrapper class: " + kind);
        }
        if (value.getType() != kind.getPrimitiveType()) {
            throw new IllegalArgumentException(kind + " wrapper cannot hold " + value.getTypeName());
        }
        return new EmberObject(kind, value, null, null, null);
    }

    // ============ 属性 ============

    /**
     * @return 属性记录，不存在返回 null
     */
    public Property getProperty(String name) {
        return properties.lookup(name);
    }

    /**
     * 查找或创建属性槽，总是成功。重复调用返回同一个属性记录。
     */
    public Property setProperty(String name) {
        return properties.insert(name);
    }

    /**
     * 查找或创建属性槽并写入值
     */
    public Property setProperty(String name, EmberValue value) {
        Property prop = properties.insert(name);
        prop.setValue(value);
        return prop;
    }

    public Property firstProperty() {
        return properties.first();
    }

    public Property nextProperty(String name) {
        return properties.next(name);
    }

    /**
     * 按属性名字典序迭代
     */
    public Iterable<Property> properties() {
        return properties;
    }

    public int getPropertyCount() {
        return properties.size();
    }

    PropertyTree getPropertyTree() {
        return properties;
    }

    // ============ 字段访问 ============

    public ObjectClass getObjectClass() {
        return objectClass;
    }

    public EmberObject getPrototype() {
        return prototype;
    }

    public void setPrototype(EmberObject prototype) {
        this.prototype = prototype;
    }

    public EmberValue getPrimitive() {
        return primitive;
    }

    /** 脚本函数体，非 FUNCTION 对象返回 null */
    public ScriptFunction getFunction() {
        return function;
    }

    /** 闭包作用域，非 FUNCTION 对象返回 null */
    public Environment getScope() {
        return scope;
    }

    /** 原生入口，非 NATIVE_FUNCTION 对象返回 null */
    public NativeFunction getNativeFunction() {
        return nativeFunction;
    }

    @Override
    public ValueType getType() {
        return ValueType.OBJECT;
    }

    @Override
    public String toString() {
        return "<object " + objectClass + "@" + Integer.toHexString(System.identityHashCode(this)) + ">";
    }
}
