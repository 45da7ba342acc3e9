package ember.runtime.types;

import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * 词法作用域帧
 *
 * <p>每一帧包装一个只用作变量表的 {@link EmberObject}，并通过 outer 链接到外层帧；
 * 最外层（全局）帧的 outer 为 null。一个帧可以被多个闭包共享。</p>
 */
public final class Environment {

    private static final Logger LOG = Logger.getLogger(Environment.class.getName());

    private final Environment outer;
    private final EmberObject variables;

    /**
     * @param outer     外层作用域，全局帧传 null
     * @param variables 变量表对象
     */
    public Environment(Environment outer, EmberObject variables) {
        this.outer = outer;
        this.variables = Objects.requireNonNull(variables, "variables");
    }

    /**
     * 创建全局作用域（变量表为新的空对象）
     */
    public static Environment global() {
        return new Environment(null, EmberObject.newObject(ObjectClass.OBJECT));
    }

    /**
     * 创建以当前帧为外层的子作用域
     */
    public Environment extend() {
        return new Environment(this, EmberObject.newObject(ObjectClass.OBJECT));
    }

    public Environment getOuter() {
        return outer;
    }

    public EmberObject getVariables() {
        return variables;
    }

    public boolean isGlobal() {
        return outer == null;
    }

    /**
     * 沿 outer 链找到最外层帧
     */
    public Environment getGlobal() {
        Environment env = this;
        while (env.outer != null) {
            env = env.outer;
        }
        return env;
    }

    // ============ 变量操作 ============

    /**
     * 在当前帧声明变量，不考虑外层的同名变量（变量提升语义）
     */
    public Property declare(String name) {
        return variables.setProperty(name);
    }

    /**
     * 由内向外查找变量
     *
     * @return 最近的绑定，整条链都没有时返回 null
     */
    public Property resolve(String name) {
        for (Environment env = this; env != null; env = env.outer) {
            Property ref = env.variables.getProperty(name);
            if (ref != null) {
                return ref;
            }
        }
        return null;
    }

    /**
     * 由内向外查找要赋值的绑定。整条链都没有该名字时，在最外层帧创建（隐式全局变量）。
     */
    public Property assign(String name) {
        Environment env = this;
        while (true) {
            Property ref = env.variables.getProperty(name);
            if (ref != null) {
                return ref;
            }
            if (env.outer == null) {
                break;
            }
            env = env.outer;
        }
        if (LOG.isLoggable(Level.FINE)) {
            LOG.fine("Assignment to undeclared variable creates global: " + name);
        }
        return env.variables.setProperty(name);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("Environment{");
        boolean first = true;
        for (Property prop : variables.properties()) {
            if (!first) sb.append(", ");
            first = false;
            sb.append(prop.getName());
        }
        sb.append("}");
        if (outer != null) {
            sb.append(" -> outer");
        }
        return sb.toString();
    }
}
