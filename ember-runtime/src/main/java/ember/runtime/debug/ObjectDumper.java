package ember.runtime.debug;

import ember.runtime.types.EmberObject;
import ember.runtime.types.Property;

import java.io.PrintStream;

/**
 * 以键序打印对象的属性，每行一个：
 *
 * <pre>
 * {
 * 	name: value,
 * }
 * </pre>
 *
 * 嵌套对象只输出引用标记，不展开。
 */
public final class ObjectDumper {

    private ObjectDumper() {}

    public static String dump(EmberObject obj) {
        StringBuilder sb = new StringBuilder();
        sb.append("{\n");
        obj.properties().forEach(prop -> appendProperty(sb, prop));
        sb.append("}\n");
        return sb.toString();
    }

    public static void dump(EmberObject obj, PrintStream out) {
        out.print(dump(obj));
    }

    private static void appendProperty(StringBuilder sb, Property prop) {
        sb.append('\t').append(prop.getName()).append(": ")
          .append(ValueFormatter.format(prop.getValue()))
          .append(",\n");
    }
}
