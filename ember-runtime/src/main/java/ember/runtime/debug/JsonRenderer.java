package ember.runtime.debug;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonElement;
import com.google.gson.JsonNull;
import com.google.gson.JsonObject;
import com.google.gson.JsonPrimitive;
import ember.runtime.EmberException;
import ember.runtime.EmberValue;
import ember.runtime.types.EmberObject;
import ember.runtime.types.Property;

import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.Set;

/**
 * 把对象图渲染为 JSON（Gson 树模型）
 *
 * <p>属性按键序输出；嵌套对象递归展开，指回正在渲染的祖先对象时输出引用标记。
 * undefined 与 null 都输出为 JSON null，非有限数字输出为字符串。
 * 嵌套层数上限与 {@link JsonImporter#MAX_DEPTH} 相同。</p>
 */
public final class JsonRenderer {

    private final Gson gson;

    public JsonRenderer() {
        this(false);
    }

    public JsonRenderer(boolean pretty) {
        GsonBuilder builder = new GsonBuilder().serializeNulls();
        if (pretty) {
            builder.setPrettyPrinting();
        }
        this.gson = builder.create();
    }

    public JsonObject render(EmberObject obj) {
        Set<EmberObject> path = Collections.newSetFromMap(new IdentityHashMap<EmberObject, Boolean>());
        return renderObject(obj, path);
    }

    public String toJson(EmberObject obj) {
        return gson.toJson(render(obj));
    }

    private JsonObject renderObject(EmberObject obj, Set<EmberObject> path) {
        if (path.size() >= JsonImporter.MAX_DEPTH) {
            throw new EmberException("Object nesting too deep to render (limit " + JsonImporter.MAX_DEPTH + ")");
        }
        path.add(obj);
        JsonObject json = new JsonObject();
        for (Property prop : obj.properties()) {
            json.add(prop.getName(), renderValue(prop.getValue(), path));
        }
        path.remove(obj);
        return json;
    }

    private JsonElement renderValue(EmberValue value, Set<EmberObject> path) {
        switch (value.getType()) {
            case UNDEFINED:
            case NULL:
                return JsonNull.INSTANCE;
            case BOOLEAN:
                return new JsonPrimitive(value.asBoolean());
            case NUMBER:
                return renderNumber(value.asNumber());
            case STRING:
                return new JsonPrimitive(value.asString());
            case OBJECT:
                EmberObject obj = (EmberObject) value;
                if (path.contains(obj)) {
                    return new JsonPrimitive(ValueFormatter.format(obj));
                }
                return renderObject(obj, path);
            default:
                throw new IllegalStateException("Unknown value type: " + value.getType());
        }
    }

    private static JsonElement renderNumber(double d) {
        if (Double.isNaN(d) || Double.isInfinite(d)) {
            return new JsonPrimitive(ValueFormatter.formatNumber(d));
        }
        // 整数值保持整数形式（1 而不是 1.0）
        if (d == Math.rint(d) && Math.abs(d) < 0x1p53 && !(d == 0 && 1 / d < 0)) {
            return new JsonPrimitive((long) d);
        }
        return new JsonPrimitive(d);
    }
}
