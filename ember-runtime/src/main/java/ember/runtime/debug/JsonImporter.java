package ember.runtime.debug;

import com.google.gson.stream.JsonReader;
import com.google.gson.stream.JsonToken;
import com.google.gson.stream.MalformedJsonException;
import ember.runtime.EmberBoolean;
import ember.runtime.EmberException;
import ember.runtime.EmberNull;
import ember.runtime.EmberNumber;
import ember.runtime.EmberString;
import ember.runtime.EmberValue;
import ember.runtime.types.EmberObject;
import ember.runtime.types.ObjectClass;

import java.io.EOFException;
import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * 把 JSON 文档加载为对象图
 *
 * <ul>
 *   <li>JSON 对象 → {@link ObjectClass#OBJECT}</li>
 *   <li>JSON 数组 → {@link ObjectClass#ARRAY}，元素以下标为属性名，另加 length 属性</li>
 *   <li>null / boolean / number / string → 对应的值标签</li>
 * </ul>
 *
 * <p>边读边建对象，嵌套层数超过 {@link #MAX_DEPTH} 时报错。</p>
 */
public final class JsonImporter {

    private static final Logger LOG = Logger.getLogger(JsonImporter.class.getName());

    /** 对象/数组的最大嵌套层数（根对象为第 1 层） */
    public static final int MAX_DEPTH = 512;

    /**
     * @param reader JSON 输入，根必须是对象
     * @throws EmberException 输入不是合法 JSON、根不是对象或嵌套过深
     */
    public EmberObject load(Reader reader) {
        JsonReader in = new JsonReader(reader);
        // 与 Gson.fromJson 一致
        in.setLenient(true);
        try {
            JsonToken first;
            try {
                first = in.peek();
            } catch (EOFException e) {
                throw new EmberException("Empty JSON document", e);
            }
            if (first == JsonToken.END_DOCUMENT) {
                throw new EmberException("Empty JSON document");
            }
            if (first != JsonToken.BEGIN_OBJECT) {
                throw new EmberException("JSON root must be an object but was " + describe(first));
            }
            int[] objectCount = {0};
            EmberObject result = readObject(in, 1, objectCount);
            if (in.peek() != JsonToken.END_DOCUMENT) {
                throw new EmberException("Malformed JSON: trailing content at " + in.getPath());
            }
            if (LOG.isLoggable(Level.FINE)) {
                LOG.fine("Imported " + objectCount[0] + " objects, " + result.getPropertyCount() + " root properties");
            }
            return result;
        } catch (MalformedJsonException | EOFException | IllegalStateException e) {
            throw new EmberException("Malformed JSON: " + e.getMessage(), e);
        } catch (NumberFormatException e) {
            throw new EmberException("Malformed JSON: bad number: " + e.getMessage(), e);
        } catch (IOException e) {
            throw new EmberException("Cannot read JSON: " + e.getMessage(), e);
        }
    }

    public EmberObject load(String json) {
        return load(new StringReader(json));
    }

    // ============ 递归下降 ============

    private EmberObject readObject(JsonReader in, int depth, int[] objectCount) throws IOException {
        checkDepth(depth);
        objectCount[0]++;
        EmberObject obj = EmberObject.newObject(ObjectClass.OBJECT);
        in.beginObject();
        while (in.hasNext()) {
            String name = in.nextName();
            obj.setProperty(name, readValue(in, depth, objectCount));
        }
        in.endObject();
        return obj;
    }

    private EmberObject readArray(JsonReader in, int depth, int[] objectCount) throws IOException {
        checkDepth(depth);
        objectCount[0]++;
        EmberObject arr = EmberObject.newObject(ObjectClass.ARRAY);
        in.beginArray();
        int length = 0;
        while (in.hasNext()) {
            arr.setProperty(Integer.toString(length), readValue(in, depth, objectCount));
            length++;
        }
        in.endArray();
        arr.setProperty("length", EmberNumber.of(length));
        return arr;
    }

    /** depth 为所在容器的层数 */
    private EmberValue readValue(JsonReader in, int depth, int[] objectCount) throws IOException {
        JsonToken token = in.peek();
        switch (token) {
            case BEGIN_OBJECT:
                return readObject(in, depth + 1, objectCount);
            case BEGIN_ARRAY:
                return readArray(in, depth + 1, objectCount);
            case NULL:
                in.nextNull();
                return EmberNull.NULL;
            case BOOLEAN:
                return EmberBoolean.of(in.nextBoolean());
            case NUMBER:
                return EmberNumber.of(in.nextDouble());
            case STRING:
                return EmberString.of(in.nextString());
            default:
                throw new EmberException("Malformed JSON: unexpected " + token + " at " + in.getPath());
        }
    }

    private static void checkDepth(int depth) {
        if (depth > MAX_DEPTH) {
            throw new EmberException("JSON nesting too deep (limit " + MAX_DEPTH + ")");
        }
    }

    private static String describe(JsonToken token) {
        switch (token) {
            case BEGIN_ARRAY: return "an array";
            case NULL: return "null";
            default: return "a primitive";
        }
    }
}
