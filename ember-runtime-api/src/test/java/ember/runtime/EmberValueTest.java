package ember.runtime;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Locale;

import static org.junit.jupiter.api.Assertions.*;

/**
 * EmberValue 类型标签单元测试
 */
class EmberValueTest {

    @Nested
    @DisplayName("undefined / null")
    class NullTests {

        @Test
        @DisplayName("两个单例的标签不同")
        void testTags() {
            assertEquals(ValueType.UNDEFINED, EmberNull.UNDEFINED.getType());
            assertEquals(ValueType.NULL, EmberNull.NULL.getType());
            assertTrue(EmberNull.UNDEFINED.isUndefined());
            assertFalse(EmberNull.UNDEFINED.isNull());
            assertTrue(EmberNull.NULL.isNull());
        }

        @Test
        @DisplayName("toString")
        void testToString() {
            assertEquals("undefined", EmberNull.UNDEFINED.toString());
            assertEquals("null", EmberNull.NULL.toString());
        }

        @Test
        @DisplayName("取数值抛出异常而不是强制转换")
        void testNoCoercion() {
            EmberException e = assertThrows(EmberException.class, () -> EmberNull.NULL.asNumber());
            assertEquals("Expected number but was null", e.getMessage());
        }

        @Test
        @DisplayName("类型名不受默认 Locale 影响")
        void testTypeNameLocale() {
            Locale saved = Locale.getDefault();
            Locale.setDefault(new Locale("tr", "TR"));
            try {
                assertEquals("undefined", EmberNull.UNDEFINED.getTypeName());
                EmberException e = assertThrows(EmberException.class, () -> EmberNull.UNDEFINED.asString());
                assertEquals("Expected string but was undefined", e.getMessage());
            } finally {
                Locale.setDefault(saved);
            }
        }
    }

    @Nested
    @DisplayName("EmberBoolean")
    class BooleanTests {

        @Test
        @DisplayName("of 返回单例")
        void testOf() {
            assertSame(EmberBoolean.TRUE, EmberBoolean.of(true));
            assertSame(EmberBoolean.FALSE, EmberBoolean.of(false));
            assertTrue(EmberBoolean.TRUE.asBoolean());
        }

        @Test
        @DisplayName("取字符串抛出异常")
        void testMismatch() {
            assertThrows(EmberException.class, () -> EmberBoolean.TRUE.asString());
        }
    }

    @Nested
    @DisplayName("EmberNumber")
    class NumberTests {

        @Test
        @DisplayName("零值共享，负零不共享")
        void testZero() {
            assertSame(EmberNumber.ZERO, EmberNumber.of(0));
            assertNotSame(EmberNumber.ZERO, EmberNumber.of(-0.0));
            assertNotEquals(EmberNumber.ZERO, EmberNumber.of(-0.0));
        }

        @Test
        @DisplayName("相等性")
        void testEquality() {
            assertEquals(EmberNumber.of(1.5), EmberNumber.of(1.5));
            assertEquals(EmberNumber.of(1.5).hashCode(), EmberNumber.of(1.5).hashCode());
            assertEquals(EmberNumber.of(Double.NaN), EmberNumber.of(Double.NaN));
            assertEquals(2.25, EmberNumber.of(2.25).asNumber(), 0.0);
        }
    }

    @Nested
    @DisplayName("EmberString")
    class StringTests {

        @Test
        @DisplayName("空串返回常量")
        void testEmpty() {
            assertSame(EmberString.EMPTY, EmberString.of(""));
        }

        @Test
        @DisplayName("短字符串驻留")
        void testIntern() {
            assertSame(EmberString.of("hello"), EmberString.of(new String("hello")));
        }

        @Test
        @DisplayName("长字符串按值相等")
        void testLongString() {
            StringBuilder sb = new StringBuilder();
            for (int i = 0; i < 100; i++) sb.append('x');
            EmberString a = EmberString.of(sb.toString());
            EmberString b = EmberString.of(sb.toString());
            assertEquals(a, b);
            assertEquals(ValueType.STRING, a.getType());
            assertEquals(sb.toString(), a.asString());
        }

        @Test
        @DisplayName("null 参数被拒绝")
        void testNull() {
            assertThrows(NullPointerException.class, () -> EmberString.of(null));
        }
    }
}
