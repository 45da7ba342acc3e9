package ember.runtime.debug;

import ember.runtime.EmberBoolean;
import ember.runtime.EmberNull;
import ember.runtime.EmberNumber;
import ember.runtime.EmberString;
import ember.runtime.types.EmberObject;
import ember.runtime.types.ObjectClass;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * ValueFormatter 单元测试
 */
class ValueFormatterTest {

    @Test
    @DisplayName("基本标签")
    void testSimpleTags() {
        assertEquals("undefined", ValueFormatter.format(EmberNull.UNDEFINED));
        assertEquals("null", ValueFormatter.format(EmberNull.NULL));
        assertEquals("true", ValueFormatter.format(EmberBoolean.TRUE));
        assertEquals("false", ValueFormatter.format(EmberBoolean.FALSE));
    }

    @Test
    @DisplayName("字符串加单引号")
    void testString() {
        assertEquals("'hello'", ValueFormatter.format(EmberString.of("hello")));
        assertEquals("''", ValueFormatter.format(EmberString.EMPTY));
    }

    @Test
    @DisplayName("对象输出引用标记")
    void testObject() {
        EmberObject obj = EmberObject.newObject(ObjectClass.OBJECT);
        String text = ValueFormatter.format(obj);
        assertTrue(text.startsWith("<object OBJECT@"), text);
        assertTrue(text.endsWith(">"), text);
    }

    @Nested
    @DisplayName("数字（%.9g）")
    class NumberTests {

        @Test
        @DisplayName("整数不带小数点")
        void testIntegers() {
            assertEquals("0", ValueFormatter.format(EmberNumber.ZERO));
            assertEquals("1", ValueFormatter.format(EmberNumber.of(1)));
            assertEquals("-42", ValueFormatter.format(EmberNumber.of(-42)));
            assertEquals("123456789", ValueFormatter.formatNumber(123456789));
        }

        @Test
        @DisplayName("小数保留 9 位有效数字并去掉尾随零")
        void testFractions() {
            assertEquals("0.1", ValueFormatter.formatNumber(0.1));
            assertEquals("-2.5", ValueFormatter.formatNumber(-2.5));
            assertEquals("0.333333333", ValueFormatter.formatNumber(1.0 / 3));
            assertEquals("3.14159265", ValueFormatter.formatNumber(Math.PI));
            assertEquals("0.0001", ValueFormatter.formatNumber(0.0001));
        }

        @Test
        @DisplayName("超出范围时使用指数形式")
        void testExponent() {
            assertEquals("1.23456789e+09", ValueFormatter.formatNumber(1234567890));
            assertEquals("1e+21", ValueFormatter.formatNumber(1e21));
            assertEquals("1e-05", ValueFormatter.formatNumber(0.00001));
            assertEquals("1.5e-07", ValueFormatter.formatNumber(1.5e-7));
            assertEquals("1e+100", ValueFormatter.formatNumber(1e100));
        }

        @Test
        @DisplayName("进位后切换到指数形式")
        void testRoundingCarry() {
            assertEquals("1e+09", ValueFormatter.formatNumber(999999999.5));
        }

        @Test
        @DisplayName("非有限数字和负零")
        void testSpecialValues() {
            assertEquals("NaN", ValueFormatter.formatNumber(Double.NaN));
            assertEquals("Infinity", ValueFormatter.formatNumber(Double.POSITIVE_INFINITY));
            assertEquals("-Infinity", ValueFormatter.formatNumber(Double.NEGATIVE_INFINITY));
            assertEquals("-0", ValueFormatter.formatNumber(-0.0));
        }
    }
}
