package ember.runtime.debug;

import ember.runtime.EmberValue;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;

/**
 * 值到调试文本的转换
 *
 * <ul>
 *   <li>undefined / null / true / false 原样输出</li>
 *   <li>数字按 C 的 {@code %.9g}：9 位有效数字，去掉尾随零，十进制指数小于 -4 或不小于 9 时用指数形式</li>
 *   <li>字符串加单引号</li>
 *   <li>对象输出不透明的引用标记</li>
 * </ul>
 */
public final class ValueFormatter {

    /** 有效数字位数 */
    static final int PRECISION = 9;

    private static final MathContext ROUNDING = new MathContext(PRECISION, RoundingMode.HALF_EVEN);

    private ValueFormatter() {}

    public static String format(EmberValue value) {
        switch (value.getType()) {
            case UNDEFINED: return "undefined";
            case NULL:      return "null";
            case BOOLEAN:   return value.asBoolean() ? "true" : "false";
            case NUMBER:    return formatNumber(value.asNumber());
            case STRING:    return "'" + value.asString() + "'";
            case OBJECT:    return value.toString();
            default:
                throw new IllegalStateException("Unknown value type: " + value.getType());
        }
    }

    public static String formatNumber(double d) {
        if (Double.isNaN(d)) return "NaN";
        if (Double.isInfinite(d)) return d > 0 ? "Infinity" : "-Infinity";
        if (d == 0) return 1 / d < 0 ? "-0" : "0";

        BigDecimal rounded = new BigDecimal(d).round(ROUNDING);
        // 舍入后的十进制指数（可能因进位比原值大 1）
        int exponent = rounded.precision() - rounded.scale() - 1;
        if (exponent < -4 || exponent >= PRECISION) {
            String mantissa = rounded.movePointLeft(exponent).stripTrailingZeros().toPlainString();
            int abs = Math.abs(exponent);
            return mantissa + "e" + (exponent < 0 ? "-" : "+") + (abs < 10 ? "0" : "") + abs;
        }
        return rounded.stripTrailingZeros().toPlainString();
    }
}
