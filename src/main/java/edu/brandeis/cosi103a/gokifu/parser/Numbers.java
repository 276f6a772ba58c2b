package edu.brandeis.cosi103a.gokifu.parser;

import com.google.common.primitives.Ints;

import java.math.BigDecimal;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Lenient number reading for legacy header fields, which often carry trailing text.
 */
public final class Numbers {

    private static final Pattern LEADING_INT = Pattern.compile("^\\s*([+-]?\\d+)");
    private static final Pattern LEADING_DECIMAL = Pattern.compile("^\\s*([+-]?(?:\\d+(?:\\.\\d*)?|\\.\\d+))");

    private Numbers() {}

    /**
     * Reads the integer at the start of {@code s}, ignoring leading whitespace and anything after the digits.
     * Digits that overflow an {@code int} saturate to {@link Integer#MAX_VALUE} or {@link Integer#MIN_VALUE},
     * so range checks still reject them.
     */
    public static Optional<Integer> leadingInt(String s) {
        Matcher m = LEADING_INT.matcher(s);
        if (!m.find()) {
            return Optional.empty();
        }
        String digits = m.group(1).startsWith("+") ? m.group(1).substring(1) : m.group(1);
        Integer value = Ints.tryParse(digits);
        if (value == null) {
            return Optional.of(digits.startsWith("-") ? Integer.MIN_VALUE : Integer.MAX_VALUE);
        }
        return Optional.of(value);
    }

    /**
     * Reads the decimal number at the start of {@code s}. Values too large for a {@code double} count as unparsable.
     */
    public static Optional<Double> leadingDecimal(String s) {
        Matcher m = LEADING_DECIMAL.matcher(s);
        if (!m.find()) {
            return Optional.empty();
        }
        return Optional.of(Double.parseDouble(m.group(1))).filter(Double::isFinite);
    }

    /**
     * Shortest plain decimal form: 6.5 stays "6.5", 7.0 becomes "7".
     */
    public static String format(double value) {
        if (value == 0) {
            return "0";
        }
        return BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
    }

    /**
     * Formats a value recorded in tenths, e.g. 65 as "6.5".
     */
    public static String tenths(int value) {
        return format(value / 10.0);
    }
}
