package com.example.demo.factfind.formula;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Lenient number reading for form values. Input is read up to the first character that
 * cannot continue a number ("12abc" is 12); anything that yields no finite number is 0.
 */
public final class NumericValues {
    private static final Pattern LEADING_NUMBER = Pattern.compile("^\\s*([+-]?(?:\\d+\\.?\\d*|\\.\\d+)(?:[eE][+-]?\\d+)?)");

    private NumericValues() {
    }

    public static double parseOrZero(Object value) {
        if (value == null) return 0d;
        if (value instanceof Number) {
            double d = ((Number) value).doubleValue();
            return Double.isFinite(d) ? d : 0d;
        }
        if (value instanceof Boolean) return 0d;
        Matcher m = LEADING_NUMBER.matcher(value.toString());
        if (!m.find()) return 0d;
        try {
            double d = Double.parseDouble(m.group(1));
            return Double.isFinite(d) ? d : 0d;
        } catch (NumberFormatException e) {
            return 0d;
        }
    }
}
